/*
 * EBML-Catalog - EBML/Matroska schema catalog generator
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.ebml.catalog.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.ebml.catalog.catalog.DeprecatedAlias;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import net.boyechko.ebml.catalog.schema.SourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Generator settings, loaded from YAML. Field names follow the YAML keys. */
public final class GeneratorConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/ebml-catalog.yaml";
    private static final Logger logger = LoggerFactory.getLogger(GeneratorConfig.class);

    /** Element schema sources, highest priority first. */
    public List<Source> sources = new ArrayList<>();

    public Source tag_source;
    public Map<String, String> tag_overrides = new LinkedHashMap<>();
    public List<Alias> deprecated_aliases = new ArrayList<>();
    public Output output = new Output();
    public String cache_directory;

    public static final class Source {
        public String name;
        public String url;

        /** True if paths in this document carry legacy {@code n*m(...)} repetition markers. */
        public boolean legacy_paths;

        public SourceSpec toSpec() {
            return new SourceSpec(name, url, legacy_paths);
        }
    }

    public static final class Alias {
        public String name;
        public String alias_of;
    }

    public static final class Output {
        public String directory = "generated";
        public String java_package = "org.ebml.matroska";
        public String elements_class = "MatroskaElements";
        public String tags_class = "MatroskaTags";
    }

    /** Load from a classpath resource, e.g. {@code /ebml-catalog.yaml}. */
    public static GeneratorConfig fromResource(String resourcePath) {
        try (InputStream in = GeneratorConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new CatalogException(
                        CatalogFailure.INVALID_CONFIGURATION, "Resource not found: " + resourcePath);
            }
            return load(in, resourcePath);
        } catch (IOException e) {
            throw new CatalogException(
                    CatalogFailure.INVALID_CONFIGURATION, "Cannot read " + resourcePath, e);
        }
    }

    public static GeneratorConfig fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new CatalogException(CatalogFailure.INVALID_CONFIGURATION, "Cannot read " + file, e);
        }
    }

    /** Load the bundled configuration. */
    public static GeneratorConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static GeneratorConfig load(InputStream in, String origin) {
        GeneratorConfig config;
        try {
            config = yaml().load(in);
        } catch (RuntimeException e) {
            logger.error("Failed to load configuration from {}: {}", origin, e.getMessage());
            throw new CatalogException(
                    CatalogFailure.INVALID_CONFIGURATION,
                    "Failed to load configuration from " + origin + ": " + e.getMessage(),
                    e);
        }
        if (config == null) {
            throw new CatalogException(CatalogFailure.INVALID_CONFIGURATION, origin + " is empty");
        }
        config.requireComplete(origin);
        logger.debug("Loaded configuration with {} sources from {}", config.sources.size(), origin);

        return config;
    }

    private static Yaml yaml() {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(GeneratorConfig.class, options);
        TypeDescription description = new TypeDescription(GeneratorConfig.class);
        description.addPropertyParameters("sources", Source.class);
        description.addPropertyParameters("deprecated_aliases", Alias.class);
        description.addPropertyParameters("tag_overrides", String.class, String.class);
        constructor.addTypeDescription(description);
        return new Yaml(constructor);
    }

    private void requireComplete(String origin) {
        List<String> missing = new ArrayList<>();
        if (sources == null || sources.isEmpty()) {
            missing.add("sources");
        } else {
            for (int i = 0; i < sources.size(); i++) {
                Source s = sources.get(i);
                if (s == null || s.name == null || s.name.isBlank()) {
                    missing.add("sources[" + i + "].name");
                }
            }
        }
        if (tag_source == null || tag_source.name == null || tag_source.name.isBlank()) {
            missing.add("tag_source.name");
        }
        if (tag_overrides != null) {
            for (Map.Entry<String, String> entry : tag_overrides.entrySet()) {
                if (entry.getValue() == null || entry.getValue().isBlank()) {
                    missing.add("tag_overrides." + entry.getKey());
                }
            }
        }
        if (deprecated_aliases != null) {
            for (int i = 0; i < deprecated_aliases.size(); i++) {
                Alias a = deprecated_aliases.get(i);
                if (a == null || a.name == null || a.alias_of == null) {
                    missing.add("deprecated_aliases[" + i + "].name/alias_of");
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new CatalogException(
                    CatalogFailure.INVALID_CONFIGURATION,
                    origin + " is missing " + String.join(", ", missing));
        }
        if (tag_overrides == null) {
            tag_overrides = new LinkedHashMap<>();
        }
        if (deprecated_aliases == null) {
            deprecated_aliases = new ArrayList<>();
        }
        if (output == null) {
            output = new Output();
        }
    }

    /**
     * Checks for settings that load fine but are probably mistakes: two sources with the same
     * name (they would share a cache file), aliases that point at themselves, and aliases listed
     * twice.
     *
     * @return warning messages, empty if none
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (Source source : sources) {
            if (!seen.add(source.name)) {
                warnings.add(String.format("Source name '%s' is listed more than once", source.name));
            }
        }
        if (tag_source != null && seen.contains(tag_source.name)) {
            warnings.add(
                    String.format(
                            "Tag source '%s' shares its name with an element source", tag_source.name));
        }

        Set<String> aliasNames = new HashSet<>();
        for (Alias alias : deprecated_aliases) {
            if (alias.name.equals(alias.alias_of)) {
                warnings.add(String.format("Alias '%s' refers to itself", alias.name));
            }
            if (!aliasNames.add(alias.name)) {
                warnings.add(String.format("Alias '%s' is listed more than once", alias.name));
            }
        }
        return warnings;
    }

    public List<SourceSpec> sourceSpecs() {
        return sources.stream().map(Source::toSpec).collect(Collectors.toList());
    }

    public SourceSpec tagSourceSpec() {
        return tag_source.toSpec();
    }

    public List<DeprecatedAlias> aliases() {
        return deprecated_aliases.stream()
                .map(a -> new DeprecatedAlias(a.name, a.alias_of))
                .collect(Collectors.toList());
    }
}

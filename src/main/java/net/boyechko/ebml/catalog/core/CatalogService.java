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
package net.boyechko.ebml.catalog.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.catalog.CatalogAssembler;
import net.boyechko.ebml.catalog.catalog.Hierarchy;
import net.boyechko.ebml.catalog.catalog.HierarchyResolver;
import net.boyechko.ebml.catalog.catalog.SchemaMerger;
import net.boyechko.ebml.catalog.catalog.SourceElements;
import net.boyechko.ebml.catalog.config.GeneratorConfig;
import net.boyechko.ebml.catalog.emit.Artifact;
import net.boyechko.ebml.catalog.emit.ArtifactWriter;
import net.boyechko.ebml.catalog.emit.CatalogEmitter;
import net.boyechko.ebml.catalog.emit.JavaSourceEmitter;
import net.boyechko.ebml.catalog.naming.TagNaming;
import net.boyechko.ebml.catalog.schema.EbmlSchemaReader;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawTag;
import net.boyechko.ebml.catalog.schema.SchemaFetcher;
import net.boyechko.ebml.catalog.schema.SourceSpec;
import net.boyechko.ebml.catalog.schema.TagRegistryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one generation: load every source, merge, resolve the hierarchy, assemble the catalog,
 * then render and write the artifacts. Stages run strictly in that order and share nothing with
 * other runs. Any {@link net.boyechko.ebml.catalog.error.CatalogException} aborts the run before
 * a file is written.
 */
public class CatalogService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final GeneratorConfig config;
    private final SchemaFetcher fetcher;
    private final GenerationListener listener;
    private final CatalogEmitter emitter;

    public static class CatalogServiceBuilder {
        private GeneratorConfig config;
        private SchemaFetcher fetcher;
        private GenerationListener listener;
        private CatalogEmitter emitter;

        public CatalogServiceBuilder withConfig(GeneratorConfig config) {
            this.config = config;
            return this;
        }

        public CatalogServiceBuilder withFetcher(SchemaFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public CatalogServiceBuilder withListener(GenerationListener listener) {
            this.listener = listener;
            return this;
        }

        /** Replaces the Java emitter configured by the {@code output} section. */
        public CatalogServiceBuilder withEmitter(CatalogEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        public CatalogService build() {
            if (config == null) {
                throw new IllegalStateException(
                        "GeneratorConfig must be provided via withConfig(...) before building CatalogService");
            }
            if (fetcher == null) {
                throw new IllegalStateException(
                        "SchemaFetcher must be provided via withFetcher(...) before building CatalogService");
            }
            return new CatalogService(this);
        }
    }

    private CatalogService(CatalogServiceBuilder builder) {
        this.config = builder.config;
        this.fetcher = builder.fetcher;
        this.listener = builder.listener != null ? builder.listener : GenerationListener.silent();
        this.emitter =
                builder.emitter != null
                        ? builder.emitter
                        : new JavaSourceEmitter(
                                config.output.java_package,
                                config.output.elements_class,
                                config.output.tags_class);
    }

    /** Builds the catalog without writing anything. */
    public Catalog buildCatalog() {
        listener.onPhaseStart("Loading schema sources");
        for (String warning : config.validateConsistency()) {
            listener.onWarning(warning);
        }
        List<SourceElements> sources = new ArrayList<>();
        for (SourceSpec spec : config.sourceSpecs()) {
            List<RawElement> elements = EbmlSchemaReader.read(fetcher.fetch(spec), spec.name());
            sources.add(new SourceElements(spec, elements));
            listener.onSuccess(
                    spec.name() + ": " + elements.size() + " elements"
                            + (spec.legacyPaths() ? " (legacy paths)" : ""));
        }
        SourceSpec tagSpec = config.tagSourceSpec();
        List<RawTag> tags = TagRegistryReader.read(fetcher.fetch(tagSpec), tagSpec.name());
        listener.onSuccess(tagSpec.name() + ": " + tags.size() + " tags");

        listener.onPhaseStart("Merging and resolving");
        List<RawElement> merged = SchemaMerger.merge(sources);
        int total = sources.stream().mapToInt(s -> s.elements().size()).sum();
        listener.onSuccess(
                "Merged " + merged.size() + " unique elements from " + sources.size() + " sources");
        if (total > merged.size()) {
            listener.onInfo((total - merged.size()) + " duplicate definitions discarded");
        }
        Hierarchy hierarchy = HierarchyResolver.resolve(merged);
        listener.onSuccess(
                "Resolved nesting for "
                        + hierarchy.descendants().size()
                        + " master elements, "
                        + hierarchy.roots().size()
                        + " roots");

        listener.onPhaseStart("Assembling catalog");
        CatalogAssembler assembler =
                new CatalogAssembler(TagNaming.withOverrides(config.tag_overrides), config.aliases());
        Catalog catalog = assembler.assemble(merged, hierarchy, tags);
        listener.onSuccess(
                catalog.elements().size() + " elements, "
                        + catalog.enumerationCount() + " enumerated values, "
                        + catalog.tags().size() + " tags");
        return catalog;
    }

    /**
     * Builds the catalog and writes the emitter's artifacts into {@code outputDirectory}.
     *
     * @throws net.boyechko.ebml.catalog.error.CatalogException on any fatal condition; no file is
     *     written in that case
     */
    public GenerationResult generate(Path outputDirectory) {
        Catalog catalog = buildCatalog();

        listener.onPhaseStart("Writing artifacts");
        List<Artifact> artifacts = emitter.render(catalog);
        List<Path> written = ArtifactWriter.writeAll(outputDirectory, artifacts);
        for (Path path : written) {
            listener.onSuccess("Wrote " + path);
        }
        logger.info("Generated {} artifacts in {}", written.size(), outputDirectory);

        GenerationResult result = new GenerationResult(catalog, written);
        listener.onSummary(result);
        return result;
    }
}

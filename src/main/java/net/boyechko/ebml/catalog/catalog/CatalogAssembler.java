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
package net.boyechko.ebml.catalog.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import net.boyechko.ebml.catalog.naming.ElementNames;
import net.boyechko.ebml.catalog.naming.TagNaming;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the final catalog: canonical names applied to elements and to their computed relations,
 * enumerations normalized, deprecated aliases appended, and everything sorted.
 *
 * <p>Elements sort by {@code name + "Element"} and tags by {@code "Tag" + identifier}, comparing
 * strings case-sensitively. The suffix and prefix take part in the comparison, so the order matches
 * the order of the emitted constant names.
 */
public final class CatalogAssembler {
    static final String ELEMENT_SUFFIX = "Element";
    static final String TAG_PREFIX = "Tag";

    private static final Logger logger = LoggerFactory.getLogger(CatalogAssembler.class);

    private static final Comparator<ElementDefinition> ELEMENT_ORDER =
            Comparator.comparing(e -> e.name() + ELEMENT_SUFFIX);
    private static final Comparator<TagDefinition> TAG_ORDER =
            Comparator.comparing(t -> TAG_PREFIX + t.identifierName());

    private final TagNaming tagNaming;
    private final List<DeprecatedAlias> aliases;

    public CatalogAssembler(TagNaming tagNaming, List<DeprecatedAlias> aliases) {
        this.tagNaming = tagNaming;
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public Catalog assemble(List<RawElement> merged, Hierarchy hierarchy, List<RawTag> tags) {
        Map<String, String> canonical = canonicalNames(merged);

        Map<String, ElementDefinition> elements = new LinkedHashMap<>();
        for (RawElement raw : merged) {
            String name = canonical.get(raw.name());
            List<Descendant> descendants =
                    hierarchy.descendantsOf(raw.name()).stream()
                            .map(d -> new Descendant(canonical.get(d.name()), d.path()))
                            .collect(Collectors.toList());
            elements.put(
                    name,
                    new ElementDefinition(
                            name,
                            raw.rawId(),
                            raw.valueType(),
                            hierarchy.pathOf(raw.name()),
                            hierarchy.isRoot(raw.name()),
                            false,
                            EnumerationNormalizer.normalize(raw),
                            descendants));
        }
        requireDistinctIds(elements.values());
        addAliases(elements);

        List<ElementDefinition> sortedElements = new ArrayList<>(elements.values());
        sortedElements.sort(ELEMENT_ORDER);
        List<TagDefinition> sortedTags = tagDefinitions(tags);
        requireDistinctIdentifiers(sortedTags);
        sortedTags.sort(TAG_ORDER);

        logger.debug("Assembled {} elements and {} tags", sortedElements.size(), sortedTags.size());
        return new Catalog(sortedElements, sortedTags);
    }

    /** Maps schema names to canonical names, failing if two schema names collapse into one. */
    private static Map<String, String> canonicalNames(List<RawElement> merged) {
        Map<String, String> canonical = new HashMap<>();
        Map<String, String> claimedBy = new HashMap<>();
        for (RawElement raw : merged) {
            String name = ElementNames.canonicalize(raw.name());
            String previous = claimedBy.putIfAbsent(name, raw.name());
            if (previous != null) {
                throw new CatalogException(
                        CatalogFailure.MALFORMED_SCHEMA_RECORD,
                        "Elements '" + previous + "' and '" + raw.name() + "' both canonicalize to " + name);
            }
            canonical.put(raw.name(), name);
        }
        return canonical;
    }

    /** Element ids key the generated lookups, so two live elements may not share one. */
    private static void requireDistinctIds(Iterable<ElementDefinition> elements) {
        Map<Object, String> claimedBy = new HashMap<>();
        for (ElementDefinition element : elements) {
            String previous = claimedBy.putIfAbsent(idKey(element.rawId()), element.name());
            if (previous != null) {
                throw new CatalogException(
                        CatalogFailure.MALFORMED_SCHEMA_RECORD,
                        "Elements " + previous + " and " + element.name() + " share id " + element.rawId());
            }
        }
    }

    private static Object idKey(String rawId) {
        try {
            return Long.decode(rawId.trim());
        } catch (NumberFormatException e) {
            return rawId.trim();
        }
    }

    private static void requireDistinctIdentifiers(List<TagDefinition> tags) {
        Map<String, String> claimedBy = new HashMap<>();
        for (TagDefinition tag : tags) {
            String previous = claimedBy.putIfAbsent(tag.identifierName(), tag.officialName());
            if (previous != null) {
                throw new CatalogException(
                        CatalogFailure.MALFORMED_SCHEMA_RECORD,
                        "Tags " + previous + " and " + tag.officialName() + " both map to identifier "
                                + tag.identifierName());
            }
        }
    }

    private void addAliases(Map<String, ElementDefinition> elements) {
        for (DeprecatedAlias alias : aliases) {
            String name = ElementNames.canonicalize(alias.name());
            if (elements.containsKey(name)) {
                logger.debug("Alias {} skipped; the schema defines an element with that name", name);
                continue;
            }
            String targetName = alias.aliasOf() == null ? null : ElementNames.canonicalize(alias.aliasOf());
            ElementDefinition target = targetName == null ? null : elements.get(targetName);
            if (target == null || target.deprecated()) {
                throw new CatalogException(
                        CatalogFailure.INVALID_CONFIGURATION,
                        "Deprecated alias " + alias.name() + " refers to unknown element " + alias.aliasOf());
            }
            elements.put(
                    name,
                    new ElementDefinition(
                            name,
                            target.rawId(),
                            target.valueType(),
                            null,
                            false,
                            true,
                            List.of(),
                            List.of()));
        }
    }

    /** Names each tag; a repeated official name keeps its first entry. */
    private List<TagDefinition> tagDefinitions(List<RawTag> tags) {
        Map<String, TagDefinition> byName = new LinkedHashMap<>();
        for (RawTag tag : tags) {
            if (byName.containsKey(tag.name())) {
                logger.debug("Tag {} listed more than once", tag.name());
                continue;
            }
            byName.put(tag.name(), new TagDefinition(tag.name(), tagNaming.identifierFor(tag.name())));
        }
        return new ArrayList<>(byName.values());
    }
}

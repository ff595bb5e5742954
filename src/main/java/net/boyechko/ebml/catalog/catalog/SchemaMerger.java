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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.ebml.catalog.path.PathGrammar;
import net.boyechko.ebml.catalog.schema.RawElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the element lists of several schema sources into one list with unique names.
 *
 * <p>Sources are taken in priority order, highest first. The first source to define a name wins
 * outright; later definitions of that name are dropped whole, with no field-level merging. Paths
 * of legacy sources have their repetition markers stripped before merging.
 */
public final class SchemaMerger {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMerger.class);

    private SchemaMerger() {}

    /**
     * @param sources per-source element lists, highest priority first
     * @return merged elements in first-occurrence order
     */
    public static List<RawElement> merge(List<SourceElements> sources) {
        Map<String, RawElement> merged = new LinkedHashMap<>();
        Map<String, String> origin = new LinkedHashMap<>();

        for (SourceElements source : sources) {
            int added = 0;
            for (RawElement element : source.elements()) {
                if (merged.containsKey(element.name())) {
                    logger.debug(
                            "{}: {} already defined by {}; keeping that definition",
                            source.source().name(),
                            element.name(),
                            origin.get(element.name()));
                    continue;
                }
                RawElement normalized =
                        source.source().legacyPaths()
                                ? element.withPath(PathGrammar.stripRepetitionMarkers(element.path()))
                                : element;
                merged.put(element.name(), normalized);
                origin.put(element.name(), source.source().name());
                added++;
            }
            logger.debug(
                    "{} contributed {} of {} elements",
                    source.source().name(),
                    added,
                    source.elements().size());
        }
        return new ArrayList<>(merged.values());
    }
}

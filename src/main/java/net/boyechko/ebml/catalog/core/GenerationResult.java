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
import java.util.List;
import net.boyechko.ebml.catalog.catalog.Catalog;

/**
 * Outcome of one run.
 *
 * @param catalog the assembled catalog
 * @param writtenFiles artifacts written, empty when the run only built the catalog
 */
public record GenerationResult(Catalog catalog, List<Path> writtenFiles) {
    public GenerationResult {
        writtenFiles = List.copyOf(writtenFiles);
    }

    public int elementCount() {
        return catalog.elements().size();
    }

    public int deprecatedCount() {
        return (int) catalog.elements().stream().filter(e -> e.deprecated()).count();
    }

    public int rootCount() {
        return catalog.roots().size();
    }

    public int masterCount() {
        return catalog.masters().size();
    }

    public int enumerationCount() {
        return catalog.enumerationCount();
    }

    public int tagCount() {
        return catalog.tags().size();
    }
}

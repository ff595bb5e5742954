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
package net.boyechko.ebml.catalog.naming;

import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;

/** Canonical element names: the schema name with hyphens removed ({@code CRC-32} → {@code CRC32}). */
public final class ElementNames {
    private ElementNames() {}

    public static String canonicalize(String rawName) {
        String name = rawName == null ? "" : rawName.replace("-", "");
        if (name.isEmpty()) {
            throw new CatalogException(
                    CatalogFailure.EMPTY_CANONICAL_NAME,
                    "Element name '" + rawName + "' has no identifier characters");
        }
        return name;
    }
}

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
package net.boyechko.ebml.catalog.schema;

import java.util.List;

/**
 * An element definition exactly as one schema source declares it.
 *
 * @param name schema name, possibly containing hyphens
 * @param rawId wire identifier, passed through unchanged (e.g. {@code 0x1A45DFA3})
 * @param path raw path expression
 * @param enumerations restriction entries in document order; empty if unrestricted
 */
public record RawElement(
        String name,
        String rawId,
        ValueType valueType,
        String path,
        List<RawEnumEntry> enumerations) {
    public RawElement {
        enumerations = enumerations == null ? List.of() : List.copyOf(enumerations);
    }

    public RawElement withPath(String newPath) {
        return new RawElement(name, rawId, valueType, newPath, enumerations);
    }
}

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

import java.util.List;
import net.boyechko.ebml.catalog.path.PathExpression;
import net.boyechko.ebml.catalog.schema.ValueType;

/**
 * A canonical element in the assembled catalog.
 *
 * @param name canonical name, unique in the catalog
 * @param rawId wire identifier, unchanged from the schema
 * @param path parsed path; null for deprecated aliases, which have no position of their own
 * @param root true if the element sits directly beneath the document root
 * @param deprecated true if kept only so old names are still recognized
 * @param enumerations allowed values, empty if unrestricted
 * @param descendants elements that may nest under this one; empty unless this is a master
 */
public record ElementDefinition(
        String name,
        String rawId,
        ValueType valueType,
        PathExpression path,
        boolean root,
        boolean deprecated,
        List<EnumerationValue> enumerations,
        List<Descendant> descendants) {
    public ElementDefinition {
        enumerations = List.copyOf(enumerations);
        descendants = List.copyOf(descendants);
    }

    public boolean isMaster() {
        return valueType == ValueType.MASTER;
    }

    public boolean hasEnumerations() {
        return !enumerations.isEmpty();
    }

    /** The path text, or an empty string for aliases. */
    public String pathText() {
        return path != null ? path.text() : "";
    }
}

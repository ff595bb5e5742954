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

/**
 * One allowed value of an element.
 *
 * @param label human-readable text from the schema
 * @param name canonical identifier, unique within the owning element
 * @param value the value as written in the schema, unquoted
 * @param type how {@link #literal()} renders the value
 */
public record EnumerationValue(String label, String name, String value, LiteralType type) {

    /** The constant as a literal: quoted text, or the integer as written. */
    public String literal() {
        if (type == LiteralType.TEXT) {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return value;
    }
}

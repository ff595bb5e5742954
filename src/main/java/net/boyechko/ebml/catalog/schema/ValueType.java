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

import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;

/** The value type an EBML element carries, keyed by its schema {@code type} attribute. */
public enum ValueType {
    MASTER("master"),
    UNSIGNED_INTEGER("uinteger"),
    SIGNED_INTEGER("integer"),
    BINARY("binary"),
    UTF8_TEXT("utf-8"),
    STRING("string"),
    FLOAT("float"),
    DATE("date");

    private final String wireName;

    ValueType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for types whose enumerated values are text rather than numbers. */
    public boolean isStringLike() {
        return this == STRING || this == UTF8_TEXT;
    }

    public static ValueType fromWireName(String wireName) {
        for (ValueType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new CatalogException(
                CatalogFailure.MALFORMED_SCHEMA_RECORD, "Unknown element type '" + wireName + "'");
    }
}

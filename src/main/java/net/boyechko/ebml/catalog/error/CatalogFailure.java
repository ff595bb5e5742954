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
package net.boyechko.ebml.catalog.error;

/** Kinds of failure that abort a catalog generation run. */
public enum CatalogFailure {
    SOURCE_UNAVAILABLE("schema source unavailable"),
    MALFORMED_SCHEMA_RECORD("malformed schema record"),
    UNPARSEABLE_PATH_EXPRESSION("unparseable path expression"),
    EMPTY_CANONICAL_NAME("label canonicalizes to an empty name"),
    INVALID_CONFIGURATION("invalid generator configuration"),
    OUTPUT_FAILED("could not write generated artifacts");

    private final String description;

    CatalogFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}

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

/**
 * Where a schema document comes from.
 *
 * @param name logical name; also the file name looked up in the local cache
 * @param url download location, may be null for cache-only sources
 * @param legacyPaths true if the document embeds {@code n*m(...)} repetition markers in paths
 */
public record SourceSpec(String name, String url, boolean legacyPaths) {
    public SourceSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Source name is required");
        }
    }
}

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

/**
 * Fatal error raised anywhere in the generation pipeline. No stage recovers from it locally; it
 * unwinds to the caller of {@code CatalogService}, and nothing is written.
 */
public class CatalogException extends RuntimeException {
    private final CatalogFailure failure;

    public CatalogException(CatalogFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public CatalogException(CatalogFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public CatalogFailure failure() {
        return failure;
    }

    /** Returns the message prefixed with the failure description, for user-facing output. */
    public String describe() {
        return failure.description() + ": " + getMessage();
    }
}

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

/** Receives progress events from {@link CatalogService}. */
public interface GenerationListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(String message);

    void onSummary(GenerationResult result);

    default void onError(String message) {}

    default void onInfo(String message) {}

    /** A listener that ignores every event. */
    static GenerationListener silent() {
        return new GenerationListener() {
            @Override
            public void onPhaseStart(String phaseName) {}

            @Override
            public void onSuccess(String message) {}

            @Override
            public void onWarning(String message) {}

            @Override
            public void onSummary(GenerationResult result) {}
        };
    }
}

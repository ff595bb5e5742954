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
package net.boyechko.ebml.catalog;

import java.nio.file.Path;
import net.boyechko.ebml.catalog.config.GeneratorConfig;
import net.boyechko.ebml.catalog.core.CatalogService;
import net.boyechko.ebml.catalog.core.GenerationListener;
import net.boyechko.ebml.catalog.schema.CachingSchemaFetcher;
import net.boyechko.ebml.catalog.schema.SchemaFetcher;

/** Small schema documents under src/test/resources/fixtures, named like the real cache files. */
public final class CatalogFixtures {
    public static final Path FIXTURES_DIR = Path.of("src/test/resources/fixtures");
    public static final Path SNAPSHOTS_DIR = Path.of("src/test/resources/snapshots");

    private CatalogFixtures() {}

    public static GeneratorConfig config() {
        return GeneratorConfig.fromResource("/fixtures/generator.yaml");
    }

    public static SchemaFetcher fetcher() {
        return new CachingSchemaFetcher(FIXTURES_DIR, true, false);
    }

    public static CatalogService service(GenerationListener listener) {
        return new CatalogService.CatalogServiceBuilder()
                .withConfig(config())
                .withFetcher(fetcher())
                .withListener(listener)
                .build();
    }
}

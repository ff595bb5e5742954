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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a schema document from the cache directory if a file with the source's logical name is
 * there, and downloads it otherwise.
 */
public class CachingSchemaFetcher implements SchemaFetcher {
    private static final Logger logger = LoggerFactory.getLogger(CachingSchemaFetcher.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final Path cacheDirectory;
    private final boolean offline;
    private final boolean writeBack;
    private HttpClient client;

    /**
     * @param cacheDirectory directory searched for cached documents
     * @param offline never download; a source missing from the cache is unavailable
     * @param writeBack store downloaded documents in the cache directory
     */
    public CachingSchemaFetcher(Path cacheDirectory, boolean offline, boolean writeBack) {
        this.cacheDirectory = cacheDirectory;
        this.offline = offline;
        this.writeBack = writeBack;
    }

    @Override
    public byte[] fetch(SourceSpec source) {
        Path cached = cacheDirectory.resolve(source.name());
        if (Files.isRegularFile(cached)) {
            logger.debug("Reading {} from cache {}", source.name(), cached);
            try {
                return Files.readAllBytes(cached);
            } catch (IOException e) {
                throw new CatalogException(
                        CatalogFailure.SOURCE_UNAVAILABLE, "Cannot read cached " + cached, e);
            }
        }
        if (offline) {
            throw new CatalogException(
                    CatalogFailure.SOURCE_UNAVAILABLE,
                    source.name() + " is not in " + cacheDirectory + " and downloads are disabled");
        }
        if (source.url() == null) {
            throw new CatalogException(
                    CatalogFailure.SOURCE_UNAVAILABLE,
                    source.name() + " is not cached and has no download URL");
        }

        byte[] body = download(source);
        if (writeBack) {
            store(cached, body);
        }
        return body;
    }

    private byte[] download(SourceSpec source) {
        logger.info("Downloading {} ...", source.url());
        HttpRequest request =
                HttpRequest.newBuilder(URI.create(source.url())).timeout(TIMEOUT).GET().build();
        try {
            HttpResponse<byte[]> response =
                    httpClient().send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new CatalogException(
                        CatalogFailure.SOURCE_UNAVAILABLE,
                        "GET " + source.url() + " returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new CatalogException(
                    CatalogFailure.SOURCE_UNAVAILABLE, "GET " + source.url() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException(
                    CatalogFailure.SOURCE_UNAVAILABLE, "Interrupted downloading " + source.url(), e);
        }
    }

    private void store(Path cached, byte[] body) {
        try {
            Files.createDirectories(cacheDirectory);
            Files.write(cached, body);
            logger.debug("Cached {} bytes at {}", body.length, cached);
        } catch (IOException e) {
            logger.warn("Could not cache {}: {}", cached, e.getMessage());
        }
    }

    private HttpClient httpClient() {
        if (client == null) {
            client =
                    HttpClient.newBuilder()
                            .followRedirects(HttpClient.Redirect.NORMAL)
                            .connectTimeout(TIMEOUT)
                            .build();
        }
        return client;
    }
}

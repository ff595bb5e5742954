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
package net.boyechko.ebml.catalog.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a set of artifacts so that either all of them land in the output directory or none do.
 * Every artifact is first written to a temporary file next to its target; only when all temps
 * are complete are they moved into place. If a move fails, targets already moved are removed and
 * any files they replaced are restored.
 */
public final class ArtifactWriter {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    private ArtifactWriter() {}

    /** @return the written files, in artifact order */
    public static List<Path> writeAll(Path directory, List<Artifact> artifacts) {
        List<Path> temps = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (Artifact artifact : artifacts) {
                Path temp = Files.createTempFile(directory, "." + artifact.fileName(), ".tmp");
                temps.add(temp);
                Files.writeString(temp, artifact.content(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            deleteQuietly(temps);
            throw new CatalogException(
                    CatalogFailure.OUTPUT_FAILED, "Cannot write artifacts to " + directory, e);
        }
        return commit(directory, artifacts, temps);
    }

    private static List<Path> commit(Path directory, List<Artifact> artifacts, List<Path> temps) {
        List<Path> written = new ArrayList<>();
        Map<Path, Path> backups = new LinkedHashMap<>();
        try {
            for (int i = 0; i < artifacts.size(); i++) {
                Path target = directory.resolve(artifacts.get(i).fileName());
                if (Files.isRegularFile(target)) {
                    backups.put(target, backUp(directory, target));
                }
                move(temps.get(i), target);
                written.add(target);
                logger.debug("Wrote {}", target);
            }
        } catch (IOException e) {
            deleteQuietly(written);
            for (Map.Entry<Path, Path> backup : backups.entrySet()) {
                restore(backup.getValue(), backup.getKey());
            }
            deleteQuietly(temps);
            throw new CatalogException(
                    CatalogFailure.OUTPUT_FAILED, "Cannot write artifacts to " + directory, e);
        }
        deleteQuietly(new ArrayList<>(backups.values()));
        return written;
    }

    /** Moves {@code target} aside to a fresh {@code .bak} file in {@code directory}. */
    static Path backUp(Path directory, Path target) throws IOException {
        Path backup = Files.createTempFile(directory, "." + target.getFileName(), ".bak");
        try {
            move(target, backup);
        } catch (IOException e) {
            deleteQuietly(List.of(backup));
            throw e;
        }
        return backup;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restore(Path backup, Path target) {
        try {
            move(backup, target);
        } catch (IOException e) {
            logger.error("Could not restore {} from {}", target, backup, e);
        }
    }

    private static void deleteQuietly(List<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.warn("Could not remove {}", path, e);
            }
        }
    }
}

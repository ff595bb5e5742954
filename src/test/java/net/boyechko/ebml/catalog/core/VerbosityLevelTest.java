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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class VerbosityLevelTest {

    @Test
    void levelsAreOrdered() {
        assertTrue(VerbosityLevel.DEBUG.isAtLeast(VerbosityLevel.VERBOSE));
        assertTrue(VerbosityLevel.NORMAL.isAtLeast(VerbosityLevel.NORMAL));
        assertFalse(VerbosityLevel.QUIET.isAtLeast(VerbosityLevel.NORMAL));
    }

    @Test
    void mapsToLogLevels() {
        assertEquals("ERROR", VerbosityLevel.QUIET.logLevel());
        assertEquals("WARN", VerbosityLevel.NORMAL.logLevel());
        assertEquals("INFO", VerbosityLevel.VERBOSE.logLevel());
        assertEquals("DEBUG", VerbosityLevel.DEBUG.logLevel());
    }
}

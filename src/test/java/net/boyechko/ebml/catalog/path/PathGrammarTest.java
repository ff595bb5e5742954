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
package net.boyechko.ebml.catalog.path;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class PathGrammarTest {

    @Test
    void parsesPlainPath() {
        PathExpression path = PathGrammar.parse("\\Segment\\Tracks\\TrackEntry");
        assertEquals(List.of("Segment", "Tracks", "TrackEntry"), path.segments());
        assertFalse(path.global());
        assertEquals("\\Segment\\Tracks\\TrackEntry", path.text());
    }

    @Test
    void leadingOccurrenceMarkerMakesPathGlobal() {
        PathExpression unbounded = PathGrammar.parse("\\(-\\)Void");
        assertTrue(unbounded.global());
        assertEquals(List.of("Void"), unbounded.segments());

        PathExpression bounded = PathGrammar.parse("\\(1-\\)CRC-32");
        assertTrue(bounded.global());
        assertEquals("CRC-32", bounded.leaf());
    }

    @Test
    void singleSegmentPathIsRoot() {
        assertTrue(PathGrammar.parse("\\EBML").isRoot());
        assertFalse(PathGrammar.parse("\\EBML\\DocType").isRoot());
        assertFalse(PathGrammar.parse("\\(-\\)Void").isRoot());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Segment", "Segment\\Info", "\\", "\\Segment\\", "\\Segment\\\\Info"})
    void malformedPathsAreRejected(String raw) {
        CatalogException e = assertThrows(CatalogException.class, () -> PathGrammar.parse(raw));
        assertEquals(CatalogFailure.UNPARSEABLE_PATH_EXPRESSION, e.failure());
    }

    @Test
    void missingPathIsRejected() {
        CatalogException e = assertThrows(CatalogException.class, () -> PathGrammar.parse(null));
        assertEquals(CatalogFailure.UNPARSEABLE_PATH_EXPRESSION, e.failure());
    }

    @Test
    void stripsLegacyRepetitionMarkers() {
        assertEquals("\\Segment\\Inner", PathGrammar.stripRepetitionMarkers("\\Segment\\1*4(Inner)"));
        assertEquals("\\Segment\\Cluster\\Timecode", PathGrammar.stripRepetitionMarkers("\\Segment\\Cluster\\*1(Timecode)"));
        assertEquals("\\A\\B\\C", PathGrammar.stripRepetitionMarkers("\\A\\(B)\\C"));
    }

    @Test
    void strippingLeavesGlobalMarkerIntact() {
        assertEquals("\\(1-\\)CRC-32", PathGrammar.stripRepetitionMarkers("\\(1-\\)CRC-32"));
        assertTrue(PathGrammar.parse(PathGrammar.stripRepetitionMarkers("\\(-\\)Void")).global());
    }

    @Test
    void strippingPlainPathIsNoOp() {
        assertEquals("\\Segment\\Info", PathGrammar.stripRepetitionMarkers("\\Segment\\Info"));
        assertNull(PathGrammar.stripRepetitionMarkers(null));
    }
}

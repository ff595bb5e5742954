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
package net.boyechko.ebml.catalog.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawEnumEntry;
import net.boyechko.ebml.catalog.schema.ValueType;
import org.junit.jupiter.api.Test;

public class EnumerationNormalizerTest {

    private static RawElement element(ValueType type, RawEnumEntry... entries) {
        return new RawElement("StereoMode", "0x53B8", type, "\\Segment\\StereoMode", List.of(entries));
    }

    @Test
    void reservedLabelsGetTheirIndex() {
        List<EnumerationValue> values =
                EnumerationNormalizer.normalize(
                        element(
                                ValueType.UNSIGNED_INTEGER,
                                new RawEnumEntry("0", "Reserved"),
                                new RawEnumEntry("1", "Reserved"),
                                new RawEnumEntry("2", "Mono")));

        assertEquals(
                List.of(
                        new EnumerationValue("Reserved", "Reserved0", "0", LiteralType.SIGNED_INTEGER),
                        new EnumerationValue("Reserved", "Reserved1", "1", LiteralType.SIGNED_INTEGER),
                        new EnumerationValue("Mono", "Mono", "2", LiteralType.SIGNED_INTEGER)),
                values);
    }

    @Test
    void indexCountsDroppedEntries() {
        List<EnumerationValue> values =
                EnumerationNormalizer.normalize(
                        element(
                                ValueType.UNSIGNED_INTEGER,
                                new RawEnumEntry("0", "mono"),
                                new RawEnumEntry("1", "Mono"),
                                new RawEnumEntry("2", "reserved")));

        assertEquals(List.of("Mono", "Reserved2"), values.stream().map(EnumerationValue::name).toList());
    }

    @Test
    void laterDuplicateNameIsDropped() {
        List<EnumerationValue> values =
                EnumerationNormalizer.normalize(
                        element(
                                ValueType.UNSIGNED_INTEGER,
                                new RawEnumEntry("1", "side by side"),
                                new RawEnumEntry("11", "Side-By-Side"),
                                new RawEnumEntry("2", "top bottom")));

        assertEquals(2, values.size());
        assertEquals("1", values.get(0).value());
        assertEquals("TopBottom", values.get(1).name());
    }

    @Test
    void stringLikeValuesAreQuoted() {
        for (ValueType type : List.of(ValueType.STRING, ValueType.UTF8_TEXT)) {
            EnumerationValue value =
                    EnumerationNormalizer.normalize(
                                    new RawElement("DocType", "0x4282", type, "\\EBML\\DocType",
                                            List.of(new RawEnumEntry("webm", "WebM"))))
                            .get(0);
            assertEquals(LiteralType.TEXT, value.type());
            assertEquals("\"webm\"", value.literal());
        }
    }

    @Test
    void quotedLiteralEscapesQuotesAndBackslashes() {
        EnumerationValue value = new EnumerationValue("odd", "Odd", "a\"b\\c", LiteralType.TEXT);
        assertEquals("\"a\\\"b\\\\c\"", value.literal());
    }

    @Test
    void numericValuesAreVerbatim() {
        EnumerationValue value =
                EnumerationNormalizer.normalize(
                                element(ValueType.UNSIGNED_INTEGER, new RawEnumEntry("0x11", "subtitle")))
                        .get(0);
        assertEquals("0x11", value.literal());
        assertEquals("Subtitle", value.name());
    }

    @Test
    void nonNumericValueOfIntegerElementIsMalformed() {
        CatalogException e =
                assertThrows(
                        CatalogException.class,
                        () -> EnumerationNormalizer.normalize(
                                element(ValueType.SIGNED_INTEGER, new RawEnumEntry("left", "Left"))));
        assertEquals(CatalogFailure.MALFORMED_SCHEMA_RECORD, e.failure());
    }

    @Test
    void labelWithoutWordsIsFatal() {
        CatalogException e =
                assertThrows(
                        CatalogException.class,
                        () -> EnumerationNormalizer.normalize(
                                element(ValueType.UNSIGNED_INTEGER, new RawEnumEntry("7", "()"))));
        assertEquals(CatalogFailure.EMPTY_CANONICAL_NAME, e.failure());
    }

    @Test
    void unrestrictedElementHasNoValues() {
        assertTrue(EnumerationNormalizer.normalize(element(ValueType.BINARY)).isEmpty());
    }
}

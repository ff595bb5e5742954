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
import java.util.Map;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import net.boyechko.ebml.catalog.naming.TagNaming;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawTag;
import net.boyechko.ebml.catalog.schema.ValueType;
import org.junit.jupiter.api.Test;

public class CatalogAssemblerTest {

    private static final List<RawElement> ELEMENTS =
            List.of(
                    new RawElement("Segment", "0x18538067", ValueType.MASTER, "\\Segment", List.of()),
                    new RawElement("TimecodeScale", "0x2AD7B1", ValueType.UNSIGNED_INTEGER, "\\Segment\\TimecodeScale", List.of()),
                    new RawElement("Timecode", "0xE7", ValueType.UNSIGNED_INTEGER, "\\Segment\\Timecode", List.of()),
                    new RawElement("CRC-32", "0xBF", ValueType.BINARY, "\\(1-\\)CRC-32", List.of()));

    private static Catalog assemble(List<RawElement> elements, List<DeprecatedAlias> aliases, List<RawTag> tags) {
        return new CatalogAssembler(TagNaming.defaults(), aliases)
                .assemble(elements, HierarchyResolver.resolve(elements), tags);
    }

    private static List<String> elementNames(Catalog catalog) {
        return catalog.elements().stream().map(ElementDefinition::name).toList();
    }

    @Test
    void elementsSortByEmittedConstantName() {
        Catalog catalog = assemble(ELEMENTS, List.of(), List.of());
        // "TimecodeElement" < "TimecodeScaleElement" because 'E' < 'S'
        assertEquals(List.of("CRC32", "Segment", "Timecode", "TimecodeScale"), elementNames(catalog));
    }

    @Test
    void canonicalNamesApplyToDescendants() {
        Catalog catalog = assemble(ELEMENTS, List.of(), List.of());
        ElementDefinition segment = catalog.element("Segment").orElseThrow();

        assertEquals(
                List.of("TimecodeScale", "Timecode", "CRC32"),
                segment.descendants().stream().map(Descendant::name).toList());
        assertEquals("\\(1-\\)CRC-32", segment.descendants().get(2).path());
        assertTrue(segment.root());
    }

    @Test
    void elementFieldsCarryThrough() {
        ElementDefinition crc = assemble(ELEMENTS, List.of(), List.of()).element("CRC32").orElseThrow();
        assertEquals("0xBF", crc.rawId());
        assertEquals(ValueType.BINARY, crc.valueType());
        assertTrue(crc.path().global());
        assertFalse(crc.root());
        assertFalse(crc.deprecated());
        assertTrue(crc.descendants().isEmpty());
    }

    @Test
    void aliasSharesTargetIdAndSortsWithOthers() {
        Catalog catalog =
                assemble(ELEMENTS, List.of(new DeprecatedAlias("TimeCodeScale", "TimecodeScale")), List.of());

        assertEquals(List.of("CRC32", "Segment", "TimeCodeScale", "Timecode", "TimecodeScale"), elementNames(catalog));
        ElementDefinition alias = catalog.element("TimeCodeScale").orElseThrow();
        assertTrue(alias.deprecated());
        assertEquals("0x2AD7B1", alias.rawId());
        assertEquals(ValueType.UNSIGNED_INTEGER, alias.valueType());
        assertNull(alias.path());
        assertEquals("", alias.pathText());
        assertFalse(alias.root());
    }

    @Test
    void aliasNamingExistingElementIsSkipped() {
        Catalog catalog = assemble(ELEMENTS, List.of(new DeprecatedAlias("Timecode", "TimecodeScale")), List.of());
        ElementDefinition timecode = catalog.element("Timecode").orElseThrow();
        assertFalse(timecode.deprecated());
        assertEquals("0xE7", timecode.rawId());
        assertEquals(4, catalog.elements().size());
    }

    @Test
    void aliasToUnknownElementIsInvalidConfiguration() {
        CatalogException e =
                assertThrows(
                        CatalogException.class,
                        () -> assemble(ELEMENTS, List.of(new DeprecatedAlias("TimeCode", "Timestamp")), List.of()));
        assertEquals(CatalogFailure.INVALID_CONFIGURATION, e.failure());
    }

    @Test
    void namesCollidingAfterCanonicalizationAreMalformed() {
        List<RawElement> colliding =
                List.of(
                        new RawElement("CRC-32", "0xBF", ValueType.BINARY, "\\CRC-32", List.of()),
                        new RawElement("CRC32", "0xC0", ValueType.BINARY, "\\CRC32", List.of()));
        CatalogException e = assertThrows(CatalogException.class, () -> assemble(colliding, List.of(), List.of()));
        assertEquals(CatalogFailure.MALFORMED_SCHEMA_RECORD, e.failure());
    }

    @Test
    void elementsSharingAnIdAreMalformed() {
        List<RawElement> sameId =
                List.of(
                        new RawElement("Timecode", "0xE7", ValueType.UNSIGNED_INTEGER, "\\Timecode", List.of()),
                        new RawElement("Timestamp", "0xe7", ValueType.UNSIGNED_INTEGER, "\\Timestamp", List.of()));
        CatalogException e = assertThrows(CatalogException.class, () -> assemble(sameId, List.of(), List.of()));
        assertEquals(CatalogFailure.MALFORMED_SCHEMA_RECORD, e.failure());
        assertTrue(e.getMessage().contains("Timecode and Timestamp"), e.getMessage());
    }

    @Test
    void tagsSharingAnIdentifierAreMalformed() {
        CatalogAssembler assembler =
                new CatalogAssembler(TagNaming.withOverrides(Map.of("SUBTITLE", "Title")), List.of());
        CatalogException e =
                assertThrows(
                        CatalogException.class,
                        () -> assembler.assemble(
                                ELEMENTS,
                                HierarchyResolver.resolve(ELEMENTS),
                                List.of(new RawTag("TITLE"), new RawTag("SUBTITLE"))));
        assertEquals(CatalogFailure.MALFORMED_SCHEMA_RECORD, e.failure());
    }

    @Test
    void tagsSortByConstantNameAndDropRepeats() {
        Catalog catalog =
                assemble(
                        ELEMENTS,
                        List.of(),
                        List.of(
                                new RawTag("TITLE"),
                                new RawTag("REPLAYGAIN_PEAK"),
                                new RawTag("BPM"),
                                new RawTag("TITLE"),
                                new RawTag("DATE_RELEASED")));

        assertEquals(
                List.of(
                        new TagDefinition("BPM", "BPM"),
                        new TagDefinition("DATE_RELEASED", "DateReleased"),
                        new TagDefinition("REPLAYGAIN_PEAK", "ReplayGainPeak"),
                        new TagDefinition("TITLE", "Title")),
                catalog.tags());
    }

    @Test
    void catalogCountsEnumerations() {
        Catalog catalog = assemble(ELEMENTS, List.of(), List.of());
        assertEquals(0, catalog.enumerationCount());
        assertEquals(List.of("Segment"), catalog.roots().stream().map(ElementDefinition::name).toList());
        assertEquals(1, catalog.masters().size());
    }
}

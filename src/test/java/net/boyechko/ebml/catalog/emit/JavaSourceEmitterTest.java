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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.catalog.CatalogAssembler;
import net.boyechko.ebml.catalog.catalog.DeprecatedAlias;
import net.boyechko.ebml.catalog.catalog.HierarchyResolver;
import net.boyechko.ebml.catalog.naming.TagNaming;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawEnumEntry;
import net.boyechko.ebml.catalog.schema.RawTag;
import net.boyechko.ebml.catalog.schema.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JavaSourceEmitterTest {

    private Catalog catalog;
    private JavaSourceEmitter emitter;

    @BeforeEach
    void setUp() {
        List<RawElement> elements =
                List.of(
                        new RawElement("EBML", "0x1A45DFA3", ValueType.MASTER, "\\EBML", List.of()),
                        new RawElement(
                                "DocType", "0x4282", ValueType.STRING, "\\EBML\\DocType",
                                List.of(new RawEnumEntry("webm", "WebM"))),
                        new RawElement(
                                "StereoMode", "0x53B8", ValueType.UNSIGNED_INTEGER, "\\EBML\\StereoMode",
                                List.of(new RawEnumEntry("0", "mono"), new RawEnumEntry("1", "*/ sneaky"))),
                        new RawElement("CRC-32", "0xBF", ValueType.BINARY, "\\(1-\\)CRC-32", List.of()),
                        new RawElement("Unknown", "0x1111", ValueType.BINARY, "\\EBML\\unknown", List.of()));
        catalog =
                new CatalogAssembler(TagNaming.defaults(), List.of(new DeprecatedAlias("DocKind", "DocType")))
                        .assemble(elements, HierarchyResolver.resolve(elements), List.of(new RawTag("TITLE"), new RawTag("BPM")));
        emitter = new JavaSourceEmitter("org.example.mkv", "Elements", "Tags");
    }

    @Test
    void rendersOneFilePerClass() {
        List<Artifact> artifacts = emitter.render(catalog);
        assertEquals(List.of("Elements.java", "Tags.java"), artifacts.stream().map(Artifact::fileName).toList());
        for (Artifact artifact : artifacts) {
            assertTrue(artifact.content().startsWith(JavaSourceEmitter.GENERATED_HEADER + "\npackage org.example.mkv;\n"));
        }
    }

    @Test
    void elementConstantsFollowCatalogOrder() {
        String src = emitter.renderElements(catalog);
        int crc = src.indexOf("public static final int CRC32Element = 0xBF;");
        int kind = src.indexOf("public static final int DocKindElement = 0x4282;");
        int type = src.indexOf("public static final int DocTypeElement = 0x4282;");
        int ebml = src.indexOf("public static final int EBMLElement = 0x1A45DFA3;");
        assertTrue(crc >= 0 && crc < kind && kind < type && type < ebml, src);
    }

    @Test
    void deprecatedAliasIsConstantOnly() {
        String src = emitter.renderElements(catalog);
        assertTrue(src.contains("/** @deprecated Do not use. */\n    @Deprecated\n    public static final int DocKindElement"));
        assertFalse(src.contains("case DocKindElement"));
        assertFalse(src.contains("Map.entry(DocKindElement"));
    }

    @Test
    void typeLookupCoversLiveElements() {
        String src = emitter.renderElements(catalog);
        assertTrue(src.contains("case DocTypeElement:\n                return ElementType.STRING;"));
        assertTrue(src.contains("case EBMLElement:\n                return ElementType.MASTER;"));
        assertTrue(src.contains("Map.entry(CRC32Element, \"CRC32\"),"));
    }

    @Test
    void descendantTablesAndRoots() {
        String src = emitter.renderElements(catalog);
        assertTrue(src.contains("private static final int[] EBMLDescendants ="));
        assertTrue(src.contains("DocTypeElement, // \\EBML\\DocType"));
        assertTrue(src.contains("CRC32Element, // \\(1-\\)CRC-32"));
        assertTrue(src.contains("case EBMLElement: // \\EBML\n                return Arrays.binarySearch(EBMLDescendants, child) >= 0;"));
        assertFalse(src.contains("DocTypeDescendants"));
        assertTrue(src.contains("public static boolean isRoot(int id) {\n        switch (id) {\n            case EBMLElement: // \\EBML\n                return true;\n            default:"));
    }

    @Test
    void unicodeEscapeLookalikesInPathsAreDefused() {
        String src = emitter.renderElements(catalog);
        assertTrue(src.contains("// \\EBML\\\\unknown"));
        assertFalse(src.contains("// \\EBML\\unknown"));
    }

    @Test
    void enumerationConstantsAreTyped() {
        String src = emitter.renderElements(catalog);
        assertTrue(src.contains("// Possible DocTypeElement values\n    /** WebM */\n    public static final String DocType_Webm = \"webm\";"));
        assertTrue(src.contains("/** mono */\n    public static final long StereoMode_Mono = 0L;"));
        assertTrue(src.contains("/** *&#47; sneaky */"));
    }

    @Test
    void tagsRenderAsStringConstants() {
        String src = emitter.renderTags(catalog);
        assertTrue(src.contains("public final class Tags {"));
        int bpm = src.indexOf("public static final String TagBPM = \"BPM\";");
        int title = src.indexOf("public static final String TagTitle = \"TITLE\";");
        assertTrue(bpm >= 0 && bpm < title, src);
    }

    @Test
    void renderingIsDeterministic() {
        assertEquals(emitter.render(catalog), emitter.render(catalog));
    }
}

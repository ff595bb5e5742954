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
import java.util.Map;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.catalog.CatalogAssembler;
import net.boyechko.ebml.catalog.catalog.DeprecatedAlias;
import net.boyechko.ebml.catalog.catalog.HierarchyResolver;
import net.boyechko.ebml.catalog.naming.TagNaming;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawEnumEntry;
import net.boyechko.ebml.catalog.schema.RawTag;
import net.boyechko.ebml.catalog.schema.ValueType;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

public class CatalogDumpTest {

    private static Catalog catalog() {
        List<RawElement> elements =
                List.of(
                        new RawElement("Segment", "0x18538067", ValueType.MASTER, "\\Segment", List.of()),
                        new RawElement(
                                "FlagLacing", "0x9C", ValueType.UNSIGNED_INTEGER, "\\Segment\\FlagLacing",
                                List.of(new RawEnumEntry("0", "off"), new RawEnumEntry("1", "on"))),
                        new RawElement("Void", "0xEC", ValueType.BINARY, "\\(-\\)Void", List.of()));
        return new CatalogAssembler(TagNaming.defaults(), List.of(new DeprecatedAlias("Lacing", "FlagLacing")))
                .assemble(elements, HierarchyResolver.resolve(elements), List.of(new RawTag("URL")));
    }

    @Test
    void indentedTreeListsFlagsValuesAndDescendants() {
        String expected =
                String.join(
                        "\n",
                        "Elements (4)",
                        "  FlagLacing 0x9C uinteger \\Segment\\FlagLacing",
                        "    = Off 0",
                        "    = On 1",
                        "  Lacing 0x9C uinteger deprecated",
                        "  Segment 0x18538067 master root \\Segment",
                        "    > FlagLacing",
                        "    > Void",
                        "  Void 0xEC binary \\(-\\)Void global",
                        "Tags (1)",
                        "  URL URL",
                        "");
        assertEquals(expected, CatalogDump.toIndentedString(catalog()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void yamlDumpParsesBack() {
        Map<String, Object> parsed = new Yaml().load(CatalogDump.toYaml(catalog()));

        List<Map<String, Object>> elements = (List<Map<String, Object>>) parsed.get("elements");
        assertEquals(4, elements.size());
        Map<String, Object> segment = elements.get(2);
        assertEquals("Segment", segment.get("name"));
        assertEquals("0x18538067", segment.get("id"));
        assertEquals(Boolean.TRUE, segment.get("root"));
        assertEquals(List.of("FlagLacing", "Void"), segment.get("descendants"));

        Map<String, Object> alias = elements.get(1);
        assertEquals("", alias.get("path"));
        assertEquals(Boolean.TRUE, alias.get("deprecated"));

        List<Map<String, Object>> values = (List<Map<String, Object>>) elements.get(0).get("enumerations");
        assertEquals("Off", values.get(0).get("name"));
        assertEquals("0", values.get(0).get("literal"));

        assertEquals(Map.of("URL", "URL"), parsed.get("tags"));
    }
}

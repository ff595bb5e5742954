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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.catalog.Descendant;
import net.boyechko.ebml.catalog.catalog.ElementDefinition;
import net.boyechko.ebml.catalog.catalog.EnumerationValue;
import net.boyechko.ebml.catalog.catalog.TagDefinition;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/** Human-readable renderings of a catalog, for inspection rather than code generation. */
public final class CatalogDump {
    private CatalogDump() {}

    /**
     * Indented text tree: one line per element with its flags, then its enumerations and
     * descendants, then the tags.
     */
    public static String toIndentedString(Catalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("Elements (").append(catalog.elements().size()).append(")\n");
        for (ElementDefinition e : catalog.elements()) {
            sb.append("  ").append(e.name()).append(' ').append(e.rawId());
            sb.append(' ').append(e.valueType().wireName());
            if (e.root()) {
                sb.append(" root");
            }
            if (e.deprecated()) {
                sb.append(" deprecated");
            }
            if (e.path() != null) {
                sb.append(' ').append(e.path().text());
                if (e.path().global()) {
                    sb.append(" global");
                }
            }
            sb.append('\n');
            for (EnumerationValue v : e.enumerations()) {
                sb.append("    = ").append(v.name()).append(' ').append(v.literal()).append('\n');
            }
            for (Descendant d : e.descendants()) {
                sb.append("    > ").append(d.name()).append('\n');
            }
        }
        sb.append("Tags (").append(catalog.tags().size()).append(")\n");
        for (TagDefinition t : catalog.tags()) {
            sb.append("  ").append(t.identifierName()).append(' ').append(t.officialName()).append('\n');
        }
        return sb.toString();
    }

    public static String toYaml(Catalog catalog) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(toMap(catalog));
    }

    static Map<String, Object> toMap(Catalog catalog) {
        List<Object> elements = new ArrayList<>();
        for (ElementDefinition e : catalog.elements()) {
            Map<String, Object> el = new LinkedHashMap<>();
            el.put("name", e.name());
            el.put("id", e.rawId());
            el.put("type", e.valueType().wireName());
            el.put("path", e.pathText());
            el.put("global", e.path() != null && e.path().global());
            el.put("root", e.root());
            el.put("deprecated", e.deprecated());
            if (e.hasEnumerations()) {
                List<Object> values = new ArrayList<>();
                for (EnumerationValue v : e.enumerations()) {
                    Map<String, Object> value = new LinkedHashMap<>();
                    value.put("name", v.name());
                    value.put("label", v.label());
                    value.put("literal", v.literal());
                    values.add(value);
                }
                el.put("enumerations", values);
            }
            if (!e.descendants().isEmpty()) {
                List<Object> nested = new ArrayList<>();
                for (Descendant d : e.descendants()) {
                    nested.add(d.name());
                }
                el.put("descendants", nested);
            }
            elements.add(el);
        }

        Map<String, Object> tags = new LinkedHashMap<>();
        for (TagDefinition t : catalog.tags()) {
            tags.put(t.identifierName(), t.officialName());
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("elements", elements);
        root.put("tags", tags);
        return root;
    }
}

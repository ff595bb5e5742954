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

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.ebml.catalog.catalog.Catalog;
import net.boyechko.ebml.catalog.catalog.Descendant;
import net.boyechko.ebml.catalog.catalog.ElementDefinition;
import net.boyechko.ebml.catalog.catalog.EnumerationValue;
import net.boyechko.ebml.catalog.catalog.LiteralType;
import net.boyechko.ebml.catalog.catalog.TagDefinition;
import net.boyechko.ebml.catalog.schema.ValueType;

/**
 * Emits two Java source files: one with element ID constants, type and name lookups, nesting
 * predicates and enumeration constants, and one with the official tag names.
 *
 * <p>Deprecated elements get a constant but are left out of every lookup, since they share their
 * identifier with the element that replaced them.
 */
public class JavaSourceEmitter implements CatalogEmitter {
    static final String GENERATED_HEADER = "// Code generated by ebml-catalog. DO NOT EDIT.";
    private static final String ELEMENT_SUFFIX = "Element";
    private static final String TAG_PREFIX = "Tag";
    private static final String INDENT = "    ";

    private final String javaPackage;
    private final String elementsClass;
    private final String tagsClass;

    public JavaSourceEmitter(String javaPackage, String elementsClass, String tagsClass) {
        this.javaPackage = javaPackage;
        this.elementsClass = elementsClass;
        this.tagsClass = tagsClass;
    }

    @Override
    public List<Artifact> render(Catalog catalog) {
        return List.of(
                new Artifact(elementsClass + ".java", renderElements(catalog)),
                new Artifact(tagsClass + ".java", renderTags(catalog)));
    }

    String renderElements(Catalog catalog) {
        List<ElementDefinition> live =
                catalog.elements().stream().filter(e -> !e.deprecated()).collect(Collectors.toList());
        SourceBuilder src = new SourceBuilder();

        src.line(GENERATED_HEADER);
        src.line("package " + javaPackage + ";");
        src.blank();
        src.line("import java.util.Arrays;");
        src.line("import java.util.Map;");
        src.blank();
        src.line("/** EBML element identifiers, value types and nesting rules. */");
        src.line("public final class " + elementsClass + " {");
        src.indent();
        src.line("private " + elementsClass + "() {}");
        src.blank();

        src.line("/** Value type carried by an element. */");
        src.line("public enum ElementType {");
        src.indent();
        ValueType[] types = ValueType.values();
        for (int i = 0; i < types.length; i++) {
            src.line(types[i].name() + (i < types.length - 1 ? "," : ""));
        }
        src.outdent();
        src.line("}");
        src.blank();

        src.line("// Supported element IDs");
        for (ElementDefinition e : catalog.elements()) {
            if (e.deprecated()) {
                src.line("/** @deprecated Do not use. */");
                src.line("@Deprecated");
            }
            src.line("public static final int " + constant(e) + " = " + e.rawId() + ";");
        }
        src.blank();

        renderTypeLookup(src, live);
        renderNames(src, live);
        renderDescendants(src, live);
        renderRoots(src, live);
        renderEnumerations(src, catalog.elements());

        src.line("private static int[] sorted(int... ids) {");
        src.indent();
        src.line("int[] copy = ids.clone();");
        src.line("Arrays.sort(copy);");
        src.line("return copy;");
        src.outdent();
        src.line("}");
        src.outdent();
        src.line("}");
        return src.toString();
    }

    private void renderTypeLookup(SourceBuilder src, List<ElementDefinition> live) {
        src.line("/** Returns the value type of an element, or null if the ID is unknown. */");
        src.line("public static ElementType typeOf(int id) {");
        src.indent();
        src.line("switch (id) {");
        src.indent();
        for (ElementDefinition e : live) {
            src.line("case " + constant(e) + ":");
            src.line(INDENT + "return ElementType." + e.valueType().name() + ";");
        }
        src.line("default:");
        src.line(INDENT + "return null;");
        src.outdent();
        src.line("}");
        src.outdent();
        src.line("}");
        src.blank();
    }

    private void renderNames(SourceBuilder src, List<ElementDefinition> live) {
        src.line("private static final Map<Integer, String> NAMES =");
        src.indent();
        src.line("Map.ofEntries(");
        src.indent();
        for (int i = 0; i < live.size(); i++) {
            ElementDefinition e = live.get(i);
            src.line(
                    "Map.entry(" + constant(e) + ", " + quote(e.name()) + ")"
                            + (i < live.size() - 1 ? "," : ");"));
        }
        if (live.isEmpty()) {
            src.line(");");
        }
        src.outdent();
        src.outdent();
        src.blank();
        src.line("/** Returns the schema name of an element, or null if the ID is unknown. */");
        src.line("public static String nameOf(int id) {");
        src.indent();
        src.line("return NAMES.get(id);");
        src.outdent();
        src.line("}");
        src.blank();
    }

    private void renderDescendants(SourceBuilder src, List<ElementDefinition> live) {
        List<ElementDefinition> masters =
                live.stream().filter(ElementDefinition::isMaster).collect(Collectors.toList());
        for (ElementDefinition m : masters) {
            src.line("private static final int[] " + m.name() + "Descendants =");
            src.indent();
            src.line("sorted(");
            src.indent();
            List<Descendant> nested = m.descendants();
            for (int i = 0; i < nested.size(); i++) {
                Descendant d = nested.get(i);
                src.line(
                        d.name() + ELEMENT_SUFFIX + (i < nested.size() - 1 ? "," : "")
                                + " // " + comment(d.path()));
            }
            src.outdent();
            src.line(");");
            src.outdent();
        }
        if (!masters.isEmpty()) {
            src.blank();
        }

        src.line("/** True if {@code child} may appear anywhere below {@code parent}. */");
        src.line("public static boolean isDescendant(int child, int parent) {");
        src.indent();
        src.line("switch (parent) {");
        src.indent();
        for (ElementDefinition m : masters) {
            src.line("case " + constant(m) + ": // " + comment(m.pathText()));
            src.line(INDENT + "return Arrays.binarySearch(" + m.name() + "Descendants, child) >= 0;");
        }
        src.line("default:");
        src.line(INDENT + "return false;");
        src.outdent();
        src.line("}");
        src.outdent();
        src.line("}");
        src.blank();
    }

    private void renderRoots(SourceBuilder src, List<ElementDefinition> live) {
        src.line("/** True if the element sits directly beneath the document root. */");
        src.line("public static boolean isRoot(int id) {");
        src.indent();
        src.line("switch (id) {");
        src.indent();
        for (ElementDefinition e : live) {
            if (e.root()) {
                src.line("case " + constant(e) + ": // " + comment(e.pathText()));
                src.line(INDENT + "return true;");
            }
        }
        src.line("default:");
        src.line(INDENT + "return false;");
        src.outdent();
        src.line("}");
        src.outdent();
        src.line("}");
        src.blank();
    }

    private void renderEnumerations(SourceBuilder src, List<ElementDefinition> elements) {
        for (ElementDefinition e : elements) {
            if (!e.hasEnumerations()) {
                continue;
            }
            src.line("// Possible " + constant(e) + " values");
            for (EnumerationValue v : e.enumerations()) {
                src.line("/** " + javadoc(v.label()) + " */");
                if (v.type() == LiteralType.TEXT) {
                    src.line("public static final String " + e.name() + "_" + v.name() + " = " + v.literal() + ";");
                } else {
                    src.line("public static final long " + e.name() + "_" + v.name() + " = " + v.literal() + "L;");
                }
            }
            src.blank();
        }
    }

    String renderTags(Catalog catalog) {
        SourceBuilder src = new SourceBuilder();
        src.line(GENERATED_HEADER);
        src.line("package " + javaPackage + ";");
        src.blank();
        src.line("/** Official tags. See https://www.matroska.org/technical/tagging.html */");
        src.line("public final class " + tagsClass + " {");
        src.indent();
        src.line("private " + tagsClass + "() {}");
        src.blank();
        for (TagDefinition tag : catalog.tags()) {
            src.line(
                    "public static final String " + TAG_PREFIX + tag.identifierName() + " = "
                            + quote(tag.officialName()) + ";");
        }
        src.outdent();
        src.line("}");
        return src.toString();
    }

    private static String constant(ElementDefinition e) {
        return e.name() + ELEMENT_SUFFIX;
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /** Paths contain backslashes; a {@code \\u} in a comment would still be read as an escape. */
    private static String comment(String text) {
        return text.replace("\\u", "\\\\u").replaceAll("[\\r\\n]+", " ");
    }

    private static String javadoc(String text) {
        return comment(text).replace("*/", "*&#47;");
    }

    /** Line-oriented text builder with four-space indentation. */
    private static final class SourceBuilder {
        private final StringBuilder sb = new StringBuilder();
        private int depth;

        void line(String text) {
            sb.append(INDENT.repeat(depth)).append(text).append('\n');
        }

        void blank() {
            sb.append('\n');
        }

        void indent() {
            depth++;
        }

        void outdent() {
            depth--;
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}

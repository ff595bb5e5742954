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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.ebml.catalog.path.PathExpression;

/**
 * The nesting relation over a merged element list, keyed by schema element name. Immutable once
 * built.
 *
 * @param paths parsed path of every element
 * @param descendants for every master element, the elements that may nest under it, in merge
 *     order
 * @param roots elements directly beneath the document root, in merge order
 */
public record Hierarchy(
        Map<String, PathExpression> paths,
        Map<String, List<Descendant>> descendants,
        Set<String> roots) {
    public Hierarchy {
        paths = unmodifiableCopy(paths);
        Map<String, List<Descendant>> copy = new LinkedHashMap<>();
        descendants.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        descendants = Collections.unmodifiableMap(copy);
        roots = Collections.unmodifiableSet(new LinkedHashSet<>(roots));
    }

    public List<Descendant> descendantsOf(String name) {
        return descendants.getOrDefault(name, List.of());
    }

    public boolean isDescendant(String child, String parent) {
        return descendantsOf(parent).stream().anyMatch(d -> d.name().equals(child));
    }

    public boolean isRoot(String name) {
        return roots.contains(name);
    }

    public PathExpression pathOf(String name) {
        return paths.get(name);
    }

    private static <K, V> Map<K, V> unmodifiableCopy(Map<K, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}

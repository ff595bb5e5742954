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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.ebml.catalog.path.PathExpression;
import net.boyechko.ebml.catalog.path.PathGrammar;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes which elements may nest under which, and which elements are roots.
 *
 * <p>Element A is a descendant of element B when A is not B and either A is global, or B's path
 * is a strict structural prefix of A's path. Only master elements collect descendants. Every path
 * is parsed before any relation is computed, so one bad path aborts the run.
 */
public final class HierarchyResolver {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyResolver.class);

    private HierarchyResolver() {}

    /**
     * @param elements merged elements with unique names
     * @throws net.boyechko.ebml.catalog.error.CatalogException if any path cannot be parsed
     */
    public static Hierarchy resolve(List<RawElement> elements) {
        Map<String, PathExpression> paths = new LinkedHashMap<>();
        for (RawElement element : elements) {
            paths.put(element.name(), PathGrammar.parse(element.path()));
        }

        Set<String> roots = new LinkedHashSet<>();
        Map<String, List<Descendant>> descendants = new LinkedHashMap<>();
        for (RawElement parent : elements) {
            PathExpression parentPath = paths.get(parent.name());
            if (parentPath.isRoot()) {
                roots.add(parent.name());
            }
            if (parent.valueType() != ValueType.MASTER) {
                continue;
            }
            List<Descendant> nested = new ArrayList<>();
            for (RawElement child : elements) {
                PathExpression childPath = paths.get(child.name());
                if (isDescendant(child.name(), childPath, parent.name(), parentPath)) {
                    nested.add(new Descendant(child.name(), childPath.text()));
                }
            }
            descendants.put(parent.name(), nested);
        }

        logger.debug(
                "Resolved {} master elements and {} roots over {} elements",
                descendants.size(),
                roots.size(),
                elements.size());
        return new Hierarchy(paths, descendants, roots);
    }

    static boolean isDescendant(
            String childName, PathExpression childPath, String parentName, PathExpression parentPath) {
        if (childName.equals(parentName)) {
            return false;
        }
        return childPath.global() || parentPath.isAncestorOf(childPath);
    }
}

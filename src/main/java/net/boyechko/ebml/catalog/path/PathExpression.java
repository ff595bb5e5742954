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

import java.util.List;

/**
 * A parsed element path: the ordered segments below the document root and whether the element
 * is global (may recur at any depth). Ancestry is decided on segments, never on raw text, so
 * {@code \A} is an ancestor of {@code \A\B} but not of {@code \AB}.
 *
 * @param text the path as it appeared in the source, after legacy normalization
 * @param segments element names from outermost to innermost; never empty
 * @param global true if the path carried a leading {@code (lo-hi\)} occurrence marker
 */
public record PathExpression(String text, List<String> segments, boolean global) {
    public PathExpression {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one segment: " + text);
        }
    }

    /** True if the element sits directly beneath the document root. */
    public boolean isRoot() {
        return !global && segments.size() == 1;
    }

    /** The innermost segment, i.e. the element's own name as written in the path. */
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    /**
     * True if this path is a strict structural prefix of {@code other}: every segment of this path
     * matches the leading segments of {@code other}, and {@code other} has more of them.
     */
    public boolean isAncestorOf(PathExpression other) {
        return segments.size() < other.segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    @Override
    public String toString() {
        return text;
    }
}

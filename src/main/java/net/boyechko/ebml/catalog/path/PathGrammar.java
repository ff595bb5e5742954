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

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;

/**
 * Parser for the compact path notation used by EBML schemas.
 *
 * <pre>
 *   path    := '\' marker? segment ('\' segment)*
 *   marker  := '(' digits? '-' digits? '\)'
 * </pre>
 *
 * A leading marker makes the element global. Legacy schemas additionally wrap parts of a path in
 * repetition markers such as {@code 1*4(Inner)}; {@link #stripRepetitionMarkers} removes them
 * before parsing.
 */
public final class PathGrammar {
    public static final char DELIMITER = '\\';

    private static final Pattern PATH = Pattern.compile("\\\\(\\(\\d*-\\d*\\\\\\))?(.*)");
    private static final Pattern GLOBAL_MARKER = Pattern.compile("\\\\\\(\\d*-\\d*\\\\\\)");
    private static final Pattern REPETITION = Pattern.compile("\\d*\\*\\d*\\(|\\(|\\)");

    private PathGrammar() {}

    /**
     * Parses a raw path.
     *
     * @throws CatalogException with {@link CatalogFailure#UNPARSEABLE_PATH_EXPRESSION} if the path
     *     does not start with the delimiter or has an empty segment
     */
    public static PathExpression parse(String raw) {
        if (raw == null) {
            throw unparseable(null, "path is missing");
        }
        Matcher m = PATH.matcher(raw);
        if (!m.matches()) {
            throw unparseable(raw, "path must start with '" + DELIMITER + "'");
        }
        boolean global = m.group(1) != null;
        String body = m.group(2);
        List<String> segments = Arrays.asList(body.split(Pattern.quote(String.valueOf(DELIMITER)), -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw unparseable(raw, "path has an empty segment");
        }
        return new PathExpression(raw, segments, global);
    }

    /**
     * Removes legacy repetition markers ({@code n*m(}, bare {@code (} and {@code )}) from a path.
     * A leading global marker is left untouched.
     */
    public static String stripRepetitionMarkers(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher marker = GLOBAL_MARKER.matcher(raw);
        if (marker.lookingAt()) {
            return raw.substring(0, marker.end())
                    + REPETITION.matcher(raw.substring(marker.end())).replaceAll("");
        }
        return REPETITION.matcher(raw).replaceAll("");
    }

    private static CatalogException unparseable(String raw, String reason) {
        return new CatalogException(
                CatalogFailure.UNPARSEABLE_PATH_EXPRESSION,
                "Unable to match path '" + raw + "': " + reason);
    }
}

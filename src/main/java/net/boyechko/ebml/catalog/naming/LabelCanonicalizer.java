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
package net.boyechko.ebml.catalog.naming;

import java.util.Locale;
import java.util.regex.Pattern;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;

/**
 * Turns free-text labels into identifier fragments: {@code "stereo mode"} becomes {@code
 * "StereoMode"}, {@code "ISBN-10"} becomes {@code "ISBN10"}.
 *
 * <p>Hyphens, periods, slashes and parentheses count as word separators. A word made only of
 * uppercase letters (non-letters ignored) is kept verbatim as an acronym; any other word is
 * lowercased and then gets its first character uppercased.
 */
public final class LabelCanonicalizer {
    private static final Pattern SEPARATORS = Pattern.compile("[-./()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LabelCanonicalizer() {}

    /** Canonicalizes a label. The result is empty when the label has no words. */
    public static String canonicalize(String label) {
        if (label == null) {
            return "";
        }
        String spaced = SEPARATORS.matcher(label).replaceAll(" ").trim();
        if (spaced.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String word : WHITESPACE.split(spaced)) {
            if (word.isEmpty()) {
                continue;
            }
            sb.append(isAcronym(word) ? word : titleCase(word.toLowerCase(Locale.ROOT)));
        }
        return sb.toString();
    }

    /**
     * Canonicalizes a label that must produce a name.
     *
     * @param context what the label belongs to, used in the error message
     * @throws CatalogException with {@link CatalogFailure#EMPTY_CANONICAL_NAME} if the result is
     *     empty
     */
    public static String require(String label, String context) {
        String name = canonicalize(label);
        if (name.isEmpty()) {
            throw new CatalogException(
                    CatalogFailure.EMPTY_CANONICAL_NAME,
                    "Label '" + label + "' of " + context + " has no identifier characters");
        }
        return name;
    }

    static boolean isAcronym(String word) {
        for (int i = 0; i < word.length(); ) {
            int cp = word.codePointAt(i);
            if (Character.isLetter(cp) && !Character.isUpperCase(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    private static String titleCase(String word) {
        int first = word.codePointAt(0);
        return new StringBuilder()
                .appendCodePoint(Character.toUpperCase(first))
                .append(word, Character.charCount(first), word.length())
                .toString();
    }
}

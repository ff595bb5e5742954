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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;

/**
 * Derives identifiers for official tag names. {@code ORIGINAL_MEDIA_TYPE} becomes {@code
 * OriginalMediaType}; names listed in the override table map to a fixed identifier instead.
 */
public final class TagNaming {
    /** Short acronyms kept verbatim and compound names that would otherwise read ambiguously. */
    public static final Map<String, String> DEFAULT_OVERRIDES =
            Map.ofEntries(
                    Map.entry("BPM", "BPM"),
                    Map.entry("BPS", "BPS"),
                    Map.entry("FPS", "FPS"),
                    Map.entry("IMDB", "IMDB"),
                    Map.entry("ISBN", "ISBN"),
                    Map.entry("ISRC", "ISRC"),
                    Map.entry("LCCN", "LCCN"),
                    Map.entry("MCDI", "MCDI"),
                    Map.entry("TMDB", "TMDB"),
                    Map.entry("TVDB", "TVDB"),
                    Map.entry("URL", "URL"),
                    Map.entry("REPLAYGAIN_GAIN", "ReplayGainGain"),
                    Map.entry("REPLAYGAIN_PEAK", "ReplayGainPeak"));

    private final Map<String, String> overrides;

    private TagNaming(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    public static TagNaming defaults() {
        return new TagNaming(DEFAULT_OVERRIDES);
    }

    /**
     * Returns naming rules with the given entries added to, or replacing, the defaults.
     *
     * @throws CatalogException with {@link CatalogFailure#EMPTY_CANONICAL_NAME} if an override
     *     has no identifier
     */
    public static TagNaming withOverrides(Map<String, String> extra) {
        Map<String, String> merged = new HashMap<>(DEFAULT_OVERRIDES);
        if (extra != null) {
            for (Map.Entry<String, String> entry : extra.entrySet()) {
                if (entry.getValue() == null || entry.getValue().isBlank()) {
                    throw new CatalogException(
                            CatalogFailure.EMPTY_CANONICAL_NAME,
                            "Tag override for " + entry.getKey() + " has no identifier");
                }
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return new TagNaming(merged);
    }

    public String identifierFor(String officialName) {
        String override = overrides.get(officialName);
        if (override != null) {
            return override;
        }
        String words = officialName == null ? null : officialName.replace('_', ' ');
        return LabelCanonicalizer.require(
                words == null ? null : words.toLowerCase(Locale.ROOT), "tag " + officialName);
    }

    public Map<String, String> overrides() {
        return overrides;
    }
}

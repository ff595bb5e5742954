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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import net.boyechko.ebml.catalog.naming.LabelCanonicalizer;
import net.boyechko.ebml.catalog.schema.RawElement;
import net.boyechko.ebml.catalog.schema.RawEnumEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an element's raw restriction entries into named, typed constants.
 *
 * <p>Labels are canonicalized. A label that canonicalizes to {@value #RESERVED} gets its entry
 * index appended ({@code Reserved0}, {@code Reserved1}, ...). A later entry whose name is already
 * taken is dropped. Surviving entries keep document order.
 */
public final class EnumerationNormalizer {
    static final String RESERVED = "Reserved";

    private static final Logger logger = LoggerFactory.getLogger(EnumerationNormalizer.class);

    private EnumerationNormalizer() {}

    public static List<EnumerationValue> normalize(RawElement element) {
        List<RawEnumEntry> entries = element.enumerations();
        LiteralType type =
                element.valueType().isStringLike() ? LiteralType.TEXT : LiteralType.SIGNED_INTEGER;

        List<EnumerationValue> values = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            RawEnumEntry entry = entries.get(i);
            String name = LabelCanonicalizer.require(entry.label(), element.name() + " value " + entry.value());
            if (RESERVED.equals(name)) {
                name = RESERVED + i;
            }
            if (!used.add(name)) {
                logger.debug(
                        "{}: dropping value {} ({}), name {} already used",
                        element.name(),
                        entry.value(),
                        entry.label(),
                        name);
                continue;
            }
            if (type == LiteralType.SIGNED_INTEGER) {
                requireInteger(element, entry);
            }
            values.add(new EnumerationValue(entry.label(), name, entry.value(), type));
        }
        return values;
    }

    private static void requireInteger(RawElement element, RawEnumEntry entry) {
        try {
            Long.decode(entry.value());
        } catch (NumberFormatException e) {
            throw new CatalogException(
                    CatalogFailure.MALFORMED_SCHEMA_RECORD,
                    element.name()
                            + ": enumerated value '"
                            + entry.value()
                            + "' is not an integer but the element is "
                            + element.valueType().wireName(),
                    e);
        }
    }
}

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
package net.boyechko.ebml.catalog.schema;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import org.w3c.dom.Element;

/** Reads the official tag names from a {@code <matroska_tagging_registry>} document. */
public final class TagRegistryReader {
    private TagRegistryReader() {}

    public static List<RawTag> read(byte[] data, String sourceName) {
        Element root =
                XmlDocuments.requireRoot(
                        XmlDocuments.parse(data, sourceName), "matroska_tagging_registry", sourceName);
        Element tags = XmlDocuments.firstChild(root, "tags");
        if (tags == null) {
            throw new CatalogException(
                    CatalogFailure.MALFORMED_SCHEMA_RECORD, sourceName + " has no <tags> section");
        }
        List<RawTag> result = new ArrayList<>();
        for (Element tag : XmlDocuments.children(tags, "tag")) {
            result.add(new RawTag(XmlDocuments.requireAttribute(tag, "name", sourceName)));
        }
        return result;
    }
}

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Reads the {@code element} definitions of an EBML schema document ({@code <EBMLSchema>}) into
 * {@link RawElement} records, in document order.
 */
public final class EbmlSchemaReader {
    private static final Logger logger = LoggerFactory.getLogger(EbmlSchemaReader.class);

    private EbmlSchemaReader() {}

    public static List<RawElement> read(byte[] data, String sourceName) {
        Element root =
                XmlDocuments.requireRoot(XmlDocuments.parse(data, sourceName), "EBMLSchema", sourceName);

        List<RawElement> elements = new ArrayList<>();
        for (Element el : XmlDocuments.children(root, "element")) {
            String name = XmlDocuments.requireAttribute(el, "name", sourceName);
            String id = XmlDocuments.requireAttribute(el, "id", sourceName);
            ValueType type = ValueType.fromWireName(XmlDocuments.requireAttribute(el, "type", sourceName));
            String path = XmlDocuments.requireAttribute(el, "path", sourceName);
            elements.add(new RawElement(name, id, type, path, readEnums(el, sourceName)));
        }
        logger.debug("Read {} elements from {}", elements.size(), sourceName);
        return elements;
    }

    private static List<RawEnumEntry> readEnums(Element element, String sourceName) {
        Element restriction = XmlDocuments.firstChild(element, "restriction");
        if (restriction == null) {
            return List.of();
        }
        List<RawEnumEntry> entries = new ArrayList<>();
        for (Element e : XmlDocuments.children(restriction, "enum")) {
            String value = XmlDocuments.requireAttribute(e, "value", sourceName);
            String label = XmlDocuments.attribute(e, "label");
            entries.add(new RawEnumEntry(value, label == null ? "" : label));
        }
        return entries;
    }
}

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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import net.boyechko.ebml.catalog.error.CatalogException;
import net.boyechko.ebml.catalog.error.CatalogFailure;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/** DOM helpers shared by the schema readers. Element matching ignores namespaces. */
final class XmlDocuments {
    private XmlDocuments() {}

    static Document parse(byte[] data, String sourceName) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(data));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new CatalogException(
                    CatalogFailure.MALFORMED_SCHEMA_RECORD,
                    "Cannot parse " + sourceName + ": " + e.getMessage(),
                    e);
        }
    }

    static Element requireRoot(Document doc, String expected, String sourceName) {
        Element root = doc.getDocumentElement();
        if (!expected.equals(localName(root))) {
            throw new CatalogException(
                    CatalogFailure.MALFORMED_SCHEMA_RECORD,
                    sourceName + ": expected root <" + expected + "> but found <" + localName(root) + ">");
        }
        return root;
    }

    /** Direct child elements of {@code parent} with the given local name, in document order. */
    static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static Element firstChild(Element parent, String name) {
        List<Element> matches = children(parent, name);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /** Attribute value, or null if absent. */
    static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    static String requireAttribute(Element element, String name, String sourceName) {
        String value = attribute(element, name);
        if (value == null || value.isEmpty()) {
            String owner = attribute(element, "name");
            throw new CatalogException(
                    CatalogFailure.MALFORMED_SCHEMA_RECORD,
                    sourceName
                            + ": <"
                            + localName(element)
                            + (owner != null ? " name=\"" + owner + "\"" : "")
                            + "> is missing attribute '"
                            + name
                            + "'");
        }
        return value;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}

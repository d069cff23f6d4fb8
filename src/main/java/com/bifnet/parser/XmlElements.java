package com.bifnet.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Direct-child lookups over a DOM tree. Unlike {@link Element#getElementsByTagName(String)}
 * these never descend past the first level.
 */
final class XmlElements {
    private XmlElements() {}

    static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && tag.equals(child.getNodeName())) {
                result.add((Element) child);
            }
        }
        return result;
    }

    static Optional<Element> child(Element parent, String tag) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && tag.equals(child.getNodeName())) {
                return Optional.of((Element) child);
            }
        }
        return Optional.empty();
    }

    static Optional<Element> last(Element parent, String tag) {
        List<Element> all = children(parent, tag);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    static Optional<String> childText(Element parent, String tag) {
        return child(parent, tag).map(XmlElements::text);
    }

    static List<String> childTexts(Element parent, String tag) {
        return children(parent, tag).stream().map(XmlElements::text).toList();
    }

    // Concatenated text and CDATA content of the element itself, untouched.
    static String text(Element element) {
        StringBuilder sb = new StringBuilder();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            short type = child.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) sb.append(child.getNodeValue());
        }
        return sb.toString();
    }
}

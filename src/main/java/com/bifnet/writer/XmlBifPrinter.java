package com.bifnet.writer;

import com.bifnet.writer.WriterDtos.XmlNode;

import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes an {@link XmlNode} tree. In pretty mode every element starts on its own line, indented
 * two spaces per level, and elements without children stay on one line.
 */
public final class XmlBifPrinter {
    private static final String INDENT = "  ";

    private XmlBifPrinter() {}

    public static String print(XmlNode root, Charset encoding, boolean prettyPrint) {
        CharsetEncoder encoder = encoding.newEncoder();
        StringBuilder out = new StringBuilder();
        if (!encoding.equals(StandardCharsets.UTF_8) && !encoding.equals(StandardCharsets.US_ASCII)) {
            out.append("<?xml version='1.0' encoding='").append(encoding.name()).append("'?>\n");
        }
        write(out, root, 0, prettyPrint, encoder);
        if (prettyPrint) out.append('\n');
        return out.toString();
    }

    private static void write(StringBuilder out, XmlNode node, int level, boolean pretty, CharsetEncoder encoder) {
        out.append('<').append(node.tag());
        for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
            out.append(' ').append(attr.getKey()).append("=\"");
            escape(out, attr.getValue(), true, encoder);
            out.append('"');
        }

        if (!node.children().isEmpty()) {
            out.append('>');
            for (XmlNode child : node.children()) {
                if (pretty) newline(out, level + 1);
                write(out, child, level + 1, pretty, encoder);
            }
            if (pretty) newline(out, level);
            out.append("</").append(node.tag()).append('>');
        } else if (node.text() == null || node.text().isEmpty()) {
            out.append(" />");
        } else {
            out.append('>');
            escape(out, node.text(), false, encoder);
            out.append("</").append(node.tag()).append('>');
        }
    }

    private static void newline(StringBuilder out, int level) {
        out.append('\n').append(INDENT.repeat(level));
    }

    static void escape(StringBuilder out, String value, boolean attribute, CharsetEncoder encoder) {
        value.codePoints().forEach(cp -> {
            switch (cp) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append(attribute ? "&quot;" : "\"");
                case '\n' -> out.append(attribute ? "&#10;" : "\n");
                case '\t' -> out.append(attribute ? "&#9;" : "\t");
                case '\r' -> out.append("&#13;");
                default -> {
                    if (!isXmlChar(cp)) {
                        throw new IllegalArgumentException(String.format("Character U+%04X cannot appear in XML", cp));
                    }
                    String ch = new String(Character.toChars(cp));
                    if (encoder.canEncode(ch)) out.append(ch);
                    else out.append("&#").append(cp).append(';');
                }
            }
        });
    }

    // XML 1.0 Char production
    static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}

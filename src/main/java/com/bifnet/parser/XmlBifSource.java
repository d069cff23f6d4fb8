package com.bifnet.parser;

import com.bifnet.error.XmlBifConfigurationException;

import java.nio.file.Path;

/**
 * Where a document comes from: a file or an in-memory XML string, never both.
 * An empty string counts as no string.
 */
public record XmlBifSource(Path path, String text) {
    public XmlBifSource {
        boolean hasText = text != null && !text.isEmpty();
        if (path == null && !hasText) {
            throw new XmlBifConfigurationException("Must specify either path or string");
        }
        if (path != null && hasText) {
            throw new XmlBifConfigurationException("Specify either path or string, not both");
        }
    }

    public static XmlBifSource fromPath(Path path) {
        return new XmlBifSource(path, null);
    }

    public static XmlBifSource fromString(String text) {
        return new XmlBifSource(null, text);
    }

    public String describe() {
        return path != null ? path.toString() : "<string>";
    }
}

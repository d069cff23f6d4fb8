package com.bifnet.error;

/**
 * Raised when a reader source names neither or both of a path and an XML string.
 */
public class XmlBifConfigurationException extends XmlBifException {
    public XmlBifConfigurationException(String message) {
        super("SOURCE_CONFIGURATION", message);
    }
}

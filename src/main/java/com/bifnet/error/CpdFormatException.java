package com.bifnet.error;

/**
 * Raised when a TABLE cannot be read as whitespace separated numbers or cannot be
 * reshaped into one row per state of its variable.
 */
public class CpdFormatException extends XmlBifException {
    private final String variable;

    public CpdFormatException(String code, String variable, String message) {
        super(code, message);
        this.variable = variable;
    }

    public CpdFormatException(String code, String variable, String message, Throwable cause) {
        super(code, message, cause);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}

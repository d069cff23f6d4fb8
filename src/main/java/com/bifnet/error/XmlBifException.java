package com.bifnet.error;

public class XmlBifException extends RuntimeException {
    private final String code;

    public XmlBifException(String code, String message) {
        super(message);
        this.code = code;
    }

    public XmlBifException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

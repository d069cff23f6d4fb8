package com.bifnet.error;

public class ModelConstructionException extends XmlBifException {
    public ModelConstructionException(String code, String message) {
        super(code, message);
    }
}

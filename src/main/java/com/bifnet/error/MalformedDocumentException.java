package com.bifnet.error;

import com.bifnet.parser.ParserDtos.ParseError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a document is not well-formed XML or is missing elements the
 * XMLBIF vocabulary requires. Carries every structural problem found in one pass.
 */
public class MalformedDocumentException extends XmlBifException {
    private final List<ParseError> errors;

    public MalformedDocumentException(List<ParseError> errors) {
        super(errors.isEmpty() ? "MALFORMED_DOCUMENT" : errors.get(0).code(), summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public MalformedDocumentException(ParseError error, Throwable cause) {
        super(error.code(), error.message(), cause);
        this.errors = List.of(error);
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    private static String summarize(List<ParseError> errors) {
        return errors.stream().map(ParseError::message).collect(Collectors.joining("; "));
    }
}

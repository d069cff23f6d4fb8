package com.bifnet.api;

import com.bifnet.error.MalformedDocumentException;
import com.bifnet.error.XmlBifException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    @ExceptionHandler(MalformedDocumentException.class)
    public ResponseEntity<ApiError> handleMalformed(MalformedDocumentException ex) {
        return ResponseEntity.badRequest().body(new ApiError(ex.getCode(), ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(XmlBifException.class)
    public ResponseEntity<ApiError> handleCodec(XmlBifException ex) {
        return ResponseEntity.badRequest().body(new ApiError(ex.getCode(), ex.getMessage(), List.of()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleInvalidDescription(Exception ex) {
        log.debug("Rejected network description", ex);
        return ResponseEntity.badRequest().body(new ApiError("INVALID_DESCRIPTION", ex.getMessage(), List.of()));
    }

    @ExceptionHandler({IllegalCharsetNameException.class, UnsupportedCharsetException.class})
    public ResponseEntity<ApiError> handleCharset(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ApiError("UNSUPPORTED_ENCODING", ex.getMessage(), List.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL_ERROR", "Internal server error", List.of()));
    }
}

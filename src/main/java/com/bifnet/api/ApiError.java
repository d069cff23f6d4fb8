package com.bifnet.api;

import com.bifnet.parser.ParserDtos.ParseError;

import java.util.List;

public record ApiError(String code, String message, List<ParseError> errors) {}

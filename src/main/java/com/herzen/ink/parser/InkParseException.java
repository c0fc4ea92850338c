package com.herzen.ink.parser;

import com.herzen.ink.parser.ParserDtos.ParseError;

import java.util.List;
import java.util.stream.Collectors;

public class InkParseException extends RuntimeException {
    private final List<ParseError> errors;

    public InkParseException(List<ParseError> errors) {
        super(errors.size() + " error(s) in story source:\n" + errors.stream()
                .map(e -> "line " + e.line() + ": [" + e.code() + "] " + e.message())
                .collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public List<ParseError> getErrors() {
        return errors;
    }
}

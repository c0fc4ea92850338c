package com.herzen.ink.markup;

public class MarkupSyntaxException extends RuntimeException {
    private final String code;

    public MarkupSyntaxException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

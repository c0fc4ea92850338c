package com.herzen.ink.markup;

public class ExpressionException extends RuntimeException {
    public static final String UNKNOWN_NAME = "UNKNOWN_NAME";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String DIVISION_BY_ZERO = "DIVISION_BY_ZERO";
    public static final String INTEGER_OVERFLOW = "INTEGER_OVERFLOW";

    private final String code;

    public ExpressionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

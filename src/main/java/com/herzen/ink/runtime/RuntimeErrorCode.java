package com.herzen.ink.runtime;

public enum RuntimeErrorCode {
    INVALID_CHOICE_INDEX,
    NOT_AWAITING_CHOICE,
    NOT_AT_LINE,
    UNRESOLVED_DIVERT,
    DIVERT_LOOP,
    OUT_OF_CHOICES,
    EXPRESSION_ERROR,
    UNKNOWN_VARIABLE,
    VARIABLE_TYPE_MISMATCH,
    INVALID_STATE
}

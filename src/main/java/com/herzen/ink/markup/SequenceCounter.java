package com.herzen.ink.markup;

public interface SequenceCounter {
    /** Returns how many times the span was visited before this visit, and records this visit. */
    int visit(String spanId);
}

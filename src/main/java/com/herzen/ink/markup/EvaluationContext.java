package com.herzen.ink.markup;

/**
 * Name lookup used while evaluating expressions. Implementations throw
 * {@link ExpressionException} with {@link ExpressionException#UNKNOWN_NAME} for names they cannot resolve.
 */
public interface EvaluationContext {
    InkValue lookup(String name);
}

package com.herzen.ink.markup;

import java.util.List;

public class MarkupModels {

    public record Markup(List<Span> spans) {
        public static final Markup EMPTY = new Markup(List.of());

        public static Markup literal(String text) {
            return text.isEmpty() ? EMPTY : new Markup(List.of(new Literal(text)));
        }

        public boolean blank() {
            return spans.stream().allMatch(s -> s instanceof Literal l && l.text().isBlank());
        }
    }

    public sealed interface Span {}

    public record Literal(String text) implements Span {}

    public record Interpolation(Expression expression) implements Span {}

    public record Conditional(Expression condition, Markup whenTrue, Markup whenFalse) implements Span {}

    /** {@code id} is the source position of the opening brace; sequence counters are keyed by it. */
    public record Alternatives(String id, AlternativeMode mode, List<Markup> items) implements Span {}

    public enum AlternativeMode { SEQUENCE, CYCLE, ONCE_ONLY }

    public sealed interface Expression {}

    public record Constant(InkValue value) implements Expression {}

    /** A variable name, or a knot/stitch address whose value is its visit count. */
    public record Reference(String name) implements Expression {}

    public record Unary(UnaryOp op, Expression operand) implements Expression {}

    public record Binary(BinaryOp op, Expression left, Expression right) implements Expression {}

    public enum UnaryOp { NEGATE, NOT }

    public enum BinaryOp {
        ADD, SUBTRACT, MULTIPLY, DIVIDE, REMAINDER,
        EQUAL, NOT_EQUAL, LESS, LESS_OR_EQUAL, GREATER, GREATER_OR_EQUAL,
        AND, OR
    }
}

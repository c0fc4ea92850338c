package com.herzen.ink.markup;

import com.herzen.ink.markup.MarkupModels.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a piece of line text into literal text and brace spans: interpolations, inline conditionals
 * and sequence/cycle/once-only alternatives. Spans may nest.
 */
public class MarkupParser {

    private MarkupParser() {}

    /**
     * @param line   source line number, used for alternative identities
     * @param column 1-based source column of {@code text.charAt(0)}
     * @param scope  prefix keeping identities distinct when the same source text is parsed twice
     */
    public static Markup parse(String text, int line, int column, String scope) {
        List<Span> spans = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                literal.append(text.charAt(i + 1));
                i += 2;
            } else if (c == '{') {
                int end = matchingBrace(text, i);
                if (end < 0) {
                    throw new MarkupSyntaxException("UNMATCHED_BRACE", "Unmatched '{' at column " + (column + i));
                }
                if (literal.length() > 0) {
                    spans.add(new Literal(literal.toString()));
                    literal.setLength(0);
                }
                spans.add(parseBraces(text.substring(i + 1, end), line, column + i, scope));
                i = end + 1;
            } else if (c == '}') {
                throw new MarkupSyntaxException("UNMATCHED_BRACE", "Unmatched '}' at column " + (column + i));
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            spans.add(new Literal(literal.toString()));
        }
        return spans.isEmpty() ? Markup.EMPTY : new Markup(List.copyOf(spans));
    }

    private static Span parseBraces(String inner, int line, int braceColumn, String scope) {
        if (inner.isBlank()) {
            throw new MarkupSyntaxException("EMPTY_BRACES", "Empty braces at column " + braceColumn);
        }
        if (indexOfTopLevel(inner, "->", 0, false) >= 0) {
            throw new MarkupSyntaxException("DIVERT_IN_SPAN",
                    "Diverts inside braces are only supported as a whole-line conditional divert");
        }
        int innerColumn = braceColumn + 1;

        AlternativeMode mode;
        int start = 0;
        switch (inner.charAt(0)) {
            case '&' -> {
                mode = AlternativeMode.CYCLE;
                start = 1;
            }
            case '!' -> {
                mode = AlternativeMode.ONCE_ONLY;
                start = 1;
            }
            case '~' -> throw new MarkupSyntaxException("UNSUPPORTED_SHUFFLE",
                    "Shuffle alternatives are not supported (column " + braceColumn + ")");
            default -> {
                int colon = indexOfTopLevel(inner, ":", 0, true);
                if (colon >= 0) {
                    return conditional(inner, colon, line, braceColumn, scope);
                }
                if (indexOfTopLevel(inner, "|", 0, false) < 0) {
                    return new Interpolation(ExpressionParser.parse(inner));
                }
                mode = AlternativeMode.SEQUENCE;
            }
        }

        List<Markup> items = new ArrayList<>();
        for (Segment segment : splitTopLevel(inner.substring(start), '|', start)) {
            items.add(parse(segment.text(), line, innerColumn + segment.offset(), scope));
        }
        return new Alternatives(scope + line + ":" + braceColumn, mode, List.copyOf(items));
    }

    private static Span conditional(String inner, int colon, int line, int braceColumn, String scope) {
        int innerColumn = braceColumn + 1;
        Expression condition = ExpressionParser.parse(inner.substring(0, colon));
        List<Segment> branches = splitTopLevel(inner.substring(colon + 1), '|', colon + 1);
        if (branches.size() > 2) {
            throw new MarkupSyntaxException("INVALID_CONDITIONAL",
                    "Inline conditional at column " + braceColumn + " has more than two branches");
        }
        Segment first = branches.get(0).stripLeading();
        Markup whenTrue = parse(first.text(), line, innerColumn + first.offset(), scope);
        Markup whenFalse = branches.size() == 2
                ? parse(branches.get(1).text(), line, innerColumn + branches.get(1).offset(), scope)
                : Markup.EMPTY;
        return new Conditional(condition, whenTrue, whenFalse);
    }

    /** Index of the '}' closing the '{' at {@code open}, or -1. */
    public static int matchingBrace(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Index of {@code token} outside any braces, skipping escaped characters, or -1.
     * With {@code quoteAware}, double-quoted runs are skipped as well.
     */
    public static int indexOfTopLevel(String text, String token, int from, boolean quoteAware) {
        int depth = 0;
        boolean quoted = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (quoteAware && c == '"') {
                quoted = !quoted;
                continue;
            }
            if (quoted) continue;
            if (depth == 0 && text.startsWith(token, i)) return i;
            if (c == '{') depth++;
            else if (c == '}') depth--;
        }
        return -1;
    }

    public static List<Segment> splitTopLevel(String text, char separator, int baseOffset) {
        List<Segment> segments = new ArrayList<>();
        String token = String.valueOf(separator);
        int start = 0;
        int idx;
        while ((idx = indexOfTopLevel(text, token, start, false)) >= 0) {
            segments.add(new Segment(text.substring(start, idx), baseOffset + start));
            start = idx + 1;
        }
        segments.add(new Segment(text.substring(start), baseOffset + start));
        return segments;
    }

    public record Segment(String text, int offset) {
        Segment stripLeading() {
            String stripped = text.stripLeading();
            return new Segment(stripped, offset + text.length() - stripped.length());
        }
    }
}

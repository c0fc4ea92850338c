package com.herzen.ink.parser;

import com.herzen.ink.markup.ExpressionParser;
import com.herzen.ink.markup.InkValue;
import com.herzen.ink.markup.MarkupModels.*;
import com.herzen.ink.markup.MarkupParser;
import com.herzen.ink.markup.MarkupSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.ink.parser.ParserDtos.*;

/**
 * Classifies a single source line. Knot and stitch headers win over choices, choices over gathers,
 * gathers over diverts; anything else is text. Inline spans are parsed here but only evaluated at playback.
 */
public class LineClassifier {
    public static final String GLUE = "<>";
    public static final String ARROW = "->";

    private static final Pattern KNOT_PATTERN = Pattern.compile("^={2,}\\s*(.*?)\\s*=*$");
    private static final Pattern STITCH_PATTERN = Pattern.compile("^=\\s*(.*?)\\s*$");
    private static final Pattern VAR_PATTERN = Pattern.compile("^VAR\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern TARGET_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    /** Throws {@link MarkupSyntaxException} for a malformed line. */
    public ClassifiedLine classify(String raw, int lineNo) {
        String trimmed = raw.strip();
        int offset = raw.indexOf(trimmed.isEmpty() ? raw : trimmed);
        if (trimmed.isEmpty()) {
            return new BlankLine(lineNo);
        }

        if (trimmed.startsWith("==")) {
            Matcher m = KNOT_PATTERN.matcher(trimmed);
            m.matches();
            return new KnotHeaderLine(name(m.group(1), "INVALID_KNOT_NAME", "knot"), lineNo);
        }
        if (trimmed.startsWith("=")) {
            Matcher m = STITCH_PATTERN.matcher(trimmed);
            m.matches();
            return new StitchHeaderLine(name(m.group(1), "INVALID_STITCH_NAME", "stitch"), lineNo);
        }
        if (trimmed.equals("VAR") || trimmed.startsWith("VAR ")) {
            return declaration(trimmed, lineNo);
        }

        char first = trimmed.charAt(0);
        if (first == '*' || first == '+') {
            int i = 0;
            int depth = 0;
            boolean sawStar = false;
            boolean sawPlus = false;
            while (i < trimmed.length() && (trimmed.charAt(i) == '*' || trimmed.charAt(i) == '+' || Character.isWhitespace(trimmed.charAt(i)))) {
                char c = trimmed.charAt(i++);
                if (c == '*') sawStar = true;
                if (c == '+') sawPlus = true;
                if (!Character.isWhitespace(c)) depth++;
            }
            if (sawStar && sawPlus) {
                throw new MarkupSyntaxException("MIXED_CHOICE_MARKERS",
                        "Choice markers mix sticky '+' and non-sticky '*': " + trimmed);
            }
            return choice(trimmed.substring(i), offset + i, depth, sawPlus, lineNo);
        }
        if (first == '-' && !trimmed.startsWith(ARROW)) {
            int i = 0;
            int depth = 0;
            while (i < trimmed.length()) {
                char c = trimmed.charAt(i);
                if (c == '-' && !trimmed.startsWith(ARROW, i)) {
                    depth++;
                    i++;
                } else if (Character.isWhitespace(c)) {
                    i++;
                } else {
                    break;
                }
            }
            String rest = trimmed.substring(i);
            ClassifiedLine body = rest.isBlank() ? null : body(rest, offset + i, lineNo);
            return new GatherLine(depth, body, lineNo);
        }
        if (first == '#') {
            return new TagOnlyLine(tags(trimmed.substring(1)), lineNo);
        }
        return body(trimmed, offset, lineNo);
    }

    private ClassifiedLine declaration(String trimmed, int lineNo) {
        Matcher m = VAR_PATTERN.matcher(trimmed);
        if (!m.matches()) {
            throw new MarkupSyntaxException("INVALID_VARIABLE", "Expected 'VAR name = value': " + trimmed);
        }
        InkValue value = InkValue.parseLiteral(m.group(2));
        if (value == null) {
            throw new MarkupSyntaxException("INVALID_VARIABLE", "Invalid initial value for " + m.group(1) + ": " + m.group(2).trim());
        }
        return new DeclarationLine(m.group(1), value, lineNo);
    }

    /** Text or divert content: everything that can follow a gather marker or stand alone. */
    private ClassifiedLine body(String text, int offset, int lineNo) {
        List<String> tags = List.of();
        int hash = MarkupParser.indexOfTopLevel(text, "#", 0, false);
        if (hash >= 0) {
            tags = tags(text.substring(hash + 1));
            text = text.substring(0, hash);
        }

        String stripped = text.strip();
        if (stripped.startsWith("{") && MarkupParser.matchingBrace(stripped, 0) == stripped.length() - 1) {
            String inner = stripped.substring(1, stripped.length() - 1);
            if (MarkupParser.indexOfTopLevel(inner, ARROW, 0, false) >= 0) {
                return conditionalDivert(inner, tags, lineNo);
            }
        }

        int arrow = MarkupParser.indexOfTopLevel(text, ARROW, 0, false);
        if (arrow >= 0) {
            String target = target(text.substring(arrow + ARROW.length()));
            Glued leading = glue(text.substring(0, arrow), offset);
            Markup markup = MarkupParser.parse(leading.text(), lineNo, leading.column(), "");
            return new DivertLine(markup, leading.start(), leading.end(), target, null, null, tags, lineNo);
        }

        Glued glued = glue(text, offset);
        Markup markup = MarkupParser.parse(glued.text(), lineNo, glued.column(), "");
        return new TextContentLine(markup, glued.start(), glued.end(), tags, lineNo);
    }

    /** {@code {cond: -> a}} or {@code {cond: -> a | -> b}}. */
    private ClassifiedLine conditionalDivert(String inner, List<String> tags, int lineNo) {
        int colon = MarkupParser.indexOfTopLevel(inner, ":", 0, true);
        if (colon < 0) {
            throw new MarkupSyntaxException("DIVERT_IN_SPAN", "A divert inside braces needs a condition: {" + inner + "}");
        }
        List<MarkupParser.Segment> branches = MarkupParser.splitTopLevel(inner.substring(colon + 1), '|', 0);
        if (branches.size() > 2) {
            throw new MarkupSyntaxException("INVALID_CONDITIONAL", "Conditional divert has more than two branches: {" + inner + "}");
        }
        String[] targets = new String[branches.size()];
        for (int i = 0; i < branches.size(); i++) {
            String branch = branches.get(i).text().strip();
            if (!branch.startsWith(ARROW)) {
                throw new MarkupSyntaxException("DIVERT_IN_SPAN",
                        "Each branch of a conditional divert must be a divert, as in {condition: -> a | -> b}: {" + inner + "}");
            }
            targets[i] = target(branch.substring(ARROW.length()));
        }
        Expression condition = ExpressionParser.parse(inner.substring(0, colon));
        String elseTarget = targets.length == 2 ? targets[1] : null;
        return new DivertLine(Markup.EMPTY, false, false, targets[0], condition, elseTarget, tags, lineNo);
    }

    private ClassifiedLine choice(String text, int offset, int depth, boolean sticky, int lineNo) {
        List<String> tags = List.of();
        int hash = MarkupParser.indexOfTopLevel(text, "#", 0, false);
        if (hash >= 0) {
            tags = tags(text.substring(hash + 1));
            text = text.substring(0, hash);
        }

        Expression condition = null;
        while (true) {
            String lead = text.stripLeading();
            if (!lead.startsWith("{")) break;
            int skipped = text.length() - lead.length();
            int end = MarkupParser.matchingBrace(lead, 0);
            if (end < 0) {
                throw new MarkupSyntaxException("UNMATCHED_BRACE", "Unmatched '{' in choice condition");
            }
            Expression next = ExpressionParser.parse(lead.substring(1, end));
            condition = condition == null ? next : new Binary(BinaryOp.AND, condition, next);
            text = lead.substring(end + 1);
            offset += skipped + end + 1;
        }

        String divertTarget = null;
        int arrow = MarkupParser.indexOfTopLevel(text, ARROW, 0, false);
        if (arrow >= 0) {
            divertTarget = target(text.substring(arrow + ARROW.length()));
            text = text.substring(0, arrow);
        }

        boolean glueEnd = false;
        if (text.stripTrailing().endsWith(GLUE)) {
            glueEnd = true;
            text = text.stripTrailing();
            text = text.substring(0, text.length() - GLUE.length());
        }

        int open = MarkupParser.indexOfTopLevel(text, "[", 0, false);
        int stray = MarkupParser.indexOfTopLevel(text, "]", 0, false);
        String before;
        String inside = "";
        String after = "";
        int insideOffset = 0;
        int afterOffset = 0;
        if (open < 0) {
            if (stray >= 0) throw new MarkupSyntaxException("UNMATCHED_BRACKET", "Unmatched ']' in choice");
            before = text;
        } else {
            int close = MarkupParser.indexOfTopLevel(text, "]", open + 1, false);
            if (close < 0 || stray < open) {
                throw new MarkupSyntaxException("UNMATCHED_BRACKET", "Unmatched '[' in choice");
            }
            if (MarkupParser.indexOfTopLevel(text, "[", close + 1, false) >= 0
                    || MarkupParser.indexOfTopLevel(text, "]", close + 1, false) >= 0) {
                throw new MarkupSyntaxException("UNMATCHED_BRACKET", "Choice text may contain one [...] section");
            }
            before = text.substring(0, open);
            inside = text.substring(open + 1, close);
            after = text.substring(close + 1);
            insideOffset = open + 1;
            afterOffset = close + 1;
            if (before.isBlank() || Character.isWhitespace(before.charAt(before.length() - 1))) {
                String strippedAfter = after.stripLeading();
                afterOffset += after.length() - strippedAfter.length();
                after = strippedAfter;
            }
        }
        int beforeOffset = before.length() - before.stripLeading().length();
        before = before.stripLeading();

        int column = offset + 1;
        Markup display = trimEnd(concat(
                MarkupParser.parse(before, lineNo, column + beforeOffset, ""),
                MarkupParser.parse(inside, lineNo, column + insideOffset, "")));
        Markup content = concat(
                MarkupParser.parse(before, lineNo, column + beforeOffset, "c"),
                MarkupParser.parse(after, lineNo, column + afterOffset, "c"));
        if (!glueEnd) content = trimEnd(content);

        boolean fallback = display.blank();
        return new ChoiceLine(depth, sticky, fallback, condition, display, content, glueEnd, divertTarget, tags, lineNo);
    }

    private String target(String raw) {
        String target = raw.strip();
        if (target.contains(ARROW)) {
            throw new MarkupSyntaxException("UNSUPPORTED_TUNNEL", "Tunnels and chained diverts are not supported: -> " + target);
        }
        if (!TARGET_PATTERN.matcher(target).matches()) {
            throw new MarkupSyntaxException("INVALID_DIVERT_TARGET", "Invalid divert target: '" + target + "'");
        }
        return target;
    }

    private String name(String raw, String code, String kind) {
        if (!NAME_PATTERN.matcher(raw).matches()) {
            throw new MarkupSyntaxException(code, "Invalid " + kind + " name: '" + raw + "'");
        }
        return raw;
    }

    private List<String> tags(String raw) {
        return Arrays.stream(raw.split("#")).map(String::strip).filter(t -> !t.isEmpty()).toList();
    }

    /** Strips surrounding whitespace except where glue keeps it, and reports which ends were glued. */
    private Glued glue(String text, int offset) {
        int start = 0;
        int end = text.length();
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        boolean glueStart = text.startsWith(GLUE, start);
        if (glueStart) start += GLUE.length();
        boolean glueEnd = end - start >= GLUE.length() && text.startsWith(GLUE, end - GLUE.length());
        if (glueEnd) end -= GLUE.length();
        if (!glueStart) {
            while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        }
        if (!glueEnd) {
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        }
        return new Glued(text.substring(start, end), offset + start + 1, glueStart, glueEnd);
    }

    private static Markup concat(Markup left, Markup right) {
        if (left.spans().isEmpty()) return right;
        if (right.spans().isEmpty()) return left;
        List<Span> spans = new ArrayList<>(left.spans());
        Span last = spans.get(spans.size() - 1);
        Span first = right.spans().get(0);
        if (last instanceof Literal l && first instanceof Literal f) {
            spans.set(spans.size() - 1, new Literal(l.text() + f.text()));
            spans.addAll(right.spans().subList(1, right.spans().size()));
        } else {
            spans.addAll(right.spans());
        }
        return new Markup(List.copyOf(spans));
    }

    private static Markup trimEnd(Markup markup) {
        List<Span> spans = new ArrayList<>(markup.spans());
        while (!spans.isEmpty() && spans.get(spans.size() - 1) instanceof Literal l) {
            String text = l.text().stripTrailing();
            if (!text.isEmpty()) {
                spans.set(spans.size() - 1, new Literal(text));
                break;
            }
            spans.remove(spans.size() - 1);
        }
        return spans.isEmpty() ? Markup.EMPTY : new Markup(List.copyOf(spans));
    }

    private record Glued(String text, int column, boolean start, boolean end) {}
}

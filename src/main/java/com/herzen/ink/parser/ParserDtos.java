package com.herzen.ink.parser;

import com.herzen.ink.markup.InkValue;
import com.herzen.ink.markup.MarkupModels.Expression;
import com.herzen.ink.markup.MarkupModels.Markup;

import java.util.List;

public class ParserDtos {

    public sealed interface ClassifiedLine {
        int line();
    }

    public record BlankLine(int line) implements ClassifiedLine {}

    public record KnotHeaderLine(String name, int line) implements ClassifiedLine {}

    public record StitchHeaderLine(String name, int line) implements ClassifiedLine {}

    public record DeclarationLine(String name, InkValue value, int line) implements ClassifiedLine {}

    public record TagOnlyLine(List<String> tags, int line) implements ClassifiedLine {}

    public record TextContentLine(Markup text, boolean glueStart, boolean glueEnd, List<String> tags, int line)
            implements ClassifiedLine {}

    /**
     * A divert, optionally preceded by text on the same line or guarded by a whole-line inline conditional.
     * {@code elseTarget} is taken when {@code condition} is false, or {@code null} to fall through.
     */
    public record DivertLine(Markup leadingText, boolean glueStart, boolean glueEnd, String target,
                             Expression condition, String elseTarget, List<String> tags, int line)
            implements ClassifiedLine {}

    public record ChoiceLine(int depth, boolean sticky, boolean fallback, Expression condition,
                             Markup display, Markup content, boolean glueEnd, String divertTarget,
                             List<String> tags, int line) implements ClassifiedLine {}

    /** {@code body} is the text or divert following the gather markers on the same line, or {@code null}. */
    public record GatherLine(int depth, ClassifiedLine body, int line) implements ClassifiedLine {}

    public record ParseError(String code, String message, int line, String knot) {}
}

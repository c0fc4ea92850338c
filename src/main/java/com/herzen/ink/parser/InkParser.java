package com.herzen.ink.parser;

import com.herzen.ink.graph.StoryGraphBuilder;
import com.herzen.ink.graph.StoryModels.StoryGraph;
import com.herzen.ink.markup.MarkupSyntaxException;
import com.herzen.ink.validation.StoryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.herzen.ink.parser.ParserDtos.*;

@Component
public class InkParser {
    private static final Logger log = LoggerFactory.getLogger(InkParser.class);

    private final LineClassifier classifier = new LineClassifier();
    private final StoryValidator validator;

    public InkParser(StoryValidator validator) {
        this.validator = validator;
    }

    /**
     * Classifies every line and builds the story graph. The graph is {@code null} whenever any error was found;
     * name resolution is left to {@link StoryValidator}.
     */
    public ParseResult parse(String content) {
        List<ParseError> errors = new ArrayList<>();
        String[] lines = stripComments(content).split("\\R", -1);

        List<ClassifiedLine> classified = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            try {
                classified.add(classifier.classify(lines[i], lineNo));
            } catch (MarkupSyntaxException e) {
                errors.add(new ParseError(e.getCode(), e.getMessage(), lineNo, null));
            }
        }

        StoryGraph graph = StoryGraphBuilder.build(classified, errors);
        if (!errors.isEmpty()) {
            log.debug("Story source rejected with {} parse error(s)", errors.size());
            return new ParseResult(null, errors);
        }
        return new ParseResult(graph, errors);
    }

    /** Parses and validates, throwing {@link InkParseException} with every error found. */
    public StoryGraph read(String content) {
        ParseResult result = parse(content);
        if (!result.errors().isEmpty()) {
            throw new InkParseException(result.errors());
        }
        List<ParseError> unresolved = validator.validate(result.graph());
        if (!unresolved.isEmpty()) {
            throw new InkParseException(unresolved);
        }
        return result.graph();
    }

    /**
     * Blanks out {@code //} and {@code /* *}{@code /} comments and {@code TODO:} lines, keeping line and column
     * positions intact.
     */
    static String stripComments(String content) {
        StringBuilder out = new StringBuilder(content.length());
        boolean block = false;
        boolean lineComment = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            char next = i + 1 < content.length() ? content.charAt(i + 1) : '\0';
            if (c == '\n' || c == '\r') {
                lineComment = false;
                out.append(c);
            } else if (block) {
                if (c == '*' && next == '/') {
                    block = false;
                    out.append("  ");
                    i++;
                } else {
                    out.append(' ');
                }
            } else if (lineComment) {
                out.append(' ');
            } else if (c == '\\' && next != '\0' && next != '\n' && next != '\r') {
                out.append(c).append(next);
                i++;
            } else if (c == '/' && next == '/') {
                lineComment = true;
                out.append("  ");
                i++;
            } else if (c == '/' && next == '*') {
                block = true;
                out.append("  ");
                i++;
            } else {
                out.append(c);
            }
        }

        String[] lines = out.toString().split("(?<=\\n)", -1);
        StringBuilder result = new StringBuilder(out.length());
        for (String line : lines) {
            if (line.strip().startsWith("TODO:")) {
                result.append(line.endsWith("\n") ? "\n" : "");
            } else {
                result.append(line);
            }
        }
        return result.toString();
    }

    public record ParseResult(StoryGraph graph, List<ParseError> errors) {}
}

package com.herzen.ink.validation;

import com.herzen.ink.graph.StoryModels.*;
import com.herzen.ink.markup.MarkupModels.*;
import com.herzen.ink.parser.ParserDtos.ParseError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves every divert target and every name used in an expression once the whole graph is known,
 * so forward references across knots are legal.
 */
@Component
public class StoryValidator {

    public List<ParseError> validate(StoryGraph graph) {
        List<ParseError> errors = new ArrayList<>();
        for (Knot knot : graph.knots().values()) {
            Scope scope = new Scope(graph, knot.name(), errors);
            block(knot.defaultStitch().content(), scope);
            knot.stitches().values().forEach(s -> block(s.content(), scope));
        }
        return errors;
    }

    private void block(ContentBlock block, Scope scope) {
        for (Node node : block.nodes()) {
            if (node instanceof TextLine t) {
                markup(t.text(), t.line(), scope);
            } else if (node instanceof Choice c) {
                expression(c.condition(), c.line(), scope);
                markup(c.display(), c.line(), scope);
                markup(c.content(), c.line(), scope);
                block(c.body(), scope);
            } else if (node instanceof Gather g) {
                block(g.body(), scope);
            } else if (node instanceof Divert d) {
                expression(d.condition(), d.line(), scope);
                if (scope.graph.resolve(scope.knot, d.target()).isEmpty()) {
                    scope.errors.add(new ParseError("DIVERT_TARGET_NOT_FOUND",
                            "Divert target '" + d.target() + "' does not name a knot or stitch", d.line(), scope.knot));
                }
            }
        }
    }

    private void markup(Markup markup, int line, Scope scope) {
        for (Span span : markup.spans()) {
            if (span instanceof Interpolation i) {
                expression(i.expression(), line, scope);
            } else if (span instanceof Conditional c) {
                expression(c.condition(), line, scope);
                markup(c.whenTrue(), line, scope);
                markup(c.whenFalse(), line, scope);
            } else if (span instanceof Alternatives a) {
                a.items().forEach(item -> markup(item, line, scope));
            }
        }
    }

    private void expression(Expression expression, int line, Scope scope) {
        if (expression instanceof Reference r) {
            boolean variable = scope.graph.variables().containsKey(r.name());
            boolean address = scope.graph.resolve(scope.knot, r.name()).filter(a -> !a.terminal()).isPresent();
            if (!variable && !address) {
                scope.errors.add(new ParseError("VARIABLE_NOT_FOUND",
                        "'" + r.name() + "' is neither a declared variable nor a knot or stitch", line, scope.knot));
            }
        } else if (expression instanceof Unary u) {
            expression(u.operand(), line, scope);
        } else if (expression instanceof Binary b) {
            expression(b.left(), line, scope);
            expression(b.right(), line, scope);
        }
    }

    private record Scope(StoryGraph graph, String knot, List<ParseError> errors) {}
}

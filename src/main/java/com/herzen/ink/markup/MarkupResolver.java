package com.herzen.ink.markup;

import com.herzen.ink.markup.MarkupModels.*;

import java.util.List;

public class MarkupResolver {

    private MarkupResolver() {}

    public static String resolve(Markup markup, EvaluationContext context, SequenceCounter counter) {
        StringBuilder out = new StringBuilder();
        append(markup, context, counter, out);
        return out.toString();
    }

    private static void append(Markup markup, EvaluationContext context, SequenceCounter counter, StringBuilder out) {
        for (Span span : markup.spans()) {
            if (span instanceof Literal l) {
                out.append(l.text());
            } else if (span instanceof Interpolation i) {
                out.append(ExpressionEvaluator.evaluate(i.expression(), context).display());
            } else if (span instanceof Conditional c) {
                boolean holds = ExpressionEvaluator.evaluate(c.condition(), context).truthy();
                append(holds ? c.whenTrue() : c.whenFalse(), context, counter, out);
            } else if (span instanceof Alternatives a) {
                int visits = counter.visit(a.id());
                int index = select(a.mode(), a.items(), visits);
                if (index >= 0) {
                    append(a.items().get(index), context, counter, out);
                }
            }
        }
    }

    /** Index of the alternative shown on the visit after {@code visits} earlier ones, or -1 for nothing. */
    public static int select(AlternativeMode mode, List<Markup> items, int visits) {
        int n = items.size();
        return switch (mode) {
            case SEQUENCE -> Math.min(visits, n - 1);
            case CYCLE -> visits % n;
            case ONCE_ONLY -> visits < n ? visits : -1;
        };
    }
}

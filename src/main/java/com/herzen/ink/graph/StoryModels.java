package com.herzen.ink.graph;

import com.herzen.ink.markup.InkValue;
import com.herzen.ink.markup.MarkupModels.Expression;
import com.herzen.ink.markup.MarkupModels.Markup;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class StoryModels {
    /** Knot holding the content written before the first knot header. */
    public static final String ROOT_KNOT = "$ROOT$";
    public static final String DEFAULT_STITCH = "";
    public static final String END = "END";
    public static final String DONE = "DONE";

    /** {@code tags} are the story-level tags written above any content. */
    public record StoryGraph(Map<String, Knot> knots, Map<String, InkValue> variables, List<String> tags) {

        public Optional<Knot> knot(String name) {
            return Optional.ofNullable(knots.get(name));
        }

        public boolean hasRootContent() {
            return knots.containsKey(ROOT_KNOT);
        }

        /**
         * Resolves a divert target or address as seen from {@code currentKnot}: a stitch of the current knot
         * shadows a knot of the same name, and a knot address enters the knot's entry stitch.
         */
        public Optional<Address> resolve(String currentKnot, String target) {
            if (END.equals(target) || DONE.equals(target)) {
                return Optional.of(Address.TERMINAL);
            }
            int dot = target.indexOf('.');
            if (dot >= 0) {
                Knot knot = knots.get(target.substring(0, dot));
                String stitch = target.substring(dot + 1);
                if (knot == null || !knot.stitches().containsKey(stitch)) return Optional.empty();
                return Optional.of(new Address(knot.name(), stitch));
            }
            Knot current = currentKnot == null ? null : knots.get(currentKnot);
            if (current != null && current.stitches().containsKey(target)) {
                return Optional.of(new Address(current.name(), target));
            }
            Knot knot = knots.get(target);
            if (knot == null) return Optional.empty();
            return Optional.of(new Address(knot.name(), knot.entryStitch()));
        }

        public Stitch stitch(Address address) {
            Knot knot = knots.get(address.knot());
            if (knot == null) return null;
            return knot.stitch(address.stitch());
        }
    }

    public record Knot(String name, List<String> tags, Stitch defaultStitch, Map<String, Stitch> stitches, int line) {

        public Stitch stitch(String name) {
            return DEFAULT_STITCH.equals(name) ? defaultStitch : stitches.get(name);
        }

        /** The default stitch, or the first named stitch when the knot has no content of its own. */
        public String entryStitch() {
            if (defaultStitch.content().nodes().isEmpty() && !stitches.isEmpty()) {
                return stitches.keySet().iterator().next();
            }
            return DEFAULT_STITCH;
        }
    }

    public record Stitch(String name, ContentBlock content, int line) {}

    public record ContentBlock(List<Node> nodes) {
        public static final ContentBlock EMPTY = new ContentBlock(List.of());

        public int size() {
            return nodes.size();
        }

        public Node get(int index) {
            return nodes.get(index);
        }
    }

    public sealed interface Node {
        int line();
    }

    public record TextLine(Markup text, boolean glueStart, boolean glueEnd, List<String> tags, int line) implements Node {}

    public record Choice(String id, int depth, boolean sticky, boolean fallback, Expression condition,
                         Markup display, Markup content, boolean glueEnd, List<String> tags,
                         ContentBlock body, int line) implements Node {}

    public record Gather(int depth, ContentBlock body, int line) implements Node {}

    public record Divert(String target, Expression condition, int line) implements Node {}

    public record Address(String knot, String stitch) {
        public static final Address TERMINAL = new Address(null, null);

        public boolean terminal() {
            return knot == null;
        }

        /** Key used for visit counts: {@code knot} for the default stitch, {@code knot.stitch} otherwise. */
        public String key() {
            return DEFAULT_STITCH.equals(stitch) ? knot : knot + "." + stitch;
        }
    }
}

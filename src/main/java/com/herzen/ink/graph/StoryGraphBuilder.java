package com.herzen.ink.graph;

import com.herzen.ink.graph.StoryModels.*;
import com.herzen.ink.markup.InkValue;
import com.herzen.ink.markup.MarkupModels.Unary;
import com.herzen.ink.markup.MarkupModels.UnaryOp;
import com.herzen.ink.parser.ParserDtos.*;

import java.util.*;

import static com.herzen.ink.graph.StoryModels.DEFAULT_STITCH;
import static com.herzen.ink.graph.StoryModels.ROOT_KNOT;

/**
 * Assembles classified lines into knots, stitches and nested content blocks.
 *
 * <p>Open blocks are kept on an explicit stack of frames. A frame's level is the depth of the choice that owns
 * the block (0 for a stitch); choices of depth {@code d} live in a block of level {@code d - 1}. A choice or
 * gather of depth {@code d} first closes every frame of level {@code >= d}. A gather's own block continues at
 * level {@code d - 1}, so following choices of the same depth are appended into it.
 */
public class StoryGraphBuilder {
    private final List<ParseError> errors;
    private final Map<String, KnotDraft> knots = new LinkedHashMap<>();
    private final Map<String, InkValue> variables = new LinkedHashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<String> pendingTags = new ArrayList<>();

    private KnotDraft root;
    private KnotDraft knot;
    private boolean headerTagsOpen;
    private int pendingTagLine;

    private StoryGraphBuilder(List<ParseError> errors) {
        this.errors = errors;
    }

    /** Appends any structural errors to {@code errors}; the returned graph must be discarded if there are any. */
    public static StoryGraph build(List<ClassifiedLine> lines, List<ParseError> errors) {
        StoryGraphBuilder builder = new StoryGraphBuilder(errors);
        builder.root = new KnotDraft(ROOT_KNOT, 0);
        builder.knot = builder.root;
        builder.open(builder.root.defaultStitch.body);
        builder.headerTagsOpen = true;
        for (ClassifiedLine line : lines) {
            builder.accept(line);
        }
        builder.flushDanglingTags();
        return builder.freeze();
    }

    private void accept(ClassifiedLine line) {
        if (line instanceof BlankLine) {
            return;
        }
        if (line instanceof KnotHeaderLine h) {
            flushDanglingTags();
            KnotDraft draft = new KnotDraft(h.name(), h.line());
            if (knots.containsKey(h.name())) {
                error("DUPLICATE_KNOT", "Knot '" + h.name() + "' is already defined", h.line());
            } else {
                knots.put(h.name(), draft);
            }
            knot = draft;
            open(draft.defaultStitch.body);
            headerTagsOpen = true;
        } else if (line instanceof StitchHeaderLine h) {
            flushDanglingTags();
            headerTagsOpen = false;
            if (ROOT_KNOT.equals(knot.name)) {
                error("STITCH_OUTSIDE_KNOT", "Stitch '" + h.name() + "' must belong to a knot", h.line());
            } else if (knot.stitches.containsKey(h.name())) {
                error("DUPLICATE_STITCH", "Stitch '" + h.name() + "' is already defined in knot '" + knot.name + "'", h.line());
            }
            StitchDraft stitch = new StitchDraft(h.name(), h.line());
            knot.stitches.putIfAbsent(h.name(), stitch);
            open(stitch.body);
        } else if (line instanceof DeclarationLine d) {
            if (variables.containsKey(d.name())) {
                error("DUPLICATE_VARIABLE", "Variable '" + d.name() + "' is already declared", d.line());
            } else {
                variables.put(d.name(), d.value());
            }
        } else if (line instanceof TagOnlyLine t) {
            if (headerTagsOpen) {
                knot.tags.addAll(t.tags());
            } else {
                if (pendingTags.isEmpty()) pendingTagLine = t.line();
                pendingTags.addAll(t.tags());
            }
        } else if (line instanceof ChoiceLine c) {
            headerTagsOpen = false;
            if (!closeTo(c.depth(), c.line(), "Choice")) return;
            ChoiceDraft choice = new ChoiceDraft(c, takeTags(c.tags()));
            if (c.divertTarget() != null) {
                choice.body.add(new Divert(c.divertTarget(), null, c.line()));
            }
            frames.peek().block.add(choice);
            frames.push(new Frame(c.depth(), choice.body));
        } else if (line instanceof GatherLine g) {
            headerTagsOpen = false;
            if (!closeTo(g.depth(), g.line(), "Gather")) return;
            GatherDraft gather = new GatherDraft(g.depth(), g.line());
            frames.peek().block.add(gather);
            frames.push(new Frame(g.depth() - 1, gather.body));
            if (g.body() != null) {
                accept(g.body());
            }
        } else if (line instanceof TextContentLine t) {
            headerTagsOpen = false;
            frames.peek().block.add(new TextLine(t.text(), t.glueStart(), t.glueEnd(), takeTags(t.tags()), t.line()));
        } else if (line instanceof DivertLine d) {
            headerTagsOpen = false;
            boolean hasText = !d.leadingText().spans().isEmpty() || d.glueStart() || d.glueEnd();
            if (hasText) {
                frames.peek().block.add(new TextLine(d.leadingText(), d.glueStart(), d.glueEnd(), takeTags(d.tags()), d.line()));
            } else if (!d.tags().isEmpty()) {
                error("DANGLING_TAG", "Tags on a divert line need text to attach to", d.line());
            }
            frames.peek().block.add(new Divert(d.target(), d.condition(), d.line()));
            if (d.elseTarget() != null) {
                frames.peek().block.add(new Divert(d.elseTarget(), new Unary(UnaryOp.NOT, d.condition()), d.line()));
            }
        }
    }

    /** Pops frames of level >= depth and checks the remaining top frame can hold an item of that depth. */
    private boolean closeTo(int depth, int line, String what) {
        while (frames.size() > 1 && frames.peek().level >= depth) {
            frames.pop();
        }
        int level = frames.peek().level;
        if (level != depth - 1) {
            error("INVALID_NESTING", what + " at depth " + depth + " has no enclosing choice at depth " + (depth - 1), line);
            return false;
        }
        return true;
    }

    private void open(BlockDraft block) {
        frames.clear();
        frames.push(new Frame(0, block));
    }

    private List<String> takeTags(List<String> own) {
        if (pendingTags.isEmpty()) return own;
        List<String> tags = new ArrayList<>(pendingTags);
        tags.addAll(own);
        pendingTags.clear();
        return List.copyOf(tags);
    }

    private void flushDanglingTags() {
        if (!pendingTags.isEmpty()) {
            error("DANGLING_TAG", "Tags " + pendingTags + " are not followed by a line in the same section", pendingTagLine);
            pendingTags.clear();
        }
    }

    private void error(String code, String message, int line) {
        errors.add(new ParseError(code, message, line, knot == null ? null : knot.name));
    }

    private StoryGraph freeze() {
        Map<String, Knot> frozen = new LinkedHashMap<>();
        if (!root.defaultStitch.body.items.isEmpty()) {
            frozen.put(ROOT_KNOT, root.freeze());
        }
        knots.values().forEach(k -> frozen.put(k.name, k.freeze()));
        return new StoryGraph(Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(new LinkedHashMap<>(variables)), List.copyOf(root.tags));
    }

    private record Frame(int level, BlockDraft block) {}

    private static final class KnotDraft {
        final String name;
        final int line;
        final List<String> tags = new ArrayList<>();
        final StitchDraft defaultStitch;
        final Map<String, StitchDraft> stitches = new LinkedHashMap<>();

        KnotDraft(String name, int line) {
            this.name = name;
            this.line = line;
            this.defaultStitch = new StitchDraft(DEFAULT_STITCH, line);
        }

        Knot freeze() {
            Map<String, Stitch> frozen = new LinkedHashMap<>();
            stitches.values().forEach(s -> frozen.put(s.name, s.freeze()));
            return new Knot(name, List.copyOf(tags), defaultStitch.freeze(), Collections.unmodifiableMap(frozen), line);
        }
    }

    private static final class StitchDraft {
        final String name;
        final int line;
        final BlockDraft body = new BlockDraft();

        StitchDraft(String name, int line) {
            this.name = name;
            this.line = line;
        }

        Stitch freeze() {
            return new Stitch(name, body.freeze(), line);
        }
    }

    private static final class BlockDraft {
        final List<Object> items = new ArrayList<>();

        void add(Object item) {
            items.add(item);
        }

        ContentBlock freeze() {
            if (items.isEmpty()) return ContentBlock.EMPTY;
            List<Node> nodes = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item instanceof ChoiceDraft c) nodes.add(c.freeze());
                else if (item instanceof GatherDraft g) nodes.add(g.freeze());
                else nodes.add((Node) item);
            }
            return new ContentBlock(List.copyOf(nodes));
        }
    }

    private static final class ChoiceDraft {
        final ChoiceLine source;
        final List<String> tags;
        final BlockDraft body = new BlockDraft();

        ChoiceDraft(ChoiceLine source, List<String> tags) {
            this.source = source;
            this.tags = tags;
        }

        Choice freeze() {
            return new Choice("line:" + source.line(), source.depth(), source.sticky(), source.fallback(),
                    source.condition(), source.display(), source.content(), source.glueEnd(), tags, body.freeze(),
                    source.line());
        }
    }

    private static final class GatherDraft {
        final int depth;
        final int line;
        final BlockDraft body = new BlockDraft();

        GatherDraft(int depth, int line) {
            this.depth = depth;
            this.line = line;
        }

        Gather freeze() {
            return new Gather(depth, body.freeze(), line);
        }
    }
}

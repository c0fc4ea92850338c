package com.herzen.ink.runtime;

import com.herzen.ink.graph.StoryModels.*;
import com.herzen.ink.markup.EvaluationContext;
import com.herzen.ink.markup.ExpressionEvaluator;
import com.herzen.ink.markup.ExpressionException;
import com.herzen.ink.markup.InkValue;
import com.herzen.ink.markup.MarkupModels.Expression;
import com.herzen.ink.markup.MarkupModels.Markup;
import com.herzen.ink.markup.MarkupResolver;
import com.herzen.ink.runtime.RuntimeModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.herzen.ink.graph.StoryModels.DEFAULT_STITCH;
import static com.herzen.ink.graph.StoryModels.ROOT_KNOT;

/**
 * Pull-based playback of a {@link StoryGraph}. The graph is shared read-only; everything that changes during a
 * playthrough is owned by this instance. Not thread-safe.
 *
 * <p>Every call works on a copy of the mutable state and commits it only when the call succeeds, so a call that
 * throws {@link StoryRuntimeException} leaves location, counters and consumed choices as they were.
 */
public final class StoryRuntime {
    private static final Logger log = LoggerFactory.getLogger(StoryRuntime.class);

    private final StoryGraph graph;
    private final RuntimeOptions options;
    private final VariableStore variables;
    private final SequenceState sequences;
    private final Set<String> consumedChoices;
    private final Map<String, Integer> visitCounts;

    private String knot;
    private String stitch;
    private List<Integer> cursor;
    private Phase phase;
    private List<PresentedChoice> presented;
    private OutputUnit pendingUnit;

    private StoryRuntime(StoryGraph graph, RuntimeOptions options, SequenceState sequences,
                         Set<String> consumedChoices, Map<String, Integer> visitCounts) {
        this.graph = graph;
        this.options = options;
        this.variables = new VariableStore(graph.variables());
        this.sequences = sequences;
        this.consumedChoices = consumedChoices;
        this.visitCounts = visitCounts;
        this.presented = List.of();
    }

    /** Starts at the content written before the first knot. */
    public static StoryRuntime start(StoryGraph graph) {
        return start(graph, ROOT_KNOT, RuntimeOptions.DEFAULTS);
    }

    public static StoryRuntime start(StoryGraph graph, String knotName) {
        return start(graph, knotName, RuntimeOptions.DEFAULTS);
    }

    /** {@code knotName} may also be a {@code knot.stitch} address. */
    public static StoryRuntime start(StoryGraph graph, String knotName, RuntimeOptions options) {
        Address address = graph.resolve(null, knotName)
                .filter(a -> !a.terminal())
                .orElseThrow(() -> new StoryRuntimeException(RuntimeErrorCode.UNRESOLVED_DIVERT,
                        ROOT_KNOT.equals(knotName)
                                ? "Story has no content before its first knot; start at a named knot"
                                : "Cannot start at '" + knotName + "': no such knot or stitch"));
        StoryRuntime runtime = new StoryRuntime(graph, options, new SequenceState(), new HashSet<>(), new HashMap<>());
        runtime.knot = address.knot();
        runtime.stitch = address.stitch();
        runtime.cursor = new ArrayList<>(List.of(0));
        runtime.phase = Phase.AT_LINE;
        runtime.countVisit(address, true, runtime.visitCounts);
        log.debug("Playthrough started at {}", address.key());
        return runtime;
    }

    /** Rebuilds a runtime from a snapshot taken by {@link #snapshot()}, against the same story graph. */
    public static StoryRuntime restore(StoryGraph graph, RuntimeState state, RuntimeOptions options) {
        if (state.version() != RuntimeState.CURRENT_VERSION) {
            throw invalidState("Unsupported state version " + state.version());
        }
        if (state.phase() == null || state.cursor() == null || state.knot() == null || state.stitch() == null) {
            throw invalidState("Saved state is incomplete");
        }
        Knot knot = graph.knots().get(state.knot());
        Stitch stitch = knot == null ? null : knot.stitch(state.stitch());
        if (stitch == null) {
            throw invalidState("Saved location " + state.knot() + "." + state.stitch() + " is not in this story");
        }
        StoryRuntime runtime = new StoryRuntime(graph, options, new SequenceState(orEmpty(state.sequenceCounts())),
                new HashSet<>(state.consumedChoices() == null ? List.of() : state.consumedChoices()),
                new HashMap<>(orEmpty(state.visitCounts())));
        runtime.knot = state.knot();
        runtime.stitch = state.stitch();
        runtime.cursor = new ArrayList<>(state.cursor());
        runtime.phase = state.phase();
        runtime.presented = state.presentedChoices() == null ? List.of() : List.copyOf(state.presentedChoices());
        runtime.pendingUnit = state.pendingUnit();
        runtime.checkCursor(stitch.content());
        try {
            orEmpty(state.variableOverrides()).forEach(runtime.variables::override);
        } catch (StoryRuntimeException e) {
            throw new StoryRuntimeException(RuntimeErrorCode.INVALID_STATE, "Saved variable overrides do not fit this story: "
                    + e.getMessage(), e);
        }
        return runtime;
    }

    public StoryStep advance() {
        if (phase == Phase.ENDED) {
            return new Ended();
        }
        if (phase == Phase.AWAITING_CHOICE) {
            throw new StoryRuntimeException(RuntimeErrorCode.NOT_AT_LINE,
                    "A choice must be selected before the story can continue");
        }
        Walk walk = new Walk();
        StoryStep step = walk.run();
        walk.commit();
        return step;
    }

    public void select(int index) {
        if (phase != Phase.AWAITING_CHOICE) {
            throw new StoryRuntimeException(RuntimeErrorCode.NOT_AWAITING_CHOICE,
                    "No choice is being presented (story is " + phase + ")");
        }
        if (index < 0 || index >= presented.size()) {
            throw new StoryRuntimeException(RuntimeErrorCode.INVALID_CHOICE_INDEX,
                    "Choice index " + index + " is out of range; " + presented.size() + " choice(s) available");
        }
        Walk walk = new Walk();
        walk.choose(presented.get(index).nodeIndex());
        walk.phase = Phase.AT_LINE;
        walk.presented = List.of();
        walk.commit();
    }

    /** Advances until a choice set is presented or the story ends, collecting the lines on the way. */
    public Passage advanceUntilPause() {
        List<OutputUnit> lines = new ArrayList<>();
        while (true) {
            StoryStep step = advance();
            if (step instanceof OutputUnit unit) {
                lines.add(unit);
            } else if (step instanceof ChoiceSet choices) {
                return new Passage(List.copyOf(lines), choices, false);
            } else {
                return new Passage(List.copyOf(lines), null, true);
            }
        }
    }

    /** The choices currently presented, or {@code null} unless a choice is awaited. */
    public ChoiceSet currentChoices() {
        return phase == Phase.AWAITING_CHOICE ? choiceSet(presented) : null;
    }

    public Phase phase() {
        return phase;
    }

    public Address location() {
        return new Address(knot, stitch);
    }

    public void overrideVariable(String name, InkValue value) {
        variables.override(name, value);
    }

    public int visitCount(String address) {
        return visitCounts.getOrDefault(address, 0);
    }

    public RuntimeState snapshot() {
        List<String> consumed = new ArrayList<>(consumedChoices);
        Collections.sort(consumed);
        return new RuntimeState(RuntimeState.CURRENT_VERSION, knot, stitch, List.copyOf(cursor), phase,
                presented, pendingUnit, sequences.snapshot(), consumed, new TreeMap<>(visitCounts),
                variables.overrides());
    }

    private void checkCursor(ContentBlock root) {
        if (cursor.isEmpty()) {
            throw invalidState("Saved cursor is empty");
        }
        ContentBlock block = root;
        for (int i = 0; i < cursor.size() - 1; i++) {
            int index = cursor.get(i);
            Node node = index >= 0 && index < block.size() ? block.get(index) : null;
            if (node instanceof Choice c) block = c.body();
            else if (node instanceof Gather g) block = g.body();
            else throw invalidState("Saved cursor " + cursor + " does not follow the story structure");
        }
        int last = cursor.get(cursor.size() - 1);
        if (last < 0 || last > block.size()) {
            throw invalidState("Saved cursor " + cursor + " is out of bounds");
        }
        for (PresentedChoice choice : presented) {
            if (choice.nodeIndex() < 0 || choice.nodeIndex() >= block.size() || !(block.get(choice.nodeIndex()) instanceof Choice)) {
                throw invalidState("Saved choice " + choice.nodeIndex() + " is not a choice in this story");
            }
        }
    }

    private void countVisit(Address address, boolean countKnot, Map<String, Integer> counts) {
        if (countKnot) {
            counts.merge(address.knot(), 1, Integer::sum);
        }
        if (!DEFAULT_STITCH.equals(address.stitch())) {
            counts.merge(address.knot() + "." + address.stitch(), 1, Integer::sum);
        }
    }

    private static ChoiceSet choiceSet(List<PresentedChoice> presented) {
        List<ChoiceOption> options = new ArrayList<>(presented.size());
        for (int i = 0; i < presented.size(); i++) {
            options.add(new ChoiceOption(i, presented.get(i).text(), presented.get(i).tags()));
        }
        return new ChoiceSet(List.copyOf(options));
    }

    private static <V> Map<String, V> orEmpty(Map<String, V> map) {
        return map == null ? Map.of() : map;
    }

    private static StoryRuntimeException invalidState(String message) {
        return new StoryRuntimeException(RuntimeErrorCode.INVALID_STATE, message);
    }

    /** Working copy of the mutable state for one call. */
    private final class Walk implements EvaluationContext {
        private final SequenceState.Staging staging = sequences.stage();
        private final Set<String> consumed = new HashSet<>();
        private final Map<String, Integer> visits = new HashMap<>(visitCounts);
        private String knot = StoryRuntime.this.knot;
        private String stitch = StoryRuntime.this.stitch;
        private final List<Integer> cursor = new ArrayList<>(StoryRuntime.this.cursor);
        private Phase phase = StoryRuntime.this.phase;
        private List<PresentedChoice> presented = StoryRuntime.this.presented;
        private OutputUnit pending = StoryRuntime.this.pendingUnit;

        StoryStep run() {
            int steps = 0;
            while (true) {
                if (pending != null) {
                    OutputUnit unit = pending;
                    pending = null;
                    return unit;
                }
                if (++steps > options.maxStepsPerAdvance()) {
                    throw new StoryRuntimeException(RuntimeErrorCode.DIVERT_LOOP, "No output after " + options.maxStepsPerAdvance()
                            + " steps near " + new Address(knot, stitch).key() + "; the story is diverting in a loop");
                }

                ContentBlock block = block();
                int index = last();
                if (index >= block.size()) {
                    if (cursor.size() == 1) {
                        phase = Phase.ENDED;
                        return new Ended();
                    }
                    cursor.remove(cursor.size() - 1);
                    ContentBlock parent = block();
                    int container = last();
                    setLast(parent.get(container) instanceof Choice ? endOfChoiceRun(parent, container) : container + 1);
                    continue;
                }

                Node node = block.get(index);
                if (node instanceof TextLine t) {
                    String text = resolve(t.text());
                    setLast(index + 1);
                    if (text.isEmpty() && t.tags().isEmpty()) continue;
                    return new OutputUnit(text, t.tags(), t.glueStart(), t.glueEnd());
                } else if (node instanceof Divert d) {
                    if (!test(d.condition())) {
                        setLast(index + 1);
                        continue;
                    }
                    Address target = graph.resolve(knot, d.target()).orElseThrow(() -> new StoryRuntimeException(
                            RuntimeErrorCode.UNRESOLVED_DIVERT, "Divert target '" + d.target() + "' on line " + d.line() + " does not exist"));
                    if (target.terminal()) {
                        setLast(index + 1);
                        phase = Phase.ENDED;
                        return new Ended();
                    }
                    enter(target);
                } else if (node instanceof Gather) {
                    cursor.add(0);
                } else if (node instanceof Choice) {
                    int end = endOfChoiceRun(block, index);
                    List<PresentedChoice> visible = new ArrayList<>();
                    int fallback = -1;
                    for (int j = index; j < end; j++) {
                        Choice choice = (Choice) block.get(j);
                        if (!available(choice)) continue;
                        if (!choice.fallback()) {
                            visible.add(new PresentedChoice(j, resolve(choice.display()), choice.tags()));
                        } else if (fallback < 0) {
                            fallback = j;
                        }
                    }
                    if (!visible.isEmpty()) {
                        presented = List.copyOf(visible);
                        phase = Phase.AWAITING_CHOICE;
                        return choiceSet(presented);
                    }
                    if (fallback < 0) {
                        throw new StoryRuntimeException(RuntimeErrorCode.OUT_OF_CHOICES,
                                "No choice is available at line " + block.get(index).line() + " and there is no fallback choice");
                    }
                    choose(fallback);
                }
            }
        }

        void choose(int nodeIndex) {
            Choice choice = (Choice) block().get(nodeIndex);
            if (!choice.sticky()) {
                consumed.add(choice.id());
            }
            String text = resolve(choice.content());
            if (!text.isEmpty()) {
                pending = new OutputUnit(text, choice.tags(), false, choice.glueEnd());
            }
            setLast(nodeIndex);
            cursor.add(0);
        }

        void commit() {
            staging.commit();
            consumedChoices.addAll(consumed);
            visitCounts.clear();
            visitCounts.putAll(visits);
            StoryRuntime.this.knot = knot;
            StoryRuntime.this.stitch = stitch;
            StoryRuntime.this.cursor = cursor;
            StoryRuntime.this.phase = phase;
            StoryRuntime.this.presented = presented;
            StoryRuntime.this.pendingUnit = pending;
        }

        @Override
        public InkValue lookup(String name) {
            Optional<InkValue> variable = variables.lookup(name);
            if (variable.isPresent()) {
                return variable.get();
            }
            Address address = graph.resolve(knot, name).filter(a -> !a.terminal()).orElseThrow(() ->
                    new ExpressionException(ExpressionException.UNKNOWN_NAME, "Unknown variable or address '" + name + "'"));
            boolean knotName = name.indexOf('.') < 0 && !(address.knot().equals(knot) && name.equals(address.stitch()));
            String key = knotName ? address.knot() : address.knot() + "." + address.stitch();
            return new InkValue.Int(visits.getOrDefault(key, 0));
        }

        private void enter(Address target) {
            Knot targetKnot = graph.knots().get(target.knot());
            boolean countKnot = !target.knot().equals(knot) || target.stitch().equals(targetKnot.entryStitch());
            countVisit(target, countKnot, visits);
            knot = target.knot();
            stitch = target.stitch();
            cursor.clear();
            cursor.add(0);
            log.trace("Diverted to {}", target.key());
        }

        private boolean available(Choice choice) {
            boolean spent = !choice.sticky() && (consumedChoices.contains(choice.id()) || consumed.contains(choice.id()));
            return !spent && test(choice.condition());
        }

        private boolean test(Expression condition) {
            try {
                return ExpressionEvaluator.test(condition, this);
            } catch (ExpressionException e) {
                throw translate(e);
            }
        }

        private String resolve(Markup markup) {
            try {
                return MarkupResolver.resolve(markup, this, staging);
            } catch (ExpressionException e) {
                throw translate(e);
            }
        }

        private StoryRuntimeException translate(ExpressionException e) {
            RuntimeErrorCode code = ExpressionException.UNKNOWN_NAME.equals(e.getCode())
                    ? RuntimeErrorCode.UNKNOWN_VARIABLE : RuntimeErrorCode.EXPRESSION_ERROR;
            return new StoryRuntimeException(code, e.getMessage() + " (in " + new Address(knot, stitch).key() + ")", e);
        }

        private ContentBlock block() {
            ContentBlock block = graph.stitch(new Address(knot, stitch)).content();
            for (int i = 0; i < cursor.size() - 1; i++) {
                Node node = block.get(cursor.get(i));
                block = node instanceof Choice c ? c.body() : ((Gather) node).body();
            }
            return block;
        }

        private int last() {
            return cursor.get(cursor.size() - 1);
        }

        private void setLast(int value) {
            cursor.set(cursor.size() - 1, value);
        }
    }

    private static int endOfChoiceRun(ContentBlock block, int from) {
        int end = from;
        while (end < block.size() && block.get(end) instanceof Choice) end++;
        return end;
    }
}

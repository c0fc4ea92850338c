package com.herzen.ink.runtime;

import com.herzen.ink.markup.InkValue;

import java.util.List;
import java.util.Map;

public class RuntimeModels {

    /** What a call to {@link StoryRuntime#advance()} produced. */
    public sealed interface StoryStep {}

    /**
     * One line of resolved narrative. {@code glueStart} and {@code glueEnd} mark that no line break belongs
     * before or after it; see {@link OutputUnits#join(List)}.
     */
    public record OutputUnit(String text, List<String> tags, boolean glueStart, boolean glueEnd) implements StoryStep {}

    public record ChoiceSet(List<ChoiceOption> choices) implements StoryStep {}

    public record ChoiceOption(int index, String text, List<String> tags) {}

    public record Ended() implements StoryStep {}

    public enum Phase { AT_LINE, AWAITING_CHOICE, ENDED }

    /** Everything produced up to the next pause: either a choice set or the end of the story. */
    public record Passage(List<OutputUnit> lines, ChoiceSet choices, boolean ended) {}

    /** A presented choice, by its index within the content block holding the choice run. */
    public record PresentedChoice(int nodeIndex, String text, List<String> tags) {}

    public record RuntimeOptions(int maxStepsPerAdvance) {
        public static final RuntimeOptions DEFAULTS = new RuntimeOptions(10_000);
    }

    /**
     * Restorable snapshot of a playthrough. {@code cursor} holds one index per open content block, starting at
     * the stitch content; every index but the last points at the choice or gather whose body is the next block.
     */
    public record RuntimeState(int version,
                               String knot,
                               String stitch,
                               List<Integer> cursor,
                               Phase phase,
                               List<PresentedChoice> presentedChoices,
                               OutputUnit pendingUnit,
                               Map<String, Integer> sequenceCounts,
                               List<String> consumedChoices,
                               Map<String, Integer> visitCounts,
                               Map<String, InkValue> variableOverrides) {
        public static final int CURRENT_VERSION = 1;
    }
}

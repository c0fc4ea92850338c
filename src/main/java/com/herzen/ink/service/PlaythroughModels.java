package com.herzen.ink.service;

import com.herzen.ink.runtime.RuntimeModels.Phase;

import java.time.Instant;
import java.util.List;

public class PlaythroughModels {

    public record LineView(String text, List<String> tags) {}

    public record ChoiceView(int index, String text, List<String> tags) {}

    /** Result of a single advance: exactly one of a line, a choice list or the end. */
    public record StepView(String sessionId, String kind, LineView line, List<ChoiceView> choices) {
        public static final String LINE = "line";
        public static final String CHOICES = "choices";
        public static final String ENDED = "ended";
    }

    public record PlaythroughView(String sessionId,
                                  String storyId,
                                  Phase phase,
                                  String text,
                                  List<LineView> lines,
                                  List<ChoiceView> choices) {}

    public record SaveReceipt(String saveId, String sessionId, String storyId, Instant savedAt) {}
}

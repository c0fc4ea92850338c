package com.herzen.ink.runtime;

import com.herzen.ink.markup.SequenceCounter;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Visit counters of alternative spans, keyed by span position. Counters only grow, and visits are
 * staged so that a failed resolution leaves them untouched.
 */
public class SequenceState {
    private final Map<String, Integer> counts;

    public SequenceState() {
        this(Map.of());
    }

    public SequenceState(Map<String, Integer> counts) {
        this.counts = new HashMap<>(counts);
    }

    public int count(String spanId) {
        return counts.getOrDefault(spanId, 0);
    }

    public Staging stage() {
        return new Staging();
    }

    public Map<String, Integer> snapshot() {
        return new TreeMap<>(counts);
    }

    public class Staging implements SequenceCounter {
        private final Map<String, Integer> staged = new HashMap<>();

        @Override
        public int visit(String spanId) {
            int before = staged.getOrDefault(spanId, count(spanId));
            staged.put(spanId, before + 1);
            return before;
        }

        public void commit() {
            counts.putAll(staged);
            staged.clear();
        }
    }
}

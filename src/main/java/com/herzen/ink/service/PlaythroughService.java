package com.herzen.ink.service;

import com.herzen.ink.graph.StoryModels;
import com.herzen.ink.graph.StoryModels.StoryGraph;
import com.herzen.ink.markup.InkValue;
import com.herzen.ink.repository.PlaythroughJdbcRepository;
import com.herzen.ink.repository.PlaythroughJdbcRepository.SavedPlaythroughRow;
import com.herzen.ink.runtime.OutputUnits;
import com.herzen.ink.runtime.RuntimeModels.*;
import com.herzen.ink.runtime.RuntimeStateCodec;
import com.herzen.ink.runtime.StoryRuntime;
import com.herzen.ink.service.PlaythroughModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live playthroughs, one {@link StoryRuntime} per session. Calls on the same session are serialized.
 */
@Service
public class PlaythroughService {
    private static final Logger log = LoggerFactory.getLogger(PlaythroughService.class);

    private final StoryImportService storyService;
    private final PlaythroughJdbcRepository repository;
    private final RuntimeStateCodec codec;
    private final RuntimeOptions options;
    private final Duration idleTimeout;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public PlaythroughService(StoryImportService storyService,
                              PlaythroughJdbcRepository repository,
                              RuntimeStateCodec codec,
                              @Value("${ink.runtime.max-steps-per-advance:10000}") int maxStepsPerAdvance,
                              @Value("${ink.sessions.idle-timeout-ms:1800000}") long idleTimeoutMs) {
        this.storyService = storyService;
        this.repository = repository;
        this.codec = codec;
        this.options = new RuntimeOptions(maxStepsPerAdvance);
        this.idleTimeout = Duration.ofMillis(idleTimeoutMs);
    }

    public PlaythroughView start(String storyId, String knot, Map<String, Object> overrides) {
        StoryGraph graph = storyService.graph(storyId);
        String entry = knot == null || knot.isBlank() ? StoryModels.ROOT_KNOT : knot;
        StoryRuntime runtime = StoryRuntime.start(graph, entry, options);
        if (overrides != null) {
            overrides.forEach((name, value) -> runtime.overrideVariable(name, toInkValue(name, value)));
        }
        Session session = register(storyId, runtime);
        log.info("Started playthrough {} of story '{}' at {}", session.id, storyId, entry);
        return view(session, List.of());
    }

    public StepView advance(String sessionId) {
        Session session = session(sessionId);
        synchronized (session) {
            StoryStep step = session.runtime.advance();
            if (step instanceof OutputUnit unit) {
                return new StepView(session.id, StepView.LINE, new LineView(unit.text(), unit.tags()), List.of());
            }
            if (step instanceof ChoiceSet choices) {
                return new StepView(session.id, StepView.CHOICES, null, choiceViews(choices));
            }
            return new StepView(session.id, StepView.ENDED, null, List.of());
        }
    }

    /** Plays until the next choice or the end of the story. */
    public PlaythroughView continueToPause(String sessionId) {
        Session session = session(sessionId);
        synchronized (session) {
            Passage passage = session.runtime.advanceUntilPause();
            return view(session, passage.lines());
        }
    }

    public PlaythroughView select(String sessionId, int index) {
        Session session = session(sessionId);
        synchronized (session) {
            session.runtime.select(index);
            return view(session, List.of());
        }
    }

    public PlaythroughView current(String sessionId) {
        Session session = session(sessionId);
        synchronized (session) {
            return view(session, List.of());
        }
    }

    public void setVariable(String sessionId, String name, Object value) {
        Session session = session(sessionId);
        synchronized (session) {
            session.runtime.overrideVariable(name, toInkValue(name, value));
        }
    }

    public SaveReceipt save(String sessionId) {
        Session session = session(sessionId);
        String json;
        synchronized (session) {
            json = codec.encode(session.runtime.snapshot());
        }
        SavedPlaythroughRow row = new SavedPlaythroughRow(UUID.randomUUID().toString(), session.storyId, json, Instant.now());
        repository.save(row);
        log.info("Saved playthrough {} as {}", session.id, row.saveId());
        return new SaveReceipt(row.saveId(), session.id, session.storyId, row.savedAt());
    }

    /** Opens a new session from a saved playthrough. */
    public PlaythroughView restore(String saveId) {
        SavedPlaythroughRow row = repository.load(saveId)
                .orElseThrow(() -> new ResourceNotFoundException("Saved playthrough '" + saveId + "' not found"));
        StoryGraph graph = storyService.graph(row.storyId());
        StoryRuntime runtime = StoryRuntime.restore(graph, codec.decode(row.stateJson()), options);
        Session session = register(row.storyId(), runtime);
        log.info("Restored save {} into playthrough {}", saveId, session.id);
        return view(session, List.of());
    }

    @Scheduled(fixedDelayString = "${ink.sessions.evict-fixed-delay-ms:60000}")
    public void evictIdleSessions() {
        Instant cutoff = Instant.now().minus(idleTimeout);
        int before = sessions.size();
        sessions.values().removeIf(s -> s.lastAccess.isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle playthrough(s)", evicted);
        }
    }

    int activeSessions() {
        return sessions.size();
    }

    static InkValue toInkValue(String name, Object value) {
        if (value instanceof Boolean b) return new InkValue.Bool(b);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) {
            return new InkValue.Int(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new InkValue.Decimal(((Number) value).doubleValue());
        }
        if (value instanceof String s) return new InkValue.Text(s);
        throw new IllegalArgumentException("Unsupported value for variable '" + name + "': " + value);
    }

    private Session register(String storyId, StoryRuntime runtime) {
        Session session = new Session(UUID.randomUUID().toString(), storyId, runtime);
        sessions.put(session.id, session);
        return session;
    }

    private Session session(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new ResourceNotFoundException("Playthrough '" + sessionId + "' not found or expired");
        }
        session.lastAccess = Instant.now();
        return session;
    }

    private PlaythroughView view(Session session, List<OutputUnit> lines) {
        StoryRuntime runtime = session.runtime;
        ChoiceSet choices = runtime.currentChoices();
        return new PlaythroughView(session.id, session.storyId, runtime.phase(), OutputUnits.join(lines),
                lines.stream().map(u -> new LineView(u.text(), u.tags())).toList(),
                choices == null ? List.of() : choiceViews(choices));
    }

    private static List<ChoiceView> choiceViews(ChoiceSet choices) {
        return choices.choices().stream().map(c -> new ChoiceView(c.index(), c.text(), c.tags())).toList();
    }

    private static final class Session {
        final String id;
        final String storyId;
        final StoryRuntime runtime;
        volatile Instant lastAccess = Instant.now();

        Session(String id, String storyId, StoryRuntime runtime) {
            this.id = id;
            this.storyId = storyId;
            this.runtime = runtime;
        }
    }
}

package com.herzen.ink.service;

import com.herzen.ink.graph.StoryModels;
import com.herzen.ink.graph.StoryModels.StoryGraph;
import com.herzen.ink.parser.InkParseException;
import com.herzen.ink.parser.InkParser;
import com.herzen.ink.parser.ParserDtos.ParseError;
import com.herzen.ink.repository.StoryJdbcRepository;
import com.herzen.ink.validation.StoryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class StoryImportService {
    private static final Logger log = LoggerFactory.getLogger(StoryImportService.class);

    private final InkParser parser;
    private final StoryValidator validator;
    private final StoryJdbcRepository repository;

    private final Map<String, StoryGraph> graphs = new ConcurrentHashMap<>();

    public StoryImportService(InkParser parser, StoryValidator validator, StoryJdbcRepository repository) {
        this.parser = parser;
        this.validator = validator;
        this.repository = repository;
    }

    public ImportResult importStory(String storyId, String content, boolean dryRun) {
        if (storyId == null || storyId.isBlank()) {
            throw new IllegalArgumentException("storyId is required");
        }
        InkParser.ParseResult parseResult = parser.parse(content == null ? "" : content);
        List<ParseError> errors = new ArrayList<>(parseResult.errors());
        if (errors.isEmpty()) {
            errors.addAll(validator.validate(parseResult.graph()));
        }

        if (!errors.isEmpty()) {
            log.info("Story '{}' rejected with {} error(s)", storyId, errors.size());
            return new ImportResult(dryRun, false, storyId, List.of(), List.of(), errors);
        }

        StoryGraph graph = parseResult.graph();
        if (!dryRun) {
            repository.saveSource(storyId, content);
            graphs.put(storyId, graph);
            log.info("Story '{}' imported with {} knot(s)", storyId, graph.knots().size());
        }
        List<String> knots = graph.knots().keySet().stream().filter(k -> !StoryModels.ROOT_KNOT.equals(k)).toList();
        return new ImportResult(dryRun, true, storyId, knots, graph.tags(), List.of());
    }

    /** The imported graph, re-parsed from storage after a restart. */
    public StoryGraph graph(String storyId) {
        StoryGraph cached = graphs.get(storyId);
        if (cached != null) {
            return cached;
        }
        String source = repository.loadSource(storyId)
                .orElseThrow(() -> new ResourceNotFoundException("Story '" + storyId + "' has not been imported"));
        try {
            StoryGraph graph = parser.read(source);
            graphs.put(storyId, graph);
            return graph;
        } catch (InkParseException e) {
            throw new IllegalStateException("Stored story '" + storyId + "' no longer parses", e);
        }
    }

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               String storyId,
                               List<String> knots,
                               List<String> tags,
                               List<ParseError> errors) {
    }
}

package com.herzen.ink.api;

import com.herzen.ink.graph.StoryModels;
import com.herzen.ink.graph.StoryModels.StoryGraph;
import com.herzen.ink.service.StoryImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/stories")
public class StoryController {
    private final StoryImportService importService;

    public StoryController(StoryImportService importService) {
        this.importService = importService;
    }

    @PostMapping("/import")
    public ResponseEntity<StoryImportService.ImportResult> importStory(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importStory(request.storyId(), request.content(), request.dryRun()));
    }

    @GetMapping("/{storyId}")
    public ResponseEntity<StorySummary> story(@PathVariable String storyId) {
        StoryGraph graph = importService.graph(storyId);
        return ResponseEntity.ok(new StorySummary(storyId,
                graph.knots().keySet().stream().filter(k -> !StoryModels.ROOT_KNOT.equals(k)).toList(),
                graph.variables().keySet().stream().toList(),
                graph.tags(),
                graph.hasRootContent()));
    }

    public record ImportRequest(String storyId, String content, boolean dryRun) {}

    public record StorySummary(String storyId, List<String> knots, List<String> variables, List<String> tags, boolean startsAtRoot) {}
}

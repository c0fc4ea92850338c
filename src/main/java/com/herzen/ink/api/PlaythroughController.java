package com.herzen.ink.api;

import com.herzen.ink.service.PlaythroughModels.*;
import com.herzen.ink.service.PlaythroughService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/playthroughs")
public class PlaythroughController {
    private final PlaythroughService playthroughService;

    public PlaythroughController(PlaythroughService playthroughService) {
        this.playthroughService = playthroughService;
    }

    @PostMapping
    public ResponseEntity<PlaythroughView> start(@RequestBody StartRequest request) {
        return ResponseEntity.ok(playthroughService.start(request.storyId(), request.knot(), request.variables()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<PlaythroughView> current(@PathVariable String sessionId) {
        return ResponseEntity.ok(playthroughService.current(sessionId));
    }

    @PostMapping("/{sessionId}/advance")
    public ResponseEntity<StepView> advance(@PathVariable String sessionId) {
        return ResponseEntity.ok(playthroughService.advance(sessionId));
    }

    @PostMapping("/{sessionId}/continue")
    public ResponseEntity<PlaythroughView> continueToPause(@PathVariable String sessionId) {
        return ResponseEntity.ok(playthroughService.continueToPause(sessionId));
    }

    @PostMapping("/{sessionId}/select")
    public ResponseEntity<PlaythroughView> select(@PathVariable String sessionId, @RequestBody SelectRequest request) {
        return ResponseEntity.ok(playthroughService.select(sessionId, request.index()));
    }

    @PutMapping("/{sessionId}/variables/{name}")
    public ResponseEntity<Void> setVariable(@PathVariable String sessionId, @PathVariable String name,
                                            @RequestBody VariableRequest request) {
        playthroughService.setVariable(sessionId, name, request.value());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/save")
    public ResponseEntity<SaveReceipt> save(@PathVariable String sessionId) {
        return ResponseEntity.ok(playthroughService.save(sessionId));
    }

    @PostMapping("/restore")
    public ResponseEntity<PlaythroughView> restore(@RequestBody RestoreRequest request) {
        return ResponseEntity.ok(playthroughService.restore(request.saveId()));
    }

    public record StartRequest(String storyId, String knot, Map<String, Object> variables) {}

    public record SelectRequest(int index) {}

    public record VariableRequest(Object value) {}

    public record RestoreRequest(String saveId) {}
}

package com.chimera.orchestrator.api;

import com.chimera.orchestrator.api.dto.DeadLetterResponse;
import com.chimera.orchestrator.service.DeadLetterQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read and prune the dead letter queue.
 *
 * GET    /dead-letters?limit&offset  newest first
 * GET    /dead-letters/{taskId}
 * DELETE /dead-letters/{taskId}      after a manual re-submit
 */
@RestController
@RequestMapping("/dead-letters")
public class DeadLetterController {

    private final DeadLetterQueue deadLetters;

    public DeadLetterController(DeadLetterQueue deadLetters) {
        this.deadLetters = deadLetters;
    }

    @GetMapping
    public List<DeadLetterResponse> list(@RequestParam(defaultValue = "100") int limit,
                                         @RequestParam(defaultValue = "0") int offset) {
        return deadLetters.entries(limit, offset).stream()
                .map(DeadLetterResponse::from)
                .toList();
    }

    @GetMapping("/{taskId}")
    public DeadLetterResponse get(@PathVariable String taskId) {
        return deadLetters.get(taskId)
                .map(DeadLetterResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No dead letter for task: " + taskId));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> remove(@PathVariable String taskId) {
        if (!deadLetters.remove(taskId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No dead letter for task: " + taskId);
        }
        return ResponseEntity.noContent().build();
    }
}

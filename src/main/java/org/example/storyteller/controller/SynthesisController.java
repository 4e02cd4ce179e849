package org.example.storyteller.controller;

import org.example.storyteller.model.FailureReason;
import org.example.storyteller.model.SessionContext;
import org.example.storyteller.model.SynthesisResult;
import org.example.storyteller.service.StorySynthesisService;
import org.example.storyteller.service.backend.NarrationBackend;
import org.example.storyteller.service.backend.NarrationBackendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/synthesis")
public class SynthesisController {

    private static final Logger log = LoggerFactory.getLogger(SynthesisController.class);

    private final StorySynthesisService storySynthesisService;
    private final NarrationBackendRegistry backendRegistry;

    public SynthesisController(StorySynthesisService storySynthesisService, NarrationBackendRegistry backendRegistry) {
        this.storySynthesisService = storySynthesisService;
        this.backendRegistry = backendRegistry;
    }

    /**
     * Synthesizes a story. Runs that fail part-way still return 200 with {@code success=false}
     * and the partial story; an empty transcript is a 400.
     */
    @PostMapping
    public ResponseEntity<?> synthesize(@RequestBody SynthesisRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request body is required"));
        }
        SynthesisResult result;
        try {
            result = storySynthesisService.synthesize(
                    request.transcript(), request.context(), request.backends(), request.segmentTokenBudget());
        } catch (IllegalArgumentException e) {
            log.debug("Rejected synthesis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (result.failureReason() == FailureReason.SEGMENTATION_ERROR) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/backends")
    public BackendsResponse backends() {
        List<BackendInfo> backends = backendRegistry.getBackends().stream()
                .map(SynthesisController::describe)
                .toList();
        return new BackendsResponse(backendRegistry.getDefaultPreference(), backends);
    }

    private static BackendInfo describe(NarrationBackend backend) {
        return new BackendInfo(backend.name(), backend.maxTokensPerSegment(), backend.isMetered(), backend.isAvailable());
    }

    public record SynthesisRequest(
            String transcript,
            List<String> backends,
            Integer segmentTokenBudget,
            SessionContext context
    ) {
    }

    public record BackendsResponse(List<String> defaultPreference, List<BackendInfo> backends) {
    }

    public record BackendInfo(String name, int maxTokensPerSegment, boolean metered, boolean available) {
    }
}

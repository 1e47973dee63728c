package com.deepansh.research.api;

import com.deepansh.research.core.ResearchRunner;
import com.deepansh.research.memory.ConversationMemory;
import com.deepansh.research.model.ConversationMessage;
import com.deepansh.research.model.ResearchRequest;
import com.deepansh.research.model.ResearchResponse;
import com.deepansh.research.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Research endpoints.
 *
 * POST   /api/v1/research/query                    run the workflow
 *   Optional header: Idempotency-Key: <uuid>; a repeat within 24h returns the stored response
 * GET    /api/v1/research/sessions/{id}/messages   conversation history
 * DELETE /api/v1/research/sessions/{id}            forget a session
 * GET    /api/v1/research/health
 */
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchRunner researchRunner;
    private final ConversationMemory conversationMemory;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/query")
    public ResponseEntity<ResearchResponse> query(
            @Valid @RequestBody ResearchRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Research request [sessionId={}, idempotencyKey={}]", request.getSessionId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.getCachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    ResearchResponse cachedResponse = objectMapper.readValue(cached.get(), ResearchResponse.class);
                    log.info("Returning cached response for idempotency key={}", idempotencyKey);
                    return ResponseEntity.ok(cachedResponse);
                } catch (Exception e) {
                    log.warn("Failed to deserialize cached response, running again", e);
                }
            }
            idempotencyService.claimKey(idempotencyKey);
        }

        ResearchResponse response;
        try {
            response = researchRunner.run(request);
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (Exception e) {
                log.warn("Failed to cache idempotent response", e);
            }
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<List<ConversationMessage>> messages(@PathVariable String sessionId) {
        return ResponseEntity.ok(conversationMemory.allMessages(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        return conversationMemory.delete(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}

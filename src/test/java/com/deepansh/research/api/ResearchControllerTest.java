package com.deepansh.research.api;

import com.deepansh.research.core.ResearchRunner;
import com.deepansh.research.exception.WorkflowTimeoutException;
import com.deepansh.research.memory.ConversationMemory;
import com.deepansh.research.model.ResearchRequest;
import com.deepansh.research.model.ResearchResponse;
import com.deepansh.research.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchControllerTest {

    @Mock ResearchRunner researchRunner;
    @Mock ConversationMemory conversationMemory;
    @Mock IdempotencyService idempotencyService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ResearchController controller;

    @BeforeEach
    void setUp() {
        controller = new ResearchController(researchRunner, conversationMemory, idempotencyService, objectMapper);
    }

    private static ResearchResponse response(String report) {
        return ResearchResponse.builder().runId("run-1").sessionId("session-1").report(report).build();
    }

    @Test
    void query_withIdempotencyKey_storesResponse() {
        ResearchRequest request = new ResearchRequest("Analyze AAPL", "session-1");
        when(idempotencyService.getCachedResponse("key-1")).thenReturn(Optional.empty());
        when(researchRunner.run(request)).thenReturn(response("AAPL report"));

        ResponseEntity<ResearchResponse> result = controller.query(request, "key-1");

        assertThat(result.getBody().getReport()).isEqualTo("AAPL report");
        verify(idempotencyService).claimKey("key-1");
        verify(idempotencyService).storeResponse(eq("key-1"), anyString());
    }

    @Test
    void query_repeatedKey_returnsStoredResponseWithoutRunning() throws Exception {
        when(idempotencyService.getCachedResponse("key-1"))
                .thenReturn(Optional.of(objectMapper.writeValueAsString(response("stored report"))));

        ResponseEntity<ResearchResponse> result =
                controller.query(new ResearchRequest("Analyze AAPL", "session-1"), "key-1");

        assertThat(result.getBody().getReport()).isEqualTo("stored report");
        verifyNoInteractions(researchRunner);
    }

    @Test
    void query_runFails_releasesKey() {
        ResearchRequest request = new ResearchRequest("Analyze AAPL", "session-1");
        when(idempotencyService.getCachedResponse("key-1")).thenReturn(Optional.empty());
        when(researchRunner.run(any(ResearchRequest.class)))
                .thenThrow(new WorkflowTimeoutException("run-1", Duration.ofSeconds(1)));

        assertThatThrownBy(() -> controller.query(request, "key-1"))
                .isInstanceOf(WorkflowTimeoutException.class);
        verify(idempotencyService).releaseKey("key-1");
    }

    @Test
    void query_withoutKey_skipsIdempotency() {
        ResearchRequest request = new ResearchRequest("Analyze AAPL", null);
        when(researchRunner.run(request)).thenReturn(response("AAPL report"));

        controller.query(request, null);

        verifyNoInteractions(idempotencyService);
    }

    @Test
    void deleteSession_unknown_isNotFound() {
        when(conversationMemory.delete("missing")).thenReturn(false);

        assertThat(controller.deleteSession("missing").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}

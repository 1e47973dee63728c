package com.deepansh.research.analysis;

import com.deepansh.research.exception.ResearchException;
import com.deepansh.research.llm.LlmClient;
import com.deepansh.research.model.LlmResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmGatewayTest {

    @Mock LlmClient llmClient;

    private LlmGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new LlmGateway(llmClient, new ObjectMapper());
    }

    private void reply(String content) {
        when(llmClient.chat(anyList(), anyInt(), anyDouble()))
                .thenReturn(LlmResponse.builder().content(content).build());
    }

    @Test
    void completeJson_fencedReply_isParsed() {
        reply("```json\n{\"valid\": true, \"reason\": \"stock question\"}\n```");

        JsonNode node = gateway.completeJson("system", "user", 100, 0.0);

        assertThat(node.path("valid").asBoolean()).isTrue();
        assertThat(node.path("reason").asText()).isEqualTo("stock question");
    }

    @Test
    void completeJson_notJson_throwsResearchException() {
        reply("Sure! The intent is price_query.");

        assertThatThrownBy(() -> gateway.completeJson("system", "user", 100, 0.0))
                .isInstanceOf(ResearchException.class);
    }

    @Test
    void complete_blankReply_throwsResearchException() {
        reply("  ");

        assertThatThrownBy(() -> gateway.complete("system", "user", 100, 0.0))
                .isInstanceOf(ResearchException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void stripFences_plainText_unchanged() {
        assertThat(LlmGateway.stripFences("  {\"a\": 1} ")).isEqualTo("{\"a\": 1}");
    }
}

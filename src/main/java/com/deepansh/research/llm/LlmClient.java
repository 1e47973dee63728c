package com.deepansh.research.llm;

import com.deepansh.research.model.LlmResponse;
import com.deepansh.research.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send a prompt (system + user messages) to the active provider.
     *
     * @param messages   conversation to complete
     * @param maxTokens  upper bound for the completion; 0 uses the provider default
     * @param temperature sampling temperature; negative uses the provider default
     * @return the completion text plus token usage
     */
    LlmResponse chat(List<Message> messages, int maxTokens, double temperature);

    default LlmResponse chat(List<Message> messages) {
        return chat(messages, 0, -1);
    }
}

package com.deepansh.research.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}

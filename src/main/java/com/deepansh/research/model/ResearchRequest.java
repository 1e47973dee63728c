package com.deepansh.research.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

    @NotBlank(message = "query must not be blank")
    @Size(max = 2000, message = "query must be at most 2000 characters")
    private String query;

    /**
     * Optional. When present the run continues an existing conversation;
     * otherwise a new session id is generated.
     */
    private String sessionId;
}

package com.deepansh.research.memory;

import com.deepansh.research.model.ConversationMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One research conversation. Messages are embedded in order of arrival;
 * readers that only need the tail load it with a negative $slice.
 *
 * Collection: research_sessions
 */
@Document(collection = "research_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession {

    @Id
    private String sessionId;

    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    @Builder.Default
    private int messageCount = 0;

    private Instant createdAt;

    @Indexed
    private Instant updatedAt;
}

package com.deepansh.research.memory;

import com.deepansh.research.model.ConversationMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationMemoryTest {

    @Mock MongoTemplate mongoTemplate;
    @Mock ConversationSessionRepository sessionRepository;

    @InjectMocks
    ConversationMemory memory;

    @Test
    void load_unknownSession_returnsEmpty() {
        when(mongoTemplate.findOne(any(Query.class), eq(ConversationSession.class))).thenReturn(null);

        assertThat(memory.load("missing", 10)).isEmpty();
    }

    @Test
    void load_slicesTail() {
        ConversationMessage message = ConversationMessage.builder()
                .role("user").content("Analyze AAPL").timestamp(Instant.now()).build();
        when(mongoTemplate.findOne(any(Query.class), eq(ConversationSession.class)))
                .thenReturn(ConversationSession.builder().sessionId("s-1").messages(List.of(message)).build());

        List<ConversationMessage> history = memory.load("s-1", 10);

        assertThat(history).containsExactly(message);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findOne(query.capture(), eq(ConversationSession.class));
        assertThat(query.getValue().getFieldsObject().get("messages").toString()).contains("$slice");
    }

    @Test
    void save_upsertsPushAndCounter() {
        memory.save("s-1", "assistant", "AAPL trades at $190.");

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq(ConversationSession.class));
        assertThat(update.getValue().modifies("messages")).isTrue();
        assertThat(update.getValue().modifies("messageCount")).isTrue();
        assertThat(update.getValue().modifies("createdAt")).isTrue();
    }

    @Test
    void delete_missingSession_returnsFalse() {
        when(sessionRepository.existsById("missing")).thenReturn(false);

        assertThat(memory.delete("missing")).isFalse();
        verify(sessionRepository, never()).deleteById(any());
    }

    @Test
    void delete_existingSession_removesIt() {
        when(sessionRepository.existsById("s-1")).thenReturn(true);

        assertThat(memory.delete("s-1")).isTrue();
        verify(sessionRepository).deleteById("s-1");
    }
}

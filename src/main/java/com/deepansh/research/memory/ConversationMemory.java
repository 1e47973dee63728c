package com.deepansh.research.memory;

import com.deepansh.research.model.ConversationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Conversation history for research sessions, backed by MongoDB.
 *
 * save() is a single upsert: $push the message, $inc the counter,
 * $setOnInsert createdAt. A session that does not exist yet is created by
 * its first message, so callers never need a separate "create" step.
 * $setOnInsert and $inc touch different paths, avoiding Mongo's
 * conflicting-update error (code 40).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationMemory {

    private final MongoTemplate mongoTemplate;
    private final ConversationSessionRepository sessionRepository;

    /** The last {@code limit} messages of the session, oldest first; empty for unknown sessions. */
    public List<ConversationMessage> load(String sessionId, int limit) {
        Query query = new Query(Criteria.where("_id").is(sessionId));
        query.fields().slice("messages", -Math.max(1, limit));

        ConversationSession session = mongoTemplate.findOne(query, ConversationSession.class);
        if (session == null || session.getMessages() == null) {
            log.debug("No conversation history for session={}", sessionId);
            return List.of();
        }

        log.debug("Loaded {} messages for session={}", session.getMessages().size(), sessionId);
        return List.copyOf(session.getMessages());
    }

    public void save(String sessionId, String role, String content) {
        Instant now = Instant.now();
        ConversationMessage message = ConversationMessage.builder()
                .role(role)
                .content(content)
                .timestamp(now)
                .build();

        Query query = new Query(Criteria.where("_id").is(sessionId));
        Update update = new Update()
                .push("messages", message)
                .inc("messageCount", 1)
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);

        mongoTemplate.upsert(query, update, ConversationSession.class);
        log.debug("Saved {} message to session={}", role, sessionId);
    }

    public List<ConversationMessage> allMessages(String sessionId) {
        return sessionRepository.findById(sessionId)
                .map(ConversationSession::getMessages)
                .map(List::copyOf)
                .orElse(List.of());
    }

    public List<ConversationSession> recentSessions() {
        return sessionRepository.findTop20ByOrderByUpdatedAtDesc();
    }

    public boolean delete(String sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            return false;
        }
        sessionRepository.deleteById(sessionId);
        log.info("Deleted conversation session={}", sessionId);
        return true;
    }
}

package com.deepansh.research.memory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationSessionRepository extends MongoRepository<ConversationSession, String> {

    List<ConversationSession> findTop20ByOrderByUpdatedAtDesc();
}

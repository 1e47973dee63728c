package com.deepansh.research.retrieval;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResearchDocumentRepository extends MongoRepository<ResearchDocument, String> {

    @Query("{ 'embedding': { $exists: true, $ne: null } }")
    List<ResearchDocument> findAllWithEmbedding();

    @Query("{ 'ticker': ?0, 'embedding': { $exists: true, $ne: null } }")
    List<ResearchDocument> findByTickerWithEmbedding(String ticker);

    /** Case-insensitive substring match; the pattern must already be regex-quoted. */
    @Query(value = "{ 'text': { $regex: ?0, $options: 'i' } }", sort = "{ 'createdAt': -1 }")
    List<ResearchDocument> searchByKeyword(String quotedPattern, Pageable pageable);

    List<ResearchDocument> findByTickerOrderByCreatedAtDesc(String ticker, Pageable pageable);
}

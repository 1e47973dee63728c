package com.deepansh.research.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A chunk of research text (filing excerpt, news article, company profile)
 * available to the rag_retrieval node.
 *
 * Collection: research_documents
 *
 * The embedding is stored as a plain List<Double> so the same collection
 * works with an Atlas vector index or with in-process cosine similarity.
 */
@Document(collection = "research_documents")
@CompoundIndex(name = "idx_ticker_date", def = "{'ticker': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchDocument {

    @Id
    private String id;

    @Indexed
    private String ticker;

    /** edgar | news | yfinance */
    private String source;

    private String text;

    private Map<String, Object> metadata;

    private List<Double> embedding;

    @CreatedDate
    private Instant createdAt;
}

package com.deepansh.research.retrieval;

import com.deepansh.research.config.ProviderProperties;
import com.deepansh.research.model.RetrievedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Semantic search over {@link ResearchDocument}s.
 *
 * In-process cosine similarity against stored embeddings, filtered by a
 * similarity threshold and optionally by ticker. When no embedded
 * documents exist the search falls back to a keyword/ticker lookup so
 * fresh installations still return something.
 */
@Service
@Slf4j
public class DocumentRetriever {

    private final EmbeddingService embeddingService;
    private final ResearchDocumentRepository documentRepository;
    private final double similarityThreshold;

    public DocumentRetriever(EmbeddingService embeddingService,
                             ResearchDocumentRepository documentRepository,
                             ProviderProperties providerProperties) {
        this.embeddingService = embeddingService;
        this.documentRepository = documentRepository;
        this.similarityThreshold = providerProperties.getRetrieval().getSimilarityThreshold();
    }

    /**
     * @param ticker optional filter; null searches every document
     */
    public List<RetrievedDocument> search(String query, String ticker, int topK) {
        List<ResearchDocument> candidates = ticker != null
                ? documentRepository.findByTickerWithEmbedding(ticker)
                : documentRepository.findAllWithEmbedding();

        if (candidates.isEmpty()) {
            log.debug("No embedded documents [ticker={}], falling back to keyword search", ticker);
            return keywordFallback(query, ticker, topK);
        }

        float[] queryEmbedding = embeddingService.embed(query);

        return candidates.stream()
                .filter(d -> d.getEmbedding() != null && !d.getEmbedding().isEmpty())
                .map(d -> new ScoredDocument(d, cosineSimilarity(queryEmbedding, d.getEmbedding())))
                .filter(sd -> sd.score() >= similarityThreshold)
                .sorted(Comparator.comparingDouble(ScoredDocument::score).reversed())
                .limit(topK)
                .map(sd -> toRetrieved(sd.document(), sd.score()))
                .toList();
    }

    private List<RetrievedDocument> keywordFallback(String query, String ticker, int topK) {
        PageRequest page = PageRequest.of(0, topK);
        List<ResearchDocument> matches = ticker != null
                ? documentRepository.findByTickerOrderByCreatedAtDesc(ticker, page)
                : documentRepository.searchByKeyword(Pattern.quote(query), page);
        return matches.stream()
                .map(d -> toRetrieved(d, 0.0))
                .toList();
    }

    private RetrievedDocument toRetrieved(ResearchDocument document, double similarity) {
        return new RetrievedDocument(
                document.getText(),
                document.getSource(),
                document.getTicker(),
                similarity,
                document.getMetadata() != null ? document.getMetadata() : Map.of());
    }

    static double cosineSimilarity(float[] a, List<Double> b) {
        if (a.length != b.size()) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double bi = b.get(i);
            dot   += a[i] * bi;
            normA += a[i] * a[i];
            normB += bi * bi;
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record ScoredDocument(ResearchDocument document, double score) {}
}

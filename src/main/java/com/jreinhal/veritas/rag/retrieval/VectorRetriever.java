package com.jreinhal.veritas.rag.retrieval;

import com.jreinhal.veritas.constant.MetadataKeys;
import com.jreinhal.veritas.llm.LlmRateLimiter;
import com.jreinhal.veritas.model.Provenance;
import com.jreinhal.veritas.model.RetrievedItem;
import com.jreinhal.veritas.model.SourceType;
import com.jreinhal.veritas.util.VectorFilters;
import com.jreinhal.veritas.workspace.TenantClients;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Similarity search over passages, restricted to one workspace. The store embeds the query, so each
 * search goes through the shared rate limiter.
 */
@Component
public class VectorRetriever {
    private final LlmRateLimiter rateLimiter;

    @Value("${veritas.retrieval.vector-top-k:10}")
    private int topK;
    @Value("${veritas.retrieval.similarity-threshold:0.3}")
    private double similarityThreshold;

    public VectorRetriever(LlmRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public List<RetrievedItem> search(TenantClients clients, String query) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(this.topK)
                .similarityThreshold(this.similarityThreshold)
                .filterExpression(VectorFilters.forWorkspace(clients.workspaceId()))
                .build();
        List<Document> documents = this.rateLimiter.execute("embed", LlmRateLimiter.estimateTokens(query),
                () -> clients.vectorStore().similaritySearch(request));
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }
        List<RetrievedItem> items = new ArrayList<>(documents.size());
        for (Document document : documents) {
            String text = document.getText();
            if (text == null || text.isBlank()) {
                continue;
            }
            double score = document.getScore() != null ? document.getScore() : 0.0;
            items.add(new RetrievedItem(SourceType.VECTOR, text, toProvenance(document), score));
        }
        return items;
    }

    static Provenance toProvenance(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        String documentId = firstPresent(metadata, MetadataKeys.DOCUMENT_ID_KEYS);
        if (documentId == null) {
            documentId = document.getId();
        }
        return Provenance.of(documentId, firstPresent(metadata, MetadataKeys.LABEL_KEYS), locator(metadata),
                firstPresent(metadata, MetadataKeys.SPEAKER_KEYS));
    }

    /**
     * Raw locator: seconds or a clock string for timestamps, {@code offset:N} for character offsets.
     */
    static String locator(Map<String, Object> metadata) {
        Object timestamp = metadata.get(MetadataKeys.TIMESTAMP);
        if (timestamp == null) {
            timestamp = metadata.get(MetadataKeys.START_SECONDS);
        }
        if (timestamp != null && !String.valueOf(timestamp).isBlank()) {
            return String.valueOf(timestamp).trim();
        }
        Object offset = metadata.get(MetadataKeys.OFFSET);
        if (offset != null && !String.valueOf(offset).isBlank()) {
            return "offset:" + String.valueOf(offset).trim();
        }
        return null;
    }

    private static String firstPresent(Map<String, Object> metadata, List<String> keys) {
        for (String key : keys) {
            Object value = metadata.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }
}

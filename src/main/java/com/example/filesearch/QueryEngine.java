package com.example.filesearch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text query to ranked hits: optional rewrite, embed, then {@link VectorIndex#search}.
 * Never throws; any failure is logged and answered with an empty list.
 */
@Slf4j
@Service
public class QueryEngine {

    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;
    private final QueryOptimizer optimizer;
    private final boolean filterMissing;

    @Autowired
    public QueryEngine(VectorIndex vectorIndex, EmbeddingProvider embeddingProvider,
                       ObjectProvider<QueryOptimizer> optimizer,
                       @Value("${query.filter-missing:true}") boolean filterMissing) {
        this(vectorIndex, embeddingProvider, optimizer.getIfAvailable(), filterMissing);
    }

    public QueryEngine(VectorIndex vectorIndex, EmbeddingProvider embeddingProvider, QueryOptimizer optimizer, boolean filterMissing) {
        this.vectorIndex = vectorIndex;
        this.embeddingProvider = embeddingProvider;
        this.optimizer = optimizer;
        this.filterMissing = filterMissing;
    }

    public List<SearchHit> search(String query, int topK) {
        return search(query, topK, true);
    }

    public List<SearchHit> search(String query, int topK, boolean optimize) {
        if (query == null || query.isBlank() || topK <= 0) return Collections.emptyList();
        try {
            String effective = query;
            if (optimize && optimizer != null) {
                effective = rewrite(query);
            }
            float[] qv = embeddingProvider.embed(effective);
            List<SearchHit> hits = vectorIndex.search(qv, topK);
            if (!filterMissing) return hits;
            return hits.stream()
                    .filter(h -> Files.exists(Path.of(h.metadata().path())))
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.error("Search failed for query '{}': {}", query, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    private String rewrite(String query) {
        try {
            String rewritten = optimizer.optimize(query);
            return rewritten == null || rewritten.isBlank() ? query : rewritten;
        } catch (RuntimeException e) {
            log.warn("Query optimizer failed, using original query: {}", e.getMessage());
            return query;
        }
    }

    public boolean hasOptimizer() {
        return optimizer != null;
    }
}

package com.example.filesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;

@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);

    @Value("${index.dimension:384}")
    private int dimension;

    @Value("${index.path:./data/ann-index.idx}")
    private String indexPath;

    @Value("${index.id-map.path:./data/id-map.json}")
    private String idMapPath;

    @Value("${index.ann.type:hnsw}")
    private String annType;

    @Value("${hnsw.m:16}")
    private int m;

    @Value("${hnsw.efConstruction:200}")
    private int efConstruction;

    @Value("${hnsw.ef:64}")
    private int ef;

    @Value("${hnsw.max.items:1000}")
    private int maxItems;

    @Bean
    public AnnIndex annIndex() {
        switch (annType.trim().toLowerCase(Locale.ROOT)) {
            case "brute-force":
                log.info("Using brute-force ANN index (dimension={})", dimension);
                return new BruteForceAnnIndex(dimension);
            case "hnsw":
                log.info("Using HNSW ANN index (dimension={}, m={}, efConstruction={}, ef={}, maxItems={})",
                        dimension, m, efConstruction, ef, maxItems);
                return new HnswAnnIndex(dimension, m, efConstruction, ef, maxItems);
            default:
                throw new IllegalArgumentException("Unknown index.ann.type '" + annType + "' (expected hnsw or brute-force)");
        }
    }

    @Bean
    public VectorIndex vectorIndex(AnnIndex annIndex, EmbeddingProvider embeddingProvider) {
        if (embeddingProvider.dimension() != annIndex.dimension()) {
            throw new IllegalStateException("Embedding dimension " + embeddingProvider.dimension()
                    + " does not match index.dimension " + annIndex.dimension());
        }
        return new VectorIndex(annIndex, Path.of(indexPath), Path.of(idMapPath));
    }
}

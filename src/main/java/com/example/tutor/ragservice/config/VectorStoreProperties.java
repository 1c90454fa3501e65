package com.example.tutor.ragservice.config;

import com.example.tutor.ragservice.store.SimilarityMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.vector")
public class VectorStoreProperties {

    public enum Backend { MONGO, MEMORY }

    private Backend backend = Backend.MONGO;
    private String collectionName = "rag_tutor_collection";

    /** Snapshot file for the memory backend; blank keeps the collection in memory only. */
    private String persistPath = "";

    /** 1536 matches text-embedding-3-small. */
    private int embeddingDimension = 1536;

    private SimilarityMetric metric = SimilarityMetric.COSINE;
    private boolean useAtlasVector = false;
    private String indexName = "vector_index";
}

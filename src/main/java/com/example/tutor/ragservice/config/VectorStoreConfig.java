package com.example.tutor.ragservice.config;

import com.example.tutor.ragservice.store.ChunkCollection;
import com.example.tutor.ragservice.store.InMemoryChunkCollection;
import com.example.tutor.ragservice.store.MongoChunkCollection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class VectorStoreConfig {

    @Bean
    ChunkCollection chunkCollection(VectorStoreProperties props,
                                    ObjectProvider<MongoTemplate> mongoTemplate,
                                    ObjectMapper objectMapper) {
        return switch (props.getBackend()) {
            case MONGO -> new MongoChunkCollection(mongoTemplate.getObject(), props);
            case MEMORY -> new InMemoryChunkCollection(
                    props.getCollectionName(),
                    props.getPersistPath() == null || props.getPersistPath().isBlank() ? null : Path.of(props.getPersistPath()),
                    props.getMetric(),
                    objectMapper);
        };
    }

    /** Runs the per-query searches of one retrieval in parallel. */
    @Bean(destroyMethod = "shutdown")
    ExecutorService retrievalExecutor(RetrievalProperties props) {
        return Executors.newFixedThreadPool(Math.max(1, props.getParallelism()),
                new CustomizableThreadFactory("retrieval-"));
    }
}

package com.example.tutor.ragservice.config;

import dev.langchain4j.model.Tokenizer;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiTokenizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfig {

    @Bean
    EmbeddingModel embeddingModel(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.embeddingModel:text-embedding-3-small}") String model,
            @Value("${openai.timeout:60s}") Duration timeout
    ) {
        return OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .timeout(timeout)
                .build();
    }

    /** Used only for chunk token counts. */
    @Bean
    Tokenizer tokenizer(@Value("${openai.tokenizerModel:gpt-3.5-turbo}") String model) {
        return new OpenAiTokenizer(model);
    }
}

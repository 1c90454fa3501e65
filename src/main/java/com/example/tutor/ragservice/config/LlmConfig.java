package com.example.tutor.ragservice.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

@Configuration
public class LlmConfig {

    /** Free-text model used to compose tutoring answers. */
    @Bean
    @Primary
    ChatLanguageModel chatModel(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.model:gpt-4o-mini}") String model,
            @Value("${openai.temperature:0.1}") double temperature,
            @Value("${openai.timeout:60s}") Duration timeout) {
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .temperature(temperature)
                .maxTokens(1500)
                .timeout(timeout)
                .build();
    }

    /** JSON-mode model for question analysis, query generation and relevance judging. */
    @Bean
    ChatLanguageModel jsonChatModel(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.model:gpt-4o-mini}") String model,
            @Value("${openai.timeout:60s}") Duration timeout) {
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .temperature(0.1)
                .responseFormat("json_object")
                .timeout(timeout)
                .build();
    }
}

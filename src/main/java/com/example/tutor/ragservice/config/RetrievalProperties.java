package com.example.tutor.ragservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.retrieval")
public class RetrievalProperties {

    private int defaultK = 5;
    private boolean rerankEnabled = true;
    private int rerankPrefixChars = 500;
    private int maxQueries = 5;
    private int parallelism = 4;
    private Duration queryTimeout = Duration.ofSeconds(30);
}

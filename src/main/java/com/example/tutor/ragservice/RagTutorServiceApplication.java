package com.example.tutor.ragservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RagTutorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagTutorServiceApplication.class, args);
    }
}

package com.ai.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AI Tutor Application
 * Main entry point for the retrieval and exercise-generation backend.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorApplication.class, args);
    }
}

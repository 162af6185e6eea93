package com.jreinhal.lectern;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class LecternApplication {
    private static final Logger log = LoggerFactory.getLogger(LecternApplication.class);
    private final Environment environment;

    public LecternApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(LecternApplication.class, (String[])args);
    }

    @PostConstruct
    public void logRuntimeConfiguration() {
        String mongoUri = this.environment.getProperty("spring.data.mongodb.uri", "");
        log.info("Chat model: {}", this.environment.getProperty("spring.ai.ollama.chat.options.model", "(default)"));
        log.info("Embedding model: {}", this.environment.getProperty("spring.ai.ollama.embedding.options.model", "(default)"));
        log.info("MongoDB host: {}", mongoUri.replaceAll("//[^@/]*@", "//***@"));
    }
}

package com.jreinhal.lectern.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation served at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:lectern}")
    private String appName;

    @Bean
    public OpenAPI lecternOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lectern API")
                        .description("""
                                **%s** answers questions over the documents uploaded to one chat session.

                                Every (userId, sessionId) pair gets its own retrieval partition. Queries are
                                classified, then answered by decomposition, focused chunk retrieval, whole-document
                                reading or plain retrieval, degrading to the next strategy on failure.
                                """.formatted(this.appName))
                        .version("1.0.0"))
                .servers(List.of(new Server().url("/").description("Current Server")))
                .tags(List.of(
                        new Tag().name("Query").description("Answers and answer streams"),
                        new Tag().name("Sessions").description("Conversation history and partitions"),
                        new Tag().name("Documents").description("Page-text ingestion")));
    }
}

package com.jreinhal.lectern.llm;

import com.jreinhal.lectern.exception.GenerationException;
import com.jreinhal.lectern.util.CorrelatedTasks;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class OllamaGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationClient.class);
    private final ChatClient chatClient;
    private final ExecutorService externalCallExecutor;
    @Value("${lectern.timeouts.generation-seconds:90}")
    private int timeoutSeconds;
    @Value("${lectern.generation.temperature:0.2}")
    private double temperature;

    public OllamaGenerationClient(ChatClient.Builder builder, @Qualifier("externalCallExecutor") ExecutorService externalCallExecutor) {
        this.chatClient = builder.build();
        this.externalCallExecutor = externalCallExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Generation client initialized (timeout={}s, temperature={})", this.timeoutSeconds, this.temperature);
    }

    @Override
    public String complete(List<Message> messages, ResponseFormat format) {
        OllamaOptions options = format == ResponseFormat.JSON
                ? OllamaOptions.builder().temperature(this.temperature).format("json").build()
                : OllamaOptions.builder().temperature(this.temperature).build();
        Prompt prompt = new Prompt(messages, options);
        long start = System.currentTimeMillis();
        String content;
        try {
            content = CompletableFuture.supplyAsync(CorrelatedTasks.wrap(() -> this.chatClient.prompt(prompt).call().content()), this.externalCallExecutor)
                    .get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            log.warn("Generation timed out after {}s", this.timeoutSeconds);
            throw new GenerationException("Generation timed out after " + this.timeoutSeconds + "s", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Generation interrupted", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Generation failed: {}", cause.getMessage());
            throw new GenerationException("Generation failed", cause);
        }
        if (content == null || content.isBlank()) {
            throw new GenerationException("Generation returned an empty completion");
        }
        log.debug("Generation completed in {}ms ({} mode, {} chars)", System.currentTimeMillis() - start, format, content.length());
        return content;
    }
}

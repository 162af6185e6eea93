package com.jreinhal.lectern.llm;

import java.util.List;
import org.springframework.ai.chat.messages.Message;

/**
 * Text generation capability.
 */
public interface GenerationClient {

    /**
     * @throws com.jreinhal.lectern.exception.GenerationException on failure, timeout or an empty completion
     */
    String complete(List<Message> messages, ResponseFormat format);

    default String complete(List<Message> messages) {
        return this.complete(messages, ResponseFormat.TEXT);
    }
}

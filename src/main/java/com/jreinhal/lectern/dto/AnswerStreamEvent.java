package com.jreinhal.lectern.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jreinhal.lectern.model.SourceCitation;

/**
 * One record of an answer stream. A stream ends with exactly one {@code done} or
 * {@code error} event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerStreamEvent(Type type, String label, String chunk, SourceCitation citation, String message) {

    public enum Type {
        LAYER_UPDATE("layer-update"),
        TEXT_DELTA("text-delta"),
        SOURCE("source"),
        ERROR("error"),
        DONE("done");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return this.wireName;
        }
    }

    public static AnswerStreamEvent layer(String label) {
        return new AnswerStreamEvent(Type.LAYER_UPDATE, label, null, null, null);
    }

    public static AnswerStreamEvent textDelta(String chunk) {
        return new AnswerStreamEvent(Type.TEXT_DELTA, null, chunk, null, null);
    }

    public static AnswerStreamEvent source(SourceCitation citation) {
        return new AnswerStreamEvent(Type.SOURCE, null, null, citation, null);
    }

    public static AnswerStreamEvent error(String message) {
        return new AnswerStreamEvent(Type.ERROR, null, null, null, message);
    }

    public static AnswerStreamEvent done() {
        return new AnswerStreamEvent(Type.DONE, null, null, null, null);
    }
}

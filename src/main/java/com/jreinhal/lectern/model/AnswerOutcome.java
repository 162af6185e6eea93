package com.jreinhal.lectern.model;

public enum AnswerOutcome {
    ANSWERED,
    GREETING,
    NO_DOCUMENTS,
    NO_RELEVANT_INFO,
    APOLOGY,
    SERVICE_UNAVAILABLE,
    INVALID
}

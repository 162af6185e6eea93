package com.jreinhal.lectern.rag.strategy;

/**
 * Answer strategies, strongest first. The fallback chain walks this order.
 */
public enum Strategy {
    AGENTIC_DECOMPOSITION,
    SMART_CHUNKING,
    FULL_DOCUMENT,
    SIMPLE_RAG
}

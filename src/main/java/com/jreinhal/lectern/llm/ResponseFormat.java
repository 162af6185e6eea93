package com.jreinhal.lectern.llm;

public enum ResponseFormat {
    TEXT,
    JSON
}

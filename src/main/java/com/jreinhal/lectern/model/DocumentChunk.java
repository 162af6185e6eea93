package com.jreinhal.lectern.model;

import java.util.HashMap;
import java.util.Map;

/**
 * One page of one uploaded file, as stored in a session partition.
 */
public record DocumentChunk(String id, String fileId, String fileName, int pageNumber, String content, String language) {
    public static final String FILE_ID_KEY = "fileId";
    public static final String FILE_NAME_KEY = "fileName";
    public static final String PAGE_NUMBER_KEY = "pageNumber";
    public static final String LANGUAGE_KEY = "language";

    public static String chunkId(String fileId, int pageNumber) {
        return fileId + "_p" + pageNumber;
    }

    public Map<String, Object> toMetadata() {
        HashMap<String, Object> metadata = new HashMap<>();
        metadata.put(FILE_ID_KEY, this.fileId);
        metadata.put(FILE_NAME_KEY, this.fileName);
        metadata.put(PAGE_NUMBER_KEY, this.pageNumber);
        metadata.put(LANGUAGE_KEY, this.language != null ? this.language : "en");
        return metadata;
    }

    public static DocumentChunk fromIndex(String id, String content, Map<String, Object> metadata) {
        Map<String, Object> meta = metadata != null ? metadata : Map.of();
        return new DocumentChunk(id,
                asString(meta.get(FILE_ID_KEY), ""),
                asString(meta.get(FILE_NAME_KEY), "Unknown document"),
                asInt(meta.get(PAGE_NUMBER_KEY)),
                content != null ? content : "",
                asString(meta.get(LANGUAGE_KEY), "en"));
    }

    private static String asString(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? fallback : text;
    }

    private static int asInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        }
        catch (NumberFormatException e) {
            return 0;
        }
    }
}

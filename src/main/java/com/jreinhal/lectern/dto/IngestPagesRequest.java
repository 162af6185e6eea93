package com.jreinhal.lectern.dto;

import com.jreinhal.lectern.model.DocumentPage;
import java.util.List;

/**
 * Extracted page text for one uploaded file.
 */
public record IngestPagesRequest(String userId, String sessionId, String fileId, String fileName, String language, List<DocumentPage> pages) {
}

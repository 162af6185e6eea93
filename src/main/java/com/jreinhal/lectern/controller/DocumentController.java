package com.jreinhal.lectern.controller;

import com.jreinhal.lectern.dto.IngestPagesRequest;
import com.jreinhal.lectern.service.DocumentIngestionService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Page-text ingestion for a session. Files arrive already split into pages.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {
    private final DocumentIngestionService documentIngestionService;

    public DocumentController(DocumentIngestionService documentIngestionService) {
        this.documentIngestionService = documentIngestionService;
    }

    @PostMapping("/pages")
    public ResponseEntity<DocumentIngestionService.IngestionResult> indexPages(@RequestBody IngestPagesRequest request) {
        if (isBlank(request.userId()) || isBlank(request.sessionId())) {
            throw new IllegalArgumentException("userId and sessionId are required");
        }
        return ResponseEntity.ok(this.documentIngestionService.indexPages(request.userId(), request.sessionId(),
                request.fileId(), request.fileName(), request.pages(), request.language()));
    }

    @DeleteMapping("/{fileId}")
    public ResponseEntity<Map<String, Object>> removeFile(@PathVariable String fileId, @RequestParam String userId, @RequestParam String sessionId) {
        long removed = this.documentIngestionService.removeFile(userId, sessionId, fileId);
        return ResponseEntity.ok(Map.of("fileId", fileId, "chunksRemoved", removed));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

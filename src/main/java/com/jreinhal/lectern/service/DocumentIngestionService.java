package com.jreinhal.lectern.service;

import com.jreinhal.lectern.llm.QueryEmbedder;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.DocumentPage;
import com.jreinhal.lectern.partition.PartitionManager;
import com.jreinhal.lectern.store.DocumentStore;
import com.jreinhal.lectern.util.LogSanitizer;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Indexes already-extracted page text into a session partition, one chunk per page.
 * Text extraction and language detection happen upstream.
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    private final PartitionManager partitionManager;
    private final VectorIndex vectorIndex;
    private final DocumentStore documentStore;
    private final QueryEmbedder queryEmbedder;

    public DocumentIngestionService(PartitionManager partitionManager, VectorIndex vectorIndex, DocumentStore documentStore, QueryEmbedder queryEmbedder) {
        this.partitionManager = partitionManager;
        this.vectorIndex = vectorIndex;
        this.documentStore = documentStore;
        this.queryEmbedder = queryEmbedder;
    }

    /**
     * Stores the pages for full-document reading and indexes each non-blank page.
     * Re-indexing a file replaces its chunks because chunk ids are derived from
     * (fileId, page).
     *
     * @throws IllegalArgumentException when ids are missing or no page has text
     */
    public IngestionResult indexPages(String userId, String sessionId, String fileId, String fileName, List<DocumentPage> pages, String language) {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("fileId is required");
        }
        List<DocumentPage> usable = pages == null ? List.of() : pages.stream()
                .filter(page -> page != null && page.content() != null && !page.content().isBlank())
                .toList();
        if (usable.isEmpty()) {
            throw new IllegalArgumentException("No page text to index");
        }
        String name = fileName == null || fileName.isBlank() ? fileId : fileName;
        PartitionHandle partition = this.partitionManager.resolve(userId, sessionId);
        this.documentStore.savePages(partition.partitionId(), fileId, name, usable);

        List<String> ids = new ArrayList<>(usable.size());
        List<float[]> vectors = new ArrayList<>(usable.size());
        List<Map<String, Object>> metadata = new ArrayList<>(usable.size());
        List<String> documents = new ArrayList<>(usable.size());
        for (DocumentPage page : usable) {
            DocumentChunk chunk = new DocumentChunk(DocumentChunk.chunkId(fileId, page.pageNumber()), fileId, name, page.pageNumber(), page.content(), language);
            ids.add(chunk.id());
            vectors.add(this.queryEmbedder.embed(page.content()));
            metadata.add(chunk.toMetadata());
            documents.add(page.content());
        }
        this.vectorIndex.add(partition, ids, vectors, metadata, documents);
        log.info("Indexed {} pages of {} into {}", usable.size(), LogSanitizer.sanitize(name), partition.partitionId());
        return new IngestionResult(fileId, partition.partitionId(), usable.size(), pages.size() - usable.size());
    }

    public long removeFile(String userId, String sessionId, String fileId) {
        PartitionHandle partition = this.partitionManager.resolve(userId, sessionId);
        long removed = this.vectorIndex.deleteByFilter(partition, Map.of(DocumentChunk.FILE_ID_KEY, fileId));
        this.documentStore.deletePages(partition.partitionId(), fileId);
        log.info("Removed {} chunks of file {} from {}", removed, LogSanitizer.sanitize(fileId), partition.partitionId());
        return removed;
    }

    public record IngestionResult(String fileId, String partitionId, int pagesIndexed, int pagesSkipped) {
    }
}

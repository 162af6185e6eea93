package com.jreinhal.lectern.store;

import com.jreinhal.lectern.model.DocumentPage;
import java.util.List;
import java.util.Optional;

/**
 * Page-wise extracted text, keyed by partition and file id. A file id is only
 * meaningful inside the partition it was ingested into.
 */
public interface DocumentStore {

    /**
     * Pages of the file in ascending page order; empty when the partition holds no such file.
     */
    List<DocumentPage> getPages(String partitionId, String fileId);

    Optional<String> getFileName(String partitionId, String fileId);

    void savePages(String partitionId, String fileId, String fileName, List<DocumentPage> pages);

    long deletePages(String partitionId, String fileId);
}

package com.jreinhal.lectern.store;

import com.jreinhal.lectern.model.DocumentPage;
import com.mongodb.client.result.DeleteResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.annotation.Id;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);
    static final String PAGES_COLLECTION = "document_pages";
    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    static String pageId(String partitionId, String fileId, int pageNumber) {
        return partitionId + "_" + fileId + "_p" + pageNumber;
    }

    private static Criteria fileCriteria(String partitionId, String fileId) {
        return Criteria.where("partitionId").is(partitionId).and("fileId").is(fileId);
    }

    @Override
    public List<DocumentPage> getPages(String partitionId, String fileId) {
        Query query = new Query(fileCriteria(partitionId, fileId)).with(Sort.by(Sort.Direction.ASC, "pageNumber"));
        return this.mongoTemplate.find(query, StoredPage.class, PAGES_COLLECTION).stream()
                .map(page -> new DocumentPage(page.pageNumber(), page.content() != null ? page.content() : ""))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> getFileName(String partitionId, String fileId) {
        StoredPage page = this.mongoTemplate.findOne(new Query(fileCriteria(partitionId, fileId)), StoredPage.class, PAGES_COLLECTION);
        return Optional.ofNullable(page).map(StoredPage::fileName);
    }

    @Override
    public void savePages(String partitionId, String fileId, String fileName, List<DocumentPage> pages) {
        Instant now = Instant.now();
        for (DocumentPage page : pages) {
            String id = pageId(partitionId, fileId, page.pageNumber());
            this.mongoTemplate.save(new StoredPage(id, partitionId, fileId, fileName, page.pageNumber(), page.content(), now), PAGES_COLLECTION);
        }
        log.info("Stored {} pages for file {} in {}", pages.size(), fileId, partitionId);
    }

    @Override
    public long deletePages(String partitionId, String fileId) {
        DeleteResult result = this.mongoTemplate.remove(new Query(fileCriteria(partitionId, fileId)), PAGES_COLLECTION);
        return result.getDeletedCount();
    }

    public record StoredPage(@Id String id, String partitionId, String fileId, String fileName, int pageNumber, String content, Instant storedAt) {
    }
}

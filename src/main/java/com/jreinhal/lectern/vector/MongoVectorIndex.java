package com.jreinhal.lectern.vector;

import com.jreinhal.lectern.exception.VectorSearchException;
import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Vector index backed by one MongoDB collection per partition. Similarity is
 * cosine, computed in-process over the partition's records; distance is
 * {@code 1 - similarity}.
 */
@Component
public class MongoVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(MongoVectorIndex.class);
    private static final String METADATA_PREFIX = "metadata.";
    private final MongoTemplate mongoTemplate;

    public MongoVectorIndex(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public PartitionHandle createOrGet(String partitionId) {
        if (!this.mongoTemplate.collectionExists(partitionId)) {
            try {
                this.mongoTemplate.createCollection(partitionId);
                log.info("Created vector partition {}", partitionId);
            }
            catch (DataAccessException e) {
                // Lost a creation race; the collection is there either way.
                if (!this.mongoTemplate.collectionExists(partitionId)) {
                    throw e;
                }
                log.debug("Vector partition {} created concurrently", partitionId);
            }
        }
        return new PartitionHandle(partitionId, partitionId);
    }

    @Override
    public void add(PartitionHandle handle, List<String> ids, List<float[]> vectors, List<Map<String, Object>> metadata, List<String> documents) {
        if (ids.size() != vectors.size() || ids.size() != metadata.size() || ids.size() != documents.size()) {
            throw new IllegalArgumentException("ids, vectors, metadata and documents must have the same size");
        }
        for (int i = 0; i < ids.size(); ++i) {
            List<Double> embedding = toList(vectors.get(i));
            VectorRecord record = new VectorRecord();
            record.setId(ids.get(i));
            record.setContent(documents.get(i));
            record.setMetadata(metadata.get(i) != null ? new HashMap<>(metadata.get(i)) : new HashMap<>());
            record.setEmbedding(embedding);
            record.setEmbeddingNorm(computeNorm(embedding));
            this.mongoTemplate.save(record, handle.collectionName());
        }
        log.info("Persisted {} chunks to partition {}", ids.size(), handle.partitionId());
    }

    @Override
    public VectorQueryResult query(PartitionHandle handle, float[] vector, int k, Map<String, Object> filter) {
        List<VectorRecord> records;
        try {
            records = this.mongoTemplate.find(buildFilterQuery(filter), VectorRecord.class, handle.collectionName());
        }
        catch (DataAccessException e) {
            throw new VectorSearchException(handle.partitionId(), "Vector search failed", e);
        }
        double queryNorm = computeNorm(vector);
        List<Scored> nearest = records.stream()
                .map(r -> new Scored(r, 1.0 - cosineSimilarity(vector, queryNorm, r.getEmbedding(), r.getEmbeddingNorm())))
                .sorted(Comparator.comparingDouble(Scored::distance))
                .limit(Math.max(0, k))
                .collect(Collectors.toList());
        List<String> ids = new ArrayList<>(nearest.size());
        List<String> documents = new ArrayList<>(nearest.size());
        List<Map<String, Object>> metadatas = new ArrayList<>(nearest.size());
        List<Double> distances = new ArrayList<>(nearest.size());
        for (Scored scored : nearest) {
            ids.add(scored.record().getId());
            documents.add(scored.record().getContent());
            metadatas.add(scored.record().getMetadata() != null ? scored.record().getMetadata() : Map.of());
            distances.add(scored.distance());
        }
        log.debug("Partition {} searched: {} records, {} returned", handle.partitionId(), records.size(), ids.size());
        return new VectorQueryResult(ids, documents, metadatas, distances);
    }

    @Override
    public long deleteByFilter(PartitionHandle handle, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException("Refusing to delete with an empty filter");
        }
        DeleteResult result = this.mongoTemplate.remove(buildFilterQuery(filter), handle.collectionName());
        log.info("Deleted {} chunks from partition {}", result.getDeletedCount(), handle.partitionId());
        return result.getDeletedCount();
    }

    @Override
    public void deleteCollection(String partitionId) {
        this.mongoTemplate.dropCollection(partitionId);
        log.info("Dropped vector partition {}", partitionId);
    }

    @Override
    public long count(PartitionHandle handle, Map<String, Object> filter) {
        return this.mongoTemplate.count(buildFilterQuery(filter), handle.collectionName());
    }

    @Override
    public List<String> distinctValues(PartitionHandle handle, String metadataKey) {
        return this.mongoTemplate.findDistinct(new Query(), METADATA_PREFIX + metadataKey, handle.collectionName(), Object.class)
                .stream()
                .map(String::valueOf)
                .sorted()
                .collect(Collectors.toList());
    }

    private static Query buildFilterQuery(Map<String, Object> filter) {
        Query query = new Query();
        if (filter == null) {
            return query;
        }
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            Criteria criteria = Criteria.where(METADATA_PREFIX + entry.getKey());
            if (entry.getValue() instanceof Collection<?> values) {
                query.addCriteria(criteria.in(values));
            } else {
                query.addCriteria(criteria.is(entry.getValue()));
            }
        }
        return query;
    }

    static double cosineSimilarity(float[] v1, double normA, List<Double> v2, Double normB) {
        if (v1 == null || v2 == null || v1.length == 0 || v2.isEmpty() || v1.length != v2.size()) {
            return 0.0;
        }
        double docNorm = normB != null ? normB : computeNorm(v2);
        if (normA == 0.0 || docNorm == 0.0) {
            return 0.0;
        }
        double dotProduct = 0.0;
        for (int i = 0; i < v1.length; ++i) {
            dotProduct += (double) v1[i] * v2.get(i);
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(docNorm));
    }

    private static List<Double> toList(float[] vector) {
        List<Double> values = new ArrayList<>(vector.length);
        for (float f : vector) {
            values.add((double) f);
        }
        return values;
    }

    private static double computeNorm(float[] embedding) {
        double sum = 0.0;
        if (embedding != null) {
            for (float f : embedding) {
                sum += (double) f * (double) f;
            }
        }
        return sum;
    }

    private static double computeNorm(List<Double> embedding) {
        double sum = 0.0;
        if (embedding != null) {
            for (Double value : embedding) {
                if (value != null) {
                    sum += value * value;
                }
            }
        }
        return sum;
    }

    public static class VectorRecord {
        @Id
        private String id;
        private String content;
        private Map<String, Object> metadata;
        private List<Double> embedding;
        private Double embeddingNorm;

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getContent() {
            return this.content;
        }

        public void setContent(String content) {
            this.content = content;
        }

        public Map<String, Object> getMetadata() {
            return this.metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        public List<Double> getEmbedding() {
            return this.embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public Double getEmbeddingNorm() {
            return this.embeddingNorm;
        }

        public void setEmbeddingNorm(Double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }
    }

    private record Scored(VectorRecord record, double distance) {
    }
}

package com.example.jsoncatalog.service.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * MongoDB collections holding document-routed datasets, one collection per dataset.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    static final String ID_FIELD = "_id";
    static final String SCALAR_VALUE_FIELD = "value";

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public int insertRecords(String collectionName, String datasetId, List<JsonNode> records) {
        if (records.isEmpty()) {
            return 0;
        }
        Date importedAt = new Date();
        List<Document> documents = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            // records are plain JSON, keys such as "$date" stay data
            Document document = record.isObject()
                    ? new Document(objectMapper.convertValue(record, RECORD_TYPE))
                    : new Document(SCALAR_VALUE_FIELD, objectMapper.convertValue(record, Object.class));
            document.append(DATASET_ID_FIELD, datasetId);
            document.append(IMPORTED_AT_FIELD, importedAt);
            documents.add(document);
        }
        int inserted = mongoTemplate.insert(documents, collectionName).size();
        log.info("Stored {} records in collection: {}", inserted, collectionName);
        return inserted;
    }

    @Override
    public void dropCollection(String collectionName) {
        mongoTemplate.dropCollection(collectionName);
        log.info("Dropped collection: {}", collectionName);
    }

    @Override
    public List<Map<String, Object>> find(String collectionName, RecordQuery recordQuery) {
        Query query = toQuery(recordQuery);
        List<Document> documents = mongoTemplate.find(query, Document.class, collectionName);
        List<Map<String, Object>> data = new ArrayList<>(documents.size());
        for (Document document : documents) {
            document.remove(ID_FIELD);
            document.remove(DATASET_ID_FIELD);
            document.remove(IMPORTED_AT_FIELD);
            data.add(document);
        }
        log.info("Retrieved {} records from collection: {}", data.size(), collectionName);
        return data;
    }

    @Override
    public long count(String collectionName, Map<String, Object> filter) {
        return mongoTemplate.count(filtered(filter), collectionName);
    }

    static Query toQuery(RecordQuery recordQuery) {
        Query query = filtered(recordQuery.filter());
        if (!recordQuery.fields().isEmpty()) {
            recordQuery.fields().forEach(field -> query.fields().include(field));
        }
        if (recordQuery.sort().isEmpty()) {
            query.with(Sort.by(Sort.Direction.ASC, ID_FIELD));
        } else {
            List<Sort.Order> orders = recordQuery.sort().stream()
                    .map(order -> order.ascending() ? Sort.Order.asc(order.field()) : Sort.Order.desc(order.field()))
                    .toList();
            query.with(Sort.by(orders));
        }
        query.skip(recordQuery.offset());
        query.limit(recordQuery.limit());
        return query;
    }

    private static Query filtered(Map<String, Object> filter) {
        Query query = new Query();
        if (filter != null) {
            filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        }
        return query;
    }
}

package com.example.jsoncatalog.service.storage;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Document side of dataset storage. Collections are schemaless.
 */
public interface DocumentStore {

    String DATASET_ID_FIELD = "_datasetId";
    String IMPORTED_AT_FIELD = "_importedAt";

    int insertRecords(String collectionName, String datasetId, List<JsonNode> records);

    void dropCollection(String collectionName);

    /**
     * Returns matching documents without store-internal fields.
     */
    List<Map<String, Object>> find(String collectionName, RecordQuery query);

    long count(String collectionName, Map<String, Object> filter);
}

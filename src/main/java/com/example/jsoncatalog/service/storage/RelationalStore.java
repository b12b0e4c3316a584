package com.example.jsoncatalog.service.storage;

import com.example.jsoncatalog.model.ir.SchemaField;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Relational side of dataset storage. Implementations raise Spring
 * {@link org.springframework.dao.DataAccessException}s on storage errors.
 */
public interface RelationalStore {

    void createTable(String ddl);

    /**
     * Inserts one row per record, restricted to the given columns. Returns the number of rows written.
     */
    int insertRecords(String tableName, List<SchemaField> columns, List<JsonNode> records);

    void dropTable(String tableName);

    List<Map<String, Object>> find(String tableName, RecordQuery query);

    long count(String tableName, Map<String, Object> filter);
}

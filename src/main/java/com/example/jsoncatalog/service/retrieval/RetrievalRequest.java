package com.example.jsoncatalog.service.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Backend-agnostic read request.
 *
 * @param dataset dataset id or original file name
 * @param entity  table name or collection name of the dataset
 * @param include accepted for compatibility, datasets have a single entity
 * @param orderBy single ascending sort field, superseded by {@code sort}
 * @param sort    ordered {@code field -> 1|-1|"asc"|"desc"}
 */
public record RetrievalRequest(String dataset,
                               String entity,
                               Map<String, Object> filter,
                               List<String> fields,
                               List<String> include,
                               Integer limit,
                               Integer offset,
                               String orderBy,
                               Map<String, Object> sort) {

    public static RetrievalRequest of(String dataset, String entity) {
        return new RetrievalRequest(dataset, entity, null, null, null, null, null, null, null);
    }
}

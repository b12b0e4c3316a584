package com.example.jsoncatalog.service.storage;

import java.util.List;
import java.util.Map;

/**
 * Backend-neutral read request. Field names are already resolved to the store's own names
 * (column names for the relational store, document paths for the document store).
 *
 * @param filter equality conditions, all of which must hold
 * @param fields projection, empty for all fields
 * @param sort   ordering, empty for insertion order
 */
public record RecordQuery(Map<String, Object> filter, List<String> fields, List<SortOrder> sort, int limit, long offset) {

    public RecordQuery {
        filter = filter == null ? Map.of() : filter;
        fields = fields == null ? List.of() : List.copyOf(fields);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }
}

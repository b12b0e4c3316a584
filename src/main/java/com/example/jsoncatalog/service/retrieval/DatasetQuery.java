package com.example.jsoncatalog.service.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Paged read of one dataset. Null members fall back to configured defaults.
 */
public record DatasetQuery(Integer page,
                           Integer limit,
                           Map<String, Object> where,
                           List<String> fields,
                           String orderBy,
                           Map<String, Object> sort) {

    public static DatasetQuery page(Integer page, Integer limit) {
        return new DatasetQuery(page, limit, null, null, null, null);
    }
}

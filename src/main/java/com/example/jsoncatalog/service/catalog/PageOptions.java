package com.example.jsoncatalog.service.catalog;

/**
 * 1-based page request with a sort key and "asc"/"desc" order.
 */
public record PageOptions(int page, int limit, String sortBy, String sortOrder) {

    public static final String DEFAULT_SORT_BY = "createdAt";
    public static final String DEFAULT_SORT_ORDER = "desc";

    public static PageOptions of(Integer page, Integer limit, String sortBy, String sortOrder, int defaultLimit) {
        return new PageOptions(
                page != null ? page : 1,
                limit != null ? limit : defaultLimit,
                sortBy != null && !sortBy.isBlank() ? sortBy : DEFAULT_SORT_BY,
                sortOrder != null && !sortOrder.isBlank() ? sortOrder : DEFAULT_SORT_ORDER);
    }

    public boolean descending() {
        return !"asc".equalsIgnoreCase(sortOrder);
    }
}

package com.example.jsoncatalog.service.catalog;

public record Pagination(int page, int limit, long total, int totalPages) {

    public static Pagination of(int page, int limit, long total) {
        int totalPages = limit > 0 ? (int) ((total + limit - 1) / limit) : 0;
        return new Pagination(page, limit, total, totalPages);
    }
}

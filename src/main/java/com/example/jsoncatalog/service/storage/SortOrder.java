package com.example.jsoncatalog.service.storage;

public record SortOrder(String field, boolean ascending) {

    public static SortOrder asc(String field) {
        return new SortOrder(field, true);
    }

    public static SortOrder desc(String field) {
        return new SortOrder(field, false);
    }
}

package com.example.jsoncatalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Physical store that actually holds a dataset's rows.
 */
public enum StorageBackend {
    POSTGRES("postgres", "sql"),
    MONGODB("mongodb", "nosql");

    private final String value;
    private final String kind;

    StorageBackend(String value, String kind) {
        this.value = value;
        this.kind = kind;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * "sql" or "nosql", the vocabulary used by the backend selector and the dataset summary.
     */
    public String getKind() {
        return kind;
    }

    @JsonCreator
    public static StorageBackend fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (StorageBackend backend : values()) {
            if (backend.value.equalsIgnoreCase(raw) || backend.kind.equalsIgnoreCase(raw) || backend.name().equalsIgnoreCase(raw)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown storage backend: " + raw);
    }
}

package com.example.jsoncatalog.service.backend;

import com.example.jsoncatalog.model.StorageBackend;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BackendKind {
    SQL("sql", StorageBackend.POSTGRES),
    NOSQL("nosql", StorageBackend.MONGODB);

    private final String value;
    private final StorageBackend storage;

    BackendKind(String value, StorageBackend storage) {
        this.value = value;
        this.storage = storage;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public StorageBackend toStorage() {
        return storage;
    }
}

package com.example.jsoncatalog.service.storage;

import com.example.jsoncatalog.model.StorageBackend;

/**
 * Records actually persisted and where. {@code fallback} is set when a relational write failed
 * and the records went to the document store instead.
 */
public record WriteOutcome(StorageBackend storage, int count, boolean fallback, String relationalError) {

    public static WriteOutcome written(StorageBackend storage, int count) {
        return new WriteOutcome(storage, count, false, null);
    }

    public static WriteOutcome fellBack(int count, String relationalError) {
        return new WriteOutcome(StorageBackend.MONGODB, count, true, relationalError);
    }
}

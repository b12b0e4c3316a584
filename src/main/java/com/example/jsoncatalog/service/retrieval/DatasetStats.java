package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.SchemaField;

import java.time.LocalDateTime;
import java.util.List;

public record DatasetStats(String datasetId,
                           String name,
                           String category,
                           StorageBackend storage,
                           int recordCount,
                           long fileSize,
                           LocalDateTime createdAt,
                           List<SchemaField> fields) {

    static DatasetStats from(DatasetCatalogEntry entry) {
        List<SchemaField> fields = entry.getSchema() != null ? entry.getSchema().getFields() : List.of();
        return new DatasetStats(entry.getDatasetId(), entry.getOriginalName(), entry.getCategory(), entry.getStorage(),
                entry.getRecordCount(), entry.getFileSize(), entry.getCreatedAt(), fields);
    }
}

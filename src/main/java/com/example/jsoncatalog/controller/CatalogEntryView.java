package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Catalog entry as exposed over HTTP. Metadata and schema are only filled in for single-entry reads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogEntryView(String datasetId,
                               String originalName,
                               String name,
                               long fileSize,
                               String mimeType,
                               String extension,
                               String category,
                               StorageBackend storage,
                               int recordCount,
                               String entity,
                               List<String> tags,
                               String description,
                               boolean processed,
                               LocalDateTime createdAt,
                               LocalDateTime updatedAt,
                               Map<String, FieldInfo> metadata,
                               SchemaDescriptor schema) {

    static CatalogEntryView summary(DatasetCatalogEntry entry) {
        return of(entry, false);
    }

    static CatalogEntryView detail(DatasetCatalogEntry entry) {
        return of(entry, true);
    }

    private static CatalogEntryView of(DatasetCatalogEntry entry, boolean detailed) {
        String entity = entry.getStorage() == StorageBackend.POSTGRES ? entry.getTableName() : entry.getCollectionName();
        return new CatalogEntryView(entry.getDatasetId(), entry.getOriginalName(), entry.getDatasetName(), entry.getFileSize(),
                entry.getMimeType(), entry.getExtension(), entry.getCategory(), entry.getStorage(),
                entry.getRecordCount(), entity, List.copyOf(entry.getTags()), entry.getDescription(),
                entry.getProcessing() != null && entry.getProcessing().isProcessed(),
                entry.getCreatedAt(), entry.getUpdatedAt(),
                detailed ? entry.getMetadata() : null,
                detailed ? entry.getSchema() : null);
    }
}

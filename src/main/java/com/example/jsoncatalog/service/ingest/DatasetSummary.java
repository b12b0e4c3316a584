package com.example.jsoncatalog.service.ingest;

import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client-facing description of where a dataset lives and how to address it through retrieval.
 */
public record DatasetSummary(String datasetId,
                             String name,
                             String backend,
                             @JsonProperty("default_entity") String defaultEntity,
                             @JsonProperty("schema_version") String schemaVersion,
                             @JsonProperty("created_at") LocalDateTime createdAt,
                             @JsonProperty("connection_info") Map<String, String> connectionInfo,
                             List<String> entities,
                             List<String> tables,
                             List<String> collections) {

    public static final String SCHEMA_VERSION = "1.0";

    public static DatasetSummary from(DatasetCatalogEntry entry) {
        String name = StringUtils.hasText(entry.getDatasetName())
                ? entry.getDatasetName()
                : JsonIngestOrchestrator.generateDatasetName(entry.getOriginalName());
        return from(entry, name);
    }

    public static DatasetSummary from(DatasetCatalogEntry entry, String name) {
        Map<String, String> connectionInfo = new LinkedHashMap<>();
        connectionInfo.put("type", entry.getStorage().getValue());

        if (entry.getStorage() == StorageBackend.POSTGRES) {
            String table = entry.getTableName();
            connectionInfo.put("table", table);
            return new DatasetSummary(entry.getDatasetId(), name, entry.getStorage().getKind(), table, SCHEMA_VERSION,
                    entry.getCreatedAt(), connectionInfo, List.of(table), List.of(table), List.of());
        }

        String collection = entry.getCollectionName();
        connectionInfo.put("collection", collection);
        return new DatasetSummary(entry.getDatasetId(), name, entry.getStorage().getKind(), collection, SCHEMA_VERSION,
                entry.getCreatedAt(), connectionInfo, List.of(collection), List.of(), List.of(collection));
    }
}

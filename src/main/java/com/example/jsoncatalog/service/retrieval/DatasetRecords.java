package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.service.catalog.Pagination;

import java.util.List;
import java.util.Map;

public record DatasetRecords(String datasetId,
                             String name,
                             StorageBackend storage,
                             List<Map<String, Object>> data,
                             Pagination pagination) {
}

package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.service.catalog.CatalogFilter;
import com.example.jsoncatalog.service.catalog.CatalogPage;
import com.example.jsoncatalog.service.catalog.CatalogStore;
import com.example.jsoncatalog.service.catalog.PageOptions;
import com.example.jsoncatalog.service.ingest.DatasetSummary;
import com.example.jsoncatalog.service.ingest.JsonIngestOrchestrator;
import com.example.jsoncatalog.service.retrieval.DatasetQuery;
import com.example.jsoncatalog.service.retrieval.DatasetRecords;
import com.example.jsoncatalog.service.retrieval.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
@Slf4j
public class DatasetController {

    // Query parameters of GET /{id}/data that are not record filters
    private static final Set<String> PAGING_PARAMS = Set.of("page", "limit", "orderBy");

    private final CatalogStore catalogStore;
    private final RetrievalService retrievalService;
    private final JsonIngestOrchestrator orchestrator;

    @Value("${app.catalog.default-page-size:20}")
    private int defaultPageSize = 20;

    public record UpdateRequest(List<String> tags, String description) {
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listDatasets(@RequestParam(required = false) Integer page,
                                                            @RequestParam(required = false) Integer limit,
                                                            @RequestParam(required = false) String sortBy,
                                                            @RequestParam(required = false) String sortOrder,
                                                            @RequestParam(required = false) String storage,
                                                            @RequestParam(required = false) String backend,
                                                            @RequestParam(required = false) String category) {
        CatalogFilter filter = new CatalogFilter(parseStorage(StringUtils.hasText(storage) ? storage : backend), category);
        CatalogPage result = catalogStore.list(filter, PageOptions.of(page, limit, sortBy, sortOrder, defaultPageSize));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", result.entries().stream().map(CatalogEntryView::summary).toList());
        body.put("pagination", result.pagination());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{reference}")
    public ResponseEntity<Map<String, Object>> getDataset(@PathVariable String reference) {
        DatasetCatalogEntry entry = catalogStore.get(reference)
                .or(() -> catalogStore.findByIdOrName(reference))
                .orElseThrow(() -> new DatasetNotFoundException("dataset.get", reference));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", CatalogEntryView.detail(entry));
        body.put("summary", DatasetSummary.from(entry));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{datasetId}/data")
    public ResponseEntity<Map<String, Object>> getDatasetData(@PathVariable String datasetId,
                                                              @RequestParam(required = false) Integer page,
                                                              @RequestParam(required = false) Integer limit,
                                                              @RequestParam(required = false) String orderBy,
                                                              @RequestParam Map<String, String> params) {
        Map<String, Object> where = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (!PAGING_PARAMS.contains(key)) {
                where.put(key, value);
            }
        });
        DatasetRecords records = retrievalService.queryDataset(datasetId,
                new DatasetQuery(page, limit, where, null, orderBy, null));
        return ResponseEntity.ok(recordsBody(records));
    }

    @PostMapping("/{datasetId}/query")
    public ResponseEntity<Map<String, Object>> queryDataset(@PathVariable String datasetId,
                                                            @RequestBody(required = false) DatasetQuery query) {
        return ResponseEntity.ok(recordsBody(retrievalService.queryDataset(datasetId, query)));
    }

    @GetMapping("/{datasetId}/stats")
    public ResponseEntity<Map<String, Object>> getDatasetStats(@PathVariable String datasetId) {
        return ResponseEntity.ok(Map.of("success", true, "data", retrievalService.getDatasetStats(datasetId)));
    }

    @PatchMapping("/{datasetId}")
    public ResponseEntity<Map<String, Object>> updateDataset(@PathVariable String datasetId,
                                                             @RequestBody UpdateRequest request) {
        DatasetCatalogEntry entry = catalogStore.update(datasetId, request.tags(), request.description())
                .orElseThrow(() -> new DatasetNotFoundException("dataset.update", datasetId));
        return ResponseEntity.ok(Map.of("success", true, "data", CatalogEntryView.detail(entry)));
    }

    @DeleteMapping("/{datasetId}")
    public ResponseEntity<Map<String, Object>> deleteDataset(@PathVariable String datasetId) {
        orchestrator.deleteDataset(datasetId);
        return ResponseEntity.ok(Map.of("success", true, "message", "Dataset deleted: " + datasetId));
    }

    @GetMapping("/search/{keyword}")
    public ResponseEntity<Map<String, Object>> searchDatasets(@PathVariable String keyword) {
        List<CatalogEntryView> results = catalogStore.search(keyword).stream().map(CatalogEntryView::summary).toList();
        return ResponseEntity.ok(Map.of("success", true, "data", results, "count", results.size()));
    }

    private static Map<String, Object> recordsBody(DatasetRecords records) {
        Map<String, Object> dataset = new LinkedHashMap<>();
        dataset.put("datasetId", records.datasetId());
        dataset.put("name", records.name());
        dataset.put("storage", records.storage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("dataset", dataset);
        body.put("data", records.data());
        body.put("pagination", records.pagination());
        return body;
    }

    private static StorageBackend parseStorage(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return StorageBackend.fromValue(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("catalog.list", null, e.getMessage());
        }
    }
}

package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.example.jsoncatalog.service.catalog.CatalogStore;
import com.example.jsoncatalog.service.catalog.Pagination;
import com.example.jsoncatalog.service.storage.DocumentStore;
import com.example.jsoncatalog.service.storage.RecordQuery;
import com.example.jsoncatalog.service.storage.RelationalStore;
import com.example.jsoncatalog.service.storage.SortOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dataset records from whichever store the catalog entry names. Callers never choose the
 * backend; requests use record field names and are translated per store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetrievalService {

    private final CatalogStore catalogStore;
    private final RelationalStore relationalStore;
    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;

    @Value("${app.retrieval.default-limit:10}")
    private int defaultLimit = 10;

    @Value("${app.retrieval.dataset-default-limit:100}")
    private int datasetDefaultLimit = 100;

    @Value("${app.retrieval.max-limit:1000}")
    private int maxLimit = 1000;

    public List<Map<String, Object>> retrieve(RetrievalRequest request) {
        final String op = "retrieve";
        if (request == null || !StringUtils.hasText(request.dataset())) {
            throw new InvalidRequestException(op, null, "'dataset' is required");
        }
        if (!StringUtils.hasText(request.entity())) {
            throw new InvalidRequestException(op, request.dataset(), "'entity' is required");
        }

        DatasetCatalogEntry entry = catalogStore.findByIdOrName(request.dataset())
                .orElseThrow(() -> new DatasetNotFoundException(op, request.dataset()));
        if (!request.entity().equals(entry.getTableName()) && !request.entity().equals(entry.getCollectionName())) {
            throw new DatasetNotFoundException(op, entry.getDatasetId(),
                    "Entity '" + request.entity() + "' not found in dataset " + entry.getDatasetId());
        }
        if (request.include() != null && !request.include().isEmpty()) {
            log.debug("Ignoring include {} for single-entity dataset {}", request.include(), entry.getDatasetId());
        }

        int limit = effectiveLimit(op, entry.getDatasetId(), request.limit(), defaultLimit);
        long offset = request.offset() != null ? request.offset() : 0L;
        if (offset < 0) {
            throw new InvalidRequestException(op, entry.getDatasetId(), "offset must be >= 0");
        }
        List<SortOrder> sort = SortSpecParser.parse(op, entry.getDatasetId(), request.orderBy(), request.sort());

        log.info("Retrieving from {} dataset {} (entity {}, limit {}, offset {})",
                entry.getStorage().getValue(), entry.getDatasetId(), request.entity(), limit, offset);
        return read(op, entry, request.filter(), request.fields(), sort, limit, offset).data();
    }

    public DatasetRecords retrieveDataset(String datasetId, Integer page, Integer limit) {
        return queryDataset(datasetId, DatasetQuery.page(page, limit));
    }

    public DatasetRecords queryDataset(String datasetId, DatasetQuery datasetQuery) {
        final String op = "dataset.query";
        DatasetCatalogEntry entry = catalogStore.get(datasetId)
                .orElseThrow(() -> new DatasetNotFoundException(op, datasetId));
        DatasetQuery q = datasetQuery != null ? datasetQuery : DatasetQuery.page(null, null);

        int page = q.page() != null ? q.page() : 1;
        if (page < 1) {
            throw new InvalidRequestException(op, datasetId, "page must be >= 1");
        }
        int limit = effectiveLimit(op, datasetId, q.limit(), datasetDefaultLimit);
        long offset = (long) (page - 1) * limit;
        List<SortOrder> sort = SortSpecParser.parse(op, datasetId, q.orderBy(), q.sort());

        PagedRead result = read(op, entry, q.where(), q.fields(), sort, limit, offset);
        return new DatasetRecords(entry.getDatasetId(), entry.getOriginalName(), entry.getStorage(), result.data(),
                Pagination.of(page, limit, result.total()));
    }

    public DatasetStats getDatasetStats(String datasetId) {
        return catalogStore.get(datasetId)
                .map(DatasetStats::from)
                .orElseThrow(() -> new DatasetNotFoundException("dataset.stats", datasetId));
    }

    private record PagedRead(List<Map<String, Object>> data, long total) {
    }

    private PagedRead read(String op, DatasetCatalogEntry entry, Map<String, Object> filter, List<String> fields,
                           List<SortOrder> sort, int limit, long offset) {
        if (entry.getStorage() == StorageBackend.POSTGRES) {
            RelationalColumns columns = new RelationalColumns(entry.getSchema(), objectMapper);
            RecordQuery query = toRelational(op, entry.getDatasetId(), columns, filter, fields, sort, limit, offset);
            List<Map<String, Object>> data = relationalStore.find(entry.getTableName(), query).stream()
                    .map(columns::toRecord)
                    .toList();
            long total = relationalStore.count(entry.getTableName(), query.filter());
            return new PagedRead(data, total);
        }

        String collection = entry.getCollectionName();
        Map<String, Object> typedFilter = new DocumentFields(entry.getMetadata()).coerceFilter(filter);
        RecordQuery query = new RecordQuery(typedFilter, fields, sort, limit, offset);
        List<Map<String, Object>> data = documentStore.find(collection, query);
        return new PagedRead(data, documentStore.count(collection, query.filter()));
    }

    // Field names in, column names out
    private RecordQuery toRelational(String op, String datasetId, RelationalColumns columns, Map<String, Object> filter,
                                     List<String> fields, List<SortOrder> sort, int limit, long offset) {
        Map<String, Object> columnFilter = new LinkedHashMap<>();
        if (filter != null) {
            filter.forEach((name, value) -> {
                SchemaField field = columns.resolve(op, datasetId, name);
                columnFilter.put(field.getColumnName(), columns.coerce(field, value));
            });
        }
        List<String> projection = fields == null ? List.of() : fields.stream()
                .map(name -> columns.resolve(op, datasetId, name).getColumnName())
                .distinct()
                .toList();
        List<SortOrder> columnSort = sort.stream()
                .map(order -> new SortOrder(columns.resolve(op, datasetId, order.field()).getColumnName(), order.ascending()))
                .toList();
        return new RecordQuery(columnFilter, projection, columnSort, limit, offset);
    }

    private int effectiveLimit(String op, String datasetId, Integer requested, int fallback) {
        int limit = requested != null ? requested : fallback;
        if (limit < 1) {
            throw new InvalidRequestException(op, datasetId, "limit must be >= 1");
        }
        if (limit > maxLimit) {
            log.debug("Clamping limit {} to {}", limit, maxLimit);
            return maxLimit;
        }
        return limit;
    }
}

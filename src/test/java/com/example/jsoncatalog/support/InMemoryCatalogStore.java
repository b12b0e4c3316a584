package com.example.jsoncatalog.support;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.DuplicateDatasetException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.service.catalog.CatalogFilter;
import com.example.jsoncatalog.service.catalog.CatalogPage;
import com.example.jsoncatalog.service.catalog.CatalogStore;
import com.example.jsoncatalog.service.catalog.PageOptions;
import com.example.jsoncatalog.service.catalog.Pagination;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog kept in a map. Lists in insertion order; sort options are ignored.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private final Map<String, DatasetCatalogEntry> entries = new LinkedHashMap<>();
    private RuntimeException createFailure;

    public void failCreateWith(RuntimeException failure) {
        this.createFailure = failure;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public DatasetCatalogEntry create(DatasetCatalogEntry entry) {
        if (createFailure != null) {
            throw createFailure;
        }
        if (entries.containsKey(entry.getDatasetId())) {
            throw new DuplicateDatasetException(entry.getDatasetId());
        }
        // stands in for @PrePersist
        LocalDateTime now = LocalDateTime.now();
        ReflectionTestUtils.setField(entry, "createdAt", now);
        ReflectionTestUtils.setField(entry, "updatedAt", now);
        entries.put(entry.getDatasetId(), entry);
        return entry;
    }

    @Override
    public Optional<DatasetCatalogEntry> get(String datasetId) {
        return Optional.ofNullable(entries.get(datasetId));
    }

    @Override
    public Optional<DatasetCatalogEntry> findByIdOrName(String reference) {
        return get(reference).or(() -> entries.values().stream()
                .filter(e -> e.getOriginalName().equals(reference))
                .reduce((first, second) -> second));
    }

    @Override
    public CatalogPage list(CatalogFilter filter, PageOptions options) {
        List<DatasetCatalogEntry> matching = entries.values().stream()
                .filter(e -> filter.storage() == null || e.getStorage() == filter.storage())
                .filter(e -> filter.category() == null || filter.category().equals(e.getCategory()))
                .toList();
        List<DatasetCatalogEntry> page = matching.stream()
                .skip((long) (options.page() - 1) * options.limit())
                .limit(options.limit())
                .toList();
        return new CatalogPage(page, Pagination.of(options.page(), options.limit(), matching.size()));
    }

    @Override
    public Optional<DatasetCatalogEntry> update(String datasetId, List<String> tags, String description) {
        return get(datasetId).map(entry -> {
            entry.applyUserEdits(tags, description);
            return entry;
        });
    }

    @Override
    public void delete(String datasetId) {
        if (entries.remove(datasetId) == null) {
            throw new DatasetNotFoundException("catalog.delete", datasetId);
        }
    }

    @Override
    public List<DatasetCatalogEntry> search(String keyword) {
        String lower = keyword.toLowerCase();
        return entries.values().stream()
                .filter(e -> e.getOriginalName().toLowerCase().contains(lower)
                        || (e.getDescription() != null && e.getDescription().toLowerCase().contains(lower))
                        || e.getTags().stream().anyMatch(t -> t.toLowerCase().contains(lower)))
                .toList();
    }
}

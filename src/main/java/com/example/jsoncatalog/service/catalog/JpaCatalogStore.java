package com.example.jsoncatalog.service.catalog;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.DuplicateDatasetException;
import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.repository.DatasetCatalogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaCatalogStore implements CatalogStore {

    public static final String CATALOG_CACHE = "datasets";

    private static final Set<String> SORTABLE_PROPERTIES = Set.of("createdAt", "updatedAt", "originalName", "recordCount", "fileSize");

    private final DatasetCatalogRepository repository;

    @Value("${app.catalog.search-limit:50}")
    private int searchLimit = 50;

    @Value("${app.catalog.max-page-size:1000}")
    private int maxPageSize = 1000;

    @Override
    @Transactional
    public DatasetCatalogEntry create(DatasetCatalogEntry entry) {
        if (repository.existsByDatasetId(entry.getDatasetId())) {
            throw new DuplicateDatasetException(entry.getDatasetId());
        }
        try {
            DatasetCatalogEntry saved = repository.saveAndFlush(entry);
            log.info("Dataset cataloged: {} ({}, {} records)", saved.getDatasetId(), saved.getStorage().getValue(), saved.getRecordCount());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // unique constraint on dataset_id lost a race with a concurrent create
            throw new DuplicateDatasetException(entry.getDatasetId());
        }
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CATALOG_CACHE, key = "#datasetId", unless = "#result == null")
    public Optional<DatasetCatalogEntry> get(String datasetId) {
        return repository.findByDatasetId(datasetId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DatasetCatalogEntry> findByIdOrName(String reference) {
        if (!StringUtils.hasText(reference)) {
            return Optional.empty();
        }
        return repository.findByDatasetId(reference)
                .or(() -> repository.findFirstByOriginalNameOrderByCreatedAtDesc(reference));
    }

    /**
     * Page content and total are read in one repeatable-read transaction, so a page reflects a
     * single snapshot even while other ingests insert entries.
     */
    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CatalogPage list(CatalogFilter filter, PageOptions options) {
        if (options.page() < 1) {
            throw new InvalidRequestException("catalog.list", null, "page must be >= 1");
        }
        if (options.limit() < 1 || options.limit() > maxPageSize) {
            throw new InvalidRequestException("catalog.list", null, "limit must be between 1 and " + maxPageSize);
        }
        if (!SORTABLE_PROPERTIES.contains(options.sortBy())) {
            throw new InvalidRequestException("catalog.list", null, "Unsupported sortBy: " + options.sortBy());
        }

        Sort.Direction direction = options.descending() ? Sort.Direction.DESC : Sort.Direction.ASC;
        Sort sort = Sort.by(direction, options.sortBy()).and(Sort.by(direction, "id"));
        Page<DatasetCatalogEntry> page = repository.findAll(toSpecification(filter),
                PageRequest.of(options.page() - 1, options.limit(), sort));

        return new CatalogPage(page.getContent(), Pagination.of(options.page(), options.limit(), page.getTotalElements()));
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CATALOG_CACHE, key = "#datasetId")
    public Optional<DatasetCatalogEntry> update(String datasetId, List<String> tags, String description) {
        return repository.findByDatasetId(datasetId).map(entry -> {
            entry.applyUserEdits(tags, description);
            DatasetCatalogEntry saved = repository.saveAndFlush(entry);
            log.info("Dataset updated: {}", datasetId);
            return saved;
        });
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CATALOG_CACHE, key = "#datasetId")
    public void delete(String datasetId) {
        DatasetCatalogEntry entry = repository.findByDatasetId(datasetId)
                .orElseThrow(() -> new DatasetNotFoundException("catalog.delete", datasetId));
        repository.delete(entry);
        log.info("Dataset deleted from catalog: {}", datasetId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DatasetCatalogEntry> search(String keyword) {
        if (!StringUtils.hasText(keyword)) {
            return List.of();
        }
        String escaped = keyword.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return repository.searchByKeyword("%" + escaped + "%", PageRequest.of(0, searchLimit));
    }

    private static Specification<DatasetCatalogEntry> toSpecification(CatalogFilter filter) {
        Specification<DatasetCatalogEntry> spec = Specification.where(null);
        if (filter == null) {
            return spec;
        }
        if (filter.storage() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("storage"), filter.storage()));
        }
        if (StringUtils.hasText(filter.category())) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), filter.category()));
        }
        return spec;
    }
}

package com.example.jsoncatalog.service.ingest;

import com.example.jsoncatalog.exception.DatasetNotFoundException;
import com.example.jsoncatalog.exception.DatasetOperationException;
import com.example.jsoncatalog.exception.IngestionException;
import com.example.jsoncatalog.exception.JsonAnalysisException;
import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.ProcessingStatus;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.JsonAnalysis;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.example.jsoncatalog.service.analysis.JsonPipelineService;
import com.example.jsoncatalog.service.backend.BackendKind;
import com.example.jsoncatalog.service.backend.BackendSelector;
import com.example.jsoncatalog.service.catalog.CatalogStore;
import com.example.jsoncatalog.service.schema.SchemaGeneratorService;
import com.example.jsoncatalog.service.storage.DualBackendWriter;
import com.example.jsoncatalog.service.storage.WriteOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static com.example.jsoncatalog.service.ingest.IngestStage.*;

/**
 * Drives one staged file through analysis, schema generation, backend selection, storage and
 * cataloging. Stages run synchronously; a failure before cataloging leaves no catalog entry.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JsonIngestOrchestrator {

    static final String MDC_DATASET_ID = "datasetId";
    static final String MDC_STAGE = "ingestStage";

    static final String CATEGORY_JSON = "json";
    private static final String MIME_TYPE_JSON = "application/json";
    private static final String MIME_TYPE_NDJSON = "application/x-ndjson";

    private final JsonPipelineService pipelineService;
    private final SchemaGeneratorService schemaGenerator;
    private final BackendSelector backendSelector;
    private final DualBackendWriter writer;
    private final CatalogStore catalogStore;

    @Value("${app.ingest.profile-sample-size:3}")
    private int profileSampleSize = 3;

    /**
     * Ingests a staged JSON or NDJSON file as a new dataset.
     *
     * @param datasetName optional display name, derived from the file name when blank
     * @throws IngestionException if any stage fails; no catalog entry exists afterwards
     */
    public IngestResult processStagingFile(StagedFile stagedFile, String datasetName) {
        String datasetId = UUID.randomUUID().toString();
        MDC.put(MDC_DATASET_ID, datasetId);
        try {
            enter(VALIDATING);
            validate(stagedFile, datasetId);
            String name = StringUtils.hasText(datasetName) ? datasetName : generateDatasetName(stagedFile.originalFilename());
            log.info("Starting ingest of {} as dataset '{}'", stagedFile.originalFilename(), name);

            enter(ANALYZING);
            JsonAnalysis analysis = analyze(stagedFile.filePath(), stagedFile.originalFilename(), datasetId);
            if (analysis.isEmpty()) {
                throw new IngestionException(IngestionException.Kind.INPUT, ANALYZING, datasetId,
                        "File contains no records: " + stagedFile.originalFilename());
            }

            enter(SCHEMA_GENERATING);
            SchemaDescriptor schema = schemaGenerator.generate(name, datasetId, analysis.fields());

            enter(BACKEND_SELECTING);
            BackendKind backend = backendSelector.determineBackend(analysis.fields());
            if (backend == BackendKind.SQL && !analysis.isArrayOfObjects()) {
                log.info("Records are not all JSON objects, routing to document store");
                backend = BackendKind.NOSQL;
            } else if (backend == BackendKind.SQL && analysis.fields().isEmpty()) {
                log.info("Records carry no fields, routing to document store");
                backend = BackendKind.NOSQL;
            }
            log.info("Selected backend: {}", backend.getValue());

            enter(WRITING);
            WriteOutcome outcome = write(backend, datasetId, schema, analysis);

            enter(CATALOGING);
            DatasetCatalogEntry entry = catalog(stagedFile, datasetId, name, analysis, schema, outcome);

            enter(DONE);
            log.info("Dataset {} ingested: {} records in {}{}", datasetId, outcome.count(), outcome.storage().getValue(),
                    outcome.fallback() ? " (fallback)" : "");
            return new IngestResult(DatasetSummary.from(entry), toProfile(analysis, schema.getFields()),
                    outcome.count(), outcome.fallback());
        } catch (IngestionException e) {
            log.error("Ingest of {} failed at stage {}: {}", describe(stagedFile), e.getStage(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_DATASET_ID);
        }
    }

    /**
     * Analyzes a file without storing anything or touching the catalog.
     */
    public DatasetProfile getProfile(Path filePath) {
        return getProfile(filePath, filePath.getFileName().toString());
    }

    public DatasetProfile getProfile(Path filePath, String originalName) {
        JsonAnalysis analysis = analyze(filePath, originalName, null);
        return toProfile(analysis, schemaGenerator.toSchemaFields(analysis.fields()));
    }

    /**
     * Drops the dataset's table or collection, then its catalog entry.
     */
    public void deleteDataset(String datasetId) {
        DatasetCatalogEntry entry = catalogStore.get(datasetId)
                .orElseThrow(() -> new DatasetNotFoundException("dataset.delete", datasetId));
        try {
            writer.discard(entry);
        } catch (DataAccessException e) {
            throw new DatasetOperationException("dataset.delete", datasetId,
                    "Could not drop stored records: " + e.getMostSpecificCause().getMessage(), e);
        }
        catalogStore.delete(datasetId);
        log.info("Dataset {} deleted", datasetId);
    }

    /**
     * Derives a dataset name from a file name: extension dropped, anything outside
     * {@code [a-zA-Z0-9_]} replaced by '_', lower-cased.
     */
    public static String generateDatasetName(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return "dataset";
        }
        String base = fileName.replaceFirst("\\.[^/.]+$", "");
        return base.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase(Locale.ROOT);
    }

    private void validate(StagedFile stagedFile, String datasetId) {
        if (stagedFile == null || stagedFile.filePath() == null) {
            throw new IngestionException(IngestionException.Kind.INPUT, VALIDATING, datasetId, "No staged file given");
        }
        if (!Files.isRegularFile(stagedFile.filePath()) || !Files.isReadable(stagedFile.filePath())) {
            throw new IngestionException(IngestionException.Kind.INPUT, VALIDATING, datasetId,
                    "Staged file not found or not readable: " + stagedFile.filePath());
        }
    }

    private JsonAnalysis analyze(Path filePath, String originalName, String datasetId) {
        try {
            return pipelineService.analyzeFile(filePath, originalName != null ? originalName : filePath.getFileName().toString());
        } catch (JsonAnalysisException e) {
            throw new IngestionException(IngestionException.Kind.ANALYSIS, ANALYZING, datasetId, e.getMessage(), e);
        } catch (IOException e) {
            throw new IngestionException(IngestionException.Kind.INPUT, ANALYZING, datasetId,
                    "Could not read file " + filePath + ": " + e.getMessage(), e);
        }
    }

    private WriteOutcome write(BackendKind backend, String datasetId, SchemaDescriptor schema, JsonAnalysis analysis) {
        try {
            return writer.write(backend, datasetId, schema, analysis.records());
        } catch (DataAccessException e) {
            throw new IngestionException(IngestionException.Kind.STORAGE, WRITING, datasetId,
                    "Could not store records: " + e.getMostSpecificCause().getMessage(), e);
        } catch (RuntimeException e) {
            // driver and codec failures, e.g. a document the store cannot encode
            throw new IngestionException(IngestionException.Kind.STORAGE, WRITING, datasetId,
                    "Could not store records: " + e.getMessage(), e);
        }
    }

    private DatasetCatalogEntry catalog(StagedFile stagedFile, String datasetId, String name, JsonAnalysis analysis,
                                        SchemaDescriptor schema, WriteOutcome outcome) {
        DatasetCatalogEntry entry = DatasetCatalogEntry.builder()
                .datasetId(datasetId)
                .originalName(stagedFile.originalFilename() != null ? stagedFile.originalFilename() : stagedFile.filePath().getFileName().toString())
                .datasetName(name)
                .filePath(stagedFile.filePath().toString())
                .fileSize(stagedFile.size())
                .mimeType(JsonPipelineService.FORMAT_NDJSON.equals(analysis.format()) ? MIME_TYPE_NDJSON : MIME_TYPE_JSON)
                .extension(analysis.format())
                .category(CATEGORY_JSON)
                .storage(outcome.storage())
                .recordCount(outcome.count())
                .metadata(analysis.fields())
                .schema(schema)
                .processing(ProcessingStatus.done())
                .build();
        try {
            return catalogStore.create(entry);
        } catch (RuntimeException e) {
            // records are already stored and stay behind unreferenced
            log.error("Catalog write failed, stored data is orphaned in {} {}", outcome.storage().getValue(),
                    outcome.storage() == StorageBackend.POSTGRES ? schema.getTableName() : entry.getCollectionName());
            throw new IngestionException(IngestionException.Kind.CATALOG, CATALOGING, datasetId,
                    "Could not create catalog entry: " + e.getMessage(), e);
        }
    }

    private DatasetProfile toProfile(JsonAnalysis analysis, List<SchemaField> fields) {
        List<ProfileField> profileFields = fields.stream().map(ProfileField::from).toList();
        List<JsonNode> samples = analysis.records().stream()
                .limit(Math.max(0, profileSampleSize))
                .toList();
        return new DatasetProfile(analysis.format(), profileFields, samples, analysis.recordCount(), analysis.skippedLines());
    }

    private static void enter(IngestStage stage) {
        MDC.put(MDC_STAGE, stage.name());
        log.debug("Entering stage {}", stage);
    }

    private static String describe(StagedFile stagedFile) {
        return stagedFile != null ? stagedFile.originalFilename() : "<none>";
    }
}

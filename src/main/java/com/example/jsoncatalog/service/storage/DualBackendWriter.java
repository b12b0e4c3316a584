package com.example.jsoncatalog.service.storage;

import com.example.jsoncatalog.model.DatasetCatalogEntry;
import com.example.jsoncatalog.model.StorageBackend;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.example.jsoncatalog.service.backend.BackendKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists parsed records into the relational or the document store. A failed relational write is
 * retried once against the document store; a document store failure propagates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DualBackendWriter {

    private final RelationalStore relationalStore;
    private final DocumentStore documentStore;

    // Outcome of the relational attempt, kept as a value so the fallback is an ordinary branch
    record RelationalWriteResult(int count, String errorMessage, DataAccessException cause) {
        static RelationalWriteResult success(int count) {
            return new RelationalWriteResult(count, null, null);
        }

        static RelationalWriteResult error(DataAccessException cause) {
            return new RelationalWriteResult(0, cause.getMostSpecificCause().getMessage(), cause);
        }

        boolean isSuccess() {
            return cause == null;
        }
    }

    public WriteOutcome write(BackendKind backend, String datasetId, SchemaDescriptor schema, List<JsonNode> records) {
        String collectionName = DatasetCatalogEntry.collectionNameFor(datasetId);

        if (backend == BackendKind.SQL) {
            RelationalWriteResult result = writeRelational(schema, records);
            if (result.isSuccess()) {
                return WriteOutcome.written(backend.toStorage(), result.count());
            }
            log.warn("Relational write to table {} failed, falling back to document store: {}",
                    schema.getTableName(), result.errorMessage(), result.cause());
            dropPartialTable(schema.getTableName());
            int count = documentStore.insertRecords(collectionName, datasetId, records);
            return WriteOutcome.fellBack(count, result.errorMessage());
        }

        return WriteOutcome.written(backend.toStorage(), documentStore.insertRecords(collectionName, datasetId, records));
    }

    /**
     * Removes the physical rows of a cataloged dataset.
     */
    public void discard(DatasetCatalogEntry entry) {
        if (entry.getStorage() == StorageBackend.POSTGRES && entry.getTableName() != null) {
            relationalStore.dropTable(entry.getTableName());
        } else if (entry.getStorage() == StorageBackend.MONGODB) {
            documentStore.dropCollection(entry.getCollectionName());
        }
    }

    private RelationalWriteResult writeRelational(SchemaDescriptor schema, List<JsonNode> records) {
        try {
            relationalStore.createTable(schema.getDdl());
            int count = relationalStore.insertRecords(schema.getTableName(), schema.getFields(), records);
            return RelationalWriteResult.success(count);
        } catch (DataAccessException e) {
            return RelationalWriteResult.error(e);
        }
    }

    private void dropPartialTable(String tableName) {
        try {
            relationalStore.dropTable(tableName);
        } catch (DataAccessException e) {
            log.warn("Could not drop partially written table {} before fallback: {}", tableName, e.getMessage());
        }
    }
}

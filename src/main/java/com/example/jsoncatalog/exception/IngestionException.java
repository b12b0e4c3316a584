package com.example.jsoncatalog.exception;

import com.example.jsoncatalog.service.ingest.IngestStage;
import lombok.Getter;

/**
 * Fatal ingestion failure. No catalog entry exists for the dataset when this is thrown.
 */
@Getter
public class IngestionException extends DatasetOperationException {

    public enum Kind {
        INPUT,
        ANALYSIS,
        STORAGE,
        CATALOG
    }

    private final Kind kind;
    private final IngestStage stage;

    public IngestionException(Kind kind, IngestStage stage, String datasetId, String message, Throwable cause) {
        super("ingest." + stage.name().toLowerCase(), datasetId, message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public IngestionException(Kind kind, IngestStage stage, String datasetId, String message) {
        this(kind, stage, datasetId, message, null);
    }
}

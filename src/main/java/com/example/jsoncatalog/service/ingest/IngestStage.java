package com.example.jsoncatalog.service.ingest;

/**
 * Ingestion state machine. Stages always run in declaration order.
 */
public enum IngestStage {
    VALIDATING,
    ANALYZING,
    SCHEMA_GENERATING,
    BACKEND_SELECTING,
    WRITING,
    CATALOGING,
    DONE
}

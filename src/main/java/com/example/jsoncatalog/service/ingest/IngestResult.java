package com.example.jsoncatalog.service.ingest;

/**
 * @param fallback true when the relational write failed and the records went to the document store
 */
public record IngestResult(DatasetSummary summary, DatasetProfile profile, int recordCount, boolean fallback) {
}

package com.example.jsoncatalog.exception;

public class DuplicateDatasetException extends DatasetOperationException {

    public DuplicateDatasetException(String datasetId) {
        super("catalog.create", datasetId, "Dataset already cataloged: " + datasetId);
    }
}

package com.example.jsoncatalog.exception;

public class DatasetNotFoundException extends DatasetOperationException {

    public DatasetNotFoundException(String operation, String datasetId) {
        super(operation, datasetId, "Dataset not found: " + datasetId);
    }

    public DatasetNotFoundException(String operation, String datasetId, String message) {
        super(operation, datasetId, message);
    }
}

package com.example.jsoncatalog.exception;

import lombok.Getter;

/**
 * Base failure of every core dataset operation. Carries the operation name and, when known,
 * the dataset identifier so callers can build a transport-level response.
 */
@Getter
public class DatasetOperationException extends RuntimeException {

    private final String operation;
    private final String datasetId;

    public DatasetOperationException(String operation, String datasetId, String message) {
        super(message);
        this.operation = operation;
        this.datasetId = datasetId;
    }

    public DatasetOperationException(String operation, String datasetId, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.datasetId = datasetId;
    }
}

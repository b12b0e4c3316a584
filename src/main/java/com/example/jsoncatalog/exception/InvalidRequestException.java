package com.example.jsoncatalog.exception;

public class InvalidRequestException extends DatasetOperationException {

    public InvalidRequestException(String operation, String datasetId, String message) {
        super(operation, datasetId, message);
    }
}

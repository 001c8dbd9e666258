package com.viral.prediction.exception;

public class DatasetNotFoundException extends ResourceNotFoundException {

    public DatasetNotFoundException(String datasetId) {
        super("Dataset", datasetId);
    }
}

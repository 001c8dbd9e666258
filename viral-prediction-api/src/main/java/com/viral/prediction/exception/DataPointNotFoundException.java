package com.viral.prediction.exception;

public class DataPointNotFoundException extends ResourceNotFoundException {

    public DataPointNotFoundException(String dataPointId) {
        super("Data point", dataPointId);
    }
}

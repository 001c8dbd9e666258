package com.viral.runtime.dto;

public record TrainingConfig(
        int epochs,
        int batchSize,
        double learningRate,
        String optimizer,
        String lossFunction,
        EarlyStopping earlyStopping,
        int crossValidationFolds
) {
    public record EarlyStopping(boolean enabled, String monitor, int patience) {}

    public static TrainingConfig viralDefaults() {
        return new TrainingConfig(100, 32, 0.001, "adam", "binary_crossentropy",
                new EarlyStopping(true, "val_accuracy", 10), 5);
    }
}

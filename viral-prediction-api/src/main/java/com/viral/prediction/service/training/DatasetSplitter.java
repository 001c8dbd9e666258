package com.viral.prediction.service.training;

import com.viral.prediction.model.TrainingDatasetDocument.Splits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded shuffles, down-sampling and the 70/15/15 split.
 */
public final class DatasetSplitter {

    public static final double TRAIN_RATIO = 0.70;
    public static final double VALIDATION_RATIO = 0.15;

    private DatasetSplitter() {
    }

    /**
     * Every id lands in exactly one split; the test split takes the rounding remainder.
     */
    public static Splits split(List<String> ids, Random random) {
        List<String> shuffled = new ArrayList<>(ids);
        Collections.shuffle(shuffled, random);

        int trainSize = (int) Math.floor(shuffled.size() * TRAIN_RATIO);
        int validationSize = (int) Math.floor(shuffled.size() * VALIDATION_RATIO);

        return new Splits(
                List.copyOf(shuffled.subList(0, trainSize)),
                List.copyOf(shuffled.subList(trainSize, trainSize + validationSize)),
                List.copyOf(shuffled.subList(trainSize + validationSize, shuffled.size())));
    }

    public static <T> List<T> sample(List<T> items, int count, Random random) {
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, random);
        return shuffled.subList(0, Math.min(count, shuffled.size()));
    }
}

package com.viral.prediction.service.training;

import com.viral.prediction.model.TrainingDatasetDocument.Splits;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DatasetSplitterTest {

    private static List<String> ids(int n) {
        return IntStream.range(0, n).mapToObj(i -> "id-" + i).toList();
    }

    @Test
    void split_seventyFifteenFifteen() {
        Splits splits = DatasetSplitter.split(ids(100), new Random(42));

        assertEquals(70, splits.train().size());
        assertEquals(15, splits.validation().size());
        assertEquals(15, splits.test().size());
    }

    @Test
    void split_everyIdLandsInExactlyOneSplit() {
        List<String> ids = ids(7);
        Splits splits = DatasetSplitter.split(ids, new Random(1));

        List<String> all = new ArrayList<>(splits.train());
        all.addAll(splits.validation());
        all.addAll(splits.test());

        assertThat(all).containsExactlyInAnyOrderElementsOf(ids);
        assertEquals(4, splits.train().size());
        assertEquals(1, splits.validation().size());
        assertEquals(2, splits.test().size());
    }

    @Test
    void split_sameSeedSameSplit() {
        assertEquals(DatasetSplitter.split(ids(50), new Random(42)), DatasetSplitter.split(ids(50), new Random(42)));
    }

    @Test
    void sample_neverReturnsMoreThanAvailable() {
        assertThat(DatasetSplitter.sample(ids(3), 10, new Random(42))).hasSize(3);
        assertThat(DatasetSplitter.sample(ids(10), 4, new Random(42))).hasSize(4).doesNotHaveDuplicates();
    }
}

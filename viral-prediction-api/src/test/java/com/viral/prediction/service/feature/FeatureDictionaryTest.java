package com.viral.prediction.service.feature;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FeatureDictionaryTest {

    @Test
    void toMap_namesEveryFeature() {
        Map<String, Double> map = FeatureDictionary.toMap(FeatureDictionary.fromMap(Map.of()));

        assertEquals(59, map.size());
        assertThat(map).containsKeys("emotion_joy", "emotion_anticipation", "creator_present", "has_media",
                "inspirational_value");
        assertThat(map.values()).containsOnly(0.0);
    }

    @Test
    void fromMap_missingAndNonFiniteValuesReadAsZero() {
        Map<String, Double> stored = new HashMap<>();
        stored.put("emotional_score", Double.NaN);
        stored.put("hashtag_count", 3.0);

        ContentFeatures features = FeatureDictionary.fromMap(stored);

        assertEquals(0.0, features.sentiment().emotionalScore());
        assertEquals(3, features.social().hashtagCount());
        assertEquals(0.0, features.timing().optimalTimingScore());
    }

    @Test
    void fromMap_flagsAreThresholdedAtOneHalf() {
        ContentFeatures features = FeatureDictionary.fromMap(Map.of("creator_present", 0.6, "has_media", 0.4));

        assertTrue(features.creator().present());
        assertFalse(features.media().hasMedia());
    }

    @Test
    void clampToRange_followsEachFeaturesRange() {
        assertEquals(-1.0, FeatureDictionary.clampToRange("sentiment_score", -1.04));
        assertEquals(-0.57, FeatureDictionary.clampToRange("sentiment_score", -0.57));
        assertEquals(1.0, FeatureDictionary.clampToRange("emotional_score", 1.03));
        assertEquals(100.0, FeatureDictionary.clampToRange("readability_score", 103.0));
        assertEquals(12.6, FeatureDictionary.clampToRange("word_count", 12.6));
        assertEquals(0.0, FeatureDictionary.clampToRange("hashtag_count", -1.0));
        assertEquals(0.0, FeatureDictionary.clampToRange("caps_ratio", Double.NaN));
    }

    @Test
    void fromMap_restoresStoredVector() {
        Map<String, Double> stored = new HashMap<>(FeatureDictionary.toMap(FeatureDictionary.fromMap(Map.of())));
        stored.put("emotion_surprise", 0.4);
        stored.put("creator_present", 1.0);
        stored.put("media_count", 2.0);

        assertEquals(stored, FeatureDictionary.toMap(FeatureDictionary.fromMap(stored)));
    }
}

package com.viral.prediction.service.explain;

import java.util.List;

public record UncertaintyExplanation(
        double margin,
        double lower,
        double upper,
        List<String> uncertaintyFactors,
        List<String> dataQualityIssues,
        List<String> modelLimitations,
        List<String> recommendations
) {}

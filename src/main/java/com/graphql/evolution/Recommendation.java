package com.graphql.evolution;

import graphql.PublicApi;

/**
 * The advice that goes with a compatibility score
 */
@PublicApi
public enum Recommendation {
    EXCELLENT(0.9, "Excellent compatibility - minimal client impact expected"),
    GOOD(0.7, "Good compatibility - some client updates may be needed"),
    MODERATE(0.5, "Moderate compatibility - significant client updates required"),
    POOR(0.0, "Poor compatibility - major breaking changes detected");

    private final double lowerBound;
    private final String message;

    Recommendation(double lowerBound, String message) {
        this.lowerBound = lowerBound;
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public static Recommendation forScore(double score) {
        for (Recommendation recommendation : values()) {
            if (score >= recommendation.lowerBound) {
                return recommendation;
            }
        }
        return POOR;
    }
}

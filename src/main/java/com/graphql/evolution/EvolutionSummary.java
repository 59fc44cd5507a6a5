package com.graphql.evolution;

import graphql.PublicApi;

@PublicApi
public class EvolutionSummary {

    private final double averageBreakingChanges;
    private final double averageScore;
    private final double scoreDelta;
    private final Trend trend;

    EvolutionSummary(double averageBreakingChanges, double averageScore, double scoreDelta, Trend trend) {
        this.averageBreakingChanges = averageBreakingChanges;
        this.averageScore = averageScore;
        this.scoreDelta = scoreDelta;
        this.trend = trend;
    }

    public double getAverageBreakingChanges() {
        return averageBreakingChanges;
    }

    public double getAverageScore() {
        return averageScore;
    }

    /**
     * @return the last version score minus the first one
     */
    public double getScoreDelta() {
        return scoreDelta;
    }

    public Trend getTrend() {
        return trend;
    }
}

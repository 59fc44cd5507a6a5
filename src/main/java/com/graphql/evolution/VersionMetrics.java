package com.graphql.evolution;

import graphql.PublicApi;

/**
 * The change counts and score of one transition between consecutive schema snapshots.  The version index is the
 * position of the newer snapshot, so the transition from snapshot 0 to snapshot 1 is version 1.
 */
@PublicApi
public class VersionMetrics {

    private final int version;
    private final int breakingCount;
    private final int nonBreakingCount;
    private final double score;

    public VersionMetrics(int version, int breakingCount, int nonBreakingCount, double score) {
        this.version = version;
        this.breakingCount = breakingCount;
        this.nonBreakingCount = nonBreakingCount;
        this.score = score;
    }

    public int getVersion() {
        return version;
    }

    public int getBreakingCount() {
        return breakingCount;
    }

    public int getNonBreakingCount() {
        return nonBreakingCount;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "VersionMetrics{" +
                "version=" + version +
                ", breakingCount=" + breakingCount +
                ", nonBreakingCount=" + nonBreakingCount +
                ", score=" + score +
                '}';
    }
}

package com.graphql.evolution;

import graphql.PublicApi;

/**
 * Which way the compatibility score moved between the first and the last version transition
 */
@PublicApi
public enum Trend {
    IMPROVING,
    DECLINING,
    STABLE;

    static Trend of(double firstScore, double lastScore) {
        double delta = lastScore - firstScore;
        if (delta > 0) {
            return IMPROVING;
        }
        if (delta < 0) {
            return DECLINING;
        }
        return STABLE;
    }
}

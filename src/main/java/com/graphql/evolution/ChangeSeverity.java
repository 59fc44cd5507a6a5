package com.graphql.evolution;

import graphql.PublicApi;

/**
 * How much a change matters to existing consumers, from least to most
 */
@PublicApi
public enum ChangeSeverity {
    /**
     * Something was added, existing consumers are unaffected
     */
    MINOR,
    /**
     * Something changed in a way existing consumers may have to adapt to
     */
    MAJOR,
    /**
     * Something existing consumers rely on is gone or changed incompatibly
     */
    CRITICAL;

    public boolean isAtLeast(ChangeSeverity threshold) {
        return compareTo(threshold) >= 0;
    }
}

package com.graphql.evolution.reporting;

import com.graphql.evolution.SchemaChange;
import graphql.PublicSpi;

/**
 * This is called with each change that passes the minimum severity
 */
@PublicSpi
public interface DifferenceReporter {

    /**
     * Called to report a change
     *
     * @param schemaChange the change between the two schemas
     */
    void report(SchemaChange schemaChange);

    /**
     * Called when the difference operation is finished
     */
    void onEnd();
}

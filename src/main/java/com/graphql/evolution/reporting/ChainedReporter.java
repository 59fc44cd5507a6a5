package com.graphql.evolution.reporting;

import com.graphql.evolution.SchemaChange;
import graphql.PublicApi;

import java.util.Arrays;
import java.util.List;

/**
 * A reporter that chains together one or more reporters
 */
@PublicApi
public class ChainedReporter implements DifferenceReporter {
    private final List<DifferenceReporter> reporters;

    public ChainedReporter(DifferenceReporter... reporters) {
        this(Arrays.asList(reporters));
    }

    public ChainedReporter(List<DifferenceReporter> reporters) {
        this.reporters = reporters;
    }

    @Override
    public void report(SchemaChange schemaChange) {
        reporters.forEach(reporter -> reporter.report(schemaChange));
    }

    @Override
    public void onEnd() {
        reporters.forEach(DifferenceReporter::onEnd);
    }
}

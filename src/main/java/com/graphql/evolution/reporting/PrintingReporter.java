package com.graphql.evolution.reporting;

import com.graphql.evolution.CompatibilityScorer;
import com.graphql.evolution.Recommendation;
import com.graphql.evolution.SchemaChange;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A reporter that prints its output to a PrintStream, ending with the compatibility score of what it was given
 */
public class PrintingReporter implements DifferenceReporter {

    private final List<SchemaChange> changes = new ArrayList<>();
    int breakageCount = 0;
    final PrintStream out;

    public PrintingReporter() {
        this(System.out);
    }

    public PrintingReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void report(SchemaChange schemaChange) {
        changes.add(schemaChange);
        if (schemaChange.isBreaking()) {
            breakageCount++;
        }
        printChange(schemaChange);
    }

    @Override
    public void onEnd() {
        double score = CompatibilityScorer.score(changes);
        Recommendation recommendation = Recommendation.forScore(score);

        out.println();
        out.println(String.format("%d breaking changes", breakageCount));
        out.println(String.format("%d non breaking changes", changes.size() - breakageCount));
        out.println(String.format("compatibility score : %.2f", score));
        out.println(String.format("%s - %s", recommendation, recommendation.getMessage()));
        out.println();
    }

    private void printChange(SchemaChange change) {
        String indent = change.isBreaking() ? "" : "\t";
        String objectName = change.getTypeName();
        if (change.getFieldName() != null) {
            objectName = objectName + "." + change.getFieldName();
        }
        out.println(String.format(
                "%s%s - '%s' : '%s' : %s", indent, change.getSeverity(), change.getTypeKind(), objectName, change.getDescription()));
        change.getImpact().ifPresent(impact -> out.println(indent + "\timpact : " + impact));
        change.getRecommendation().ifPresent(recommendation -> out.println(indent + "\trecommendation : " + recommendation));
    }
}

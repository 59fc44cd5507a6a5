package com.graphql.evolution.reporting;

import com.graphql.evolution.SchemaChange;
import graphql.PublicApi;

import java.util.ArrayList;
import java.util.List;

/**
 * A reporter that captures all the changes
 */
@PublicApi
public class CapturingReporter implements DifferenceReporter {
    private final List<SchemaChange> changes = new ArrayList<>();
    private final List<SchemaChange> breakages = new ArrayList<>();
    private boolean ended;

    @Override
    public void report(SchemaChange schemaChange) {
        changes.add(schemaChange);
        if (schemaChange.isBreaking()) {
            breakages.add(schemaChange);
        }
    }

    @Override
    public void onEnd() {
        ended = true;
    }

    public List<SchemaChange> getChanges() {
        return new ArrayList<>(changes);
    }

    public List<SchemaChange> getBreakages() {
        return new ArrayList<>(breakages);
    }

    public int getBreakageCount() {
        return breakages.size();
    }

    public int getNonBreakingCount() {
        return changes.size() - breakages.size();
    }

    public boolean isEnded() {
        return ended;
    }
}

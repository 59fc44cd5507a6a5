package com.graphql.evolution;

import com.graphql.evolution.schema.SchemaModel;
import graphql.PublicApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.graphql.evolution.ChangeKind.FIELD_REMOVED;
import static com.graphql.evolution.ChangeKind.FIELD_TYPE_CHANGED;
import static com.graphql.evolution.ChangeKind.TYPE_REMOVED;
import static graphql.Assert.assertNotNull;

/**
 * Turns lists of {@link SchemaChange}s into a compatibility score between 0 and 1 and follows that score across a
 * sequence of schema snapshots.
 */
@PublicApi
public class CompatibilityScorer {

    static final String DEPRECATE_FIELDS = "Consider using field deprecation before removal to give clients time to adapt";
    static final String UPDATE_CLIENTS = "Ensure all client applications are updated before removing types";
    static final String ADD_FIELDS_ALONGSIDE = "For breaking type changes, consider adding new fields alongside old ones temporarily";

    private static final Logger log = LoggerFactory.getLogger(CompatibilityScorer.class);

    private final SchemaDiff schemaDiff;

    public CompatibilityScorer() {
        this(new SchemaDiff());
    }

    public CompatibilityScorer(SchemaDiff schemaDiff) {
        this.schemaDiff = assertNotNull(schemaDiff, () -> "a schema diff is required");
    }

    /**
     * @param changes the changes between two snapshots
     *
     * @return 1.0 when there are no changes, otherwise the share of changes that are not breaking
     */
    public static double score(List<SchemaChange> changes) {
        if (changes.isEmpty()) {
            return 1.0;
        }
        long breaking = changes.stream().filter(SchemaChange::isBreaking).count();
        return 1.0 - ((double) breaking / changes.size());
    }

    public static Recommendation recommendation(double score) {
        return Recommendation.forScore(score);
    }

    /**
     * Diffs each snapshot against the one before it
     *
     * @param snapshots the schema snapshots, oldest first
     *
     * @return one metrics entry per transition, in snapshot order
     *
     * @throws InsufficientSnapshotsException if fewer than two snapshots are given
     */
    public List<VersionMetrics> trackEvolution(List<SchemaModel> snapshots) {
        if (snapshots.size() < 2) {
            throw new InsufficientSnapshotsException(snapshots.size());
        }
        List<VersionMetrics> metrics = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            List<SchemaChange> changes = schemaDiff.diff(snapshots.get(i - 1), snapshots.get(i));
            int breaking = (int) changes.stream().filter(SchemaChange::isBreaking).count();
            VersionMetrics versionMetrics = new VersionMetrics(i, breaking, changes.size() - breaking, score(changes));
            log.debug("Version {} : {}", i, versionMetrics);
            metrics.add(versionMetrics);
        }
        return metrics;
    }

    public EvolutionSummary summarize(List<VersionMetrics> metrics) {
        if (metrics.isEmpty()) {
            return new EvolutionSummary(0, 1.0, 0, Trend.STABLE);
        }
        double averageBreaking = metrics.stream().mapToInt(VersionMetrics::getBreakingCount).average().orElse(0);
        double averageScore = metrics.stream().mapToDouble(VersionMetrics::getScore).average().orElse(1.0);
        double first = metrics.get(0).getScore();
        double last = metrics.get(metrics.size() - 1).getScore();
        return new EvolutionSummary(averageBreaking, averageScore, last - first, Trend.of(first, last));
    }

    /**
     * @param changes the changes between two snapshots
     *
     * @return the migration advice that applies to the changes, empty when nothing was removed or broken
     */
    public List<String> migrationSuggestions(List<SchemaChange> changes) {
        List<String> suggestions = new ArrayList<>();
        if (changes.stream().anyMatch(change -> change.getKind() == FIELD_REMOVED)) {
            suggestions.add(DEPRECATE_FIELDS);
        }
        if (changes.stream().anyMatch(change -> change.getKind() == TYPE_REMOVED)) {
            suggestions.add(UPDATE_CLIENTS);
        }
        if (changes.stream().anyMatch(change -> change.getKind() == FIELD_TYPE_CHANGED && change.isBreaking())) {
            suggestions.add(ADD_FIELDS_ALONGSIDE);
        }
        return suggestions;
    }
}

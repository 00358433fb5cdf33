package com.record.linkage.config;

import com.record.linkage.api.MatchOptions;
import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.core.model.FieldMap;
import com.record.linkage.core.model.MatchType;
import com.record.linkage.relational.RelationalSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed match configuration.
 *
 * @param matchType               match type
 * @param nameA                   name of record set A
 * @param fieldsA                 field map of record set A
 * @param nameB                   name of record set B, {@code null} when deduplicating
 * @param fieldsB                 field map of record set B, {@code null} when deduplicating
 * @param blockingPlan            ground-truth and numbered passes
 * @param comparerVariablesByPass comparer variables keyed by pass name
 * @param parallelism             worker count
 * @param relationalSettings      relational store, {@code null} for in-memory blocking
 */
public record MatchConfig(
        MatchType matchType,
        String nameA,
        FieldMap fieldsA,
        String nameB,
        FieldMap fieldsB,
        BlockingPlan blockingPlan,
        Map<String, List<String>> comparerVariablesByPass,
        int parallelism,
        RelationalSettings relationalSettings
) {
    public Optional<RelationalSettings> relational() {
        return Optional.ofNullable(relationalSettings);
    }

    /**
     * Options builder pre-filled from this configuration. Callers may still set
     * retries, timeout and batch threshold before building.
     */
    public MatchOptions.Builder toOptions(Path outputDirectory) {
        return MatchOptions.builder()
                .matchType(matchType)
                .blockingPlan(blockingPlan)
                .parallelism(parallelism)
                .comparerVariablesByPass(comparerVariablesByPass)
                .relationalSettings(relationalSettings)
                .outputDirectory(outputDirectory);
    }
}

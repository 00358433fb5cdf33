package com.record.linkage.api;

import com.record.linkage.blocking.ExclusionState;
import com.record.linkage.blocking.PassReport;
import com.record.linkage.output.PassCounts;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a matching run.
 *
 * @param runId          run identifier, also present in the logging MDC
 * @param passReports    one report per pass, in execution order
 * @param counts         pair and match counts per pass
 * @param shards         shard files written, in creation order
 * @param finalExclusion exclusion state after the last committed pass
 */
public record MatchRunResult(
        String runId,
        List<PassReport> passReports,
        PassCounts counts,
        List<Path> shards,
        ExclusionState finalExclusion
) {
    public MatchRunResult {
        passReports = List.copyOf(passReports);
        shards = List.copyOf(shards);
    }

    public long skippedPasses() {
        return passReports.stream().filter(PassReport::isSkipped).count();
    }
}

package com.record.linkage.blocking;

import java.time.Duration;

/**
 * Outcome of one pass.
 *
 * @param passName      pass name
 * @param kind          ground truth or numbered
 * @param state         terminal state reached
 * @param candidateRows rows materialized by generation (0 if skipped before generating)
 * @param chunks        chunks streamed to the sink
 * @param duration      wall time of the pass
 * @param detail        skip reason, or empty
 */
public record PassReport(
        String passName,
        PassKind kind,
        PassState state,
        long candidateRows,
        int chunks,
        Duration duration,
        String detail
) {
    public boolean isSkipped() {
        return state == PassState.SKIPPED;
    }
}

package com.genomecurator.core.quality;

import com.genomecurator.core.model.QcOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of quality control over a batch of genomes.
 *
 * @param outcomes one outcome per genome, in input order
 * @param counters failure counts accumulated over this batch only
 */
public record QcBatchResult(
    List<QcOutcome> outcomes,
    QcFailureCounters counters
) {
    /**
     * Compact constructor with validation.
     */
    public QcBatchResult {
        Objects.requireNonNull(counters, "counters must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Ids of genomes that passed, in input order.
     *
     * @return passing genome ids
     */
    public List<String> passedIds() {
        return outcomes.stream()
            .filter(QcOutcome::passed)
            .map(QcOutcome::genomeId)
            .toList();
    }

    public List<QcOutcome> failedOutcomes() {
        return outcomes.stream()
            .filter(outcome -> !outcome.passed())
            .toList();
    }

    public int passedCount() {
        return (int) outcomes.stream().filter(QcOutcome::passed).count();
    }

    public int failedCount() {
        return outcomes.size() - passedCount();
    }
}

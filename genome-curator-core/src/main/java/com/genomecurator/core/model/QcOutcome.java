package com.genomecurator.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of applying quality control to one genome.
 *
 * @param genomeId genome id
 * @param failures every category the genome failed, in declaration order; empty if it passed
 */
public record QcOutcome(
    String genomeId,
    Set<QcFailure> failures
) {
    /**
     * Compact constructor with validation.
     */
    public QcOutcome {
        Objects.requireNonNull(genomeId, "genomeId must not be null");
        failures = failures == null || failures.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(QcFailure.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(failures));
    }

    public boolean passed() {
        return failures.isEmpty();
    }

    public boolean failed(QcFailure failure) {
        return failures.contains(failure);
    }
}

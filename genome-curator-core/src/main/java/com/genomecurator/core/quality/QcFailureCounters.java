package com.genomecurator.core.quality;

import com.genomecurator.core.model.QcFailure;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Running tally of QC failures per category over a batch of genomes.
 *
 * <p>Not thread-safe. Parallel batches give each worker its own instance and combine
 * them with {@link #merge}; addition is commutative so merge order does not matter.
 */
public class QcFailureCounters {

    private final EnumMap<QcFailure, Long> counts = new EnumMap<>(QcFailure.class);

    public QcFailureCounters() {
        for (QcFailure failure : QcFailure.values()) {
            counts.put(failure, 0L);
        }
    }

    public void increment(QcFailure failure) {
        counts.merge(failure, 1L, Long::sum);
    }

    /**
     * Increments every category in the set.
     *
     * @param failures failed categories of one genome
     */
    public void recordAll(Set<QcFailure> failures) {
        failures.forEach(this::increment);
    }

    public long count(QcFailure failure) {
        return counts.get(failure);
    }

    /**
     * Count for a category by its report name, e.g. {@code "N50"}.
     *
     * @param key category key
     * @return failure count
     */
    public long count(String key) {
        return count(QcFailure.fromKey(key));
    }

    /**
     * Adds another tally into this one.
     *
     * @param other counters to add
     * @return this instance
     */
    public QcFailureCounters merge(QcFailureCounters other) {
        other.counts.forEach((failure, count) -> counts.merge(failure, count, Long::sum));
        return this;
    }

    /**
     * Total failures across categories. A genome failing two categories counts twice.
     *
     * @return sum of all counts
     */
    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Snapshot keyed by category name in declaration order.
     *
     * @return immutable-order copy of the counts
     */
    public Map<String, Long> asMap() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        counts.forEach((failure, count) -> snapshot.put(failure.key(), count));
        return snapshot;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}

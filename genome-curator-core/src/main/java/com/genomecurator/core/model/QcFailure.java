package com.genomecurator.core.model;

import java.util.Arrays;

/**
 * Quality-control criteria a genome can fail, keyed by their report names.
 */
public enum QcFailure {
    COMPLETENESS("comp"),
    CONTAMINATION("cont"),
    QUALITY("qual"),
    MARKER_PERCENTAGE("marker_perc"),
    CONTIG_COUNT("contig_count"),
    N50("N50"),
    AMBIGUOUS_BASES("ambig");

    private final String key;

    QcFailure(String key) {
        this.key = key;
    }

    /**
     * Category name used in reports and failure counters.
     *
     * @return category key, e.g. {@code comp}
     */
    public String key() {
        return key;
    }

    /**
     * Looks up a category by its report name.
     *
     * @param key category key
     * @return matching category
     * @throws IllegalArgumentException if no category has this key
     */
    public static QcFailure fromKey(String key) {
        return Arrays.stream(values())
            .filter(failure -> failure.key.equals(key))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown QC category: " + key));
    }
}

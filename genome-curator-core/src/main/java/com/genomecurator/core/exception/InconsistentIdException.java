package com.genomecurator.core.exception;

/**
 * The same genome appears under two different origin-prefix spellings in two inputs.
 *
 * <p>For example {@code RS_GCF_000005845.2} in the metadata table and
 * {@code GCF_000005845.2} in the marker-percentage table. Such ids must not be
 * treated as two different genomes.
 */
public class InconsistentIdException extends CurationException {

    private final String firstId;
    private final String secondId;

    public InconsistentIdException(String firstId, String firstSource, String secondId, String secondSource) {
        super(String.format("Genome id '%s' (%s) and '%s' (%s) refer to the same genome with inconsistent origin prefixes",
            firstId, firstSource, secondId, secondSource));
        this.firstId = firstId;
        this.secondId = secondId;
    }

    public String getFirstId() {
        return firstId;
    }

    public String getSecondId() {
        return secondId;
    }
}

package com.genomecurator.core.model;

import java.util.Objects;

/**
 * A genome accession with its origin prefix removed and carried alongside.
 *
 * @param accession accession without origin prefix (e.g. {@code GCF_000005845.2})
 * @param origin database the id was prefixed with
 */
public record GenomeId(
    String accession,
    GenomeOrigin origin
) {
    /**
     * Compact constructor with validation.
     */
    public GenomeId {
        Objects.requireNonNull(accession, "accession must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        if (accession.isBlank()) {
            throw new IllegalArgumentException("accession must not be blank");
        }
    }

    /**
     * Re-attaches the origin prefix.
     *
     * @return the id as it would appear in a prefixed input
     */
    public String toRawId() {
        return origin.prefix() + accession;
    }
}

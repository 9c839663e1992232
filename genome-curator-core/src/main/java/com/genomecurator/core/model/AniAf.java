package com.genomecurator.core.model;

/**
 * Average nucleotide identity and alignment fraction between two genomes.
 *
 * <p>Used both for a directional measurement (query to reference) and for the
 * reconciled symmetric value of an unordered pair.
 *
 * @param ani average nucleotide identity, percent
 * @param af alignment fraction, 0 to 1
 */
public record AniAf(double ani, double af) {

    /** Value used when two genomes are treated as unrelated. */
    public static final AniAf UNRELATED = new AniAf(0.0, 0.0);
}

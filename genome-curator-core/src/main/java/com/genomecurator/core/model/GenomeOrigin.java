package com.genomecurator.core.model;

/**
 * Database a genome accession was taken from, as encoded by its id prefix.
 */
public enum GenomeOrigin {
    /** NCBI RefSeq, prefix {@code RS_}. */
    REFSEQ("RS_"),

    /** NCBI GenBank, prefix {@code GB_}. */
    GENBANK("GB_"),

    /** User-supplied genome, prefix {@code U_}. */
    USER("U_"),

    /** No recognised prefix. */
    UNKNOWN("");

    private final String prefix;

    GenomeOrigin(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}

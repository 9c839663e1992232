package com.genomecurator.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Seven-rank GTDB taxonomy (domain through species).
 *
 * <p>Each rank carries its rank-letter prefix, e.g. {@code p__Proteobacteria}. A bare
 * prefix such as {@code s__} means the genome is unassigned at that rank.
 *
 * @param ranks exactly seven rank strings in canonical order
 */
public record GtdbTaxonomy(List<String> ranks) {

    /** Canonical rank prefixes in order. */
    public static final List<String> RANK_PREFIXES = List.of("d__", "p__", "c__", "o__", "f__", "g__", "s__");

    public static final int DOMAIN = 0;
    public static final int GENUS = 5;
    public static final int SPECIES = 6;

    /**
     * Compact constructor with validation.
     */
    public GtdbTaxonomy {
        Objects.requireNonNull(ranks, "ranks must not be null");
        if (ranks.size() != RANK_PREFIXES.size()) {
            throw new IllegalArgumentException("taxonomy must have 7 ranks, got " + ranks.size());
        }
        ranks = List.copyOf(ranks);
    }

    /**
     * Parses a {@code ;}-separated taxonomy string.
     *
     * <p>Ranks are placed by their rank letter, so missing ranks are filled with the bare
     * prefix. An empty string yields a fully unassigned taxonomy.
     *
     * @param taxonomy taxonomy string, e.g. {@code d__Bacteria;p__...;s__Escherichia coli}
     * @return parsed taxonomy
     * @throws IllegalArgumentException if a rank has an unknown prefix
     */
    public static GtdbTaxonomy parse(String taxonomy) {
        List<String> ranks = new ArrayList<>(RANK_PREFIXES);
        if (taxonomy == null || taxonomy.isBlank()) {
            return new GtdbTaxonomy(ranks);
        }

        for (String term : taxonomy.split(";")) {
            String taxon = term.trim();
            if (taxon.isEmpty()) {
                continue;
            }
            int index = RANK_PREFIXES.indexOf(taxon.length() >= 3 ? taxon.substring(0, 3) : taxon);
            if (index < 0) {
                throw new IllegalArgumentException("Unknown rank prefix in taxon: " + taxon);
            }
            ranks.set(index, taxon);
        }
        return new GtdbTaxonomy(ranks);
    }

    /**
     * Taxonomy with every rank unassigned.
     *
     * @return unassigned taxonomy
     */
    public static GtdbTaxonomy unassigned() {
        return new GtdbTaxonomy(RANK_PREFIXES);
    }

    public String rank(int index) {
        return ranks.get(index);
    }

    public String domain() {
        return ranks.get(DOMAIN);
    }

    public String genus() {
        return ranks.get(GENUS);
    }

    public String species() {
        return ranks.get(SPECIES);
    }

    /**
     * Checks whether a rank holds a name rather than just its prefix.
     *
     * @param index rank index (0 = domain, 6 = species)
     * @return true if assigned
     */
    public boolean isAssigned(int index) {
        return !ranks.get(index).equals(RANK_PREFIXES.get(index));
    }

    @Override
    public String toString() {
        return String.join(";", ranks);
    }
}

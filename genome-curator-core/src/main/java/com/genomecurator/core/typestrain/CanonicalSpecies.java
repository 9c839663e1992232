package com.genomecurator.core.typestrain;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Canonical binomial form of a species name.
 */
public final class CanonicalSpecies {

    private CanonicalSpecies() {
        // Utility class
    }

    /**
     * Drops the {@code Candidatus} qualifier and anything after the binomial.
     *
     * <p>{@code "s__Candidatus Pelagibacter ubique HTCC1062"} becomes
     * {@code "s__Pelagibacter ubique"}.
     *
     * @param species species name
     * @return canonical binomial
     */
    public static String of(String species) {
        String name = species.replace("Candidatus ", "");
        return Arrays.stream(name.trim().split("\\s+"))
            .limit(2)
            .collect(Collectors.joining(" "))
            .trim();
    }
}

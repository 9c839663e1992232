package com.genomecurator.core.typestrain;

import java.util.Locale;
import java.util.Set;

/**
 * Type-material vocabularies used by NCBI and GTDB.
 *
 * <p>The two vocabularies are distinct and sometimes disagree about the same genome.
 */
public final class TypeMaterial {

    /** NCBI designations marking the type strain of a species. */
    public static final Set<String> NCBI_TYPE_SPECIES = Set.of(
        "assembly from type material",
        "assembly from neotype material",
        "assembly designated as neotype"
    );

    public static final Set<String> NCBI_PROXYTYPE = Set.of("assembly from proxytype material");

    public static final Set<String> NCBI_TYPE_SUBSPECIES = Set.of("assembly from synonym type material");

    /** GTDB designations marking the type strain of a species. */
    public static final Set<String> GTDB_TYPE_SPECIES = Set.of(
        "type strain of species",
        "type strain of neotype"
    );

    public static final Set<String> GTDB_TYPE_SUBSPECIES = Set.of(
        "type strain of subspecies",
        "type strain of heterotypic synonym"
    );

    public static final Set<String> GTDB_NOT_TYPE_MATERIAL = Set.of("not type material");

    private TypeMaterial() {
        // Utility class
    }

    /**
     * Case-insensitive membership test; {@code null} is never a member.
     *
     * @param designation designation to test, may be null
     * @param vocabulary lower-case vocabulary
     * @return true if the lower-cased designation is in the vocabulary
     */
    public static boolean inIgnoreCase(String designation, Set<String> vocabulary) {
        return designation != null && vocabulary.contains(designation.toLowerCase(Locale.ROOT));
    }
}

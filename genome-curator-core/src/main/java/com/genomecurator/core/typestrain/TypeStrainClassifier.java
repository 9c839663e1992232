package com.genomecurator.core.typestrain;

import com.genomecurator.core.model.MetadataRecord;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Classifies genomes as type strains of their species under NCBI or GTDB conventions.
 *
 * <p>The classifiers are independent set-membership tests. They do not rank one
 * convention over the other; callers combine them, typically preferring a GTDB type
 * strain, then an NCBI type strain.
 *
 * <p>Unlike quality scoring, the NCBI test here is an exact match on the designation
 * string.
 */
public final class TypeStrainClassifier {

    private TypeStrainClassifier() {
        // Utility class
    }

    /**
     * Genomes NCBI designates as type strain of their species.
     *
     * @param metadata metadata keyed by genome id
     * @return ids in input iteration order
     */
    public static Set<String> ncbiTypeStrainOfSpecies(Map<String, MetadataRecord> metadata) {
        return select(metadata, TypeStrainClassifier::isNcbiTypeStrainOfSpecies);
    }

    /**
     * Genomes GTDB designates as type strain of their species.
     *
     * @param metadata metadata keyed by genome id
     * @return ids in input iteration order
     */
    public static Set<String> gtdbTypeStrainOfSpecies(Map<String, MetadataRecord> metadata) {
        return select(metadata, TypeStrainClassifier::isGtdbTypeStrainOfSpecies);
    }

    /**
     * Genomes GTDB designates as type strain of a subspecies or heterotypic synonym.
     *
     * @param metadata metadata keyed by genome id
     * @return ids in input iteration order
     */
    public static Set<String> gtdbTypeStrainOfSubspecies(Map<String, MetadataRecord> metadata) {
        return select(metadata, record -> isMember(record.gtdbTypeDesignation(), TypeMaterial.GTDB_TYPE_SUBSPECIES));
    }

    public static boolean isNcbiTypeStrainOfSpecies(MetadataRecord record) {
        return isMember(record.ncbiTypeMaterialDesignation(), TypeMaterial.NCBI_TYPE_SPECIES);
    }

    public static boolean isGtdbTypeStrainOfSpecies(MetadataRecord record) {
        return isMember(record.gtdbTypeDesignation(), TypeMaterial.GTDB_TYPE_SPECIES);
    }

    private static boolean isMember(String designation, Set<String> vocabulary) {
        return designation != null && vocabulary.contains(designation);
    }

    private static Set<String> select(Map<String, MetadataRecord> metadata, Predicate<MetadataRecord> test) {
        Set<String> genomeIds = new LinkedHashSet<>();
        metadata.forEach((genomeId, record) -> {
            if (test.test(record)) {
                genomeIds.add(genomeId);
            }
        });
        return Collections.unmodifiableSet(genomeIds);
    }
}

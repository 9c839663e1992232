package com.genomecurator.core.representative;

import com.genomecurator.core.model.GtdbTaxonomy;
import com.genomecurator.core.model.MetadataRecord;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Differences between the species representatives of two releases.
 *
 * <p>Species and genera are only counted when assigned, i.e. not a bare {@code s__} or
 * {@code g__}.
 *
 * @param currentRepresentatives representatives in the current release
 * @param previousRepresentatives representatives in the previous release
 * @param currentSpeciesWithRepresentative species with a representative now
 * @param previousSpeciesWithRepresentative species that had a representative before
 * @param newRepresentatives genomes that became representatives
 * @param retiredRepresentatives genomes that stopped being representatives
 * @param newSpeciesWithRepresentative species that gained a representative
 * @param newGeneraWithRepresentative genera that gained a representative
 * @param speciesLosingRepresentative species still present whose representative disappeared
 * @param generaLosingRepresentative genera still present whose representative disappeared
 * @param deprecatedRepresentatives previous representatives still present but no longer representatives
 */
public record RepresentativeComparison(
    Set<String> currentRepresentatives,
    Set<String> previousRepresentatives,
    Set<String> currentSpeciesWithRepresentative,
    Set<String> previousSpeciesWithRepresentative,
    Set<String> newRepresentatives,
    Set<String> retiredRepresentatives,
    Set<String> newSpeciesWithRepresentative,
    Set<String> newGeneraWithRepresentative,
    Set<String> speciesLosingRepresentative,
    Set<String> generaLosingRepresentative,
    Set<String> deprecatedRepresentatives
) {
    /**
     * Compares the representatives of two metadata tables.
     *
     * @param current metadata of the current release
     * @param previous metadata of the previous release
     * @return comparison with every set sorted
     */
    public static RepresentativeComparison compare(Map<String, MetadataRecord> current,
                                                   Map<String, MetadataRecord> previous) {
        Set<String> curSpecies = new TreeSet<>();
        Set<String> curGenera = new TreeSet<>();
        current.values().forEach(record -> {
            addAssigned(curSpecies, record.gtdbTaxonomy(), GtdbTaxonomy.SPECIES);
            addAssigned(curGenera, record.gtdbTaxonomy(), GtdbTaxonomy.GENUS);
        });

        Set<String> curReps = representatives(current);
        Set<String> prevReps = representatives(previous);
        Set<String> curRepSpecies = ranksOf(current, curReps, GtdbTaxonomy.SPECIES);
        Set<String> curRepGenera = ranksOf(current, curReps, GtdbTaxonomy.GENUS);
        Set<String> prevRepSpecies = ranksOf(previous, prevReps, GtdbTaxonomy.SPECIES);
        Set<String> prevRepGenera = ranksOf(previous, prevReps, GtdbTaxonomy.GENUS);

        Set<String> speciesLosing = intersect(prevRepSpecies, curSpecies);
        speciesLosing.removeAll(curRepSpecies);
        Set<String> generaLosing = intersect(prevRepGenera, curGenera);
        generaLosing.removeAll(curRepGenera);
        Set<String> deprecated = intersect(prevReps, current.keySet());
        deprecated.removeAll(curReps);

        return new RepresentativeComparison(
            frozen(curReps),
            frozen(prevReps),
            frozen(curRepSpecies),
            frozen(prevRepSpecies),
            frozen(difference(curReps, prevReps)),
            frozen(difference(prevReps, curReps)),
            frozen(difference(curRepSpecies, prevRepSpecies)),
            frozen(difference(curRepGenera, prevRepGenera)),
            frozen(speciesLosing),
            frozen(generaLosing),
            frozen(deprecated)
        );
    }

    private static Set<String> representatives(Map<String, MetadataRecord> metadata) {
        Set<String> representatives = new TreeSet<>();
        metadata.forEach((genomeId, record) -> {
            if (record.gtdbRepresentative()) {
                representatives.add(genomeId);
            }
        });
        return representatives;
    }

    private static Set<String> ranksOf(Map<String, MetadataRecord> metadata, Set<String> genomeIds, int rank) {
        Set<String> taxa = new TreeSet<>();
        genomeIds.forEach(genomeId -> addAssigned(taxa, metadata.get(genomeId).gtdbTaxonomy(), rank));
        return taxa;
    }

    private static void addAssigned(Set<String> taxa, GtdbTaxonomy taxonomy, int rank) {
        if (taxonomy.isAssigned(rank)) {
            taxa.add(taxonomy.rank(rank));
        }
    }

    private static Set<String> frozen(Set<String> taxa) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(taxa));
    }

    private static Set<String> intersect(Set<String> a, Set<String> b) {
        Set<String> result = new TreeSet<>(a);
        result.retainAll(b);
        return result;
    }

    private static Set<String> difference(Set<String> a, Set<String> b) {
        Set<String> result = new TreeSet<>(a);
        result.removeAll(b);
        return result;
    }
}

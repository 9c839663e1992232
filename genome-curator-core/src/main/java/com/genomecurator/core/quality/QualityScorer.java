package com.genomecurator.core.quality;

import com.genomecurator.core.exception.MissingFieldException;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.typestrain.TypeMaterial;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks genomes by an additive quality score; higher is better.
 *
 * <p>The score has no fixed range. It starts from completeness minus five times
 * contamination and is adjusted by:
 * <ul>
 *   <li>+100 for an essentially finished NCBI assembly (see {@link #isFinishedAssembly})</li>
 *   <li>+200 for NCBI type material of the species</li>
 *   <li>+10 for proxytype material or a RefSeq representative/reference genome</li>
 *   <li>-5 per 100 contigs and -5 per 100,000 ambiguous bases</li>
 *   <li>-200 for metagenome-derived and -100 for single-cell genomes</li>
 *   <li>+10 for a near-complete 16S rRNA gene</li>
 * </ul>
 */
public final class QualityScorer {

    static final double FINISHED_ASSEMBLY_BONUS = 100;
    static final double TYPE_SPECIES_BONUS = 200;
    static final double REFERENCE_BONUS = 10;
    static final double METAGENOME_PENALTY = 200;
    static final double SINGLE_CELL_PENALTY = 100;
    static final double SSU_BONUS = 10;

    static final int MIN_ARCHAEAL_SSU_LENGTH = 900;
    static final int MIN_SSU_LENGTH = 1200;

    private static final List<String> FINISHED_ASSEMBLY_LEVELS = List.of("complete genome", "chromosome");
    private static final int MAX_SPANNED_GAPS = 10;
    private static final long MAX_FINISHED_AMBIGUOUS_BASES = 10_000;
    private static final long MAX_FINISHED_GAP_LENGTH = 10_000;

    private QualityScorer() {
        // Utility class
    }

    /**
     * Scores each requested genome.
     *
     * @param genomeIds genomes to score
     * @param metadata metadata keyed by genome id
     * @return score per genome, in the order of {@code genomeIds}
     * @throws MissingFieldException if a genome has no metadata record
     */
    public static Map<String, Double> qualityScores(Collection<String> genomeIds, Map<String, MetadataRecord> metadata) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String genomeId : genomeIds) {
            MetadataRecord record = metadata.get(genomeId);
            if (record == null) {
                throw new MissingFieldException(genomeId, "metadata");
            }
            scores.put(genomeId, score(record));
        }
        return scores;
    }

    /**
     * Scores a single genome.
     *
     * @param record genome metadata
     * @return quality score
     */
    public static double score(MetadataRecord record) {
        double q = isFinishedAssembly(record) ? FINISHED_ASSEMBLY_BONUS : 0;

        q += record.checkmCompleteness() - 5 * record.checkmContamination();

        if (TypeMaterial.inIgnoreCase(record.ncbiTypeMaterialDesignation(), TypeMaterial.NCBI_TYPE_SPECIES)) {
            q += TYPE_SPECIES_BONUS;
        }
        if (TypeMaterial.inIgnoreCase(record.ncbiTypeMaterialDesignation(), TypeMaterial.NCBI_PROXYTYPE)
                || isRefseqReference(record.ncbiRefseqCategory())) {
            q += REFERENCE_BONUS;
        }

        q -= 5.0 * record.contigCount() / 100;
        q -= 5.0 * record.ambiguousBases() / 1e5;

        String category = lower(record.ncbiGenomeCategory());
        if (category.contains("metagenome")) {
            q -= METAGENOME_PENALTY;
        }
        if (category.contains("single cell")) {
            q -= SINGLE_CELL_PENALTY;
        }

        if (hasNearCompleteSsu(record)) {
            q += SSU_BONUS;
        }

        return q;
    }

    /**
     * Checks whether the assembly appears to consist only of unspanned chromosomes and
     * plasmids, and should therefore be treated as very high quality.
     *
     * @param record genome metadata
     * @return true if every finished-assembly criterion holds
     */
    public static boolean isFinishedAssembly(MetadataRecord record) {
        return FINISHED_ASSEMBLY_LEVELS.contains(lower(record.ncbiAssemblyLevel()))
            && "full".equals(lower(record.ncbiGenomeRepresentation()))
            && record.ncbiMoleculeCount() != null
            && record.scaffoldCount() == record.ncbiMoleculeCount()
            && record.ncbiUnspannedGaps() != null
            && record.ncbiUnspannedGaps() == 0
            && record.ncbiSpannedGaps() != null
            && record.ncbiSpannedGaps() <= MAX_SPANNED_GAPS
            && record.ambiguousBases() <= MAX_FINISHED_AMBIGUOUS_BASES
            && record.totalGapLength() <= MAX_FINISHED_GAP_LENGTH
            && record.ssuCount() >= 1;
    }

    /**
     * Checks for a 16S rRNA gene long enough to be considered near-complete. Archaeal
     * genes need 900 bp, all others 1200 bp; the domain comes from the GTDB taxonomy.
     *
     * @param record genome metadata
     * @return true if the SSU length meets the domain's minimum
     */
    public static boolean hasNearCompleteSsu(MetadataRecord record) {
        int minLength = "d__Archaea".equals(record.gtdbTaxonomy().domain())
            ? MIN_ARCHAEAL_SSU_LENGTH
            : MIN_SSU_LENGTH;
        return record.ssuLength() != null && record.ssuLength() >= minLength;
    }

    private static boolean isRefseqReference(String refseqCategory) {
        String category = lower(refseqCategory);
        return category.contains("representative") || category.contains("reference");
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

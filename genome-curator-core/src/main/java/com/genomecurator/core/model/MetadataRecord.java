package com.genomecurator.core.model;

import com.genomecurator.core.exception.MissingFieldException;

import java.util.List;
import java.util.Objects;

/**
 * Immutable per-genome metadata used by scoring, quality control and type classification.
 *
 * <p>Numeric quality and assembly statistics are required and held as primitives.
 * NCBI and GTDB categorical fields are nullable: genomes that were never deposited
 * at NCBI, such as user genomes, have no assembly level or type-material designation.
 * The NCBI gap and molecule counts and the SSU length are nullable for the same reason.
 *
 * <p>Construct through {@link #builder(String)}; {@link Builder#build()} raises
 * {@link MissingFieldException} naming the first required field that was not set.
 *
 * @param genomeId genome id as read from the metadata table
 * @param gtdbTaxonomy GTDB taxonomy
 * @param checkmCompleteness CheckM completeness, percent
 * @param checkmContamination CheckM contamination, percent
 * @param checkmStrainHeterogeneity100 CheckM strain heterogeneity at 100% AAI, percent
 * @param genomeSize genome size in bases
 * @param contigCount number of contigs
 * @param n50Contigs contig N50
 * @param scaffoldCount number of scaffolds
 * @param ambiguousBases number of ambiguous bases
 * @param totalGapLength total length of gaps
 * @param ssuCount number of 16S rRNA genes identified
 * @param ssuLength length of the longest 16S rRNA gene, or {@code null}
 * @param ncbiAssemblyLevel NCBI assembly level, e.g. {@code Complete Genome}
 * @param ncbiGenomeRepresentation NCBI genome representation, e.g. {@code full}
 * @param ncbiRefseqCategory NCBI RefSeq category
 * @param ncbiTypeMaterialDesignation NCBI type-material designation
 * @param ncbiMoleculeCount number of molecules reported by NCBI, or {@code null}
 * @param ncbiUnspannedGaps unspanned gaps reported by NCBI, or {@code null}
 * @param ncbiSpannedGaps spanned gaps reported by NCBI, or {@code null}
 * @param ncbiGenomeCategory NCBI genome category, e.g. {@code derived from metagenome}
 * @param gtdbTypeDesignation GTDB type designation
 * @param mimagHighQuality MIMAG high-quality flag, or {@code null}
 * @param gtdbRepresentative whether the genome is a GTDB species representative
 * @param gtdbClusteredGenomes genomes assigned to this representative
 */
public record MetadataRecord(
    String genomeId,
    GtdbTaxonomy gtdbTaxonomy,
    double checkmCompleteness,
    double checkmContamination,
    double checkmStrainHeterogeneity100,
    long genomeSize,
    int contigCount,
    long n50Contigs,
    int scaffoldCount,
    long ambiguousBases,
    long totalGapLength,
    int ssuCount,
    Integer ssuLength,
    String ncbiAssemblyLevel,
    String ncbiGenomeRepresentation,
    String ncbiRefseqCategory,
    String ncbiTypeMaterialDesignation,
    Integer ncbiMoleculeCount,
    Integer ncbiUnspannedGaps,
    Integer ncbiSpannedGaps,
    String ncbiGenomeCategory,
    String gtdbTypeDesignation,
    Boolean mimagHighQuality,
    boolean gtdbRepresentative,
    List<String> gtdbClusteredGenomes
) {
    /**
     * Compact constructor with validation.
     */
    public MetadataRecord {
        Objects.requireNonNull(genomeId, "genomeId must not be null");
        if (gtdbTaxonomy == null) {
            throw new MissingFieldException(genomeId, "gtdb_taxonomy");
        }
        gtdbClusteredGenomes = gtdbClusteredGenomes == null ? List.of() : List.copyOf(gtdbClusteredGenomes);
    }

    /**
     * Starts a builder for the given genome.
     *
     * @param genomeId genome id
     * @return new builder
     */
    public static Builder builder(String genomeId) {
        return new Builder(genomeId);
    }

    /**
     * Builder for {@link MetadataRecord}. Required fields are tracked as boxed values
     * so that an unset field is detected at build time.
     */
    public static class Builder {
        private final String genomeId;
        private GtdbTaxonomy gtdbTaxonomy;
        private Double checkmCompleteness;
        private Double checkmContamination;
        private Double checkmStrainHeterogeneity100;
        private Long genomeSize;
        private Integer contigCount;
        private Long n50Contigs;
        private Integer scaffoldCount;
        private Long ambiguousBases;
        private Long totalGapLength;
        private Integer ssuCount;
        private Integer ssuLength;
        private String ncbiAssemblyLevel;
        private String ncbiGenomeRepresentation;
        private String ncbiRefseqCategory;
        private String ncbiTypeMaterialDesignation;
        private Integer ncbiMoleculeCount;
        private Integer ncbiUnspannedGaps;
        private Integer ncbiSpannedGaps;
        private String ncbiGenomeCategory;
        private String gtdbTypeDesignation;
        private Boolean mimagHighQuality;
        private boolean gtdbRepresentative;
        private List<String> gtdbClusteredGenomes = List.of();

        private Builder(String genomeId) {
            this.genomeId = Objects.requireNonNull(genomeId, "genomeId must not be null");
        }

        public Builder gtdbTaxonomy(GtdbTaxonomy taxonomy) {
            this.gtdbTaxonomy = taxonomy;
            return this;
        }

        public Builder checkmCompleteness(Double value) {
            this.checkmCompleteness = value;
            return this;
        }

        public Builder checkmContamination(Double value) {
            this.checkmContamination = value;
            return this;
        }

        public Builder checkmStrainHeterogeneity100(Double value) {
            this.checkmStrainHeterogeneity100 = value;
            return this;
        }

        public Builder genomeSize(Long value) {
            this.genomeSize = value;
            return this;
        }

        public Builder contigCount(Integer value) {
            this.contigCount = value;
            return this;
        }

        public Builder n50Contigs(Long value) {
            this.n50Contigs = value;
            return this;
        }

        public Builder scaffoldCount(Integer value) {
            this.scaffoldCount = value;
            return this;
        }

        public Builder ambiguousBases(Long value) {
            this.ambiguousBases = value;
            return this;
        }

        public Builder totalGapLength(Long value) {
            this.totalGapLength = value;
            return this;
        }

        public Builder ssuCount(Integer value) {
            this.ssuCount = value;
            return this;
        }

        public Builder ssuLength(Integer value) {
            this.ssuLength = value;
            return this;
        }

        public Builder ncbiAssemblyLevel(String value) {
            this.ncbiAssemblyLevel = value;
            return this;
        }

        public Builder ncbiGenomeRepresentation(String value) {
            this.ncbiGenomeRepresentation = value;
            return this;
        }

        public Builder ncbiRefseqCategory(String value) {
            this.ncbiRefseqCategory = value;
            return this;
        }

        public Builder ncbiTypeMaterialDesignation(String value) {
            this.ncbiTypeMaterialDesignation = value;
            return this;
        }

        public Builder ncbiMoleculeCount(Integer value) {
            this.ncbiMoleculeCount = value;
            return this;
        }

        public Builder ncbiUnspannedGaps(Integer value) {
            this.ncbiUnspannedGaps = value;
            return this;
        }

        public Builder ncbiSpannedGaps(Integer value) {
            this.ncbiSpannedGaps = value;
            return this;
        }

        public Builder ncbiGenomeCategory(String value) {
            this.ncbiGenomeCategory = value;
            return this;
        }

        public Builder gtdbTypeDesignation(String value) {
            this.gtdbTypeDesignation = value;
            return this;
        }

        public Builder mimagHighQuality(Boolean value) {
            this.mimagHighQuality = value;
            return this;
        }

        public Builder gtdbRepresentative(boolean value) {
            this.gtdbRepresentative = value;
            return this;
        }

        public Builder gtdbClusteredGenomes(List<String> value) {
            this.gtdbClusteredGenomes = value;
            return this;
        }

        /**
         * Builds the record.
         *
         * @return immutable metadata record
         * @throws MissingFieldException if a required field was not set
         */
        public MetadataRecord build() {
            return new MetadataRecord(
                genomeId,
                required(gtdbTaxonomy, "gtdb_taxonomy"),
                required(checkmCompleteness, "checkm_completeness"),
                required(checkmContamination, "checkm_contamination"),
                required(checkmStrainHeterogeneity100, "checkm_strain_heterogeneity_100"),
                required(genomeSize, "genome_size"),
                required(contigCount, "contig_count"),
                required(n50Contigs, "n50_contigs"),
                required(scaffoldCount, "scaffold_count"),
                required(ambiguousBases, "ambiguous_bases"),
                required(totalGapLength, "total_gap_length"),
                required(ssuCount, "ssu_count"),
                ssuLength,
                ncbiAssemblyLevel,
                ncbiGenomeRepresentation,
                ncbiRefseqCategory,
                ncbiTypeMaterialDesignation,
                ncbiMoleculeCount,
                ncbiUnspannedGaps,
                ncbiSpannedGaps,
                ncbiGenomeCategory,
                gtdbTypeDesignation,
                mimagHighQuality,
                gtdbRepresentative,
                gtdbClusteredGenomes
            );
        }

        private <T> T required(T value, String fieldName) {
            if (value == null) {
                throw new MissingFieldException(genomeId, fieldName);
            }
            return value;
        }
    }
}

package com.genomecurator.core.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thresholds applied by {@link QcFilter}.
 *
 * <p>Bound from the {@code qc} section of {@code curation.yaml}. Unset values fall
 * back to {@link #defaults()}; unknown keys are rejected.
 *
 * @param minCompleteness minimum CheckM completeness
 * @param maxContamination maximum CheckM contamination on the strict path
 * @param minQuality minimum completeness - 5 x contamination
 * @param strainHeterogeneityException strain heterogeneity at or above which the lenient path applies
 * @param minMarkerPercentage minimum marker-gene percentage
 * @param maxContigs maximum number of contigs
 * @param minN50 minimum contig N50
 * @param maxAmbiguousBases maximum number of ambiguous bases
 */
public record QcThresholds(
    @JsonProperty("minCompleteness") Double minCompleteness,
    @JsonProperty("maxContamination") Double maxContamination,
    @JsonProperty("minQuality") Double minQuality,
    @JsonProperty("strainHeterogeneityException") Double strainHeterogeneityException,
    @JsonProperty("minMarkerPercentage") Double minMarkerPercentage,
    @JsonProperty("maxContigs") Integer maxContigs,
    @JsonProperty("minN50") Long minN50,
    @JsonProperty("maxAmbiguousBases") Long maxAmbiguousBases
) {
    /** Contamination above which a genome fails even on the strain-heterogeneity path. */
    public static final double MAX_HETEROGENEOUS_CONTAMINATION = 20.0;

    /**
     * Compact constructor filling unset values from the defaults.
     */
    public QcThresholds {
        minCompleteness = minCompleteness != null ? minCompleteness : 50.0;
        maxContamination = maxContamination != null ? maxContamination : 10.0;
        minQuality = minQuality != null ? minQuality : 50.0;
        strainHeterogeneityException = strainHeterogeneityException != null ? strainHeterogeneityException : 80.0;
        minMarkerPercentage = minMarkerPercentage != null ? minMarkerPercentage : 40.0;
        maxContigs = maxContigs != null ? maxContigs : 1000;
        minN50 = minN50 != null ? minN50 : 5000L;
        maxAmbiguousBases = maxAmbiguousBases != null ? maxAmbiguousBases : 100_000L;
    }

    /**
     * Default thresholds.
     *
     * @return thresholds with every value at its default
     */
    public static QcThresholds defaults() {
        return new QcThresholds(null, null, null, null, null, null, null, null);
    }
}

package com.genomecurator.core.quality;

import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.model.QcFailure;
import com.genomecurator.core.model.QcOutcome;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Pass/fail quality control of a single genome.
 *
 * <p>Every criterion is evaluated independently, so a genome can fail several
 * categories at once. Genomes whose strain heterogeneity is at or above
 * {@link QcThresholds#strainHeterogeneityException()} take a lenient path: their
 * contamination is mostly from closely related strains, so it is only rejected above
 * 20% and is discounted by the heterogeneity when computing quality.
 */
public final class QcFilter {

    private QcFilter() {
        // Utility class
    }

    /**
     * Applies QC and records every failed category in {@code counters}.
     *
     * @param record genome metadata
     * @param markerPercentage percentage of marker genes identified in the genome
     * @param thresholds QC thresholds
     * @param counters batch-wide failure counters, incremented on failure
     * @return true if the genome passed every criterion
     */
    public static boolean passQc(MetadataRecord record,
                                 double markerPercentage,
                                 QcThresholds thresholds,
                                 QcFailureCounters counters) {
        Objects.requireNonNull(counters, "counters must not be null");
        QcOutcome outcome = evaluate(record, markerPercentage, thresholds);
        counters.recordAll(outcome.failures());
        return outcome.passed();
    }

    /**
     * Applies QC without touching any counters.
     *
     * @param record genome metadata
     * @param markerPercentage percentage of marker genes identified in the genome
     * @param thresholds QC thresholds
     * @return outcome listing every failed category
     */
    public static QcOutcome evaluate(MetadataRecord record, double markerPercentage, QcThresholds thresholds) {
        EnumSet<QcFailure> failures = EnumSet.noneOf(QcFailure.class);

        if (record.checkmCompleteness() < thresholds.minCompleteness()) {
            failures.add(QcFailure.COMPLETENESS);
        }

        double maxContamination = usesStrainHeterogeneityException(record, thresholds)
            ? QcThresholds.MAX_HETEROGENEOUS_CONTAMINATION
            : thresholds.maxContamination();
        if (record.checkmContamination() > maxContamination) {
            failures.add(QcFailure.CONTAMINATION);
        }
        if (adjustedQuality(record, thresholds) < thresholds.minQuality()) {
            failures.add(QcFailure.QUALITY);
        }

        if (markerPercentage < thresholds.minMarkerPercentage()) {
            failures.add(QcFailure.MARKER_PERCENTAGE);
        }
        if (record.contigCount() > thresholds.maxContigs()) {
            failures.add(QcFailure.CONTIG_COUNT);
        }
        if (record.n50Contigs() < thresholds.minN50()) {
            failures.add(QcFailure.N50);
        }
        if (record.ambiguousBases() > thresholds.maxAmbiguousBases()) {
            failures.add(QcFailure.AMBIGUOUS_BASES);
        }

        return new QcOutcome(record.genomeId(), failures);
    }

    /**
     * Quality compared against {@link QcThresholds#minQuality()}.
     *
     * <p>Completeness minus five times contamination, with contamination scaled by
     * {@code 1 - heterogeneity/100} on the strain-heterogeneity path.
     *
     * @param record genome metadata
     * @param thresholds QC thresholds, selecting the path
     * @return adjusted quality
     */
    public static double adjustedQuality(MetadataRecord record, QcThresholds thresholds) {
        double contamination = record.checkmContamination();
        if (usesStrainHeterogeneityException(record, thresholds)) {
            contamination *= 1.0 - record.checkmStrainHeterogeneity100() / 100.0;
        }
        return record.checkmCompleteness() - 5 * contamination;
    }

    /**
     * Checks whether the lenient strain-heterogeneity path applies.
     *
     * @param record genome metadata
     * @param thresholds QC thresholds
     * @return true if heterogeneity is at or above the exception threshold
     */
    public static boolean usesStrainHeterogeneityException(MetadataRecord record, QcThresholds thresholds) {
        return record.checkmStrainHeterogeneity100() >= thresholds.strainHeterogeneityException();
    }
}

package com.genomecurator.core.quality;

import com.genomecurator.core.model.MetadataFixtures;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.model.QcFailure;
import com.genomecurator.core.model.QcOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link QcFilter}.
 */
class QcFilterTest {

    private static final QcThresholds THRESHOLDS =
        new QcThresholds(90.0, 5.0, 50.0, 90.0, 90.0, 1000, 5000L, 100_000L);

    private static MetadataRecord.Builder genome() {
        return MetadataFixtures.bacterium("RS_GCF_1")
            .checkmCompleteness(95.0)
            .checkmContamination(1.0)
            .checkmStrainHeterogeneity100(0.0)
            .contigCount(10)
            .n50Contigs(500_000L)
            .ambiguousBases(0L);
    }

    @Test
    void passQc_goodGenome_passesWithoutTouchingCounters() {
        QcFailureCounters counters = new QcFailureCounters();

        boolean passed = QcFilter.passQc(genome().build(), 100.0, THRESHOLDS, counters);

        assertThat(passed).isTrue();
        assertThat(counters.total()).isZero();
        assertThat(counters.asMap().values()).containsOnly(0L);
    }

    @Test
    void passQc_lowCompleteness_failsCompEvenWithoutContamination() {
        QcFailureCounters counters = new QcFailureCounters();
        MetadataRecord record = genome().checkmCompleteness(50.0).checkmContamination(0.0).build();

        boolean passed = QcFilter.passQc(record, 100.0, THRESHOLDS, counters);

        assertThat(passed).isFalse();
        assertThat(counters.count(QcFailure.COMPLETENESS)).isEqualTo(1);
        assertThat(counters.count(QcFailure.CONTAMINATION)).isZero();
    }

    @Test
    void evaluate_heterogeneityEqualToException_takesLenientPath() {
        MetadataRecord record = genome().checkmContamination(15.0).checkmStrainHeterogeneity100(90.0).build();

        QcOutcome outcome = QcFilter.evaluate(record, 100.0, THRESHOLDS);

        assertThat(QcFilter.usesStrainHeterogeneityException(record, THRESHOLDS)).isTrue();
        assertThat(outcome.passed()).isTrue();
        assertThat(QcFilter.adjustedQuality(record, THRESHOLDS)).isCloseTo(87.5, within(1e-6));
    }

    @Test
    void evaluate_heterogeneityJustBelowException_takesStrictPath() {
        MetadataRecord record = genome().checkmContamination(15.0).checkmStrainHeterogeneity100(89.99).build();

        QcOutcome outcome = QcFilter.evaluate(record, 100.0, THRESHOLDS);

        assertThat(QcFilter.usesStrainHeterogeneityException(record, THRESHOLDS)).isFalse();
        assertThat(outcome.failures()).containsExactly(QcFailure.CONTAMINATION, QcFailure.QUALITY);
        assertThat(QcFilter.adjustedQuality(record, THRESHOLDS)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void evaluate_lenientPath_stillRejectsContaminationAbove20() {
        MetadataRecord record = genome().checkmContamination(20.5).checkmStrainHeterogeneity100(100.0).build();

        QcOutcome outcome = QcFilter.evaluate(record, 100.0, THRESHOLDS);

        assertThat(outcome.failures()).containsExactly(QcFailure.CONTAMINATION);
    }

    @Test
    void evaluate_lenientPath_contaminationOf20Passes() {
        MetadataRecord record = genome().checkmContamination(20.0).checkmStrainHeterogeneity100(100.0).build();

        assertThat(QcFilter.evaluate(record, 100.0, THRESHOLDS).passed()).isTrue();
    }

    @Test
    void evaluate_strictPath_lowQualityFailsQualOnly() {
        QcThresholds thresholds = new QcThresholds(50.0, 10.0, 60.0, 90.0, 40.0, 1000, 5000L, 100_000L);
        MetadataRecord record = genome().checkmCompleteness(70.0).checkmContamination(3.0).build();

        QcOutcome outcome = QcFilter.evaluate(record, 100.0, thresholds);

        assertThat(outcome.failures()).containsExactly(QcFailure.QUALITY);
    }

    @Test
    void evaluate_assemblyLimits_areInclusive() {
        MetadataRecord atLimits = genome().contigCount(1000).n50Contigs(5000L).ambiguousBases(100_000L).build();

        assertThat(QcFilter.evaluate(atLimits, 90.0, THRESHOLDS).passed()).isTrue();
    }

    @Test
    void evaluate_assemblyLimitsExceeded_failsEachCategory() {
        MetadataRecord record = genome().contigCount(1001).n50Contigs(4999L).ambiguousBases(100_001L).build();

        QcOutcome outcome = QcFilter.evaluate(record, 89.9, THRESHOLDS);

        assertThat(outcome.failures()).containsExactly(
            QcFailure.MARKER_PERCENTAGE, QcFailure.CONTIG_COUNT, QcFailure.N50, QcFailure.AMBIGUOUS_BASES);
    }

    @Test
    void passQc_multipleGenomes_accumulateInSharedCounters() {
        QcFailureCounters counters = new QcFailureCounters();

        QcFilter.passQc(genome().checkmCompleteness(10.0).build(), 100.0, THRESHOLDS, counters);
        QcFilter.passQc(genome().checkmCompleteness(20.0).contigCount(5000).build(), 100.0, THRESHOLDS, counters);
        QcFilter.passQc(genome().build(), 100.0, THRESHOLDS, counters);

        assertThat(counters.count("comp")).isEqualTo(2);
        assertThat(counters.count("qual")).isEqualTo(2);
        assertThat(counters.count("contig_count")).isEqualTo(1);
        assertThat(counters.total()).isEqualTo(5);
    }

    @Test
    void passQc_nullCounters_throwsException() {
        assertThatThrownBy(() -> QcFilter.passQc(genome().build(), 100.0, THRESHOLDS, null))
            .isInstanceOf(NullPointerException.class);
    }
}

package com.genomecurator.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkerPercentage}.
 */
class MarkerPercentageTest {

    @Test
    void percentage_bacterialPrediction_usesBacterialColumn() {
        assertThat(new MarkerPercentage("d__Bacteria", 97.5, 12.0).percentage()).isEqualTo(97.5);
    }

    @Test
    void percentage_archaealPrediction_usesArchaealColumn() {
        assertThat(new MarkerPercentage("d__Archaea", 8.0, 91.0).percentage()).isEqualTo(91.0);
    }

    @Test
    void percentageFor_overridesPredictedDomain() {
        MarkerPercentage marker = new MarkerPercentage("d__Archaea", 8.0, 91.0);

        assertThat(marker.percentageFor("d__Bacteria")).isEqualTo(8.0);
    }
}

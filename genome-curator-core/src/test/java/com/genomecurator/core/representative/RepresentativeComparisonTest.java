package com.genomecurator.core.representative;

import com.genomecurator.core.model.MetadataFixtures;
import com.genomecurator.core.model.MetadataRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RepresentativeComparison}.
 */
class RepresentativeComparisonTest {

    private static MetadataRecord genome(String genomeId, String genus, String species, boolean representative) {
        String taxonomy = "d__Bacteria;p__P;c__C;o__O;f__F;" + genus + ";" + species;
        return MetadataFixtures.withTaxonomy(MetadataFixtures.bacterium(genomeId), taxonomy)
            .gtdbRepresentative(representative)
            .build();
    }

    private static Map<String, MetadataRecord> release(MetadataRecord... records) {
        Map<String, MetadataRecord> metadata = new LinkedHashMap<>();
        for (MetadataRecord record : records) {
            metadata.put(record.genomeId(), record);
        }
        return metadata;
    }

    @Test
    void compare_detectsNewRetiredAndDeprecatedRepresentatives() {
        Map<String, MetadataRecord> previous = release(
            genome("G1", "g__Alpha", "s__Alpha one", true),
            genome("G2", "g__Beta", "s__Beta two", true),
            genome("G3", "g__Gamma", "s__Gamma three", true));
        Map<String, MetadataRecord> current = release(
            genome("G1", "g__Alpha", "s__Alpha one", true),
            genome("G2", "g__Beta", "s__Beta two", false),
            genome("G4", "g__Delta", "s__Delta four", true),
            genome("G5", "g__Alpha", "s__", true));

        RepresentativeComparison comparison = RepresentativeComparison.compare(current, previous);

        assertThat(comparison.currentRepresentatives()).containsExactly("G1", "G4", "G5");
        assertThat(comparison.previousRepresentatives()).containsExactly("G1", "G2", "G3");
        assertThat(comparison.newRepresentatives()).containsExactly("G4", "G5");
        assertThat(comparison.retiredRepresentatives()).containsExactly("G2", "G3");
        assertThat(comparison.deprecatedRepresentatives()).containsExactly("G2");
        assertThat(comparison.currentSpeciesWithRepresentative()).containsExactly("s__Alpha one", "s__Delta four");
        assertThat(comparison.newSpeciesWithRepresentative()).containsExactly("s__Delta four");
        assertThat(comparison.newGeneraWithRepresentative()).containsExactly("g__Delta");
        assertThat(comparison.speciesLosingRepresentative()).containsExactly("s__Beta two");
        assertThat(comparison.generaLosingRepresentative()).containsExactly("g__Beta");
    }

    @Test
    void compare_identicalReleases_reportNoChanges() {
        Map<String, MetadataRecord> release = release(genome("G1", "g__Alpha", "s__Alpha one", true));

        RepresentativeComparison comparison = RepresentativeComparison.compare(release, release);

        assertThat(comparison.newRepresentatives()).isEmpty();
        assertThat(comparison.retiredRepresentatives()).isEmpty();
        assertThat(comparison.speciesLosingRepresentative()).isEmpty();
    }

    @Test
    void compare_resultSetsAreUnmodifiable() {
        Map<String, MetadataRecord> release = release(genome("G1", "g__Alpha", "s__Alpha one", true));

        RepresentativeComparison comparison = RepresentativeComparison.compare(release, release);

        assertThatThrownBy(() -> comparison.currentRepresentatives().add("G9"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}

package com.genomecurator.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GtdbTaxonomy}.
 */
class GtdbTaxonomyTest {

    @Test
    void parse_fullTaxonomy_exposesRanks() {
        GtdbTaxonomy taxonomy = GtdbTaxonomy.parse(MetadataFixtures.E_COLI_TAXONOMY);

        assertThat(taxonomy.domain()).isEqualTo("d__Bacteria");
        assertThat(taxonomy.genus()).isEqualTo("g__Escherichia");
        assertThat(taxonomy.species()).isEqualTo("s__Escherichia coli");
        assertThat(taxonomy.toString()).isEqualTo(MetadataFixtures.E_COLI_TAXONOMY);
    }

    @Test
    void parse_missingRanks_fillsBarePrefixes() {
        GtdbTaxonomy taxonomy = GtdbTaxonomy.parse("d__Archaea; g__Haloferax");

        assertThat(taxonomy.ranks()).containsExactly("d__Archaea", "p__", "c__", "o__", "f__", "g__Haloferax", "s__");
        assertThat(taxonomy.isAssigned(GtdbTaxonomy.GENUS)).isTrue();
        assertThat(taxonomy.isAssigned(GtdbTaxonomy.SPECIES)).isFalse();
    }

    @Test
    void parse_emptyString_returnsUnassigned() {
        assertThat(GtdbTaxonomy.parse("")).isEqualTo(GtdbTaxonomy.unassigned());
    }

    @Test
    void parse_unknownPrefix_throwsException() {
        assertThatThrownBy(() -> GtdbTaxonomy.parse("d__Bacteria;x__Oops"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("x__Oops");
    }

    @Test
    void constructor_wrongRankCount_throwsException() {
        assertThatThrownBy(() -> new GtdbTaxonomy(List.of("d__Bacteria")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

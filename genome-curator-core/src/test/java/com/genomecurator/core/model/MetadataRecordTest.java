package com.genomecurator.core.model;

import com.genomecurator.core.exception.MissingFieldException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MetadataRecord}.
 */
class MetadataRecordTest {

    @Test
    void build_allRequiredFields_createsRecord() {
        MetadataRecord record = MetadataFixtures.bacterium("RS_GCF_1").build();

        assertThat(record.genomeId()).isEqualTo("RS_GCF_1");
        assertThat(record.gtdbTaxonomy().species()).isEqualTo("s__Escherichia coli");
        assertThat(record.checkmCompleteness()).isEqualTo(95.0);
        assertThat(record.ssuLength()).isNull();
        assertThat(record.gtdbRepresentative()).isFalse();
        assertThat(record.gtdbClusteredGenomes()).isEmpty();
    }

    @Test
    void build_missingContamination_throwsMissingField() {
        MetadataRecord.Builder builder = MetadataRecord.builder("RS_GCF_1")
            .gtdbTaxonomy(GtdbTaxonomy.unassigned())
            .checkmCompleteness(95.0);

        assertThatThrownBy(builder::build)
            .isInstanceOf(MissingFieldException.class)
            .hasMessageContaining("checkm_contamination")
            .hasMessageContaining("RS_GCF_1");
    }

    @Test
    void build_missingTaxonomy_reportsFieldName() {
        MetadataRecord.Builder builder = MetadataFixtures.bacterium("GB_GCA_7").gtdbTaxonomy(null);

        assertThatThrownBy(builder::build)
            .isInstanceOfSatisfying(MissingFieldException.class, e -> {
                assertThat(e.getGenomeId()).isEqualTo("GB_GCA_7");
                assertThat(e.getFieldName()).isEqualTo("gtdb_taxonomy");
            });
    }

    @Test
    void build_clusteredGenomes_areCopied() {
        List<String> members = new ArrayList<>(List.of("RS_GCF_2"));
        MetadataRecord record = MetadataFixtures.bacterium("RS_GCF_1").gtdbClusteredGenomes(members).build();

        members.add("RS_GCF_3");

        assertThat(record.gtdbClusteredGenomes()).containsExactly("RS_GCF_2");
    }
}

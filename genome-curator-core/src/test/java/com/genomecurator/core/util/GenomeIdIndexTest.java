package com.genomecurator.core.util;

import com.genomecurator.core.exception.InconsistentIdException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GenomeIdIndex}.
 */
class GenomeIdIndexTest {

    @Test
    void register_sameSpellingTwice_isAccepted() {
        GenomeIdIndex index = new GenomeIdIndex();

        index.registerAll(List.of("RS_GCF_1", "GB_GCA_2"), "metadata");
        index.registerAll(List.of("GB_GCA_2", "RS_GCF_1"), "markers");

        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void register_differentPrefix_throwsInconsistentId() {
        GenomeIdIndex index = new GenomeIdIndex();
        index.register("RS_GCF_1", "metadata");

        assertThatThrownBy(() -> index.register("GCF_1", "markers"))
            .isInstanceOfSatisfying(InconsistentIdException.class, e -> {
                assertThat(e.getFirstId()).isEqualTo("RS_GCF_1");
                assertThat(e.getSecondId()).isEqualTo("GCF_1");
                assertThat(e.getMessage()).contains("metadata").contains("markers");
            });
    }

    @Test
    void register_refseqAndGenbankOfSameAccession_throwsInconsistentId() {
        GenomeIdIndex index = new GenomeIdIndex();
        index.register("RS_GCF_1", "clusters");

        assertThatThrownBy(() -> index.register("GB_GCF_1", "species labels"))
            .isInstanceOf(InconsistentIdException.class);
    }
}

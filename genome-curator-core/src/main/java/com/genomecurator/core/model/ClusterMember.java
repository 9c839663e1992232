package com.genomecurator.core.model;

import java.util.Objects;

/**
 * A genome assigned to a species cluster with its ANI/AF to the representative.
 *
 * @param genomeId member genome id
 * @param ani ANI to the representative
 * @param af AF to the representative
 */
public record ClusterMember(
    String genomeId,
    double ani,
    double af
) {
    /**
     * Compact constructor with validation.
     */
    public ClusterMember {
        Objects.requireNonNull(genomeId, "genomeId must not be null");
    }
}

package com.genomecurator.core.model;

import java.util.Optional;

/**
 * Distance from a representative genome to the nearest representative of another species.
 *
 * @param ani ANI to the nearest neighbour
 * @param af AF to the nearest neighbour, or {@code null} if not measured
 * @param neighbourId nearest neighbouring representative, or {@code null} if none was found
 */
public record TypeRadius(
    double ani,
    Double af,
    String neighbourId
) {
    /**
     * Radius for a representative without any neighbour.
     *
     * @param ani radius to report
     * @return radius with no neighbour
     */
    public static TypeRadius withoutNeighbour(double ani) {
        return new TypeRadius(ani, null, null);
    }

    public Optional<String> neighbour() {
        return Optional.ofNullable(neighbourId);
    }

    public boolean hasNeighbour() {
        return neighbourId != null;
    }
}

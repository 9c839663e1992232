package com.genomecurator.core.ani;

import com.genomecurator.core.exception.InconsistentIdException;
import com.genomecurator.core.model.AniAf;

import java.util.Optional;

/**
 * Reconciles the two directional ANI/AF measurements of a genome pair into one
 * symmetric value.
 */
public final class AniReconciler {

    private AniReconciler() {
        // Utility class
    }

    /**
     * Symmetric ANI/AF between two genomes.
     *
     * <p>If either direction was not measured the pair is treated as unrelated and
     * {@link AniAf#UNRELATED} is returned, unless a queried id is absent only because
     * the matrix spells the same genome with another origin prefix. Otherwise ANI and AF are each the larger of
     * the two directions, taken independently. The larger ANI gives the most
     * conservative circumscription of a species; the larger AF tolerates incomplete or
     * contaminated genomes whose one-way alignment fraction is low.
     *
     * @param matrix directional measurements
     * @param genomeA first genome id
     * @param genomeB second genome id
     * @return symmetric ANI/AF; identical for (a, b) and (b, a)
     * @throws InconsistentIdException if a queried id and the matrix disagree on its prefix
     */
    public static AniAf symmetricAni(AniAfMatrix matrix, String genomeA, String genomeB) {
        Optional<AniAf> forward = matrix.get(genomeA, genomeB);
        Optional<AniAf> reverse = matrix.get(genomeB, genomeA);
        if (forward.isEmpty() || reverse.isEmpty()) {
            requireMatrixSpelling(matrix, genomeA);
            requireMatrixSpelling(matrix, genomeB);
            return AniAf.UNRELATED;
        }

        return new AniAf(
            Math.max(forward.get().ani(), reverse.get().ani()),
            Math.max(forward.get().af(), reverse.get().af())
        );
    }

    private static void requireMatrixSpelling(AniAfMatrix matrix, String genomeId) {
        Optional<String> spelling = matrix.spellingOf(genomeId);
        if (spelling.isPresent() && !spelling.get().equals(genomeId)) {
            throw new InconsistentIdException(genomeId, "query", spelling.get(), AniAfMatrix.SOURCE);
        }
    }
}

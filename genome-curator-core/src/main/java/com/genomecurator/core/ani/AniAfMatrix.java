package com.genomecurator.core.ani;

import com.genomecurator.core.exception.InconsistentIdException;
import com.genomecurator.core.model.AniAf;
import com.genomecurator.core.util.GenomeIdIndex;
import com.genomecurator.core.util.GenomeIds;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directional ANI/AF measurements keyed by ordered genome pair.
 *
 * <p>Produced by an external alignment tool. A measurement from A to B says nothing
 * about B to A; either direction may be absent.
 *
 * <p>Every id in a matrix uses one spelling per genome. Adding the same accession
 * with a different origin prefix raises {@link InconsistentIdException}.
 */
public final class AniAfMatrix {

    static final String SOURCE = "ANI matrix";

    private final Map<String, Map<String, AniAf>> values;
    private final Map<String, String> spellings;

    private AniAfMatrix(Map<String, Map<String, AniAf>> values, Map<String, String> spellings) {
        this.values = values;
        this.spellings = spellings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Directional measurement from {@code query} to {@code reference}.
     *
     * @param query query genome id
     * @param reference reference genome id
     * @return measurement, or empty if it was not computed
     */
    public Optional<AniAf> get(String query, String reference) {
        Map<String, AniAf> row = values.get(query);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(reference));
    }

    public boolean contains(String query, String reference) {
        return get(query, reference).isPresent();
    }

    /**
     * Genomes that appear as a query.
     *
     * @return query genome ids
     */
    public Set<String> queryIds() {
        return values.keySet();
    }

    public int size() {
        return values.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Spelling this matrix uses for the genome behind {@code genomeId}.
     *
     * @param genomeId id with or without its origin prefix
     * @return the id as it appears in the matrix, or empty if the genome is absent
     */
    public Optional<String> spellingOf(String genomeId) {
        return Optional.ofNullable(spellings.get(GenomeIds.strip(genomeId)));
    }

    /**
     * Accumulates measurements; a later measurement for the same ordered pair replaces
     * the earlier one.
     */
    public static class Builder {
        private final Map<String, Map<String, AniAf>> values = new HashMap<>();
        private final Map<String, String> spellings = new HashMap<>();
        private final GenomeIdIndex index = new GenomeIdIndex();

        public Builder put(String query, String reference, double ani, double af) {
            return put(query, reference, new AniAf(ani, af));
        }

        /**
         * Adds one directional measurement.
         *
         * @throws InconsistentIdException if either genome was already added under another spelling
         */
        public Builder put(String query, String reference, AniAf aniAf) {
            Objects.requireNonNull(query, "query must not be null");
            Objects.requireNonNull(reference, "reference must not be null");
            Objects.requireNonNull(aniAf, "aniAf must not be null");
            index.register(query, SOURCE);
            index.register(reference, SOURCE);
            spellings.put(GenomeIds.strip(query), query);
            spellings.put(GenomeIds.strip(reference), reference);
            values.computeIfAbsent(query, key -> new HashMap<>()).put(reference, aniAf);
            return this;
        }

        public AniAfMatrix build() {
            Map<String, Map<String, AniAf>> copy = new HashMap<>();
            values.forEach((query, row) -> copy.put(query, Map.copyOf(row)));
            return new AniAfMatrix(Map.copyOf(copy), Map.copyOf(spellings));
        }
    }
}

package com.genomecurator.core.util;

import com.genomecurator.core.model.GenomeId;
import com.genomecurator.core.model.GenomeOrigin;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Single place where genome-id origin prefixes ({@code RS_}, {@code GB_}, {@code U_})
 * are recognised and removed.
 *
 * <p>Normalisation is applied at ingestion boundaries only. Once an input has been
 * read with or without prefixes, every id in it keeps that form.
 */
public final class GenomeIds {

    private static final List<GenomeOrigin> PREFIXED_ORIGINS =
        List.of(GenomeOrigin.REFSEQ, GenomeOrigin.GENBANK, GenomeOrigin.USER);

    private GenomeIds() {
        // Utility class
    }

    /**
     * Splits a raw id into its accession and origin.
     *
     * @param rawId id as found in an input, e.g. {@code RS_GCF_000005845.2}
     * @return normalised id
     * @throws IllegalArgumentException if the id is blank or only a prefix
     */
    public static GenomeId normalize(String rawId) {
        Objects.requireNonNull(rawId, "rawId must not be null");
        String id = rawId.trim();
        for (GenomeOrigin origin : PREFIXED_ORIGINS) {
            if (id.startsWith(origin.prefix())) {
                return new GenomeId(id.substring(origin.prefix().length()), origin);
            }
        }
        return new GenomeId(id, GenomeOrigin.UNKNOWN);
    }

    /**
     * Removes the origin prefix from an id.
     *
     * @param rawId id as found in an input
     * @return accession without prefix
     */
    public static String strip(String rawId) {
        return normalize(rawId).accession();
    }

    /**
     * Returns the id with or without its prefix, as an ingestion boundary requests.
     *
     * @param rawId id as found in an input
     * @param keepOriginPrefix whether to retain the prefix
     * @return id in the requested form
     */
    public static String canonical(String rawId, boolean keepOriginPrefix) {
        return keepOriginPrefix ? rawId.trim() : strip(rawId);
    }

    public static boolean isUserGenome(String rawId) {
        return normalize(rawId).origin() == GenomeOrigin.USER;
    }

    /**
     * Separates NCBI genomes from user-supplied genomes.
     *
     * @param rawIds ids to partition
     * @return partition preserving input order within each side
     */
    public static Partition partitionUserGenomes(Collection<String> rawIds) {
        Set<String> ncbi = new LinkedHashSet<>();
        Set<String> user = new LinkedHashSet<>();
        for (String rawId : rawIds) {
            if (isUserGenome(rawId)) {
                user.add(rawId);
            } else {
                ncbi.add(rawId);
            }
        }
        return new Partition(ncbi, user);
    }

    /**
     * NCBI and user genome ids.
     *
     * @param ncbiGenomeIds ids of genomes from RefSeq or GenBank
     * @param userGenomeIds ids carrying the {@code U_} prefix
     */
    public record Partition(Set<String> ncbiGenomeIds, Set<String> userGenomeIds) {
        public Partition {
            ncbiGenomeIds = Set.copyOf(ncbiGenomeIds);
            userGenomeIds = Set.copyOf(userGenomeIds);
        }
    }
}

package com.genomecurator.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Species clusters as read back from a cluster file.
 *
 * <p>Only the member ids and species labels survive a write/read cycle; the file holds
 * aggregate ANI/AF statistics rather than per-member values.
 *
 * @param clusters representative id to member ids, in file order
 * @param species representative id to species label
 */
public record ClusterTable(
    Map<String, List<String>> clusters,
    Map<String, String> species
) {
    /**
     * Compact constructor making ordered, unmodifiable copies.
     */
    public ClusterTable {
        Map<String, List<String>> clusterCopy = new LinkedHashMap<>();
        clusters.forEach((representative, members) -> clusterCopy.put(representative, List.copyOf(members)));
        clusters = Collections.unmodifiableMap(clusterCopy);
        species = Collections.unmodifiableMap(new LinkedHashMap<>(species));
    }

    public Set<String> representatives() {
        return clusters.keySet();
    }

    public List<String> members(String representative) {
        return clusters.getOrDefault(representative, List.of());
    }

    public String speciesOf(String representative) {
        return species.getOrDefault(representative, ClusterReportWriter.UNCLASSIFIED);
    }

    /**
     * Number of clusters without any member besides the representative.
     *
     * @return singleton count
     */
    public long singletonCount() {
        return clusters.values().stream().filter(List::isEmpty).count();
    }

    /**
     * Number of genomes assigned to a representative, excluding the representatives.
     *
     * @return clustered genome count
     */
    public int clusteredGenomeCount() {
        return clusters.values().stream().mapToInt(List::size).sum();
    }
}

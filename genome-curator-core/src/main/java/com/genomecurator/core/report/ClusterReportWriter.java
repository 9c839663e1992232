package com.genomecurator.core.report;

import com.genomecurator.core.model.ClusterMember;
import com.genomecurator.core.util.GenomeIdIndex;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes species-cluster assignments as a tab-separated cluster file.
 *
 * <p>Columns: {@code NCBI species, Type genome, No. clustered genomes, Mean ANI,
 * Min ANI, Mean AF, Min AF, Clustered genomes}. Representatives are ordered by
 * descending cluster size; ties keep the input order. Singleton clusters report
 * {@code N/A} for every statistic.
 */
public final class ClusterReportWriter {

    public static final String UNCLASSIFIED = "unclassified";

    static final String SPECIES = "NCBI species";
    static final String TYPE_GENOME = "Type genome";
    static final String CLUSTER_SIZE = "No. clustered genomes";
    static final String MEAN_ANI = "Mean ANI";
    static final String MIN_ANI = "Min ANI";
    static final String MEAN_AF = "Mean AF";
    static final String MIN_AF = "Min AF";
    static final String CLUSTERED_GENOMES = "Clustered genomes";

    private ClusterReportWriter() {
        // Utility class
    }

    /**
     * Writes the cluster file.
     *
     * @param clusters representative id to members
     * @param species representative id to species label; absent labels become {@code unclassified}
     * @param outputFile file to write
     * @throws IOException if the file cannot be written
     * @throws com.genomecurator.core.exception.InconsistentIdException if the two maps
     *         spell a representative with different origin prefixes
     */
    public static void write(Map<String, List<ClusterMember>> clusters,
                             Map<String, String> species,
                             Path outputFile) throws IOException {
        ReportFormat.writeLines(outputFile, format(clusters, species));
    }

    /**
     * Formats the cluster file without writing it.
     *
     * @param clusters representative id to members
     * @param species representative id to species label
     * @return header line followed by one line per representative
     */
    public static List<String> format(Map<String, List<ClusterMember>> clusters, Map<String, String> species) {
        GenomeIdIndex index = new GenomeIdIndex();
        index.registerAll(clusters.keySet(), "clusters");
        index.registerAll(species.keySet(), "species labels");

        List<String> lines = new ArrayList<>();
        lines.add(ReportFormat.row(SPECIES, TYPE_GENOME, CLUSTER_SIZE, MEAN_ANI, MIN_ANI, MEAN_AF, MIN_AF, CLUSTERED_GENOMES));

        List<String> representatives = new ArrayList<>(clusters.keySet());
        representatives.sort(Comparator.comparingInt((String rid) -> clusters.get(rid).size()).reversed());

        for (String representative : representatives) {
            List<ClusterMember> members = clusters.get(representative);

            String meanAni;
            String minAni;
            String meanAf;
            String minAf;
            if (members.isEmpty()) {
                meanAni = minAni = meanAf = minAf = ReportFormat.NOT_APPLICABLE;
            } else {
                meanAni = ReportFormat.twoDecimals(members.stream().mapToDouble(ClusterMember::ani).average().orElseThrow());
                minAni = ReportFormat.twoDecimals(members.stream().mapToDouble(ClusterMember::ani).min().orElseThrow());
                meanAf = ReportFormat.twoDecimals(members.stream().mapToDouble(ClusterMember::af).average().orElseThrow());
                minAf = ReportFormat.twoDecimals(members.stream().mapToDouble(ClusterMember::af).min().orElseThrow());
            }

            lines.add(ReportFormat.row(
                species.getOrDefault(representative, UNCLASSIFIED),
                representative,
                members.size(),
                meanAni, minAni,
                meanAf, minAf,
                members.stream().map(ClusterMember::genomeId).collect(Collectors.joining(","))
            ));
        }
        return lines;
    }
}

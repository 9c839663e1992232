package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a cluster file written by {@link ClusterReportWriter}.
 *
 * <p>Columns are located by header name, so files with reordered or additional
 * columns are accepted.
 */
public final class ClusterReportReader {

    private static final Logger log = LoggerFactory.getLogger(ClusterReportReader.class);

    private ClusterReportReader() {
        // Utility class
    }

    /**
     * Reads representative-to-member assignments and species labels.
     *
     * @param clusterFile cluster file
     * @return clusters and species labels in file order
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if a required column is missing or a size is not a number
     */
    public static ClusterTable read(Path clusterFile) throws IOException {
        DelimitedTable table = DelimitedTable.readTsv(clusterFile);

        int speciesIndex = table.columnIndex(ClusterReportWriter.SPECIES);
        int typeGenomeIndex = table.columnIndex(ClusterReportWriter.TYPE_GENOME);
        int sizeIndex = table.columnIndex(ClusterReportWriter.CLUSTER_SIZE);
        int membersIndex = table.columnIndex(ClusterReportWriter.CLUSTERED_GENOMES);

        Map<String, List<String>> clusters = new LinkedHashMap<>();
        Map<String, String> species = new LinkedHashMap<>();
        for (List<String> row : table.rows()) {
            String representative = DelimitedTable.cell(row, typeGenomeIndex);
            species.put(representative, DelimitedTable.cell(row, speciesIndex));

            int size = parseSize(table.source(), representative, DelimitedTable.cell(row, sizeIndex));
            if (size > 0) {
                clusters.put(representative, Arrays.stream(DelimitedTable.cell(row, membersIndex).split(","))
                    .map(String::trim)
                    .toList());
            } else {
                clusters.put(representative, List.of());
            }
        }

        log.debug("Read {} clusters from {}", clusters.size(), clusterFile);
        return new ClusterTable(clusters, species);
    }

    private static int parseSize(String source, String representative, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedReportException(source,
                "invalid cluster size '" + value + "' for " + representative, e);
        }
    }
}

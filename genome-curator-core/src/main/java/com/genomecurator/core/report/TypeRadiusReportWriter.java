package com.genomecurator.core.report;

import com.genomecurator.core.model.TypeRadius;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the ANI radius of each representative genome.
 *
 * <p>Columns: {@code NCBI species, Type genome, ANI, AF, Closest species,
 * Closest type genome}. An absent AF is written as zero and an absent neighbour as
 * {@code N/A} in both neighbour columns.
 */
public final class TypeRadiusReportWriter {

    static final String SPECIES = "NCBI species";
    static final String TYPE_GENOME = "Type genome";
    static final String ANI = "ANI";
    static final String AF = "AF";
    static final String CLOSEST_SPECIES = "Closest species";
    static final String CLOSEST_TYPE_GENOME = "Closest type genome";

    private TypeRadiusReportWriter() {
        // Utility class
    }

    /**
     * Writes the type-radius file.
     *
     * @param radii representative id to radius, written in iteration order
     * @param species genome id to species label for representatives and neighbours
     * @param outputFile file to write
     * @throws IOException if the file cannot be written
     */
    public static void write(Map<String, TypeRadius> radii, Map<String, String> species, Path outputFile) throws IOException {
        ReportFormat.writeLines(outputFile, format(radii, species));
    }

    /**
     * Formats the type-radius file without writing it.
     *
     * @param radii representative id to radius
     * @param species genome id to species label
     * @return header line followed by one line per representative
     */
    public static List<String> format(Map<String, TypeRadius> radii, Map<String, String> species) {
        List<String> lines = new ArrayList<>();
        lines.add(ReportFormat.row(SPECIES, TYPE_GENOME, ANI, AF, CLOSEST_SPECIES, CLOSEST_TYPE_GENOME));

        radii.forEach((representative, radius) -> {
            double af = radius.af() != null ? radius.af() : 0.0;

            String neighbourId = ReportFormat.NOT_APPLICABLE;
            String neighbourSpecies = ReportFormat.NOT_APPLICABLE;
            if (radius.hasNeighbour()) {
                neighbourId = radius.neighbourId();
                neighbourSpecies = species.getOrDefault(neighbourId, ClusterReportWriter.UNCLASSIFIED);
            }

            lines.add(ReportFormat.row(
                species.getOrDefault(representative, ClusterReportWriter.UNCLASSIFIED),
                representative,
                ReportFormat.twoDecimals(radius.ani()),
                ReportFormat.twoDecimals(af),
                neighbourSpecies,
                neighbourId
            ));
        });
        return lines;
    }
}

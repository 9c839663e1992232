package com.genomecurator.core.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes quality scores, highest first.
 */
public final class QualityScoreWriter {

    private QualityScoreWriter() {
        // Utility class
    }

    public static void write(Map<String, Double> scores, Path outputFile) throws IOException {
        ReportFormat.writeLines(outputFile, format(scores));
    }

    /**
     * Formats the score table; ties keep input order.
     *
     * @param scores genome id to quality score
     * @return header line followed by one line per genome
     */
    public static List<String> format(Map<String, Double> scores) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(scores.entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        List<String> lines = new ArrayList<>();
        lines.add(ReportFormat.row("Accession", "Quality score"));
        for (Map.Entry<String, Double> entry : entries) {
            lines.add(ReportFormat.row(entry.getKey(), ReportFormat.twoDecimals(entry.getValue())));
        }
        return lines;
    }
}

package com.genomecurator.core.report;

import com.genomecurator.core.model.MarkerPercentage;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.model.QcFailure;
import com.genomecurator.core.model.QcOutcome;
import com.genomecurator.core.quality.QcBatchResult;
import com.genomecurator.core.quality.QcFilter;
import com.genomecurator.core.quality.QcThresholds;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the genomes that passed and failed quality control.
 *
 * <p>Produces {@code qc_passed.tsv} and {@code qc_failed.tsv} in the output directory.
 * Both list the statistics QC was decided on; the failed file adds the comma-separated
 * failure categories.
 */
public final class QcReportWriter {

    public static final String PASSED_FILE = "qc_passed.tsv";
    public static final String FAILED_FILE = "qc_failed.tsv";

    static final String ACCESSION = "Accession";
    static final String FAILED_TESTS = "Failed tests";

    private static final List<String> COLUMNS = List.of(
        ACCESSION,
        "Completeness (%)",
        "Contamination (%)",
        "Quality",
        "Strain heterogeneity (%)",
        "Markers (%)",
        "No. contigs",
        "N50 (contigs)",
        "Ambiguous bases"
    );

    private QcReportWriter() {
        // Utility class
    }

    /**
     * Writes both QC files.
     *
     * @param result batch result
     * @param metadata metadata of every genome in the batch
     * @param markerPercentages marker percentages of every genome in the batch
     * @param thresholds thresholds the batch was run with
     * @param outputDir directory receiving the files
     * @throws IOException if a file cannot be written
     */
    public static void write(QcBatchResult result,
                             Map<String, MetadataRecord> metadata,
                             Map<String, MarkerPercentage> markerPercentages,
                             QcThresholds thresholds,
                             Path outputDir) throws IOException {
        List<String> passed = new ArrayList<>();
        passed.add(String.join("\t", COLUMNS));

        List<String> failed = new ArrayList<>();
        failed.add(String.join("\t", COLUMNS) + "\t" + FAILED_TESTS);

        for (QcOutcome outcome : result.outcomes()) {
            MetadataRecord record = metadata.get(outcome.genomeId());
            String line = statistics(record, markerPercentages.get(outcome.genomeId()), thresholds);
            if (outcome.passed()) {
                passed.add(line);
            } else {
                failed.add(line + "\t" + outcome.failures().stream()
                    .map(QcFailure::key)
                    .collect(Collectors.joining(",")));
            }
        }

        ReportFormat.writeLines(outputDir.resolve(PASSED_FILE), passed);
        ReportFormat.writeLines(outputDir.resolve(FAILED_FILE), failed);
    }

    private static String statistics(MetadataRecord record, MarkerPercentage marker, QcThresholds thresholds) {
        return ReportFormat.row(
            record.genomeId(),
            ReportFormat.twoDecimals(record.checkmCompleteness()),
            ReportFormat.twoDecimals(record.checkmContamination()),
            ReportFormat.twoDecimals(QcFilter.adjustedQuality(record, thresholds)),
            ReportFormat.twoDecimals(record.checkmStrainHeterogeneity100()),
            ReportFormat.twoDecimals(marker.percentage()),
            record.contigCount(),
            record.n50Contigs(),
            record.ambiguousBases()
        );
    }
}

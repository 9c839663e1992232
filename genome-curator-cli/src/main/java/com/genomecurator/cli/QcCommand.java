package com.genomecurator.cli;

import com.genomecurator.core.config.ConfigLoader;
import com.genomecurator.core.config.CurationConfig;
import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.model.MarkerPercentage;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.quality.QcBatch;
import com.genomecurator.core.quality.QcBatchResult;
import com.genomecurator.core.quality.QcThresholds;
import com.genomecurator.core.report.MarkerPercentageReader;
import com.genomecurator.core.report.MetadataTableReader;
import com.genomecurator.core.report.QcReportWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to quality check every genome of a metadata table.
 *
 * <p>Thresholds come from the configuration file and may be overridden per option.
 * Writes {@code qc_passed.tsv} and {@code qc_failed.tsv} and prints how many genomes
 * failed each criterion.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * genome-curator qc -m gtdb_metadata.csv -d gtdb_domain_report.tsv -o qc --min-comp 90 --threads 8
 * }</pre>
 */
@Command(
    name = "qc",
    description = "Quality check genomes and report failures per criterion",
    mixinStandardHelpOptions = true
)
public class QcCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QcCommand.class);

    @Option(names = {"-m", "--metadata"}, required = true, description = "Genome metadata table")
    private Path metadataFile;

    @Option(names = {"-d", "--domain-report"}, required = true, description = "Marker-gene domain report")
    private Path domainReport;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: curation.yaml)")
    private Path configPath = Paths.get("curation.yaml");

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--threads"}, description = "Worker threads (overrides config)")
    private Integer threads;

    @Option(names = {"--strip-prefix"}, description = "Remove RS_/GB_/U_ prefixes from genome ids")
    private boolean stripPrefix;

    @Option(names = {"--min-comp"}, description = "Minimum completeness")
    private Double minComp;

    @Option(names = {"--max-cont"}, description = "Maximum contamination")
    private Double maxCont;

    @Option(names = {"--min-quality"}, description = "Minimum quality (completeness - 5*contamination)")
    private Double minQuality;

    @Option(names = {"--sh-exception"}, description = "Strain heterogeneity enabling the lenient contamination path")
    private Double shException;

    @Option(names = {"--min-perc-markers"}, description = "Minimum percentage of marker genes")
    private Double minPercMarkers;

    @Option(names = {"--max-contigs"}, description = "Maximum number of contigs")
    private Integer maxContigs;

    @Option(names = {"--min-N50"}, description = "Minimum contig N50")
    private Long minN50;

    @Option(names = {"--max-ambiguous"}, description = "Maximum number of ambiguous bases")
    private Long maxAmbiguous;

    @Override
    public Integer call() {
        try {
            CurationConfig config = ConfigLoader.load(configPath);
            QcThresholds thresholds = resolveThresholds(config.qc());
            boolean keepPrefix = !stripPrefix && config.ingestion().keepOriginPrefix();
            Path output = outputDir != null ? outputDir : Paths.get(config.output().directory());
            int workers = threads != null ? threads : config.output().threads();
            if (workers < 1) {
                System.err.println("✗ QC failed: --threads must be at least 1, got " + workers);
                return 1;
            }

            log.info("Quality checking genomes in {} with thresholds {}", metadataFile, thresholds);
            Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, keepPrefix);
            Map<String, MarkerPercentage> markers = MarkerPercentageReader.read(domainReport, keepPrefix);

            QcBatchResult result = new QcBatch(thresholds).run(metadata, markers, workers);
            QcReportWriter.write(result, metadata, markers, thresholds, output);

            System.out.println("✓ Quality checked " + result.outcomes().size() + " genomes");
            System.out.println("  Passed: " + result.passedCount());
            System.out.println("  Failed: " + result.failedCount());
            result.counters().asMap().forEach((category, count) ->
                System.out.printf("    %-13s %d%n", category, count));
            System.out.println("✓ QC reports written to: " + output);
            return 0;

        } catch (CurationException | IOException e) {
            log.error("QC failed", e);
            System.err.println("✗ QC failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Applies command-line overrides on top of the configured thresholds.
     */
    private QcThresholds resolveThresholds(QcThresholds configured) {
        return new QcThresholds(
            minComp != null ? minComp : configured.minCompleteness(),
            maxCont != null ? maxCont : configured.maxContamination(),
            minQuality != null ? minQuality : configured.minQuality(),
            shException != null ? shException : configured.strainHeterogeneityException(),
            minPercMarkers != null ? minPercMarkers : configured.minMarkerPercentage(),
            maxContigs != null ? maxContigs : configured.maxContigs(),
            minN50 != null ? minN50 : configured.minN50(),
            maxAmbiguous != null ? maxAmbiguous : configured.maxAmbiguousBases()
        );
    }
}

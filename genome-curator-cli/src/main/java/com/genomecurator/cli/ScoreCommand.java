package com.genomecurator.cli;

import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.quality.QualityScorer;
import com.genomecurator.core.report.MetadataTableReader;
import com.genomecurator.core.report.QcReportReader;
import com.genomecurator.core.report.QualityScoreWriter;
import com.genomecurator.core.util.GenomeIdIndex;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to compute quality scores for genomes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Score every genome
 * genome-curator score -m gtdb_metadata.csv
 *
 * # Score only genomes that passed QC
 * genome-curator score -m gtdb_metadata.csv --qc-file qc/qc_passed.tsv -o scores.tsv
 * }</pre>
 */
@Command(
    name = "score",
    description = "Compute quality scores used to rank genomes",
    mixinStandardHelpOptions = true
)
public class ScoreCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScoreCommand.class);

    @Option(names = {"-m", "--metadata"}, required = true, description = "Genome metadata table")
    private Path metadataFile;

    @Option(names = {"--qc-file"}, description = "Restrict scoring to genomes listed in this QC file")
    private Path qcFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: quality_scores.tsv)")
    private Path outputFile = Paths.get("quality_scores.tsv");

    @Option(names = {"--strip-prefix"}, description = "Remove RS_/GB_/U_ prefixes from genome ids")
    private boolean stripPrefix;

    @Override
    public Integer call() {
        try {
            Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, !stripPrefix);
            Collection<String> genomeIds = metadata.keySet();
            if (qcFile != null) {
                genomeIds = QcReportReader.readPassed(qcFile);
                GenomeIdIndex index = new GenomeIdIndex();
                index.registerAll(metadata.keySet(), "metadata");
                index.registerAll(genomeIds, "QC file");
            }

            log.info("Scoring {} genomes", genomeIds.size());
            Map<String, Double> scores = QualityScorer.qualityScores(genomeIds, metadata);
            QualityScoreWriter.write(scores, outputFile);

            System.out.println("✓ Scored " + scores.size() + " genomes");
            System.out.println("✓ Quality scores written to: " + outputFile);
            return 0;

        } catch (CurationException | IOException e) {
            log.error("Scoring failed", e);
            System.err.println("✗ Scoring failed: " + e.getMessage());
            return 1;
        }
    }
}

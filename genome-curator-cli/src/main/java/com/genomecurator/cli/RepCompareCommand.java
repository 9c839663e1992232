package com.genomecurator.cli;

import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.report.MetadataTableReader;
import com.genomecurator.core.representative.RepresentativeComparison;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to compare the species representatives of two releases.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * genome-curator rep-compare gtdb_r95_metadata.csv gtdb_r89_metadata.csv
 * }</pre>
 */
@Command(
    name = "rep-compare",
    description = "Compare current and previous species representatives",
    mixinStandardHelpOptions = true
)
public class RepCompareCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RepCompareCommand.class);

    @Parameters(index = "0", description = "Metadata table of the current release")
    private Path currentMetadata;

    @Parameters(index = "1", description = "Metadata table of the previous release")
    private Path previousMetadata;

    @Override
    public Integer call() {
        try {
            Map<String, MetadataRecord> current = MetadataTableReader.read(currentMetadata, true);
            Map<String, MetadataRecord> previous = MetadataTableReader.read(previousMetadata, true);
            RepresentativeComparison comparison = RepresentativeComparison.compare(current, previous);

            System.out.println("No. current representatives: " + comparison.currentRepresentatives().size());
            System.out.println("No. previous representatives: " + comparison.previousRepresentatives().size());
            System.out.println();
            System.out.println("No. current species with representatives: " + comparison.currentSpeciesWithRepresentative().size());
            System.out.println("No. previous species with representatives: " + comparison.previousSpeciesWithRepresentative().size());
            System.out.println();
            System.out.println("No. new representatives: " + comparison.newRepresentatives().size());
            System.out.println("No. retired representatives: " + comparison.retiredRepresentatives().size());
            System.out.println();
            System.out.println("No. new species with representative: " + comparison.newSpeciesWithRepresentative().size());
            System.out.println("No. new genera with representative: " + comparison.newGeneraWithRepresentative().size());
            System.out.println();
            printTaxa("No. species that no longer have a representative", comparison.speciesLosingRepresentative());
            printTaxa("No. genera that no longer have a representative", comparison.generaLosingRepresentative());
            System.out.println("No. deprecated previous representatives: " + comparison.deprecatedRepresentatives().size());
            return 0;

        } catch (CurationException | IOException e) {
            log.error("Representative comparison failed", e);
            System.err.println("✗ Representative comparison failed: " + e.getMessage());
            return 1;
        }
    }

    private void printTaxa(String title, Set<String> taxa) {
        System.out.println(title + ": " + taxa.size());
        taxa.forEach(taxon -> System.out.println("  " + taxon));
        System.out.println();
    }
}

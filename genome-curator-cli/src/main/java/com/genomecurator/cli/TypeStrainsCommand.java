package com.genomecurator.cli;

import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.model.MetadataRecord;
import com.genomecurator.core.report.MetadataTableReader;
import com.genomecurator.core.typestrain.TypeStrainClassifier;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to list type strains of species under the NCBI and GTDB conventions.
 *
 * <p>Genomes recognised by only one of the two vocabularies are listed separately.
 */
@Command(
    name = "type-strains",
    description = "List NCBI and GTDB type strains of species",
    mixinStandardHelpOptions = true
)
public class TypeStrainsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TypeStrainsCommand.class);

    @Option(names = {"-m", "--metadata"}, required = true, description = "Genome metadata table")
    private Path metadataFile;

    @Option(names = {"--strip-prefix"}, description = "Remove RS_/GB_/U_ prefixes from genome ids")
    private boolean stripPrefix;

    @Override
    public Integer call() {
        try {
            Map<String, MetadataRecord> metadata = MetadataTableReader.read(metadataFile, !stripPrefix);

            Set<String> ncbi = TypeStrainClassifier.ncbiTypeStrainOfSpecies(metadata);
            Set<String> gtdb = TypeStrainClassifier.gtdbTypeStrainOfSpecies(metadata);

            Set<String> ncbiOnly = new LinkedHashSet<>(ncbi);
            ncbiOnly.removeAll(gtdb);
            Set<String> gtdbOnly = new LinkedHashSet<>(gtdb);
            gtdbOnly.removeAll(ncbi);
            log.debug("NCBI-only type strains: {}, GTDB-only type strains: {}", ncbiOnly, gtdbOnly);

            System.out.println("NCBI type strains of species: " + ncbi.size());
            System.out.println("GTDB type strains of species: " + gtdb.size());
            System.out.println();
            printGenomes("Type strain at NCBI only", ncbiOnly);
            printGenomes("Type strain at GTDB only", gtdbOnly);
            return 0;

        } catch (CurationException | IOException e) {
            log.error("Type-strain classification failed", e);
            System.err.println("✗ Type-strain classification failed: " + e.getMessage());
            return 1;
        }
    }

    private void printGenomes(String title, Set<String> genomeIds) {
        System.out.println(title + ": " + genomeIds.size());
        genomeIds.forEach(genomeId -> System.out.println("  " + genomeId));
    }
}

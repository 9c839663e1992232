package com.genomecurator.cli;

import com.genomecurator.core.exception.CurationException;
import com.genomecurator.core.report.ClusterReportReader;
import com.genomecurator.core.report.ClusterTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.Callable;

/**
 * Command to summarise a species cluster file.
 */
@Command(
    name = "clusters",
    description = "Summarise a species cluster file",
    mixinStandardHelpOptions = true
)
public class ClustersCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ClustersCommand.class);

    @Parameters(index = "0", description = "Cluster file")
    private Path clusterFile;

    @Option(names = {"--top"}, description = "Number of largest clusters to list (default: 10)")
    private int top = 10;

    @Override
    public Integer call() {
        try {
            ClusterTable table = ClusterReportReader.read(clusterFile);

            System.out.println("No. species clusters: " + table.representatives().size());
            System.out.println("No. singleton clusters: " + table.singletonCount());
            System.out.println("No. clustered genomes: " + table.clusteredGenomeCount());
            System.out.println();
            System.out.println("Largest clusters:");
            table.representatives().stream()
                .sorted(Comparator.comparingInt((String rid) -> table.members(rid).size()).reversed())
                .limit(top)
                .forEach(rid -> System.out.printf("  %s (%s): %d%n",
                    table.speciesOf(rid), rid, table.members(rid).size()));
            return 0;

        } catch (CurationException | IOException e) {
            log.error("Reading cluster file failed", e);
            System.err.println("✗ Reading cluster file failed: " + e.getMessage());
            return 1;
        }
    }
}

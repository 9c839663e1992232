package com.genomecurator;

import com.genomecurator.cli.ClustersCommand;
import com.genomecurator.cli.QcCommand;
import com.genomecurator.cli.RepCompareCommand;
import com.genomecurator.cli.ScoreCommand;
import com.genomecurator.cli.TypeStrainsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Genome Curator.
 *
 * <p>Genome Curator decides which candidate genomes are admissible to a reference genome
 * database, how they rank against their peers, and which of them are type strains.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code qc} - Quality check genomes against configurable thresholds</li>
 *   <li>{@code score} - Compute quality scores used to rank genomes</li>
 *   <li>{@code type-strains} - List NCBI and GTDB type strains of species</li>
 *   <li>{@code rep-compare} - Compare representatives of two releases</li>
 *   <li>{@code clusters} - Summarise a species cluster file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * genome-curator -v qc -m gtdb_metadata.csv -d gtdb_domain_report.tsv -o qc
 * genome-curator score -m gtdb_metadata.csv --qc-file qc/qc_passed.tsv
 * }</pre>
 */
@Command(
    name = "genome-curator",
    mixinStandardHelpOptions = true,
    version = "Genome Curator 1.0.0-SNAPSHOT",
    description = "Quality control, quality scoring and type-strain selection for reference genome curation",
    subcommands = {
        QcCommand.class,
        ScoreCommand.class,
        TypeStrainsCommand.class,
        RepCompareCommand.class,
        ClustersCommand.class
    }
)
public class GenomeCuratorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GenomeCuratorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Genome Curator - reference genome quality control and type-strain selection");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'genome-curator --help' to see available commands");
        System.out.println("Use 'genome-curator <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        GenomeCuratorCLI cli = new GenomeCuratorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

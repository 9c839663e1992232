package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import com.genomecurator.core.model.MarkerPercentage;
import com.genomecurator.core.util.GenomeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the marker-gene domain report.
 *
 * <p>The first column holds the genome id. The header must contain
 * {@code Predicted domain}, {@code Bacterial Marker Percentage} and
 * {@code Archaeal Marker Percentage}; a missing column aborts before any row is read.
 */
public final class MarkerPercentageReader {

    private static final Logger log = LoggerFactory.getLogger(MarkerPercentageReader.class);

    static final String PREDICTED_DOMAIN = "Predicted domain";
    static final String BACTERIAL_PERCENTAGE = "Bacterial Marker Percentage";
    static final String ARCHAEAL_PERCENTAGE = "Archaeal Marker Percentage";

    private MarkerPercentageReader() {
        // Utility class
    }

    /**
     * Reads marker percentages per genome.
     *
     * @param domainReport tab-separated domain report
     * @return marker percentages keyed by genome id, in file order
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if a column is missing or a percentage is not a number
     */
    public static Map<String, MarkerPercentage> read(Path domainReport) throws IOException {
        return read(domainReport, true);
    }

    /**
     * Reads marker percentages per genome, optionally stripping origin prefixes from ids.
     *
     * @param domainReport tab-separated domain report
     * @param keepOriginPrefix whether genome ids keep their {@code RS_}/{@code GB_}/{@code U_} prefix
     * @return marker percentages keyed by genome id, in file order
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if a column is missing or a percentage is not a number
     */
    public static Map<String, MarkerPercentage> read(Path domainReport, boolean keepOriginPrefix) throws IOException {
        DelimitedTable table = DelimitedTable.readTsv(domainReport);

        int domainIndex = table.columnIndex(PREDICTED_DOMAIN);
        int bacterialIndex = table.columnIndex(BACTERIAL_PERCENTAGE);
        int archaealIndex = table.columnIndex(ARCHAEAL_PERCENTAGE);

        Map<String, MarkerPercentage> percentages = new LinkedHashMap<>();
        for (List<String> row : table.rows()) {
            String genomeId = GenomeIds.canonical(DelimitedTable.cell(row, 0), keepOriginPrefix);
            percentages.put(genomeId, new MarkerPercentage(
                DelimitedTable.cell(row, domainIndex),
                parse(table.source(), genomeId, DelimitedTable.cell(row, bacterialIndex)),
                parse(table.source(), genomeId, DelimitedTable.cell(row, archaealIndex))
            ));
        }

        log.info("Read marker percentages for {} genomes from {}", percentages.size(), domainReport);
        return percentages;
    }

    private static double parse(String source, String genomeId, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedReportException(source, "invalid marker percentage '" + value + "' for " + genomeId, e);
        }
    }
}

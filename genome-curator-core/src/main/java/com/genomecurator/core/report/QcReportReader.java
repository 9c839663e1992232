package com.genomecurator.core.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the genomes that passed quality control.
 */
public final class QcReportReader {

    private QcReportReader() {
        // Utility class
    }

    /**
     * Reads genome ids from the first column of a QC file, skipping its header.
     *
     * @param qcFile file written by {@link QcReportWriter}, or any file listing ids first
     * @return genome ids in file order
     * @throws IOException if the file cannot be read
     */
    public static Set<String> readPassed(Path qcFile) throws IOException {
        DelimitedTable table = DelimitedTable.readTsv(qcFile);

        Set<String> passed = new LinkedHashSet<>();
        for (List<String> row : table.rows()) {
            String genomeId = DelimitedTable.cell(row, 0);
            if (!genomeId.isEmpty()) {
                passed.add(genomeId);
            }
        }
        return Collections.unmodifiableSet(passed);
    }
}

package com.genomecurator.core.report;

import com.genomecurator.core.exception.MalformedReportException;
import com.genomecurator.core.model.TypeRadius;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a type-radius file written by {@link TypeRadiusReportWriter}.
 */
public final class TypeRadiusReportReader {

    private TypeRadiusReportReader() {
        // Utility class
    }

    /**
     * Reads radii and species labels; {@code N/A} neighbours become absent.
     *
     * @param radiusFile type-radius file
     * @return radii and species labels in file order
     * @throws IOException if the file cannot be read
     * @throws MalformedReportException if a column is missing or a value is not a number
     */
    public static TypeRadiusTable read(Path radiusFile) throws IOException {
        DelimitedTable table = DelimitedTable.readTsv(radiusFile);

        int speciesIndex = table.columnIndex(TypeRadiusReportWriter.SPECIES);
        int typeGenomeIndex = table.columnIndex(TypeRadiusReportWriter.TYPE_GENOME);
        int aniIndex = table.columnIndex(TypeRadiusReportWriter.ANI);
        int afIndex = table.columnIndex(TypeRadiusReportWriter.AF);
        int closestSpeciesIndex = table.columnIndex(TypeRadiusReportWriter.CLOSEST_SPECIES);
        int closestGenomeIndex = table.columnIndex(TypeRadiusReportWriter.CLOSEST_TYPE_GENOME);

        Map<String, TypeRadius> radii = new LinkedHashMap<>();
        Map<String, String> species = new LinkedHashMap<>();
        for (List<String> row : table.rows()) {
            String representative = DelimitedTable.cell(row, typeGenomeIndex);
            species.put(representative, DelimitedTable.cell(row, speciesIndex));

            String neighbourId = DelimitedTable.cell(row, closestGenomeIndex);
            if (neighbourId.isEmpty() || ReportFormat.NOT_APPLICABLE.equals(neighbourId)) {
                neighbourId = null;
            } else {
                species.putIfAbsent(neighbourId, DelimitedTable.cell(row, closestSpeciesIndex));
            }

            radii.put(representative, new TypeRadius(
                parse(table.source(), representative, DelimitedTable.cell(row, aniIndex)),
                parse(table.source(), representative, DelimitedTable.cell(row, afIndex)),
                neighbourId
            ));
        }
        return new TypeRadiusTable(radii, species);
    }

    private static double parse(String source, String representative, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedReportException(source, "invalid number '" + value + "' for " + representative, e);
        }
    }
}

package com.genomecurator.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Formatting and file helpers shared by the report writers.
 */
final class ReportFormat {

    private static final Logger log = LoggerFactory.getLogger(ReportFormat.class);

    static final String NOT_APPLICABLE = "N/A";

    private ReportFormat() {
        // Utility class
    }

    static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String row(Object... cells) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                line.append('\t');
            }
            line.append(cells[i]);
        }
        return line.toString();
    }

    /**
     * Writes lines terminated by newlines, creating parent directories as needed.
     */
    static void writeLines(Path path, List<String> lines) throws IOException {
        Path parentDir = path.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        log.info("Wrote {} ({} rows)", path, Math.max(0, lines.size() - 1));
    }
}

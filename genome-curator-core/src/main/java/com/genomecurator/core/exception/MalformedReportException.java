package com.genomecurator.core.exception;

/**
 * A tabular input lacks an expected header column or holds an unparseable line.
 */
public class MalformedReportException extends CurationException {

    private final String source;

    public MalformedReportException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public MalformedReportException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    /**
     * Creates the exception raised when a header column cannot be found.
     *
     * @param source file or table name
     * @param column missing column name
     * @return a new exception
     */
    public static MalformedReportException missingColumn(String source, String column) {
        return new MalformedReportException(source, "missing expected column '" + column + "'");
    }

    public String getSource() {
        return source;
    }
}

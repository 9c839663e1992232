package com.genomecurator.core.exception;

/**
 * A required metadata field is absent for a genome.
 *
 * <p>Raised immediately and aborts the batch: a silently zeroed field would
 * corrupt quality ranking and QC decisions.
 */
public class MissingFieldException extends CurationException {

    private final String genomeId;
    private final String fieldName;

    public MissingFieldException(String genomeId, String fieldName) {
        super("Missing required field '" + fieldName + "' for genome " + genomeId);
        this.genomeId = genomeId;
        this.fieldName = fieldName;
    }

    public String getGenomeId() {
        return genomeId;
    }

    public String getFieldName() {
        return fieldName;
    }
}

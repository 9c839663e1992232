package com.genomecurator.core.exception;

/**
 * Base type for every failure raised by the curation core.
 *
 * <p>All curation failures are unchecked and carry the offending genome id,
 * field or file in their message. They are never swallowed inside the core;
 * callers decide whether to abort the batch.
 */
public class CurationException extends RuntimeException {

    public CurationException(String message) {
        super(message);
    }

    public CurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

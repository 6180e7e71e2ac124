package org.learningjava.brandlens.domain.service.extraction;

/** The extraction backend answered, but not with something matching the extraction schema. */
public class MalformedExtractionException extends RuntimeException {

    public MalformedExtractionException(String message) {
        super(message);
    }

    public MalformedExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

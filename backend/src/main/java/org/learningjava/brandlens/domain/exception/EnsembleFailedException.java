package org.learningjava.brandlens.domain.exception;

import java.util.List;

/** Thrown when an ensemble produces no usable trial; no partial result is returned. */
public class EnsembleFailedException extends RuntimeException {

    private final int requestedRuns;
    private final List<String> trialErrors;

    public EnsembleFailedException(String message, int requestedRuns, List<String> trialErrors) {
        super(message);
        this.requestedRuns = requestedRuns;
        this.trialErrors = trialErrors == null ? List.of() : List.copyOf(trialErrors);
    }

    public EnsembleFailedException(String message, int requestedRuns, Throwable cause) {
        super(message, cause);
        this.requestedRuns = requestedRuns;
        this.trialErrors = List.of();
    }

    public int getRequestedRuns() {
        return requestedRuns;
    }

    public List<String> getTrialErrors() {
        return trialErrors;
    }
}

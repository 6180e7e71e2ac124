package org.learningjava.brandlens.domain.model;

/**
 * Lifecycle of one ensemble invocation:
 * INITIATED -> (TRIAL_RUNNING -> TRIAL_SUCCEEDED | TRIAL_FAILED) x N -> AGGREGATING -> COMPLETED,
 * or FATAL_FAILED when no trial succeeded.
 */
public enum TrialState {
    INITIATED,
    TRIAL_RUNNING,
    TRIAL_SUCCEEDED,
    TRIAL_FAILED,
    AGGREGATING,
    COMPLETED,
    FATAL_FAILED
}

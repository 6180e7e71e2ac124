package org.learningjava.brandlens.application.usecase;

import org.learningjava.brandlens.domain.model.TrialResult;

/** Notified on the ensemble's thread after each trial, successful or not. */
@FunctionalInterface
public interface TrialListener {

    TrialListener NONE = (result, totalRuns) -> { };

    void onTrialFinished(TrialResult result, int totalRuns);
}

package org.learningjava.brandlens.application.usecase;

import java.time.Duration;

/** Pause between two consecutive trials of an ensemble. */
@FunctionalInterface
public interface TrialPacer {

    void pause(Duration delay) throws InterruptedException;
}

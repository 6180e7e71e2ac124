package org.learningjava.brandlens.application.usecase;

import org.learningjava.brandlens.domain.exception.EnsembleFailedException;
import org.learningjava.brandlens.domain.model.TrialResult;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Lazy, strictly sequential run of {@code count} trials. Trial {@code i} starts only when
 * {@link #next()} is called, after the pacer's pause; there is no pause after the last trial.
 * Not thread-safe.
 */
public class TrialSequence implements Iterator<TrialResult> {

    private final int count;
    private final IntFunction<TrialResult> trial;
    private final TrialPacer pacer;
    private final Duration delay;
    private int nextIndex;

    public TrialSequence(int count, IntFunction<TrialResult> trial, TrialPacer pacer, Duration delay) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        this.count = count;
        this.trial = trial;
        this.pacer = pacer;
        this.delay = delay;
    }

    @Override
    public boolean hasNext() {
        return nextIndex < count;
    }

    @Override
    public TrialResult next() {
        if (!hasNext()) throw new NoSuchElementException();
        int index = nextIndex++;
        if (index > 0) {
            try {
                pacer.pause(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EnsembleFailedException("Ensemble interrupted before run " + (index + 1) + "/" + count, count, e);
            }
        }
        return trial.apply(index);
    }
}

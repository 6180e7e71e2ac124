package org.learningjava.brandlens.application.usecase;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SleepingTrialPacer implements TrialPacer {

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        Thread.sleep(delay.toMillis());
    }
}

package org.learningjava.brandlens.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Component
@Validated
@ConfigurationProperties(prefix = "ensemble")
public class EnsembleProperties {
    @Min(1) private int defaultRunCount = 5;
    @Min(1) private int minRuns = 1;
    @Min(1) private int maxRuns = 15;
    private Duration interTrialDelay = Duration.ofMillis(500);
    @DecimalMin("0.0") private double highVarianceThreshold = 0.3;

    public int getDefaultRunCount() { return defaultRunCount; }
    public void setDefaultRunCount(int v) { this.defaultRunCount = v; }
    public int getMinRuns() { return minRuns; }
    public void setMinRuns(int v) { this.minRuns = v; }
    public int getMaxRuns() { return maxRuns; }
    public void setMaxRuns(int v) { this.maxRuns = v; }
    public Duration getInterTrialDelay() { return interTrialDelay; }
    public void setInterTrialDelay(Duration d) { this.interTrialDelay = d; }
    public double getHighVarianceThreshold() { return highVarianceThreshold; }
    public void setHighVarianceThreshold(double v) { this.highVarianceThreshold = v; }

    /** Requested count clamped to [minRuns, maxRuns]; null means the default. */
    public int clampRunCount(Integer requested) {
        int n = requested == null ? defaultRunCount : requested;
        return Math.min(maxRuns, Math.max(minRuns, n));
    }
}

package org.learningjava.brandlens.domain.service.aggregation;

import org.junit.jupiter.api.Test;
import org.learningjava.brandlens.domain.model.EnsembleBrandResult;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.model.TrialResult;
import org.learningjava.brandlens.domain.service.extraction.BrandVisibilityChecker;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.learningjava.brandlens.domain.service.aggregation.Trials.trial;

class RepresentativeRunSelectorTest {

    private final RepresentativeRunSelector selector = new RepresentativeRunSelector(new BrandVisibilityChecker());
    private final TargetBrand acme = new TargetBrand("Acme", "acme.com");

    // brand counts 2, 5, 3, 3, 7 -> median 3; Acme only in trials 0 and 3
    private final List<TrialResult> trials = List.of(
            trial(0, "Acme", "B"),
            trial(1, "B", "C", "D", "E", "F"),
            trial(2, "B", "C", "D"),
            trial(3, "Acme", "B", "C"),
            trial(4, "B", "C", "D", "E", "F", "G", "H"));

    private static List<EnsembleBrandResult> acmeAt(double frequency) {
        return List.of(new EnsembleBrandResult("Acme", "acme", null, frequency, 0, 5,
                PresenceClassifier.classify(frequency), frequency, 0, "", null, List.of()));
    }

    @Test
    void closestToMedian_earliestWins() {
        assertEquals(2, selector.select(trials, List.of(), null));
    }

    @Test
    void usuallyPresentTarget_prefersRunWhereItIsVisible() {
        assertEquals(3, selector.select(trials, acmeAt(0.6), acme));
    }

    @Test
    void rarelyPresentTarget_isNotPenalized() {
        assertEquals(2, selector.select(trials, acmeAt(0.4), acme));
    }

    @Test
    void returnsTheTrialsOwnIndex() {
        assertEquals(7, selector.select(List.of(trial(7, "Acme")), List.of(), acme));
        assertEquals(9, selector.select(List.of(trial(4, "A"), trial(9, "A", "B", "C")), List.of(), null));
        assertEquals(0, selector.select(List.of(), List.of(), acme));
    }
}

package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.BrandExtractionResult;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.ExtractedBrand;
import org.learningjava.brandlens.domain.model.SourceAnalysis;
import org.learningjava.brandlens.domain.model.TrialResult;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Test fixtures: successful trials whose extraction mentions the given brand names once each. */
final class Trials {

    private Trials() { }

    static ExtractedBrand mentioned(String name) {
        return new ExtractedBrand(name, ExtractedBrand.normalize(name), null, true, false, 1, 0, Confidence.HIGH,
                "Mentioned 1x in answer");
    }

    static ExtractedBrand supported(String name, String domain, int sources) {
        return new ExtractedBrand(name, ExtractedBrand.normalize(name), domain, false, true, 0, sources,
                Confidence.MEDIUM, "Supported by " + sources + " sources");
    }

    static BrandExtractionResult extraction(ExtractedBrand... brands) {
        return new BrandExtractionResult(List.of(), List.of(), List.of(), Arrays.asList(brands),
                new SourceAnalysis(0, List.of(), Map.of()));
    }

    static TrialResult trial(int index, String... names) {
        ExtractedBrand[] brands = Arrays.stream(names).map(Trials::mentioned).toArray(ExtractedBrand[]::new);
        return TrialResult.succeeded(index, "answer " + index, List.of(), extraction(brands));
    }

    static TrialResult trialWith(int index, ExtractedBrand... brands) {
        return TrialResult.succeeded(index, "answer " + index, List.of(), extraction(brands));
    }
}

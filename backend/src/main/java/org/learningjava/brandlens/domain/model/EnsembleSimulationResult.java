package org.learningjava.brandlens.domain.model;

import java.util.List;

public record EnsembleSimulationResult(
        Engine engine,
        String keyword,
        Region region,
        int totalRuns,
        int successfulRuns,
        TargetBrandResult targetBrandResult,
        List<EnsembleBrandResult> allBrands,
        List<SourceReference> allSources,
        List<String> uniqueDomains,
        String representativeAnswer,
        int representativeRunIndex,
        VarianceMetrics varianceMetrics,
        List<TrialResult> runResults,
        List<String> notes
) {
    public EnsembleSimulationResult {
        allBrands = allBrands == null ? List.of() : List.copyOf(allBrands);
        allSources = allSources == null ? List.of() : List.copyOf(allSources);
        uniqueDomains = uniqueDomains == null ? List.of() : List.copyOf(uniqueDomains);
        runResults = runResults == null ? List.of() : List.copyOf(runResults);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}

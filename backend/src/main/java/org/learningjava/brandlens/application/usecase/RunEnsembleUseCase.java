package org.learningjava.brandlens.application.usecase;

import org.learningjava.brandlens.application.port.SimulatorPort;
import org.learningjava.brandlens.config.EnsembleProperties;
import org.learningjava.brandlens.domain.exception.EnsembleFailedException;
import org.learningjava.brandlens.domain.model.BrandExtractionResult;
import org.learningjava.brandlens.domain.model.EnsembleBrandResult;
import org.learningjava.brandlens.domain.model.EnsembleRequest;
import org.learningjava.brandlens.domain.model.EnsembleSimulationResult;
import org.learningjava.brandlens.domain.model.PresenceLevel;
import org.learningjava.brandlens.domain.model.SimulationOutput;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.model.TargetBrandResult;
import org.learningjava.brandlens.domain.model.TrialResult;
import org.learningjava.brandlens.domain.model.TrialState;
import org.learningjava.brandlens.domain.model.VarianceMetrics;
import org.learningjava.brandlens.domain.service.aggregation.BrandAggregator;
import org.learningjava.brandlens.domain.service.aggregation.RepresentativeRunSelector;
import org.learningjava.brandlens.domain.service.aggregation.TargetBrandAnalyzer;
import org.learningjava.brandlens.domain.service.aggregation.VarianceStatistics;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.learningjava.brandlens.domain.service.extraction.BrandExtractor;
import org.learningjava.brandlens.domain.service.extraction.ExtractionInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one ensemble: N independent trials of the same query, each simulated and then passed
 * through the brand extractor, aggregated over the trials that succeeded.
 * <p>
 * Individual trial failures are tolerated; the call fails only when no trial succeeds.
 * Holds no state between calls.
 */
@Service
public class RunEnsembleUseCase {

    private static final Logger log = LoggerFactory.getLogger(RunEnsembleUseCase.class);

    private final SimulatorPort simulator;
    private final BrandExtractor extractor;
    private final BrandAggregator aggregator;
    private final TargetBrandAnalyzer targetAnalyzer;
    private final RepresentativeRunSelector representativeSelector;
    private final TrialPacer pacer;
    private final EnsembleProperties props;

    public RunEnsembleUseCase(SimulatorPort simulator,
                              BrandExtractor extractor,
                              BrandAggregator aggregator,
                              TargetBrandAnalyzer targetAnalyzer,
                              RepresentativeRunSelector representativeSelector,
                              TrialPacer pacer,
                              EnsembleProperties props) {
        this.simulator = simulator;
        this.extractor = extractor;
        this.aggregator = aggregator;
        this.targetAnalyzer = targetAnalyzer;
        this.representativeSelector = representativeSelector;
        this.pacer = pacer;
        this.props = props;
    }

    public EnsembleSimulationResult run(EnsembleRequest request) {
        return run(request, TrialListener.NONE);
    }

    public EnsembleSimulationResult run(EnsembleRequest request, TrialListener listener) {
        validate(request);
        final int runCount = props.clampRunCount(request.runCount());
        final String tag = request.engine().id() + "/" + request.region().id();

        log.info("[{}] {} Starting {} runs for \"{}\"", tag, TrialState.INITIATED, runCount, request.query());

        Map<String, SourceReference> sourceUnion = new LinkedHashMap<>();
        TrialSequence trials = new TrialSequence(runCount,
                i -> runTrial(i, runCount, request, sourceUnion, tag), pacer, props.getInterTrialDelay());

        List<TrialResult> runResults = new ArrayList<>(runCount);
        while (trials.hasNext()) {
            TrialResult r = trials.next();
            runResults.add(r);
            listener.onTrialFinished(r, runCount);
        }

        List<TrialResult> successful = runResults.stream().filter(TrialResult::success).toList();
        if (successful.isEmpty()) {
            log.error("[{}] {} All {} runs failed", tag, TrialState.FATAL_FAILED, runCount);
            throw new EnsembleFailedException("All " + runCount + " ensemble runs failed", runCount,
                    runResults.stream().map(TrialResult::error).toList());
        }

        log.info("[{}] {} {}/{} runs successful", tag, TrialState.AGGREGATING, successful.size(), runCount);
        EnsembleSimulationResult result = aggregate(request, runCount, runResults, successful, sourceUnion);

        if (result.targetBrandResult() != null) {
            TargetBrandResult t = result.targetBrandResult();
            log.info("[{}] Target brand \"{}\": {} ({}%){}", tag, t.name(), t.presenceLevel().id(),
                    Math.round(t.visibilityFrequency() * 100), t.statisticallySignificant() ? " [statistically significant]" : "");
        }
        log.info("[{}] {} {} brands across {} runs", tag, TrialState.COMPLETED, result.allBrands().size(), successful.size());
        return result;
    }

    // ---------- trials ----------

    private TrialResult runTrial(int index, int runCount, EnsembleRequest request,
                                 Map<String, SourceReference> sourceUnion, String tag) {
        log.info("[{}] {} Run {}/{}", tag, TrialState.TRIAL_RUNNING, index + 1, runCount);
        try {
            SimulationOutput sim = simulator.simulate(request.engine(), request.query(), request.language(), request.region());

            for (SourceReference s : sim.sources()) {
                sourceUnion.putIfAbsent(DomainNormalizer.canonicalizeUrl(s.url()), s);
            }

            BrandExtractionResult extraction = extractor.extract(new ExtractionInput(
                    sim.answerText(), sim.sources(), sim.searchResults(), request.targetBrand(), request.engine()));

            log.info("[{}] {} Run {} found {} brands", tag, TrialState.TRIAL_SUCCEEDED, index + 1, extraction.brandCount());
            return TrialResult.succeeded(index, sim.answerText(), sim.sources(), extraction);
        } catch (RuntimeException e) {
            log.warn("[{}] {} Run {} failed: {}", tag, TrialState.TRIAL_FAILED, index + 1, e.toString());
            return TrialResult.failed(index, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    // ---------- aggregation ----------

    private EnsembleSimulationResult aggregate(EnsembleRequest request, int runCount, List<TrialResult> runResults,
                                               List<TrialResult> successful, Map<String, SourceReference> sourceUnion) {
        boolean withStats = request.enableVarianceMetrics();
        int s = successful.size();

        List<EnsembleBrandResult> allBrands = aggregator.aggregateBrandsAcrossRuns(successful, withStats);

        TargetBrandResult target = request.targetBrand() == null ? null
                : targetAnalyzer.analyze(request.targetBrand(), successful, withStats);

        int repIndex = representativeSelector.select(successful, allBrands, request.targetBrand());
        String repAnswer = successful.stream().filter(t -> t.index() == repIndex)
                .map(TrialResult::answerText).findFirst().orElse("");

        List<SourceReference> allSources = new ArrayList<>(sourceUnion.values());
        Set<String> uniqueDomains = new LinkedHashSet<>();
        for (SourceReference src : allSources) {
            String host = DomainNormalizer.stripWww(src.url());
            if (!host.isEmpty()) uniqueDomains.add(host);
        }

        double brandVariance = aggregator.calculateBrandVariance(
                successful.stream().map(TrialResult::extraction).toList());

        List<String> notes = new ArrayList<>();
        if (s < runCount) {
            notes.add((runCount - s) + " runs failed - results based on " + s + " runs");
        }
        if (brandVariance > props.getHighVarianceThreshold()) {
            notes.add("High variance in brand detection (" + Math.round(brandVariance * 100) + "%) - results may be less reliable");
        }
        if (target != null) {
            if (target.presenceLevel() == PresenceLevel.INCONCLUSIVE) {
                notes.add("Target brand visibility is inconclusive - appeared in only " + target.visibleInRuns() + "/" + s + " runs");
            }
            if (!target.statisticallySignificant()) {
                notes.add("Result is not statistically significant - consider running more simulations");
            }
        }

        VarianceMetrics variance = null;
        if (withStats) {
            double frequency = target == null ? 0 : target.visibilityFrequency();
            int visible = target == null ? 0 : target.visibleInRuns();
            variance = new VarianceMetrics(
                    runCount,
                    s,
                    brandVariance,
                    VarianceStatistics.wilsonInterval(visible, s),
                    target != null && target.statisticallySignificant(),
                    target == null ? null : target.pValue(),
                    VarianceStatistics.standardError(frequency, s));
        }

        return new EnsembleSimulationResult(
                request.engine(),
                request.query(),
                request.region(),
                runCount,
                s,
                target,
                allBrands,
                allSources,
                new ArrayList<>(uniqueDomains),
                repAnswer,
                repIndex,
                variance,
                runResults,
                notes);
    }

    private static void validate(EnsembleRequest request) {
        if (request == null) throw new IllegalArgumentException("request is required");
        if (request.engine() == null) throw new IllegalArgumentException("engine is required");
        if (request.query() == null || request.query().isBlank()) throw new IllegalArgumentException("query must not be blank");
    }
}

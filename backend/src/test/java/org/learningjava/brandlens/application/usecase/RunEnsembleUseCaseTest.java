package org.learningjava.brandlens.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.brandlens.application.port.SimulatorPort;
import org.learningjava.brandlens.config.EnsembleProperties;
import org.learningjava.brandlens.domain.exception.EnsembleFailedException;
import org.learningjava.brandlens.domain.exception.SimulationException;
import org.learningjava.brandlens.domain.model.*;
import org.learningjava.brandlens.domain.service.aggregation.BrandAggregator;
import org.learningjava.brandlens.domain.service.aggregation.RepresentativeRunSelector;
import org.learningjava.brandlens.domain.service.aggregation.TargetBrandAnalyzer;
import org.learningjava.brandlens.domain.service.extraction.BrandExtractor;
import org.learningjava.brandlens.domain.service.extraction.BrandVisibilityChecker;
import org.learningjava.brandlens.domain.service.extraction.ExtractionInput;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RunEnsembleUseCaseTest {

    private static final TargetBrand ACME = new TargetBrand("Acme", "acme.com");

    private SimulatorPort simulator;
    private BrandExtractor extractor;
    private TrialPacer pacer;
    private RunEnsembleUseCase useCase;

    @BeforeEach
    void setUp() {
        simulator = mock(SimulatorPort.class);
        extractor = mock(BrandExtractor.class);
        pacer = mock(TrialPacer.class);

        BrandVisibilityChecker checker = new BrandVisibilityChecker();
        useCase = new RunEnsembleUseCase(simulator, extractor, new BrandAggregator(),
                new TargetBrandAnalyzer(checker), new RepresentativeRunSelector(checker), pacer, new EnsembleProperties());
    }

    // --- helpers -------------------------------------------------------------

    private static BrandExtractionResult brands(String... names) {
        List<ExtractedBrand> list = Arrays.stream(names)
                .map(n -> new ExtractedBrand(n, ExtractedBrand.normalize(n), null, true, false, 1, 0,
                        Confidence.HIGH, "Mentioned 1x in answer"))
                .toList();
        return new BrandExtractionResult(List.of(), List.of(), List.of(), list, SourceAnalysis.none());
    }

    private static SimulationOutput answer(String text, String... urls) {
        return new SimulationOutput(text, Arrays.stream(urls).map(SourceReference::new).toList());
    }

    private static EnsembleRequest request(TargetBrand target, Integer runs, boolean stats) {
        return new EnsembleRequest(Engine.CHATGPT, "best crm", Language.EN, Region.GLOBAL, target, runs, stats);
    }

    // --- tests ----------------------------------------------------------------

    @Test
    void toleratesFailedTrial_andAggregatesOverSuccessfulOnes() throws Exception {
        // Arrange
        when(simulator.simulate(Engine.CHATGPT, "best crm", Language.EN, Region.GLOBAL))
                .thenReturn(answer("a0", "https://acme.com/a?utm_source=x"),
                        answer("a1", "https://acme.com/a", "https://www.foo.io/x"))
                .thenThrow(new SimulationException(Engine.CHATGPT, "rate limited"))
                .thenReturn(answer("a3"), answer("a4"));
        when(extractor.extract(any(ExtractionInput.class)))
                .thenReturn(brands("Acme", "Foo"), brands("Acme", "Bar"), brands("Acme"), brands("Foo"));
        List<Integer> finished = new ArrayList<>();

        // Act
        EnsembleSimulationResult result = useCase.run(request(ACME, 5, true), (r, total) -> finished.add(r.index()));

        // Assert: trials
        assertEquals(List.of(0, 1, 2, 3, 4), finished);
        assertEquals(5, result.totalRuns());
        assertEquals(4, result.successfulRuns());
        assertEquals(5, result.runResults().size());
        assertFalse(result.runResults().get(2).success());
        assertEquals("rate limited", result.runResults().get(2).error());
        verify(pacer, times(4)).pause(Duration.ofMillis(500));

        // Assert: target
        TargetBrandResult target = result.targetBrandResult();
        assertEquals(0.75, target.visibilityFrequency(), 1e-9);
        assertEquals(PresenceLevel.DEFINITE_PRESENT, target.presenceLevel());
        assertEquals(Confidence.MEDIUM, target.confidence());
        assertTrue(target.statisticallySignificant());
        assertEquals(List.of(0, 1, 3, 4), target.runResults().stream().map(TargetRunResult::runIndex).toList());

        // Assert: brands, sources, representative run
        assertEquals(List.of("acme", "foo", "bar"),
                result.allBrands().stream().map(EnsembleBrandResult::normalizedName).toList());
        assertEquals(2, result.allSources().size());
        assertEquals("https://acme.com/a?utm_source=x", result.allSources().get(0).url());
        assertEquals(List.of("acme.com", "foo.io"), result.uniqueDomains());
        assertEquals(0, result.representativeRunIndex());
        assertEquals("a0", result.representativeAnswer());

        // Assert: notes and variance
        assertThat(result.notes())
                .contains("1 runs failed - results based on 4 runs")
                .contains("High variance in brand detection (33%) - results may be less reliable")
                .noneMatch(n -> n.contains("not statistically significant"));
        VarianceMetrics vm = result.varianceMetrics();
        assertEquals(5, vm.runCount());
        assertEquals(4, vm.successfulRuns());
        assertEquals(1.0 / 3, vm.brandVariance(), 1e-9);
        assertEquals(4, vm.confidenceInterval().sampleSize());
        assertEquals(0.00048125, vm.pValue(), 1e-9);
    }

    @Test
    void passesTargetAndEngineToExtractor_andSourcesSurviveExtractionFailure() {
        when(simulator.simulate(any(), any(), any(), any()))
                .thenReturn(answer("first", "https://acme.com/x"), answer("second", "https://globex.com/y"));
        when(extractor.extract(any()))
                .thenThrow(new IllegalStateException("Cannot reach OpenRouter"))
                .thenReturn(brands("Globex"));

        EnsembleSimulationResult result = useCase.run(request(ACME, 2, false));

        ArgumentCaptor<ExtractionInput> cap = ArgumentCaptor.forClass(ExtractionInput.class);
        verify(extractor, times(2)).extract(cap.capture());
        assertEquals(ACME, cap.getAllValues().get(0).targetBrand());
        assertEquals(Engine.CHATGPT, cap.getAllValues().get(0).engine());
        assertEquals("first", cap.getAllValues().get(0).answerText());

        assertEquals(1, result.successfulRuns());
        assertEquals("Cannot reach OpenRouter", result.runResults().get(0).error());
        assertEquals(List.of("acme.com", "globex.com"), result.uniqueDomains());
        assertEquals(1, result.representativeRunIndex());
        assertNull(result.varianceMetrics());
        assertEquals(PresenceLevel.LIKELY_ABSENT, result.targetBrandResult().presenceLevel());
        assertNull(result.targetBrandResult().pValue());
        assertThat(result.notes()).contains("1 runs failed - results based on 1 runs");
    }

    @Test
    void allTrialsFail_throwsWithTrialErrors() {
        when(simulator.simulate(any(), any(), any(), any()))
                .thenThrow(new SimulationException(Engine.CHATGPT, "timeout"));

        EnsembleFailedException ex = assertThrows(EnsembleFailedException.class,
                () -> useCase.run(request(ACME, null, false)));

        assertEquals("All 5 ensemble runs failed", ex.getMessage());
        assertEquals(5, ex.getRequestedRuns());
        assertEquals(List.of("timeout", "timeout", "timeout", "timeout", "timeout"), ex.getTrialErrors());
        verifyNoInteractions(extractor);
    }

    @Test
    void runCountIsClamped() {
        when(simulator.simulate(any(), any(), any(), any())).thenReturn(answer("ok"));
        when(extractor.extract(any())).thenReturn(brands("Acme"));

        assertEquals(15, useCase.run(request(null, 40, false)).totalRuns());
        assertEquals(1, useCase.run(request(null, 0, false)).totalRuns());
    }

    @Test
    void withoutTarget_noTargetResultOrTargetNotes() {
        when(simulator.simulate(any(), any(), any(), any())).thenReturn(answer("ok", "https://foo.io/"));
        when(extractor.extract(any())).thenReturn(brands("Foo"), brands("Foo"));

        EnsembleSimulationResult result = useCase.run(request(null, 2, true));

        assertNull(result.targetBrandResult());
        assertTrue(result.notes().isEmpty());
        assertFalse(result.varianceMetrics().statisticallySignificant());
        assertNull(result.varianceMetrics().pValue());
        assertEquals(1.0, result.allBrands().get(0).frequency(), 1e-9);
    }

    @Test
    void interruptedBetweenTrials_failsTheEnsemble() throws Exception {
        when(simulator.simulate(any(), any(), any(), any())).thenReturn(answer("ok"));
        when(extractor.extract(any())).thenReturn(brands("Acme"));
        doThrow(new InterruptedException()).when(pacer).pause(any());

        assertThrows(EnsembleFailedException.class, () -> useCase.run(request(ACME, 3, false)));
        assertTrue(Thread.interrupted());
        verify(simulator, times(1)).simulate(any(), any(), any(), any());
    }

    @Test
    void invalidRequests_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> useCase.run(null));
        assertThrows(IllegalArgumentException.class, () -> useCase.run(
                new EnsembleRequest(null, "q", null, null, null, 3, false)));
        assertThrows(IllegalArgumentException.class, () -> useCase.run(
                new EnsembleRequest(Engine.GEMINI, "  ", null, null, null, 3, false)));
        verifyNoInteractions(simulator);
    }

    @Test
    void requestDefaults() {
        EnsembleRequest r = new EnsembleRequest(Engine.GROK, "q", null, null, null, null, false);

        assertEquals(Language.EN, r.language());
        assertEquals(Region.GLOBAL, r.region());
    }
}

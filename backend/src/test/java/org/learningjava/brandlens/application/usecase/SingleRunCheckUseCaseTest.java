package org.learningjava.brandlens.application.usecase;

import org.junit.jupiter.api.Test;
import org.learningjava.brandlens.application.port.SimulatorPort;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.EnsembleRequest;
import org.learningjava.brandlens.domain.model.Language;
import org.learningjava.brandlens.domain.model.Region;
import org.learningjava.brandlens.domain.model.SimulationOutput;
import org.learningjava.brandlens.domain.model.SingleRunCheck;
import org.learningjava.brandlens.domain.model.SingleRunCheck.QuickVisibility;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.model.TargetBrand;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SingleRunCheckUseCaseTest {

    private final TargetBrand acme = new TargetBrand("Acme", "www.acme.com", List.of("ACME Cloud"));

    @Test
    void mentionedInAnswer_isHighConfidence() {
        QuickVisibility v = SingleRunCheckUseCase.quickVisibility(
                new SimulationOutput("Top picks: ACME, Globex.", List.of()), acme);

        assertTrue(v.visible());
        assertEquals(Confidence.HIGH, v.confidence());
        assertEquals(List.of("Mentioned in answer text"), v.evidence());
    }

    @Test
    void citedOnly_isMediumConfidence() {
        QuickVisibility v = SingleRunCheckUseCase.quickVisibility(
                new SimulationOutput("Globex leads.", List.of(new SourceReference("https://blog.acme.com/post"))), acme);

        assertTrue(v.visible());
        assertEquals(Confidence.MEDIUM, v.confidence());
        assertEquals(List.of("Supported by cited sources"), v.evidence());
    }

    @Test
    void neither_isNotVisible() {
        QuickVisibility v = SingleRunCheckUseCase.quickVisibility(
                new SimulationOutput("Globex leads.", List.of(new SourceReference("https://globex.com"))), acme);

        assertFalse(v.visible());
        assertEquals(Confidence.LOW, v.confidence());
        assertEquals(List.of("Not mentioned and not supported by sources"), v.evidence());
    }

    @Test
    void shortNeedlesAreIgnored() {
        TargetBrand hp = new TargetBrand("HP", "hp.com");

        QuickVisibility v = SingleRunCheckUseCase.quickVisibility(
                new SimulationOutput("Use a cheap printer.", List.of(new SourceReference("https://shp.example/"))), hp);

        assertFalse(v.visible());
    }

    @Test
    void check_callsSimulatorOnce() {
        SimulatorPort simulator = mock(SimulatorPort.class);
        SimulationOutput sim = new SimulationOutput("Acme is great", List.of());
        when(simulator.simulate(Engine.PERPLEXITY, "crm", Language.EN, Region.GLOBAL)).thenReturn(sim);
        SingleRunCheckUseCase useCase = new SingleRunCheckUseCase(simulator);

        SingleRunCheck withTarget = useCase.check(
                new EnsembleRequest(Engine.PERPLEXITY, "crm", null, null, acme, null, false));
        SingleRunCheck withoutTarget = useCase.check(
                new EnsembleRequest(Engine.PERPLEXITY, "crm", null, null, null, null, false));

        assertSame(sim, withTarget.simulation());
        assertTrue(withTarget.targetVisibility().visible());
        assertNull(withoutTarget.targetVisibility());
        verify(simulator, times(2)).simulate(Engine.PERPLEXITY, "crm", Language.EN, Region.GLOBAL);
    }

    @Test
    void blankQuery_isRejected() {
        SingleRunCheckUseCase useCase = new SingleRunCheckUseCase(mock(SimulatorPort.class));

        assertThrows(IllegalArgumentException.class, () -> useCase.check(
                new EnsembleRequest(Engine.CHATGPT, "", null, null, null, null, false)));
    }
}

package org.learningjava.brandlens.application.usecase;

import org.learningjava.brandlens.application.port.SimulatorPort;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.EnsembleRequest;
import org.learningjava.brandlens.domain.model.SimulationOutput;
import org.learningjava.brandlens.domain.model.SingleRunCheck;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * One simulator call and a plain text check for the target, without the extraction pass.
 * Visibility is all or nothing; use {@link RunEnsembleUseCase} for frequencies.
 */
@Service
public class SingleRunCheckUseCase {

    private static final Logger log = LoggerFactory.getLogger(SingleRunCheckUseCase.class);

    private static final int MIN_NEEDLE_LENGTH = 3;

    private final SimulatorPort simulator;

    public SingleRunCheckUseCase(SimulatorPort simulator) {
        this.simulator = simulator;
    }

    public SingleRunCheck check(EnsembleRequest request) {
        if (request == null || request.engine() == null) throw new IllegalArgumentException("engine is required");
        if (request.query() == null || request.query().isBlank()) throw new IllegalArgumentException("query must not be blank");

        SimulationOutput sim = simulator.simulate(request.engine(), request.query(), request.language(), request.region());
        TargetBrand target = request.targetBrand();
        if (target == null) {
            return new SingleRunCheck(sim, null);
        }

        SingleRunCheck.QuickVisibility visibility = quickVisibility(sim, target);
        log.info("Quick check {} for \"{}\": visible={} ({})",
                request.engine().id(), target.name(), visibility.visible(), visibility.confidence().id());
        return new SingleRunCheck(sim, visibility);
    }

    static SingleRunCheck.QuickVisibility quickVisibility(SimulationOutput sim, TargetBrand target) {
        String answer = sim.answerText().toLowerCase(Locale.ROOT);
        String domain = target.domain().toLowerCase(Locale.ROOT).replaceFirst("^www\\.", "");
        String core = DomainNormalizer.extractDomainCore(domain);

        List<String> needles = Stream.concat(Stream.of(target.name(), domain, core), target.aliases().stream())
                .filter(s -> s != null)
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> s.length() >= MIN_NEEDLE_LENGTH)
                .toList();

        boolean mentioned = needles.stream().anyMatch(answer::contains);
        boolean supported = core.length() >= MIN_NEEDLE_LENGTH && sim.sources().stream()
                .map(SourceReference::url)
                .anyMatch(u -> u != null && u.toLowerCase(Locale.ROOT).contains(core));

        List<String> evidence = new ArrayList<>();
        if (mentioned) evidence.add("Mentioned in answer text");
        if (supported) evidence.add("Supported by cited sources");
        if (evidence.isEmpty()) evidence.add("Not mentioned and not supported by sources");

        Confidence confidence = mentioned ? Confidence.HIGH : supported ? Confidence.MEDIUM : Confidence.LOW;
        return new SingleRunCheck.QuickVisibility(mentioned || supported, confidence, evidence);
    }
}

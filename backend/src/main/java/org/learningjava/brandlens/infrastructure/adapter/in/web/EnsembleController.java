package org.learningjava.brandlens.infrastructure.adapter.in.web;

import org.learningjava.brandlens.application.usecase.RunEnsembleUseCase;
import org.learningjava.brandlens.application.usecase.SingleRunCheckUseCase;
import org.learningjava.brandlens.config.EnsembleProperties;
import org.learningjava.brandlens.domain.exception.EnsembleFailedException;
import org.learningjava.brandlens.domain.model.EnsembleRequest;
import org.learningjava.brandlens.domain.model.EnsembleSimulationResult;
import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.Language;
import org.learningjava.brandlens.domain.model.Region;
import org.learningjava.brandlens.domain.model.SingleRunCheck;
import org.learningjava.brandlens.infrastructure.adapter.in.web.admin.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/ensemble")
public class EnsembleController {

    private static final Logger log = LoggerFactory.getLogger(EnsembleController.class);

    private final RunEnsembleUseCase ensemble;
    private final SingleRunCheckUseCase quickCheck;
    private final JobRegistry jobs;
    private final Executor executor;
    private final EnsembleProperties props;

    public EnsembleController(RunEnsembleUseCase ensemble,
                              SingleRunCheckUseCase quickCheck,
                              JobRegistry jobs,
                              @Qualifier("applicationTaskExecutor") Executor executor,
                              EnsembleProperties props) {
        this.ensemble = ensemble;
        this.quickCheck = quickCheck;
        this.jobs = jobs;
        this.executor = executor;
        this.props = props;
    }

    @PostMapping("/run")
    public EnsembleSimulationResult run(@RequestBody EnsembleRequest request) {
        try {
            return ensemble.run(request);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (EnsembleFailedException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }

    // --- async variant: same request, polled through /jobs/{id}
    @PostMapping("/jobs")
    public Map<String, Object> submit(@RequestBody EnsembleRequest request) {
        if (request.engine() == null || request.query() == null || request.query().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "engine and query are required");
        }
        int total = props.clampRunCount(request.runCount());
        String jobId = jobs.start(JobRegistry.ENSEMBLE, total);

        try {
            executor.execute(() -> {
                try {
                    log.info("[{}] Ensemble job start: {} \"{}\"", jobId, request.engine().id(), request.query());
                    EnsembleSimulationResult result = ensemble.run(request,
                            (trial, runs) -> jobs.update(jobId, trial.index() + 1,
                                    "Run " + (trial.index() + 1) + "/" + runs + (trial.success() ? " done" : " failed")));
                    jobs.done(jobId, result.successfulRuns() + "/" + result.totalRuns() + " runs successful", result);
                    log.info("[{}] Ensemble job done", jobId);
                } catch (Exception e) {
                    jobs.fail(jobId, e.getMessage());
                    log.error("[{}] Ensemble job failed: {}", jobId, e.toString(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            jobs.fail(jobId, "Too many ensemble jobs queued");
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many ensemble jobs queued", e);
        }

        return Map.of("jobId", jobId);
    }

    @GetMapping("/jobs/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        }
        return status;
    }

    @PostMapping("/check")
    public SingleRunCheck check(@RequestBody EnsembleRequest request) {
        try {
            return quickCheck.check(request);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/options")
    public Map<String, Object> options() {
        return Map.of(
                "engines", Arrays.stream(Engine.values()).map(e -> option(e.id(), e.label())).toList(),
                "languages", Arrays.stream(Language.values()).map(l -> option(l.id(), l.displayName())).toList(),
                "regions", Arrays.stream(Region.values()).map(r -> option(r.id(), r.label())).toList(),
                "runCount", Map.of("default", props.getDefaultRunCount(), "min", props.getMinRuns(), "max", props.getMaxRuns())
        );
    }

    private static Map<String, String> option(String id, String label) {
        return Map.of("id", id, "label", label);
    }
}

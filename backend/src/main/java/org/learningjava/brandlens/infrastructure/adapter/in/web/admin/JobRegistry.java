package org.learningjava.brandlens.infrastructure.adapter.in.web.admin;

import org.learningjava.brandlens.domain.model.EnsembleSimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory job table for async ensembles. Running jobs are always kept; only the most recent
 * {@code brandlens.jobs.retained-finished} DONE/FAILED jobs stay queryable, oldest evicted first.
 */
@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);
    static final int DEFAULT_RETAINED_FINISHED = 50;

    public static final String ENSEMBLE = "ENSEMBLE";

    public enum JobState { RUNNING, DONE, FAILED }

    public record JobStatus(
            String id,
            String type,
            JobState state,
            String message,
            int processed,
            int total,
            EnsembleSimulationResult result   // set once DONE
    ) {}

    private final Map<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();   // guarded by itself
    private final int retainedFinished;

    public JobRegistry() {
        this(DEFAULT_RETAINED_FINISHED);
    }

    @Autowired
    public JobRegistry(@Value("${brandlens.jobs.retained-finished:50}") int retainedFinished) {
        this.retainedFinished = Math.max(retainedFinished, 1);
    }

    public String start(String type, int total) {
        String id = UUID.randomUUID().toString();
        jobs.put(id, new JobStatus(id, type, JobState.RUNNING, "Started", 0, Math.max(total, 0), null));
        return id;
    }

    public void update(String id, int processed, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : placeholder(id);
            return new JobStatus(id, cur.type(), JobState.RUNNING, message != null ? message : cur.message(),
                    processed, cur.total(), null);
        });
    }

    public void done(String id, String message, EnsembleSimulationResult result) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : placeholder(id);
            int total = cur.total();
            return new JobStatus(id, cur.type(), JobState.DONE, message != null ? message : "Done", total, total, result);
        });
        retire(id);
    }

    public void fail(String id, String message) {
        jobs.compute(id, (k, j) -> {
            JobStatus cur = j != null ? j : placeholder(id);
            return new JobStatus(id, cur.type(), JobState.FAILED, message != null ? message : "Failed",
                    cur.processed(), cur.total(), null);
        });
        retire(id);
    }

    public JobStatus get(String id) {
        return jobs.get(id);
    }

    public int size() {
        return jobs.size();
    }

    private void retire(String id) {
        synchronized (finished) {
            if (finished.contains(id)) return;
            finished.addLast(id);
            while (finished.size() > retainedFinished) {
                String oldest = finished.pollFirst();
                jobs.remove(oldest);
                log.debug("Evicted finished job {}", oldest);
            }
        }
    }

    private static JobStatus placeholder(String id) {
        return new JobStatus(id, ENSEMBLE, JobState.RUNNING, "Started", 0, 0, null);
    }
}

package io.github.yok.doltsync.core;

import io.github.yok.doltsync.config.SyncConfig;
import io.github.yok.doltsync.model.SyncResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs independent sync jobs on a bounded thread pool.
 *
 * <p>
 * At most {@code sync.parallelism} jobs run at the same time. A failing job does not stop the
 * others; every job yields a {@link JobOutcome}. When the calling thread is interrupted, running
 * jobs are interrupted too and stop with {@code CANCELLED} at their next batch boundary.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncJobRunner {

    private final SyncService syncService;
    private final SyncConfig syncConfig;

    /**
     * Result of one job: either a sync result or the error that ended it.
     */
    @Value
    public static class JobOutcome {
        SyncJob job;
        SyncResult result;
        Exception error;

        /**
         * Returns whether the job finished without error and was not cancelled.
         *
         * @return {@code true} on success
         */
        public boolean isSuccess() {
            return error == null && result != null && result.isComplete();
        }
    }

    /**
     * Runs the jobs and waits for all of them.
     *
     * @param jobs jobs
     * @return outcomes in job order
     */
    public List<JobOutcome> runAll(List<SyncJob> jobs) {
        if (jobs.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(syncConfig.getParallelism(), jobs.size()));
        log.info("Running {} sync job(s) with parallelism {}", jobs.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<SyncResult>> futures = new ArrayList<>(jobs.size());
        try {
            for (SyncJob job : jobs) {
                futures.add(executor.submit(() -> run(job)));
            }
            List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
            for (int i = 0; i < jobs.size(); i++) {
                outcomes.add(await(jobs.get(i), futures.get(i)));
            }
            return outcomes;
        } catch (InterruptedException e) {
            log.warn("Interrupted; cancelling {} sync job(s)", jobs.size());
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
            jobs.forEach(job -> outcomes.add(new JobOutcome(job, null, e)));
            return outcomes;
        } finally {
            shutdown(executor, 30);
        }
    }

    private SyncResult run(SyncJob job) {
        log.info("Starting sync job {}", job);
        return syncService.syncTable(job.getTable(), job.getTargetId(), job.getDirection(),
                job.getToRef(), job.getBatchSize());
    }

    private JobOutcome await(SyncJob job, Future<SyncResult> future)
            throws InterruptedException {
        try {
            SyncResult result = future.get();
            log.info("Sync job {} finished: {} ({} row(s))", job, result.getPhase(),
                    result.getRowsApplied());
            return new JobOutcome(job, result, null);
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            log.error("Sync job {} failed: {}", job, cause.getMessage(), cause);
            return new JobOutcome(job, null, cause);
        }
    }

    private void shutdown(ExecutorService executor, int timeoutSeconds) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in {}s, forcing shutdown", timeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

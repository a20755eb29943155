package cronmanager.coordinator.scheduler;

import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.scheduler.JobEvaluator.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One monitor pass over every running job.
 *
 * Jobs are evaluated on a bounded worker pool and a tick returns only after
 * all of them are done, so consecutive ticks never overlap. A store failure
 * while listing jobs is thrown to the caller; failures evaluating a single
 * job are logged and the job is retried on the next tick.
 */
public class JobMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobMonitor.class);

    private final JobRepository jobRepository;
    private final JobEvaluator evaluator;
    private final ExecutorService workers;

    public JobMonitor(JobRepository jobRepository, JobEvaluator evaluator, int concurrency) {
        this.jobRepository = jobRepository;
        this.evaluator = evaluator;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, concurrency), r -> {
            Thread t = new Thread(r, "cron-manager-monitor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return how many jobs ended up in each outcome; failed evaluations are not counted
     */
    public Map<Outcome, Integer> tick() {
        List<Job> running = jobRepository.findByStatus(JobStatus.RUNNING);
        Map<Outcome, Integer> outcomes = new EnumMap<>(Outcome.class);
        if (running.isEmpty()) {
            log.debug("No running jobs");
            return outcomes;
        }

        List<Callable<Outcome>> tasks = new ArrayList<>(running.size());
        for (Job job : running) {
            tasks.add(() -> evaluate(job));
        }

        List<Future<Outcome>> results;
        try {
            results = workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Monitor tick interrupted");
            return outcomes;
        }

        int errors = 0;
        for (Future<Outcome> result : results) {
            try {
                outcomes.merge(result.get(), 1, Integer::sum);
            } catch (ExecutionException e) {
                errors++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return outcomes;
            }
        }

        log.debug("Monitor tick over {} running job(s): {} ({} errors)", running.size(), outcomes, errors);
        return outcomes;
    }

    private Outcome evaluate(Job job) {
        try (MDC.MDCCloseable j = MDC.putCloseable("job-id", String.valueOf(job.id()));
                MDC.MDCCloseable m = job.hasMachine() ? MDC.putCloseable("machine-id", job.machineId()) : null) {
            try {
                return evaluator.evaluate(job);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate job {}: {}", job.id(), e.getMessage(), e);
                throw e;
            }
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package cronmanager.coordinator.scheduler;

import cronmanager.coordinator.config.ManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link JobMonitor} ticks on a single background thread.
 *
 * Ticks are scheduled with a fixed delay, so the next one starts only after
 * the previous one has drained. An exception escaping a tick ends the loop;
 * {@link #awaitTermination()} rethrows it so the process can exit and be
 * restarted by its supervisor.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobMonitor monitor;
    private final ManagerConfig config;

    private volatile boolean running = false;
    private volatile ScheduledFuture<?> monitorFuture;

    public Scheduler(JobMonitor monitor, ManagerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-manager-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.monitor = monitor;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.monitorInterval().toMillis();
        monitorFuture = executor.scheduleWithFixedDelay(
                wrapRunnable("job-monitor", monitor::tick),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Job monitor scheduled every {}ms", intervalMs);
    }

    /**
     * Block until the monitor loop ends.
     *
     * @throws IllegalStateException wrapping whatever stopped the loop, unless it was {@link #stop()}
     */
    public void awaitTermination() throws InterruptedException {
        ScheduledFuture<?> future = monitorFuture;
        if (future == null) {
            throw new IllegalStateException("Scheduler not started");
        }
        try {
            future.get();
        } catch (CancellationException e) {
            log.info("Job monitor stopped");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job monitor stopped: " + e.getCause().getMessage(), e.getCause());
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        if (monitorFuture != null) {
            monitorFuture.cancel(false);
        }
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Log and rethrow: the scheduled executor suppresses later runs once a run throws.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("{} failed, stopping", name, e);
                throw e;
            }
        };
    }
}

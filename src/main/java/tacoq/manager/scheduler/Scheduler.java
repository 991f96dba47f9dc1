package tacoq.manager.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordinates the background loops:
 * - Dispatcher: periodic passes plus immediate passes on nudge
 * - LivenessDetector: periodic heartbeat sweep
 * - ResultConsumer: blocking consumer of the results queue
 *
 * Each loop has its own thread so a slow dispatch cannot delay death detection.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService dispatchExecutor;
    private final ScheduledExecutorService livenessExecutor;
    private final ExecutorService consumerExecutor;
    private final Dispatcher dispatcher;
    private final LivenessDetector livenessDetector;
    private final ResultConsumer resultConsumer;
    private final ManagerConfig config;
    private final AtomicBoolean nudgePending = new AtomicBoolean(false);

    private volatile boolean running = false;

    public Scheduler(Dispatcher dispatcher, LivenessDetector livenessDetector, ResultConsumer resultConsumer,
            ManagerConfig config) {
        this.dispatchExecutor = Executors.newSingleThreadScheduledExecutor(daemon("tacoq-dispatcher"));
        this.livenessExecutor = Executors.newSingleThreadScheduledExecutor(daemon("tacoq-liveness"));
        this.consumerExecutor = Executors.newSingleThreadExecutor(daemon("tacoq-results"));
        this.dispatcher = dispatcher;
        this.livenessDetector = livenessDetector;
        this.resultConsumer = resultConsumer;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long dispatchIntervalMs = config.dispatchInterval().toMillis();
        dispatchExecutor.scheduleWithFixedDelay(
                wrapRunnable("dispatcher", dispatcher),
                0,
                dispatchIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Dispatcher scheduled every {}ms", dispatchIntervalMs);

        long sweepIntervalMs = config.livenessSweepInterval().toMillis();
        livenessExecutor.scheduleAtFixedRate(
                wrapRunnable("liveness-detector", livenessDetector),
                sweepIntervalMs,
                sweepIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Liveness sweep scheduled every {}ms", sweepIntervalMs);

        consumerExecutor.submit(resultConsumer);

        log.info("Scheduler started");
    }

    /**
     * Request a dispatch pass as soon as possible. Requests made while one is
     * already waiting are merged into it.
     */
    public void nudgeDispatcher() {
        if (!running || !nudgePending.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> {
                nudgePending.set(false);
                wrapRunnable("dispatcher", dispatcher).run();
            });
        } catch (RejectedExecutionException e) {
            nudgePending.set(false);
            log.debug("Dispatcher nudge rejected, scheduler is stopping");
        }
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        resultConsumer.stop();
        dispatchExecutor.shutdown();
        livenessExecutor.shutdown();
        consumerExecutor.shutdown();

        try {
            boolean clean = dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)
                    & livenessExecutor.awaitTermination(5, TimeUnit.SECONDS)
                    & consumerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!clean) {
                dispatchExecutor.shutdownNow();
                livenessExecutor.shutdownNow();
                consumerExecutor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            livenessExecutor.shutdownNow();
            consumerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check if scheduler is running.
     */
    public boolean isRunning() {
        return running;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public LivenessDetector livenessDetector() {
        return livenessDetector;
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}

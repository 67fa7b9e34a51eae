package com.patina.orchestrator.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole owner of worker process handles.
 *
 * Nothing else may destroy a worker: timeouts, cancellation and protocol
 * violations are all sent here as a {@link TerminationCause}, and the
 * destruction itself runs on the watchdog's single scheduler thread.
 */
public class Watchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final ScheduledExecutorService scheduler;

    public Watchdog(String name) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start watching {@code process}: it is destroyed once {@code deadline}
     * passes or {@code cancel} fires, whichever comes first.
     */
    public Watch watch(Process process, Duration deadline, CancellationSignal cancel) {
        Watch watch = new Watch(process);
        watch.timer = scheduler.schedule(() -> watch.terminate(TerminationCause.WALL_CLOCK),
                deadline.toMillis(), TimeUnit.MILLISECONDS);
        cancel.onCancel(() -> watch.terminate(TerminationCause.CANCELLED));
        return watch;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /** Handle on one watched worker. Callers only ever send it a cause. */
    public final class Watch implements AutoCloseable {

        private final Process process;
        private final AtomicReference<TerminationCause> cause = new AtomicReference<>();
        private volatile ScheduledFuture<?> timer;

        private Watch(Process process) {
            this.process = process;
        }

        /** Record {@code reason} (if no earlier cause exists) and destroy the worker. */
        public void terminate(TerminationCause reason) {
            if (cause.compareAndSet(null, reason) && reason != TerminationCause.COMPLETED) {
                log.info("Terminating worker pid={} ({})", process.pid(), reason);
            }
            try {
                scheduler.execute(this::destroy);
            } catch (RejectedExecutionException e) {
                // scheduler already shut down with the engine
                destroy();
            }
        }

        public TerminationCause cause() {
            return cause.get();
        }

        public boolean isAlive() {
            return process.isAlive();
        }

        /** Normal end of a worker: cancel the timer and reap the process. */
        @Override
        public void close() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
            terminate(TerminationCause.COMPLETED);
        }

        private void destroy() {
            if (process.isAlive()) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }
    }
}

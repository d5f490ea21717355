package org.ascenoria.content.reload;

import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;
import org.ascenoria.content.api.SnapshotHandle;
import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.pipeline.SnapshotLoader;
import org.ascenoria.service.AbstractService;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Re-runs the content pipeline on change events and republishes the result.
 * <p>
 * Change events are offered to a bounded queue consumed only by the service thread, which runs
 * the state machine:
 * <ul>
 *   <li>IDLE: wait for an event, then debounce until no event arrived for the debounce window.</li>
 *   <li>LOADING: run the loader on the worker thread. An event arriving meanwhile cancels the run
 *       and restarts loading after another debounce.</li>
 *   <li>PUBLISHING: swap the snapshot on success. On failure keep the current snapshot, log the
 *       diagnostics and go back to IDLE.</li>
 * </ul>
 * Only the run started last is ever published; the worker executes one run at a time.
 */
public class HotReloadSupervisor extends AbstractService {

    private final SnapshotLoader loader;
    private final SnapshotHandle handle;
    private final ChangeSource changeSource;
    private final BlockingQueue<ChangeEvent> events;
    private final Duration debounce;
    private final Duration pollInterval;

    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.IDLE);
    private final AtomicLong reloadsPublished = new AtomicLong();
    private final AtomicLong reloadsFailed = new AtomicLong();
    private final AtomicLong reloadsSuperseded = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicBoolean lastReloadFailed = new AtomicBoolean();

    /**
     * @param loader        Builds candidate snapshots.
     * @param handle        Receives published snapshots.
     * @param changeSource  Emits file-system events, or {@code null} for manual reloads only.
     * @param queueCapacity Capacity of the event queue.
     * @param debounce      Quiet period required before loading.
     * @param pollInterval  How often a running load checks for newer events.
     */
    public HotReloadSupervisor(SnapshotLoader loader, SnapshotHandle handle, ChangeSource changeSource,
                               int queueCapacity, Duration debounce, Duration pollInterval) {
        super("content-reload");
        this.loader = loader;
        this.handle = handle;
        this.changeSource = changeSource;
        this.events = new ArrayBlockingQueue<>(queueCapacity);
        this.debounce = debounce;
        this.pollInterval = pollInterval;
    }

    /**
     * Offers an event without blocking. When the queue is full a reload is already pending,
     * so the event is dropped.
     *
     * @param event The event.
     * @return {@code true} if the event was queued.
     */
    public boolean offer(ChangeEvent event) {
        final boolean queued = events.offer(event);
        if (!queued) {
            eventsDropped.incrementAndGet();
        }
        return queued;
    }

    /**
     * Requests a reload regardless of file-system activity.
     */
    public void requestReload() {
        offer(ChangeEvent.manual());
    }

    public SupervisorState getSupervisorState() {
        return state.get();
    }

    @Override
    protected void run() throws InterruptedException {
        final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "content-loader");
            thread.setDaemon(true);
            return thread;
        });
        try {
            if (changeSource != null) {
                try {
                    changeSource.start(this::offer);
                } catch (IOException e) {
                    log.error("Cannot watch content directories: {}", e.getMessage());
                    throw new IllegalStateException("Failed to start file watching", e);
                }
            }
            while (!Thread.currentThread().isInterrupted()) {
                state.set(SupervisorState.IDLE);
                events.take();
                awaitQuiet();
                reload(worker);
            }
        } finally {
            state.set(SupervisorState.IDLE);
            worker.shutdownNow();
            if (changeSource != null) {
                changeSource.close();
            }
        }
    }

    /**
     * Drains events until none arrived for the debounce window.
     */
    private void awaitQuiet() throws InterruptedException {
        long deadline = System.nanoTime() + debounce.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            if (events.poll(remaining, TimeUnit.NANOSECONDS) != null) {
                deadline = System.nanoTime() + debounce.toNanos();
            }
        }
    }

    private void reload(ExecutorService worker) throws InterruptedException {
        while (true) {
            state.set(SupervisorState.LOADING);
            final AtomicBoolean cancelled = new AtomicBoolean();
            final Future<Snapshot> run = worker.submit(() -> loader.load(cancelled::get));
            if (awaitOrSupersede(run, cancelled)) {
                awaitQuiet();
                continue;
            }
            complete(run);
            return;
        }
    }

    /**
     * @return {@code true} if a newer event superseded the run.
     */
    private boolean awaitOrSupersede(Future<Snapshot> run, AtomicBoolean cancelled) throws InterruptedException {
        try {
            while (true) {
                try {
                    run.get(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    return false;
                } catch (TimeoutException e) {
                    if (!events.isEmpty()) {
                        cancelled.set(true);
                        run.cancel(false);
                        reloadsSuperseded.incrementAndGet();
                        log.debug("Content load superseded by a newer change");
                        return true;
                    }
                } catch (ExecutionException | CancellationException e) {
                    return false;
                }
            }
        } catch (InterruptedException e) {
            cancelled.set(true);
            run.cancel(false);
            throw e;
        }
    }

    private void complete(Future<Snapshot> run) throws InterruptedException {
        final Snapshot snapshot;
        try {
            snapshot = run.get();
        } catch (ExecutionException e) {
            fail(e.getCause());
            return;
        }
        state.set(SupervisorState.PUBLISHING);
        handle.publish(snapshot);
        reloadsPublished.incrementAndGet();
        lastReloadFailed.set(false);
        log.info("Published content generation {} ({} warning(s))", snapshot.generation(), snapshot.diagnostics().size());
    }

    private void fail(Throwable cause) {
        reloadsFailed.incrementAndGet();
        lastReloadFailed.set(true);
        final String kept = handle.isPublished() ? "generation " + handle.current().generation() : "no snapshot";
        if (cause instanceof ContentLoadException loadFailure) {
            final String fatal = loadFailure.fatalDiagnostics().stream()
                    .map(Diagnostic::toString)
                    .collect(Collectors.joining("; "));
            log.warn("Content reload rejected, keeping {}: {}", kept, fatal);
            recordError("RELOAD_REJECTED", loadFailure.getMessage(), fatal);
        } else {
            log.warn("Content reload failed, keeping {}: {}", kept, cause.toString());
            log.debug("Exception details:", cause);
            recordError("RELOAD_FAILED", String.valueOf(cause.getMessage()), cause.getClass().getName());
        }
    }

    /**
     * Healthy while the service runs and the most recent reload did not fail. Earlier failures
     * stay visible through {@link #getErrors()}.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && !lastReloadFailed.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("reloads_published", reloadsPublished.get());
        metrics.put("reloads_failed", reloadsFailed.get());
        metrics.put("reloads_superseded", reloadsSuperseded.get());
        metrics.put("events_dropped", eventsDropped.get());
        metrics.put("queue_size", events.size());
        metrics.put("current_generation", handle.isPublished() ? handle.current().generation() : 0);
    }
}

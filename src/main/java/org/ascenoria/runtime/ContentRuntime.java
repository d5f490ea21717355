package org.ascenoria.runtime;

import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;
import org.ascenoria.content.api.SnapshotHandle;
import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.pipeline.ContentPipeline;
import org.ascenoria.content.reload.FileSystemChangeSource;
import org.ascenoria.content.reload.HotReloadSupervisor;
import org.ascenoria.service.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Owns the content snapshot for the lifetime of the process.
 * <p>
 * {@link #start()} performs the initial load synchronously; if it fails there is no snapshot to
 * fall back to, so the failure is terminal. Afterwards the hot-reload supervisor, when enabled,
 * is the only component that replaces the snapshot.
 */
public final class ContentRuntime {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentRuntime.class);

    private final ContentSettings settings;
    private final ContentPipeline pipeline;
    private final SnapshotHandle handle = new SnapshotHandle();
    private HotReloadSupervisor supervisor;
    private Thread shutdownHook;

    public ContentRuntime(final ContentSettings settings) {
        this(settings, ContentPipeline.fromSettings(settings));
    }

    ContentRuntime(final ContentSettings settings, final ContentPipeline pipeline) {
        this.settings = settings;
        this.pipeline = pipeline;
    }

    /**
     * Loads and publishes the first snapshot, then starts hot reloading if enabled.
     *
     * @throws ContentLoadException if the initial load has fatal diagnostics.
     * @throws IllegalStateException if the runtime was already started.
     */
    public synchronized void start() throws ContentLoadException {
        if (handle.isPublished()) {
            throw new IllegalStateException("Content runtime already started");
        }
        final Snapshot initial;
        try {
            initial = pipeline.load();
        } catch (final ContentLoadException e) {
            LOGGER.error("Initial content load failed with {} fatal diagnostic(s)", e.fatalDiagnostics().size());
            for (final Diagnostic diagnostic : e.fatalDiagnostics()) {
                LOGGER.error("  {}", diagnostic);
            }
            throw e;
        }
        handle.publish(initial);
        LOGGER.info("Loaded content generation {} from {} ({} warning(s))",
                initial.generation(), initial.sources(), initial.diagnostics().size());

        if (settings.hotReload().enabled()) {
            final ContentSettings.HotReload reload = settings.hotReload();
            supervisor = new HotReloadSupervisor(pipeline, handle,
                    new FileSystemChangeSource(List.of(pipeline.baseDirectory(), pipeline.modsDirectory())),
                    reload.queueCapacity(), reload.debounce(), reload.pollInterval());
            supervisor.start();
        }

        shutdownHook = new Thread(this::stop, "content-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Stops hot reloading. The last snapshot stays readable.
     */
    public synchronized void stop() {
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        shutdownHook = null;
        if (supervisor != null && supervisor.getCurrentState() == IService.State.RUNNING) {
            supervisor.stop();
        }
        supervisor = null;
    }

    /**
     * @return The handle through which consumers read the current snapshot.
     */
    public SnapshotHandle snapshots() {
        return handle;
    }

    /**
     * @return The supervisor, or {@code null} when hot reloading is disabled or stopped.
     */
    public HotReloadSupervisor supervisor() {
        return supervisor;
    }
}

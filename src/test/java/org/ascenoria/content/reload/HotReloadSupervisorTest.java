package org.ascenoria.content.reload;

import org.ascenoria.content.api.CancellationSignal;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;
import org.ascenoria.content.api.SnapshotHandle;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.pipeline.ContentPipeline;
import org.ascenoria.content.pipeline.SnapshotLoader;
import org.ascenoria.junit.extensions.logging.AllowLog;
import org.ascenoria.junit.extensions.logging.LogLevel;
import org.ascenoria.junit.extensions.logging.LogWatchExtension;
import org.ascenoria.service.IService;
import org.ascenoria.service.OperationalError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.ascenoria.content.ContentFixtures.basePackWithBuilding;
import static org.ascenoria.content.ContentFixtures.building;
import static org.ascenoria.content.ContentFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class HotReloadSupervisorTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(30);
    private static final Duration POLL = Duration.ofMillis(10);

    @TempDir
    Path root;

    private Path buildings;
    private ContentPipeline pipeline;
    private SnapshotHandle handle;
    private HotReloadSupervisor supervisor;

    @BeforeEach
    void setUp() throws ContentLoadException {
        Path base = basePackWithBuilding(root, "housing", 5);
        buildings = base.resolve("surface_buildings.toml");
        pipeline = new ContentPipeline(base, root.resolve("mods"), 1, List.of("en", "ru"));
        handle = new SnapshotHandle();
        handle.publish(pipeline.load());
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null && supervisor.getCurrentState() == IService.State.RUNNING) {
            supervisor.stop();
        }
    }

    @Test
    void validEditIsPublished() {
        // given
        supervisor = new HotReloadSupervisor(pipeline, handle, null, 8, DEBOUNCE, POLL);
        supervisor.start();

        // when
        write(buildings, building("housing", 6));
        supervisor.requestReload();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> handle.current().generation() == 2);
        assertThat(housingCost(handle.current())).isEqualTo(6);
        assertThat(supervisor.getMetrics().get("reloads_published")).isEqualTo(1L);
        assertThat(supervisor.getMetrics().get("current_generation")).isEqualTo(2L);
        assertThat(supervisor.isHealthy()).isTrue();
        await().atMost(2, TimeUnit.SECONDS).until(() -> supervisor.getSupervisorState() == SupervisorState.IDLE);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*HotReloadSupervisor", messagePattern = "Content reload rejected, keeping generation 1.*")
    void malformedEditKeepsThePreviousSnapshot() {
        supervisor = new HotReloadSupervisor(pipeline, handle, null, 8, DEBOUNCE, POLL);
        supervisor.start();
        Snapshot before = handle.current();

        // when: the file is saved half-written
        write(buildings, "[[surface_building]]\nid = \"housing\"\nproduction_cost = ");
        supervisor.requestReload();

        // then
        await().atMost(5, TimeUnit.SECONDS).until(() -> supervisor.getMetrics().get("reloads_failed").longValue() == 1);
        assertThat(handle.current()).isSameAs(before);
        assertThat(housingCost(handle.current())).isEqualTo(5);
        assertThat(supervisor.isHealthy()).isFalse();
        assertThat(supervisor.getErrors()).extracting(OperationalError::errorType).containsExactly("RELOAD_REJECTED");
        assertThat(supervisor.getCurrentState()).isEqualTo(IService.State.RUNNING);

        // and a later valid save recovers
        write(buildings, building("housing", 6));
        supervisor.requestReload();
        await().atMost(5, TimeUnit.SECONDS).until(() -> housingCost(handle.current()) == 6);
        assertThat(supervisor.isHealthy()).isTrue();
    }

    @Test
    void newerEventSupersedesTheRunningLoad() throws Exception {
        // given: the first load blocks until it is cancelled
        CountDownLatch firstLoadStarted = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SnapshotLoader loader = signal -> {
            if (calls.incrementAndGet() == 1) {
                firstLoadStarted.countDown();
                waitForCancellation(signal);
            }
            return pipeline.load(signal);
        };
        supervisor = new HotReloadSupervisor(loader, handle, null, 8, DEBOUNCE, POLL);
        supervisor.start();

        // when
        supervisor.requestReload();
        assertThat(firstLoadStarted.await(5, TimeUnit.SECONDS)).isTrue();
        write(buildings, building("housing", 6));
        supervisor.requestReload();

        // then: only the restarted load is published
        await().atMost(5, TimeUnit.SECONDS).until(() -> supervisor.getMetrics().get("reloads_published").longValue() == 1);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(supervisor.getMetrics().get("reloads_superseded")).isEqualTo(1L);
        assertThat(supervisor.getMetrics().get("reloads_failed")).isEqualTo(0L);
        assertThat(housingCost(handle.current())).isEqualTo(6);
        assertThat(handle.current().generation()).isEqualTo(2);
    }

    @Test
    void burstOfEventsCausesOneReload() {
        AtomicInteger calls = new AtomicInteger();
        SnapshotLoader loader = signal -> {
            calls.incrementAndGet();
            return pipeline.load(signal);
        };
        supervisor = new HotReloadSupervisor(loader, handle, null, 64, Duration.ofMillis(200), POLL);
        supervisor.start();

        for (int i = 0; i < 10; i++) {
            supervisor.offer(ChangeEvent.fileChanged(buildings));
        }

        await().atMost(5, TimeUnit.SECONDS).until(() -> handle.current().generation() == 2);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void fullQueueDropsEvents() {
        supervisor = new HotReloadSupervisor(pipeline, handle, null, 1, DEBOUNCE, POLL);

        assertThat(supervisor.offer(ChangeEvent.manual())).isTrue();
        assertThat(supervisor.offer(ChangeEvent.manual())).isFalse();

        assertThat(supervisor.getMetrics())
                .containsEntry("events_dropped", 1L)
                .containsEntry("queue_size", 1)
                .containsEntry("error_count", 0);
    }

    @Test
    void stopsCleanly() {
        supervisor = new HotReloadSupervisor(pipeline, handle, null, 8, DEBOUNCE, POLL);
        supervisor.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> supervisor.getCurrentState() == IService.State.RUNNING);

        supervisor.stop();

        assertThat(supervisor.getCurrentState()).isEqualTo(IService.State.STOPPED);
        assertThat(handle.current().generation()).isEqualTo(1);
    }

    private static void waitForCancellation(CancellationSignal signal) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!signal.isCancelled() && System.nanoTime() < deadline) {
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(5));
        }
        signal.throwIfCancelled();
    }

    private static int housingCost(Snapshot snapshot) {
        return snapshot.registry().find(ContentCollections.SURFACE_BUILDINGS, "housing").orElseThrow().productionCost();
    }
}

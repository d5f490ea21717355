package org.ascenoria.runtime;

import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.ContentFixtures;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.junit.extensions.logging.AllowLog;
import org.ascenoria.junit.extensions.logging.LogLevel;
import org.ascenoria.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ContentRuntimeTest {

    @TempDir
    Path tempDir;

    private ContentRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private ContentSettings settings(boolean hotReload) {
        return new ContentSettings(tempDir.resolve("data"), tempDir.resolve("mods"), 1, List.of("en", "ru"),
                new ContentSettings.HotReload(hotReload, Duration.ofMillis(50), 16, Duration.ofMillis(20)));
    }

    @Test
    void startPublishesFirstGeneration() throws Exception {
        // given
        ContentFixtures.basePackWithBuilding(tempDir, "housing", 5);
        runtime = new ContentRuntime(settings(false));

        // when
        runtime.start();

        // then
        assertThat(runtime.snapshots().current().generation()).isEqualTo(1);
        assertThat(runtime.snapshots().current().registry()
                .find(ContentCollections.SURFACE_BUILDINGS, "housing")).isPresent();
        assertThat(runtime.supervisor()).isNull();
    }

    @Test
    void editedFilesArePickedUpWhileRunning() throws Exception {
        // given
        final Path data = ContentFixtures.basePackWithBuilding(tempDir, "housing", 5);
        runtime = new ContentRuntime(settings(true));
        runtime.start();
        assertThat(runtime.supervisor()).isNotNull();

        // when
        ContentFixtures.write(data.resolve("surface_buildings.toml"), ContentFixtures.building("housing", 6));

        // then
        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            assertThat(runtime.snapshots().current().generation()).isEqualTo(2);
            assertThat(runtime.snapshots().current().registry()
                    .find(ContentCollections.SURFACE_BUILDINGS, "housing").orElseThrow().productionCost())
                    .isEqualTo(6);
        });
    }

    @Test
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*ContentRuntime")
    void failedInitialLoadIsTerminal() {
        // given
        final Path data = ContentFixtures.basePack(tempDir, 1);
        ContentFixtures.write(data.resolve("surface_buildings.toml"), "[[surface_building]]\nid = \n");
        runtime = new ContentRuntime(settings(true));

        // when / then
        assertThatThrownBy(runtime::start).isInstanceOf(ContentLoadException.class);
        assertThat(runtime.snapshots().isPublished()).isFalse();
        assertThat(runtime.supervisor()).isNull();
    }

    @Test
    void secondStartIsRejected() throws Exception {
        // given
        ContentFixtures.basePackWithBuilding(tempDir, "housing", 5);
        runtime = new ContentRuntime(settings(false));
        runtime.start();

        // when / then
        assertThatThrownBy(runtime::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopKeepsLastSnapshotReadable() throws Exception {
        // given
        ContentFixtures.basePackWithBuilding(tempDir, "housing", 5);
        runtime = new ContentRuntime(settings(true));
        runtime.start();

        // when
        runtime.stop();

        // then
        assertThat(runtime.supervisor()).isNull();
        assertThat(runtime.snapshots().current().generation()).isEqualTo(1);
    }
}

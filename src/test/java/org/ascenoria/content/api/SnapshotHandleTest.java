package org.ascenoria.content.api;

import org.ascenoria.content.derived.DerivedStatCompiler;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.registry.RegistryBuilder;
import org.ascenoria.junit.extensions.logging.AllowLog;
import org.ascenoria.junit.extensions.logging.LogLevel;
import org.ascenoria.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.ascenoria.content.TestRecords.base;
import static org.ascenoria.content.TestRecords.building;
import static org.ascenoria.content.TestRecords.merge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SnapshotHandleTest {

    private final SnapshotHandle handle = new SnapshotHandle();

    @Test
    void currentFailsBeforeFirstPublish() {
        assertThat(handle.isPublished()).isFalse();
        assertThatThrownBy(handle::current).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void publishReplacesTheCurrentSnapshot() {
        Snapshot first = snapshot(1);
        Snapshot second = snapshot(2);

        assertThat(handle.publish(first)).isNull();
        assertThat(handle.publish(second)).isSameAs(first);
        assertThat(handle.current()).isSameAs(second);
    }

    @Test
    void listenersSeePreviousAndCurrent() {
        SnapshotListener listener = mock(SnapshotListener.class);
        handle.addListener(listener);
        Snapshot first = snapshot(1);
        Snapshot second = snapshot(2);

        handle.publish(first);
        handle.publish(second);

        InOrder order = inOrder(listener);
        order.verify(listener).onPublished(null, first);
        order.verify(listener).onPublished(first, second);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*SnapshotHandle", messagePattern = "Snapshot listener .* failed: boom")
    void failingListenerDoesNotStopPublication() {
        SnapshotListener failing = mock(SnapshotListener.class);
        SnapshotListener healthy = mock(SnapshotListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onPublished(any(), any());
        handle.addListener(failing);
        handle.addListener(healthy);
        Snapshot snapshot = snapshot(1);

        handle.publish(snapshot);

        assertThat(handle.current()).isSameAs(snapshot);
        verify(healthy).onPublished(null, snapshot);
    }

    @Test
    void nullSnapshotIsRejected() {
        assertThatThrownBy(() -> handle.publish(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Snapshot snapshot(long generation) {
        MergedContent content = merge(base(building("housing", 5)));
        return new Snapshot(generation,
                new RegistryBuilder().build(content, new DerivedStatCompiler().compile(content), generation),
                List.of(), 1, List.of("base"), Map.of(), Instant.now());
    }
}

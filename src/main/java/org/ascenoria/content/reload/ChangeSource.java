package org.ascenoria.content.reload;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Produces change events on its own thread.
 */
public interface ChangeSource extends AutoCloseable {

    /**
     * Starts emitting events to the sink. The sink must not block.
     *
     * @param sink Receives events.
     * @throws IOException if watching cannot be set up.
     */
    void start(Consumer<ChangeEvent> sink) throws IOException;

    /**
     * Stops emitting events and releases resources.
     */
    @Override
    void close();
}

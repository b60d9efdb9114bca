package com.trafficsentinel.monitors.api;

import java.util.Optional;

public interface VideoSource<F> extends AutoCloseable {
    void open(String location);

    /**
     * Returns the next frame, or empty at end of stream.
     */
    Optional<F> nextFrame();

    void rewind();

    @Override
    void close();
}

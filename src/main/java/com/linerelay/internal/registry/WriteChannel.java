package com.linerelay.internal.registry;

import java.io.Closeable;
import java.io.IOException;

/**
 * Outbound half of one client connection. Once handed to the
 * {@link ConnectionRegistry} only the registry writes to it.
 */
public interface WriteChannel extends Closeable {

    void write(byte[] bytes) throws IOException;

    @Override
    void close() throws IOException;
}

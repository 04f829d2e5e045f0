package com.linerelay.internal.registry;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

/**
 * {@link WriteChannel} over a socket's output stream. Closing it shuts down
 * the output side only; the read side belongs to the connection's handler.
 */
public class SocketWriteChannel implements WriteChannel {
    private final Socket socket;
    private final OutputStream out;

    public SocketWriteChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.out = socket.getOutputStream();
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        synchronized (out) {
            out.write(bytes);
            out.flush();
        }
    }

    @Override
    public void close() throws IOException {
        if (!socket.isClosed() && !socket.isOutputShutdown()) {
            socket.shutdownOutput();
        }
    }

    @Override
    public String toString() {
        return "SocketWriteChannel[" + socket.getRemoteSocketAddress() + "]";
    }
}

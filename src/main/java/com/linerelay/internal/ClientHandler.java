package com.linerelay.internal;

import com.linerelay.internal.protocol.LineReader;
import com.linerelay.internal.registry.SocketWriteChannel;
import com.linerelay.internal.registry.WriteChannel;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/* ---------------------------------------------------------------------------
   ClientHandler: one task per connection. Logs in, relays every line read,
   and removes the connection once reading fails or the stream ends.
   --------------------------------------------------------------------------- */
@Slf4j
public class ClientHandler implements Runnable {
    private final int connectionId;
    private final InputStream in;
    private final WriteChannel channel;
    private final Closeable connection;
    private final BroadcastCoordinator coordinator;
    private final int maxLineBytes;

    private volatile ConnectionState state = ConnectionState.CONNECTING;

    ClientHandler(int connectionId, InputStream in, WriteChannel channel, Closeable connection,
          BroadcastCoordinator coordinator, int maxLineBytes) {
        this.connectionId = connectionId;
        this.in = in;
        this.channel = channel;
        this.connection = connection;
        this.coordinator = coordinator;
        this.maxLineBytes = maxLineBytes;
    }

    /** Handler for an accepted socket, identified by its remote port. */
    public static ClientHandler forSocket(Socket client, BroadcastCoordinator coordinator, int maxLineBytes)
          throws IOException {
        int id = ((InetSocketAddress) client.getRemoteSocketAddress()).getPort();
        return new ClientHandler(id, client.getInputStream(), new SocketWriteChannel(client), client,
              coordinator, maxLineBytes);
    }

    public int getConnectionId() {
        return connectionId;
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void run() {
        IOException failure = null;
        try {
            coordinator.login(connectionId, channel);
            state = ConnectionState.LOGGED_IN;

            LineReader reader = new LineReader(in, maxLineBytes);
            String line;
            while ((line = reader.readLine()) != null) {
                coordinator.relay(connectionId, line);
            }
            log.debug("[EOF] client_id {} closed its stream", connectionId);
        } catch (IOException e) {
            failure = e;
        } catch (RuntimeException e) {
            // not a read failure; closed without a cause
            log.error("client_id {} handler error", connectionId, e);
        } finally {
            close(failure);
        }
    }

    private void close(IOException failure) {
        state = ConnectionState.CLOSED;
        coordinator.disconnect(connectionId, channel, failure);
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Closing client_id {} failed: {}", connectionId, e.getMessage());
        }
        log.debug("[CONNECTION] Closed client_id {}", connectionId);
    }
}

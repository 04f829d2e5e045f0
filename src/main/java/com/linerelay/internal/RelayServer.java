package com.linerelay.internal;

import com.linerelay.internal.event.LoggingRelayEventListener;
import com.linerelay.internal.event.RelayEventListener;
import com.linerelay.internal.registry.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Line relay server:
 *  - one accept thread
 *  - one pooled task per connection for its whole lifetime
 *  - a single shared {@link ConnectionRegistry}
 *
 * A server is single use: once closed it cannot be started again.
 */
@Slf4j
public class RelayServer implements Closeable {
    static final long ACCEPT_BACKOFF_MS = 100;

    private final RelayConfig config;
    private final ConnectionRegistry registry;
    private final BroadcastCoordinator coordinator;
    private final ThreadPoolExecutor executor;
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running = false;
    private boolean closed = false;

    public RelayServer(RelayConfig config) {
        this(config, new LoggingRelayEventListener());
    }

    public RelayServer(RelayConfig config, RelayEventListener events) {
        this.config = config;
        this.registry = new ConnectionRegistry(events);
        this.coordinator = new BroadcastCoordinator(registry, events);
        int max = config.getMaxThreads() == 0 ? Integer.MAX_VALUE : config.getMaxThreads();
        this.executor = new ThreadPoolExecutor(
              config.getCoreThreads(),
              max,
              60L, TimeUnit.SECONDS,
              new SynchronousQueue<>(),
              new NamedThreadFactory("relay-conn-"),
              new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * Binds the listener and starts accepting.
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if the server was already closed
     */
    public synchronized void start() throws IOException {
        if (closed) {
            throw new IllegalStateException("Relay server was closed and cannot be restarted");
        }
        if (running) return;
        ServerSocket socket = newServerSocket();
        try {
            socket.bind(new InetSocketAddress(InetAddress.getByName(config.getHost()), config.getPort()));
        } catch (IOException e) {
            socket.close();
            throw new IOException("Failed to bind " + config.getHost() + ":" + config.getPort(), e);
        }
        serverSocket = socket;
        running = true;
        acceptThread = new Thread(this::acceptLoop, "relay-accept");
        acceptThread.start();
        log.info("listening on {}:{}", config.getHost(), getLocalPort());
    }

    ServerSocket newServerSocket() throws IOException {
        return new ServerSocket();
    }

    public int getLocalPort() {
        ServerSocket s = serverSocket;
        return s == null ? -1 : s.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    /** Accepted sockets whose handler has not finished yet. */
    public int activeConnections() {
        return connections.size();
    }

    /** Blocks until the accept loop exits. */
    public void awaitTermination() throws InterruptedException {
        Thread t = acceptThread;
        if (t != null) {
            t.join();
        }
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    log.error("Accept failed", e);
                }
                break;
            } catch (IOException e) {
                log.error("Accept failed, retrying in {} ms", ACCEPT_BACKOFF_MS, e);
                try {
                    Thread.sleep(ACCEPT_BACKOFF_MS);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }
            handle(client);
        }
        log.info("Accept loop stopped");
    }

    private void handle(Socket client) {
        try {
            client.setTcpNoDelay(config.isTcpNoDelay());
            ClientHandler handler = ClientHandler.forSocket(client, coordinator, config.getMaxLineBytes());
            log.info("connected {} {}", client.getInetAddress().getHostAddress(), handler.getConnectionId());
            connections.add(client);
            if (!running) {
                throw new RejectedExecutionException("server is closing");
            }
            executor.execute(() -> {
                try {
                    handler.run();
                } finally {
                    connections.remove(client);
                }
            });
        } catch (IOException | RejectedExecutionException e) {
            log.warn("Dropping connection from {}: {}", client.getRemoteSocketAddress(), e.toString());
            connections.remove(client);
            try {
                client.close();
            } catch (IOException closeError) {
                log.debug("Close after rejection failed: {}", closeError.getMessage());
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                log.warn("Closing listener failed: {}", e.getMessage());
            }
        }
        registry.closeAll();
        // closing the sockets fails the handlers' blocked reads so their threads exit
        for (Socket client : connections) {
            try {
                client.close();
            } catch (IOException e) {
                log.debug("Closing {} failed: {}", client.getRemoteSocketAddress(), e.getMessage());
            }
        }
        executor.shutdownNow();
        log.info("Relay server stopped");
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

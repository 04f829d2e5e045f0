package com.linerelay.internal;

import com.linerelay.internal.protocol.LineReader;
import com.linerelay.internal.protocol.RelayProtocol;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Minimal line client for the relay. Run it from a terminal to chat through
 * a running server: stdin lines are sent, server lines are printed.
 */
@Slf4j
public class RelayClient implements Closeable {

    private final String host;
    private final int port;
    private Socket socket;
    private LineReader in;
    private OutputStream out;
    private int connectionId = -1;

    public RelayClient(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Connects and waits for the login line.
     *
     * @return the id the server assigned to this connection
     */
    public int connect() throws IOException {
        socket = new Socket(host, port);
        in = new LineReader(socket.getInputStream(), 1024 * 1024);
        out = socket.getOutputStream();

        String login = readLine();
        if (login == null || !login.startsWith(RelayProtocol.LOGIN_PREFIX)) {
            throw new IOException("Expected login line, got: " + login);
        }
        connectionId = Integer.parseInt(login.substring(RelayProtocol.LOGIN_PREFIX.length()));
        log.debug("[CLIENT] logged in as {}", connectionId);
        return connectionId;
    }

    public int getConnectionId() {
        return connectionId;
    }

    /** Port of this end of the socket; the server uses it as our id. */
    public int getLocalPort() {
        return socket.getLocalPort();
    }

    public void send(String text) throws IOException {
        out.write((text + RelayProtocol.LINE_DELIMITER).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /** Next server line, or {@code null} when the server closed the stream. */
    public String readLine() throws IOException {
        return in.readLine();
    }

    /**
     * Next server line, waiting at most {@code timeoutMillis}.
     *
     * @return the line, or {@code null} if nothing arrived in time
     */
    public String readLine(int timeoutMillis) throws IOException {
        int previous = socket.getSoTimeout();
        socket.setSoTimeout(timeoutMillis);
        try {
            return in.readLine();
        } catch (SocketTimeoutException e) {
            return null;
        } finally {
            socket.setSoTimeout(previous);
        }
    }

    @Override
    public void close() throws IOException {
        if (socket != null) {
            socket.close();
        }
    }

    public static void main(String[] args) throws Exception {
        String host = args.length > 0 ? args[0] : "127.0.0.1";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 8888;

        try (RelayClient client = new RelayClient(host, port)) {
            System.out.println(RelayProtocol.LOGIN_PREFIX + client.connect());

            Thread printer = new Thread(() -> {
                try {
                    String line;
                    while ((line = client.readLine()) != null) {
                        System.out.println(line);
                    }
                } catch (IOException e) {
                    log.debug("[CLIENT] read stopped: {}", e.getMessage());
                }
            }, "relay-client-reader");
            printer.setDaemon(true);
            printer.start();

            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = stdin.readLine()) != null) {
                client.send(line);
            }
        }
    }
}

package com.linerelay.internal;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Starts the line relay.
 *
 * Settings come from relay.properties, -Drelay.* system properties or
 * --key=value arguments (see {@link RelayConfig}).
 */
@Slf4j
public class RelayApplication {

    public static void main(String[] args) {
        RelayConfig config;
        try {
            config = RelayConfig.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        RelayServer server = new RelayServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Error running server: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "relay-shutdown"));

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.close();
        }
    }
}

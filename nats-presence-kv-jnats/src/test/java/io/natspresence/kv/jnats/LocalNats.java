package io.natspresence.kv.jnats;

import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.Nats;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Probe for a NATS server on localhost; tests that need one are skipped without it.
 */
final class LocalNats {
    static final String URL = System.getProperty("nats.url", "nats://localhost:4222");

    private LocalNats() {}

    static boolean isRunning() {
        java.net.URI uri = java.net.URI.create(URL);
        int port = uri.getPort() < 0 ? 4222 : uri.getPort();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(uri.getHost(), port), 200);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Removes a bucket a test created. Does nothing without a server or when the bucket is missing.
     */
    static void deleteBucket(String name) throws Exception {
        if (!isRunning()) return;
        try (Connection nc = Nats.connect(URL)) {
            nc.keyValueManagement().delete(name);
        } catch (JetStreamApiException e) {
            // never created by this test
        }
    }
}

package com.questrail.acars.splitter.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint}: binds nothing, lets tests inject inbound
 * datagrams and simulate bind failures.
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    private static final SocketAddress DEFAULT_REMOTE = new InetSocketAddress("127.0.0.1", 40000);

    private final InetSocketAddress bindAddress;
    private DatagramEndpointListener listener;
    private Throwable bindFailure;
    private boolean started;
    private boolean stopped;

    public FakeDatagramEndpoint(InetSocketAddress bindAddress) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (listener == null) {
            return;
        }
        if (bindFailure != null) {
            listener.onTransportDown(bindFailure);
        }
        else {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (listener != null && started && bindFailure == null) {
            listener.onTransportDown(null);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Make the next {@link #start()} report a bind failure.
     */
    public void failBindWith(Throwable cause) {
        this.bindFailure = cause;
    }

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onDatagram(remote, payload);
    }

    public void injectText(String text) {
        injectDatagram(DEFAULT_REMOTE, text.getBytes(StandardCharsets.UTF_8));
    }

    public InetSocketAddress bindAddress() {
        return bindAddress;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }
}

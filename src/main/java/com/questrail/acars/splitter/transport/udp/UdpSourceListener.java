package com.questrail.acars.splitter.transport.udp;

import com.questrail.acars.splitter.codec.DatagramTextDecoder;
import com.questrail.acars.splitter.internal.exec.StreamSplitter;
import com.questrail.acars.splitter.internal.time.WallClock;
import com.questrail.acars.splitter.observability.NullObservabilitySink;
import com.questrail.acars.splitter.observability.SplitterErrorEvent;
import com.questrail.acars.splitter.observability.SplitterObservabilitySink;
import com.questrail.acars.splitter.observability.TransportStateEvent;
import com.questrail.acars.splitter.transport.DatagramEndpoint;
import com.questrail.acars.splitter.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * UdpSourceListener
 * =============================================================================
 * Binds one {@link DatagramEndpoint} to one splitter source.
 *
 * <h2>Inbound path (decode-before-buffer)</h2>
 *
 * <pre>
 *   DatagramEndpoint (port P)
 *        → DatagramTextDecoder (strict UTF-8)
 *            → StreamSplitter.onText(P, text)
 * </pre>
 *
 * A datagram that is not valid UTF-8 is dropped whole and reported; it never
 * reaches the buffer, so text around it still frames normally.
 *
 * <h2>Task boundary</h2>
 * This is the outermost frame of every datagram task on the event loop. A
 * runtime failure in the engine is reported through
 * {@link SplitterObservabilitySink#onError} and does not reach the transport,
 * which keeps the socket open.
 */
public final class UdpSourceListener implements DatagramEndpointListener {

    private final int port;
    private final StreamSplitter splitter;
    private final DatagramTextDecoder decoder;
    private final WallClock wallClock;
    private final SplitterObservabilitySink observabilitySink;

    public UdpSourceListener(int port,
                             StreamSplitter splitter,
                             DatagramTextDecoder decoder,
                             WallClock wallClock,
                             SplitterObservabilitySink observabilitySink) {
        this.port = port;
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        // Fail at wiring time rather than on the first datagram.
        splitter.sources().source(port);
    }

    public int port() {
        return port;
    }

    /**
     * Registers this listener on {@code endpoint} and returns the endpoint.
     */
    public DatagramEndpoint attach(DatagramEndpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint").setListener(this);
        return endpoint;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new TransportStateEvent(wallClock.now(), port, true, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new TransportStateEvent(wallClock.now(), port, false, cause));
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        try {
            Optional<String> text = decoder.decode(payload);
            if (text.isEmpty()) {
                splitter.onUndecodableDatagram(port);
                return;
            }
            splitter.onText(port, text.get());
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new SplitterErrorEvent(
                wallClock.now(), "Port " + port + ": failed to process datagram", e));
        }
    }
}

package com.questrail.acars.splitter.transport.udp;

import com.questrail.acars.splitter.classify.Classifiers;
import com.questrail.acars.splitter.classify.SplitStrategy;
import com.questrail.acars.splitter.codec.impl.TimestampLineFramer;
import com.questrail.acars.splitter.codec.impl.Utf8DatagramDecoder;
import com.questrail.acars.splitter.internal.exec.BufferPolicy;
import com.questrail.acars.splitter.internal.exec.StreamSplitter;
import com.questrail.acars.splitter.internal.source.SourceRegistry;
import com.questrail.acars.splitter.observability.RecordingObservabilitySink;
import com.questrail.acars.splitter.observability.SourceAnomalyEvent;
import com.questrail.acars.splitter.observability.TransportStateEvent;
import com.questrail.acars.splitter.output.BucketWriter;
import com.questrail.acars.splitter.output.MessageRouter;
import com.questrail.acars.splitter.time.ManualMonotonicClock;
import com.questrail.acars.splitter.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UdpSourceListenerTest {

    private static final int PORT = 5555;
    private static final InetSocketAddress SENDER = new InetSocketAddress("127.0.0.1", 40000);

    @TempDir
    Path tempDir;

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private StreamSplitter splitter;
    private FakeDatagramEndpoint endpoint;

    @BeforeEach
    void setUp() {
        splitter = new StreamSplitter(
            new SourceRegistry(List.of(PORT), clock),
            new TimestampLineFramer(),
            new MessageRouter(SplitStrategy.LABEL, Classifiers.forStrategy(SplitStrategy.LABEL, null),
                new BucketWriter(tempDir)),
            BufferPolicy.defaults(),
            clock,
            () -> Instant.EPOCH,
            sink);

        UdpSourceListener listener = new UdpSourceListener(
            PORT, splitter, new Utf8DatagramDecoder(), () -> Instant.EPOCH, sink);
        endpoint = new FakeDatagramEndpoint(new InetSocketAddress("127.0.0.1", PORT));
        listener.attach(endpoint);
    }

    @Test
    void datagramsAreDecodedIntoTheSourceBuffer() throws IOException {
        endpoint.injectText("00:16:25 01-01-24 UTC ! H1 D\nfirst\n");
        endpoint.injectText("00:17:02 01-01-24 UTC ! H2 D\nsecond");

        assertEquals("00:16:25 01-01-24 UTC ! H1 D\nfirst", Files.readString(tempDir.resolve("acars_label_H1.txt")));
        assertEquals("00:17:02 01-01-24 UTC ! H2 D\nsecond", splitter.sources().source(PORT).snapshot());
    }

    @Test
    void undecodableDatagramIsDroppedAndFramingContinues() throws IOException {
        endpoint.injectText("00:16:25 01-01-24 UTC ! H1 D\nfirst ");
        endpoint.injectDatagram(SENDER, new byte[] { 'b', 'a', 'd', (byte) 0xFF });
        endpoint.injectText("part\n00:17:02 01-01-24 UTC ! H2 D\n");

        assertEquals("00:16:25 01-01-24 UTC ! H1 D\nfirst part",
            Files.readString(tempDir.resolve("acars_label_H1.txt")));

        SourceAnomalyEvent anomaly = sink.getAnomalies().get(0);
        assertEquals(SourceAnomalyEvent.Kind.UNDECODABLE_DATAGRAM, anomaly.kind());
        assertEquals(PORT, anomaly.port());
    }

    @Test
    void transportLifecycleIsReportedPerPort() {
        endpoint.start();
        endpoint.stop();

        List<TransportStateEvent> events = sink.getTransportEvents();
        assertEquals(2, events.size());
        assertTrue(events.get(0).up());
        assertFalse(events.get(1).up());
        assertNull(events.get(1).cause());
        assertEquals(PORT, events.get(0).port());
    }

    @Test
    void bindFailureCarriesTheCause() {
        IllegalStateException cause = new IllegalStateException("address in use");
        endpoint.failBindWith(cause);

        endpoint.start();

        TransportStateEvent event = sink.getTransportEvents().get(0);
        assertFalse(event.up());
        assertSame(cause, event.cause());
    }

    @Test
    void engineFailureIsContainedAtTheTaskBoundary() {
        StreamSplitter failing = new StreamSplitter(
            new SourceRegistry(List.of(PORT), clock),
            new TimestampLineFramer(),
            new MessageRouter(SplitStrategy.LABEL, m -> {
                throw new IllegalStateException("classifier failure");
            }, new BucketWriter(tempDir)),
            BufferPolicy.defaults(),
            clock,
            () -> Instant.EPOCH,
            sink);
        UdpSourceListener listener = new UdpSourceListener(
            PORT, failing, new Utf8DatagramDecoder(), () -> Instant.EPOCH, sink);

        listener.onDatagram(SENDER,
            "00:16:25 01-01-24 UTC a\n00:17:02 01-01-24 UTC b".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(IllegalStateException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void listenerForUnconfiguredPortIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new UdpSourceListener(9999, splitter, new Utf8DatagramDecoder(), () -> Instant.EPOCH, sink));
    }
}

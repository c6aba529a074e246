package com.questrail.acars.splitter.runtime;

import com.questrail.acars.splitter.codec.DatagramTextDecoder;
import com.questrail.acars.splitter.codec.impl.TimestampLineFramer;
import com.questrail.acars.splitter.codec.impl.Utf8DatagramDecoder;
import com.questrail.acars.splitter.config.SplitterConfig;
import com.questrail.acars.splitter.internal.exec.StreamSplitter;
import com.questrail.acars.splitter.internal.exec.TimeoutSweeper;
import com.questrail.acars.splitter.internal.source.SourceRegistry;
import com.questrail.acars.splitter.internal.time.MonotonicClock;
import com.questrail.acars.splitter.internal.time.MonotonicScheduler;
import com.questrail.acars.splitter.internal.time.ScheduledExecutorScheduler;
import com.questrail.acars.splitter.internal.time.SystemMonotonicClock;
import com.questrail.acars.splitter.internal.time.SystemWallClock;
import com.questrail.acars.splitter.internal.time.WallClock;
import com.questrail.acars.splitter.observability.NullObservabilitySink;
import com.questrail.acars.splitter.observability.SplitterObservabilitySink;
import com.questrail.acars.splitter.output.MessageRouter;
import com.questrail.acars.splitter.transport.DatagramEndpoint;
import com.questrail.acars.splitter.transport.udp.UdpSourceListener;
import com.questrail.acars.splitter.transport.udp.netty.NettyEventLoop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * SplitterRuntime
 * =============================================================================
 * Composition root and lifecycle owner for UDP mode.
 *
 * <pre>
 *   NettyEventLoop (1 thread)
 *     ├── DatagramEndpoint :P1 → UdpSourceListener(P1) ┐
 *     ├── DatagramEndpoint :P2 → UdpSourceListener(P2) ├→ StreamSplitter → MessageRouter → bucket files
 *     └── TimeoutSweeper (every buffer_timeout)  ──────┘
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} creates the output directory, binds every port and arms
 *       the sweep. A port that fails to bind is reported and the others keep running.</li>
 *   <li>{@link #stop()} cancels the sweep, closes every socket, then shuts the
 *       event loop down. Pending partial messages are not flushed.</li>
 * </ul>
 *
 * <p>Tests may substitute the endpoints, the scheduler and both clocks through
 * the {@link Builder}; the Netty loop is created only when something still
 * needs it.</p>
 */
public final class SplitterRuntime {
    private static final Logger log = LoggerFactory.getLogger(SplitterRuntime.class);

    private final SplitterConfig config;
    private final MessageRouter router;
    private final StreamSplitter splitter;
    private final TimeoutSweeper sweeper;
    private final List<DatagramEndpoint> endpoints;
    private final NettyEventLoop eventLoop;

    private boolean started;
    private boolean stopped;

    private SplitterRuntime(SplitterConfig config,
                            MessageRouter router,
                            StreamSplitter splitter,
                            TimeoutSweeper sweeper,
                            List<DatagramEndpoint> endpoints,
                            NettyEventLoop eventLoop) {
        this.config = config;
        this.router = router;
        this.splitter = splitter;
        this.sweeper = sweeper;
        this.endpoints = List.copyOf(endpoints);
        this.eventLoop = eventLoop;
    }

    /**
     * @throws com.questrail.acars.splitter.output.BucketWriteException if the
     *         output directory cannot be created; nothing is bound in that case
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Runtime already started");
        }
        started = true;

        router.writer().prepare();
        logConfiguration();

        for (DatagramEndpoint endpoint : endpoints) {
            endpoint.start();
        }
        sweeper.start();
    }

    /**
     * Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;

        sweeper.stop();
        for (DatagramEndpoint endpoint : endpoints) {
            endpoint.stop();
        }
        if (eventLoop != null) {
            eventLoop.shutdown();
        }
        log.info("ACARS splitter stopped");
    }

    public SplitterConfig config() {
        return config;
    }

    public StreamSplitter splitter() {
        return splitter;
    }

    private void logConfiguration() {
        log.info("ACARS splitter configuration:");
        log.info("  Host: {}", config.host());
        log.info("  Ports: {}", config.ports());
        log.info("  Output directory: {}", config.outputDirectory().toAbsolutePath());
        log.info("  Split by: {}", config.splitBy().configName());
        if (config.keyword() != null) {
            log.info("  Keyword: {}", config.keyword());
        }
        log.info("  Buffer timeout: {} seconds", config.bufferTimeout().toMillis() / 1000.0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SplitterConfig config;
        private SplitterObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private Function<InetSocketAddress, DatagramEndpoint> endpointFactory;

        public Builder withConfig(SplitterConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(SplitterObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Replaces the event-loop scheduler for the sweep.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Replaces the Netty endpoints; called once per configured port.
         */
        public Builder withEndpointFactory(Function<InetSocketAddress, DatagramEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public SplitterRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            SplitterObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Event loop, only if a production piece still needs it
            NettyEventLoop eventLoop = (scheduler == null || endpointFactory == null) ? new NettyEventLoop() : null;
            MonotonicScheduler effectiveScheduler = scheduler != null
                ? scheduler
                : new ScheduledExecutorScheduler(eventLoop.executor(), clock);
            Function<InetSocketAddress, DatagramEndpoint> effectiveFactory = endpointFactory != null
                ? endpointFactory
                : eventLoop::endpoint;

            // 2. Engine
            MessageRouter router = RuntimeWiring.router(config.output());
            SourceRegistry sources = new SourceRegistry(config.ports(), clock);
            StreamSplitter splitter = new StreamSplitter(
                sources,
                new TimestampLineFramer(),
                router,
                config.bufferPolicy(),
                clock,
                wallClock,
                sink
            );
            TimeoutSweeper sweeper = new TimeoutSweeper(splitter, effectiveScheduler, clock, wallClock, sink);

            // 3. One endpoint + listener per port
            DatagramTextDecoder decoder = new Utf8DatagramDecoder();
            List<DatagramEndpoint> endpoints = new ArrayList<>();
            for (int port : sources.ports()) {
                UdpSourceListener listener = new UdpSourceListener(port, splitter, decoder, wallClock, sink);
                DatagramEndpoint endpoint = effectiveFactory.apply(new InetSocketAddress(config.host(), port));
                endpoints.add(listener.attach(endpoint));
            }

            return new SplitterRuntime(config, router, splitter, sweeper, endpoints, eventLoop);
        }
    }
}

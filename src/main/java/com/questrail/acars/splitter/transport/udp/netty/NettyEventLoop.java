package com.questrail.acars.splitter.transport.udp.netty;

import com.questrail.acars.splitter.transport.DatagramEndpoint;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoop
 * =============================================================================
 * Owner of the single-threaded Netty event loop shared by every UDP endpoint
 * and the timeout sweep.
 *
 * <p>One thread means one task at a time: datagram handling for any port and
 * the sweep never interleave, and each runs to completion. The loop is exposed
 * as a plain {@link ScheduledExecutorService} so scheduling code stays free of
 * Netty types.</p>
 */
public final class NettyEventLoop
{
    private static final Logger log = LoggerFactory.getLogger(NettyEventLoop.class);

    private static final long QUIET_PERIOD_MILLIS = 0;
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 2_000;
    private static final long TERMINATION_WAIT_SECONDS = 5;

    private final EventLoopGroup group;

    public NettyEventLoop()
    {
        this.group = new NioEventLoopGroup(1);
    }

    /**
     * The loop as a scheduler backing; tasks submitted here run on the same
     * thread as datagram callbacks.
     */
    public ScheduledExecutorService executor()
    {
        return group;
    }

    /**
     * A new endpoint for {@code bindAddress} on this loop. Not yet bound.
     */
    public DatagramEndpoint endpoint(InetSocketAddress bindAddress)
    {
        return new NettyUdpDatagramEndpoint(group, bindAddress);
    }

    /**
     * Shut the loop down, waiting for in-flight tasks to finish.
     */
    public void shutdown()
    {
        group.shutdownGracefully(QUIET_PERIOD_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        try {
            if (!group.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Event loop did not terminate within {} seconds", TERMINATION_WAIT_SECONDS);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

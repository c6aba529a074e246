package com.questrail.acars.splitter.transport.udp.netty;

import com.questrail.acars.splitter.transport.DatagramEndpoint;
import com.questrail.acars.splitter.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Receive-only UDP socket for one ACARS source port.
 *
 * <p>Only transport happens here: each packet payload is copied out of its
 * {@code ByteBuf} and handed to the listener as {@code byte[]}. No Netty type
 * reaches the listener, and decoding and framing happen downstream.</p>
 *
 * <p>The endpoint borrows its event loop from {@link NettyEventLoop} and never
 * shuts it down. Every port shares that single thread with the timeout sweep.</p>
 *
 * <p>Transport-down is reported at most once per successful bind, whether the
 * channel closes normally or fails.</p>
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private static final long CLOSE_TIMEOUT_SECONDS = 2;

    private final InetSocketAddress bindAddress;
    private final Bootstrap bootstrap;
    private final AtomicBoolean bound = new AtomicBoolean();

    private volatile DatagramEndpointListener listener;
    private volatile Channel socket;

    NettyUdpDatagramEndpoint(EventLoopGroup group, InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.bootstrap = new Bootstrap()
                .group(Objects.requireNonNull(group, "group"))
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new PacketForwarder());
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Bind asynchronously; the outcome arrives as transport up or down.
     *
     * @throws IllegalStateException if no listener was set
     */
    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("Listener must be set before binding " + bindAddress);
        }
        bootstrap.bind(bindAddress).addListener(f -> onBindComplete((ChannelFuture) f));
    }

    @Override
    public void stop()
    {
        Channel current = socket;
        if (current == null) {
            return;
        }
        if (!current.close().awaitUninterruptibly(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Socket {} did not close within {} seconds", bindAddress, CLOSE_TIMEOUT_SECONDS);
        }
    }

    private void onBindComplete(ChannelFuture bind)
    {
        DatagramEndpointListener target = listener;
        if (!bind.isSuccess()) {
            target.onTransportDown(bind.cause());
            return;
        }
        socket = bind.channel();
        bound.set(true);
        log.debug("Bound UDP socket {}", socket.localAddress());
        target.onTransportUp();
    }

    private void reportDown(Throwable cause)
    {
        DatagramEndpointListener target = listener;
        if (target != null && bound.compareAndSet(true, false)) {
            target.onTransportDown(cause);
        }
    }

    private final class PacketForwarder extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener target = listener;
            if (target != null) {
                target.onDatagram(packet.sender(), ByteBufUtil.getBytes(packet.content()));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportDown(cause);
            ctx.close();
        }
    }
}

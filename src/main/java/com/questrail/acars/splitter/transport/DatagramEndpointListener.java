package com.questrail.acars.splitter.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks for one endpoint are delivered serially. Netty endpoints deliver
 * them on the channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The socket is bound and receiving.
     */
    void onTransportUp();

    /**
     * The socket failed to bind, failed later, or was closed.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One datagram was received.
     *
     * <p>The payload is an owned copy of exactly the bytes received. Datagram
     * boundaries carry no meaning for the splitter: a payload may hold part of a
     * message, one message, or several.</p>
     *
     * @param remote sender address; any sender is accepted
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}

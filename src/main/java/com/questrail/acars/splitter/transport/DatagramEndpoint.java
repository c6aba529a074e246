package com.questrail.acars.splitter.transport;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal receive-only port for a datagram transport bound to one local address.
 *
 * <p>Higher layers feed inbound datagrams into the splitter; the endpoint never
 * sends. Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind and begin receiving datagrams.
     *
     * <p>A successful bind is reported through
     * {@link DatagramEndpointListener#onTransportUp()}; a failed bind through
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} with the cause.
     * Binding may complete asynchronously.</p>
     */
    void start();

    /**
     * Close the socket. Idempotent.
     *
     * <p>If the endpoint was up, the listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Register the listener for inbound datagrams and lifecycle events. Must be
     * called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}

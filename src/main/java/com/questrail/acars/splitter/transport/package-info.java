/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete UDP implementation (Netty in
 * production, a fake in tests) and the splitter engine.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>sender addresses as standard {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations perform I/O only. Text decoding, framing, classification
 * and timing live above this boundary.</p>
 */
package com.questrail.acars.splitter.transport;

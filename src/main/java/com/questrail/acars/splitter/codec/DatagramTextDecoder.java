package com.questrail.acars.splitter.codec;

import java.util.Optional;

/**
 * DatagramTextDecoder
 * -----------------------------------------------------------------------------
 * Byte-level boundary between a raw datagram payload and stream text.
 *
 * <p>A datagram boundary has no relation to a message boundary, so the decoder
 * only turns bytes into characters; it never looks for messages. Payloads that
 * cannot be decoded are reported as empty and the caller drops them.</p>
 */
public interface DatagramTextDecoder
{
    /**
     * @param datagram one complete datagram payload
     * @return the decoded text, or {@link Optional#empty()} if the payload is not
     *         valid in the decoder's charset
     */
    Optional<String> decode(byte[] datagram);
}

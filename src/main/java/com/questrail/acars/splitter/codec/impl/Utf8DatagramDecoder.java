package com.questrail.acars.splitter.codec.impl;

import com.questrail.acars.splitter.codec.DatagramTextDecoder;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Strict UTF-8 {@link DatagramTextDecoder}.
 *
 * <p>Malformed or unmappable input rejects the whole datagram; nothing is
 * replaced with U+FFFD. A multi-byte character split across two datagrams
 * therefore causes both datagrams to be dropped.</p>
 */
public final class Utf8DatagramDecoder implements DatagramTextDecoder
{
    @Override
    public Optional<String> decode(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");

        // CharsetDecoder is stateful; one per call keeps this class thread-safe.
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return Optional.of(decoder.decode(ByteBuffer.wrap(datagram)).toString());
        }
        catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}

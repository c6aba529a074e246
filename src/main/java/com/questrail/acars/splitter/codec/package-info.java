/**
 * Stream codec: datagram bytes to text, text to messages
 * =============================================================================
 *
 * <p>This package defines the two wire-facing transforms of the splitter:</p>
 *
 * <pre>
 *   byte[] datagram
 *        → DatagramTextDecoder   (strict UTF-8; undecodable datagrams dropped)
 *            → source buffer     (owned by the engine, not by the codec)
 *                → MessageFramer (timestamp-line delimiters)
 *                    → complete message text
 * </pre>
 *
 * <h2>Framing signal</h2>
 * <p>JAERO (output format 3) starts every record with a header line of the form
 * {@code HH:MM:SS DD-MM-YY UTC ...} at column 0. That line is the only framing
 * signal: there is no length prefix and no terminator. A record is complete only
 * when the next record's header line has been seen, or when the engine decides
 * the source has gone quiet and forces it out.</p>
 *
 * <p>Codec implementations are stateless and hold no buffers. Accumulation,
 * prefix removal and timeouts belong to the engine in
 * {@code internal.exec} / {@code internal.source}.</p>
 */
package com.questrail.acars.splitter.codec;

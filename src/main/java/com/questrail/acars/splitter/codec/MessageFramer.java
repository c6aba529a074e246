package com.questrail.acars.splitter.codec;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * MessageFramer
 * -----------------------------------------------------------------------------
 * Reconstructs message boundaries in an un-delimited text stream.
 *
 * <p>The stream carries no length prefix and no terminator: the only framing
 * signal is the line that starts each message. A message is therefore known to
 * be complete only once the <em>next</em> message's start line has arrived.</p>
 *
 * <p>The framer is stateless. It inspects the text it is given and reports what
 * can be cut; the caller owns the buffer and applies the result.</p>
 */
public interface MessageFramer
{
    /**
     * Ordinary framing: every span between two adjacent delimiters is a complete
     * message. The last delimiter's span is never complete.
     *
     * @return {@link FramingResult#none()} when the buffer holds fewer than two delimiters
     */
    FramingResult frameComplete(CharSequence buffer);

    /**
     * Forced framing: the text from the first delimiter to the end of the buffer,
     * trimmed, as one (possibly incomplete) message.
     *
     * @return empty if the buffer contains no delimiter at all
     */
    Optional<String> framePending(CharSequence buffer);

    /**
     * Whole-document framing: every delimiter starts a message that runs to the
     * next delimiter or to the end of the text. Used for finished log files.
     */
    List<String> frameAll(CharSequence text);

    boolean containsDelimiter(CharSequence buffer);

    /**
     * Offset of the first delimiter. Everything before it belongs to no message.
     */
    OptionalInt firstDelimiter(CharSequence buffer);
}

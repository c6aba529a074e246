package com.questrail.acars.splitter.internal.source;

/**
 * SourceBuffer
 * -----------------------------------------------------------------------------
 * Accumulated, not yet framed text of one source (one UDP port), plus the
 * monotonic tick of its last flush.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Text is only ever appended at the end; removal only ever takes a prefix.</li>
 *   <li>{@link #lastActivityNanos()} moves only through {@link #markActivity(long)},
 *       which the engine calls when a flush containing a delimiter happens.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * Each buffer is its own lock. Individual methods are {@code synchronized}; the
 * engine additionally holds the monitor ({@code synchronized (source)}) across a
 * read-frame-remove-emit sequence so it is atomic with respect to the sweep.
 * Unrelated sources never contend.
 */
public final class SourceBuffer {

    private final int port;
    private final StringBuilder text = new StringBuilder();
    private long lastActivityNanos;

    public SourceBuffer(int port, long createdAtNanos) {
        this.port = port;
        this.lastActivityNanos = createdAtNanos;
    }

    public int port() {
        return port;
    }

    public synchronized void append(CharSequence data) {
        text.append(data);
    }

    /**
     * Live view of the buffered text. Only valid while the caller holds this
     * buffer's monitor; copy it if it must outlive the lock.
     */
    public synchronized CharSequence view() {
        return text;
    }

    public synchronized String snapshot() {
        return text.toString();
    }

    /**
     * Removes the first {@code count} characters.
     */
    public synchronized void removePrefix(int count) {
        if (count < 0 || count > text.length()) {
            throw new IndexOutOfBoundsException("prefix " + count + " outside buffer of length " + text.length());
        }
        text.delete(0, count);
    }

    /**
     * Empties the buffer.
     *
     * @return the number of characters discarded
     */
    public synchronized int clear() {
        int discarded = text.length();
        text.setLength(0);
        return discarded;
    }

    public synchronized int length() {
        return text.length();
    }

    public synchronized boolean isEmpty() {
        return text.length() == 0;
    }

    public synchronized long lastActivityNanos() {
        return lastActivityNanos;
    }

    public synchronized void markActivity(long nowNanos) {
        this.lastActivityNanos = nowNanos;
    }

    @Override
    public String toString() {
        return "SourceBuffer[port=" + port + ", length=" + length() + "]";
    }
}

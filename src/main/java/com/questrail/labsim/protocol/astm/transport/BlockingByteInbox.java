package com.questrail.labsim.protocol.astm.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * BlockingByteInbox
 * -----------------------------------------------------------------------------
 * Hands bytes from a producer (a transport thread) to the single session thread
 * that reads them one at a time with a deadline.
 *
 * <p>Producers {@link #offer(byte[])} whole chunks; {@link #close()} enqueues an
 * end-of-stream marker behind whatever is already buffered, so bytes received
 * before the peer closed are still delivered.</p>
 */
public final class BlockingByteInbox
{
    private static final byte[] CLOSED = new byte[0];

    private final LinkedBlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();

    private volatile boolean closed;

    // Reader-side cursor; touched only by the reading thread.
    private byte[] current;
    private int position;
    private boolean endOfStream;

    /**
     * Enqueue received bytes. Ignored after {@link #close()}.
     */
    public void offer(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (closed || bytes.length == 0) {
            return;
        }
        chunks.offer(bytes.clone());
    }

    /**
     * Mark end of stream. Idempotent.
     */
    public void close()
    {
        if (!closed) {
            closed = true;
            chunks.offer(CLOSED);
        }
    }

    public boolean isClosed()
    {
        return closed;
    }

    /**
     * Reads one byte.
     *
     * @return 0..255, {@link LinkConnection#TIMED_OUT} or {@link LinkConnection#END_OF_STREAM}
     */
    public int read(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");

        if (current != null && position < current.length) {
            return current[position++] & 0xFF;
        }
        if (endOfStream) {
            return LinkConnection.END_OF_STREAM;
        }

        byte[] next = chunks.poll(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        if (next == null) {
            return LinkConnection.TIMED_OUT;
        }
        if (next == CLOSED) {
            endOfStream = true;
            current = null;
            return LinkConnection.END_OF_STREAM;
        }
        current = next;
        position = 1;
        return next[0] & 0xFF;
    }
}

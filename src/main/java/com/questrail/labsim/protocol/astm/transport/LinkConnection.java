package com.questrail.labsim.protocol.astm.transport;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * LinkConnection
 * -----------------------------------------------------------------------------
 * One established byte-stream connection, owned by exactly one session.
 */
public interface LinkConnection extends Closeable
{
    /** {@link #read(Duration)} result: the peer closed the connection. */
    int END_OF_STREAM = -1;

    /** {@link #read(Duration)} result: nothing arrived before the deadline. */
    int TIMED_OUT = -2;

    /**
     * Reads the next byte, waiting at most {@code timeout}.
     *
     * @return the byte as 0..255, {@link #TIMED_OUT} or {@link #END_OF_STREAM}
     * @throws InterruptedException if the reading thread is interrupted
     */
    int read(Duration timeout) throws InterruptedException;

    /**
     * Writes all bytes, returning once they are handed to the network.
     *
     * @throws IOException if the connection is closed or the write fails
     */
    void write(byte[] bytes) throws IOException;

    boolean isOpen();

    /** Printable peer address for logs. */
    String remoteAddress();

    /**
     * Closes the connection. Blocked and future reads return
     * {@link #END_OF_STREAM}. Idempotent.
     */
    @Override
    void close();
}

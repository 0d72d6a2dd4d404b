package com.questrail.labsim.protocol.astm.transport;

import java.net.InetSocketAddress;

/**
 * LinkServerEndpoint
 * -----------------------------------------------------------------------------
 * Listening side of the link transport.
 */
public interface LinkServerEndpoint
{
    /**
     * Register the listener for accepted connections. Must be called before
     * {@link #start()}.
     */
    void setListener(LinkServerListener listener);

    /**
     * Bind and begin accepting connections. Returns once the socket is bound.
     *
     * @throws IllegalStateException if binding fails
     */
    void start();

    /**
     * Stop accepting and release transport resources. Connections already
     * handed out are closed by their owners.
     */
    void stop();

    /** Bound address; valid after {@link #start()}. */
    InetSocketAddress localAddress();
}

package com.questrail.labsim.protocol.astm.transport;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Outbound side of the link transport, used when the simulator pushes to a
 * bridge that is listening.
 */
public interface LinkConnector
{
    /**
     * Opens a connection to the given address.
     *
     * @throws IOException if the connection cannot be established
     */
    LinkConnection connect(InetSocketAddress remote) throws IOException;

    /** Release transport resources. */
    void close();
}

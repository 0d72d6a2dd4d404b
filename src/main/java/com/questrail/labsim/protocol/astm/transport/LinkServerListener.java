package com.questrail.labsim.protocol.astm.transport;

/**
 * Callback for connections accepted by a {@link LinkServerEndpoint}.
 *
 * <p>Invoked on a transport thread. Implementations must hand the connection to
 * their own execution context and return promptly.</p>
 */
public interface LinkServerListener
{
    void onConnection(LinkConnection connection);
}

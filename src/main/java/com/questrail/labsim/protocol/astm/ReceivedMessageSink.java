package com.questrail.labsim.protocol.astm;

import com.questrail.labsim.protocol.astm.model.AstmMessage;

/**
 * Consumer of completed inbound messages. Called on the session thread after
 * EOT; implementations must not block for long and must be thread-safe across
 * sessions.
 */
@FunctionalInterface
public interface ReceivedMessageSink
{
    void onMessage(String sessionId, AstmMessage message);
}

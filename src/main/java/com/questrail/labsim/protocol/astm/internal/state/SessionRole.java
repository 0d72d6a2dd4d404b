package com.questrail.labsim.protocol.astm.internal.state;

/**
 * Which side of the current transfer the simulator is on.
 */
public enum SessionRole {
    RECEIVER,
    INITIATOR
}

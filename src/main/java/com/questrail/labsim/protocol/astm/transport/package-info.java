/**
 * ASTM Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete byte-stream transport (Netty
 * TCP in production, in-memory pipes in tests) and the link session.
 *
 * <h2>Why these ports exist</h2>
 * Sessions are written as a synchronous sequence of deadline-bounded reads. The
 * ports give them exactly that and nothing else:
 * <ul>
 *   <li>single-byte reads with an explicit deadline and a distinguishable
 *       timeout result</li>
 *   <li>whole-buffer writes that complete or fail with {@link java.io.IOException}</li>
 *   <li>close, which cancels any blocked read</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations perform I/O only. They do not decode frames, acknowledge
 * anything or schedule retries; all protocol behaviour lives in the session.
 * Netty types never leave the {@code tcp.netty} package.
 */
package com.questrail.labsim.protocol.astm.transport;

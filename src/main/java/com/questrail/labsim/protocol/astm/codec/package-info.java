/**
 * ASTM Codec (Wire-Level)
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the CLSI LIS1-A
 * low-level link carrying ASTM E1381 / LIS2-A2 records. The codec implements the
 * frame rules and nothing else:</p>
 *
 * <ul>
 *   <li>Frame delimiting ({@code STX ... ETX|ETB cs1 cs2 CR LF})</li>
 *   <li>Frame-number digit validation (1..7)</li>
 *   <li>Restricted-character detection in record text</li>
 *   <li>Modulo-256 checksum computation and validation</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] frame bytes
 *        → AstmFrameDecoder   (wire rules applied here)
 *            → AstmFrame      (checksum-validated)
 *                → AstmReceiverReducer / AstmMessage
 * </pre>
 *
 * <p>Frame sequencing, acknowledgement and retransmission belong to the session
 * layer, never to the codec.</p>
 */
package com.questrail.labsim.protocol.astm.codec;

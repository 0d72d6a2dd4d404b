/**
 * Default implementations of the ASTM frame codec.
 *
 * <p>Checksum and framing helpers are package-private; only the decoder and
 * encoder are public.</p>
 */
package com.questrail.labsim.protocol.astm.codec.impl;

/**
 * Chamber Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP or a test double) and the chamber command adapter.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not parse chamber requests</li>
 *   <li>Not call the chamber controller directly</li>
 * </ul>
 */
package com.questrail.interlock.transport;

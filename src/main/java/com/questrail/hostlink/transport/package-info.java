/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP/TCP, a simulator, or
 * a test double) and the command listeners.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production (event loop model, robust framing and lifecycle
 * handling) <strong>without</strong> allowing Netty types to leak into the
 * listeners or the execution serializer.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads or complete JSON frames as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport and connection lifecycle notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no command interpretation)</li>
 *   <li>Not classify commands or consult the registry</li>
 *   <li>Not touch host state</li>
 * </ul>
 */
package com.questrail.hostlink.transport;

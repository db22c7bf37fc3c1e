/**
 * Worker Transport Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * networking implementation (Netty WebSocket client, a test double) and the
 * worker RPC client above it.
 *
 * <h2>Why these ports exist</h2>
 * The rendering worker is reached over a local WebSocket. Netty handles the
 * connection and framing, but Netty types must not leak into the export core.
 * Everything above this package sees only:
 * <ul>
 *   <li>complete text messages as {@code String}</li>
 *   <li>connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no JSON interpretation)</li>
 *   <li>Not correlate requests with responses</li>
 *   <li>Not retry or reconnect on their own</li>
 * </ul>
 *
 * <p>Request correlation, timeouts and retries live in the client and in
 * {@code ServiceConnection}.</p>
 */
package com.questrail.assetexport.connection.transport;

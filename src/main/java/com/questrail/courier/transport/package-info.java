/**
 * Courier Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>broker-library-agnostic transport boundary</em>
 * between a concrete AMQP client (RabbitMQ {@code amqp-client}, an in-memory
 * broker used in tests) and the requester and server adapter.
 *
 * <h2>Why these ports exist</h2>
 * The RabbitMQ client is used in production, with its own automatic connection
 * recovery, <strong>without</strong> allowing its types to leak into the
 * correlation engine.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Bodies as {@code byte[]}</li>
 *   <li>The handful of message properties Courier uses, as plain strings</li>
 *   <li>Channel lifecycle notifications (connected/disconnected)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode bodies or interpret envelope metadata</li>
 *   <li>Not emit {@code RequesterEvent} instances directly</li>
 *   <li>Not correlate, retry or time out anything</li>
 * </ul>
 */
package com.questrail.courier.transport;

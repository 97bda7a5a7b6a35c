/**
 * Service layer: connection bookkeeping, protocol handling and operational support.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.connection} - Connection ids, records and the concurrency-safe registry</li>
 *   <li>{@code service.dispatch} - Envelope decoding and message-type dispatch</li>
 *   <li>{@code service.transport} - Blocking transport abstraction and the safe send wrapper</li>
 *   <li>{@code service.session} - The per-connection handler loop</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.lifecycle} - Metrics,
 *       actuator health and shutdown reporting</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans; the registry is the only shared mutable state</li>
 *   <li>Services do not depend on the presentation layer or on Spring WebSocket types</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.service;

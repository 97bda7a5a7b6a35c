/**
 * Immutable domain values shared across layers: connection snapshots and the decoded
 * inbound message envelope.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.domain;

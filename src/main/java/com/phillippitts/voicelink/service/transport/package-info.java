/**
 * Transport abstraction used by connection handler loops, and the send wrapper that turns
 * every write failure into a boolean result.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.service.transport;

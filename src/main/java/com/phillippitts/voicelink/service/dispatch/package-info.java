/**
 * Message envelope decoding and type-based dispatch. Both units are stateless and perform
 * no I/O.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.service.dispatch;

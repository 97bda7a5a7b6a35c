/**
 * Connection bookkeeping: id generation, per-connection records and the registry that
 * serializes all access to them.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.service.connection;

/**
 * Per-connection request/response loop and its lifecycle vocabulary.
 *
 * <p>One {@link com.phillippitts.voicelink.service.session.ConnectionHandlerLoop#run run}
 * call owns one connection for its whole life: it registers the connection, answers every
 * inbound message in arrival order, and removes the registration when the connection ends.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.service.session;

/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicelink.exception.VoiceLinkException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicelink.exception.MessageDecodeException} - Inbound frame
 *       is not a JSON object; answered with an {@code error} message</li>
 *   <li>{@link com.phillippitts.voicelink.exception.MessageDispatchException} - A decoded
 *       message could not be answered; answered with a generic {@code error} message</li>
 *   <li>{@link com.phillippitts.voicelink.exception.DuplicateConnectionException} - A
 *       connection id was registered twice; the connection is closed</li>
 * </ul>
 *
 * <p>Transport failures are not part of this hierarchy: receive failures surface as
 * {@link java.io.IOException} and send failures as a {@code false} result from
 * {@link com.phillippitts.voicelink.service.transport.SafeMessageSender}.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.exception;

/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamscribe.exception.StreamScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.TransportException} - Thrown when a
 *       send or receive on the streaming session fails</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.SessionRequestException} - Thrown when
 *       the session service rejects a create or close request</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.phillippitts.streamscribe.exception;

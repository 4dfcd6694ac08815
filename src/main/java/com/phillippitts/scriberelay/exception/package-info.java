/**
 * Exception hierarchy for the relay, the session client and the live transcript engines.
 *
 * <ul>
 *   <li>{@link com.phillippitts.scriberelay.exception.ScribeRelayException} - unchecked base</li>
 *   <li>{@link com.phillippitts.scriberelay.exception.AuthenticationFailedException} - token rejected,
 *       surfaced to the user and never retried</li>
 *   <li>{@link com.phillippitts.scriberelay.exception.TransientNetworkException} - retried with backoff</li>
 *   <li>{@link com.phillippitts.scriberelay.exception.ProtocolDecodeException} - bad frame, discarded</li>
 *   <li>{@link com.phillippitts.scriberelay.exception.UpstreamFatalException} - triggers engine fallback</li>
 *   <li>{@link com.phillippitts.scriberelay.exception.InvalidAudioException} - PCM format violation</li>
 * </ul>
 *
 * <p>Messages carry no transcript text, audio or credentials.
 *
 * @see com.phillippitts.scriberelay.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.scriberelay.exception;

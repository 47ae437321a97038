/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.talkback.exception.TalkBackException} and
 * report a stable {@link com.phillippitts.talkback.exception.ErrorKind} used in outbound
 * session messages:
 * <ul>
 *   <li>{@link com.phillippitts.talkback.exception.TranscriptionException} - speech-to-text call failed</li>
 *   <li>{@link com.phillippitts.talkback.exception.GenerationException} - text generation failed</li>
 *   <li>{@link com.phillippitts.talkback.exception.SynthesisException} - one span could not be synthesized</li>
 *   <li>{@link com.phillippitts.talkback.exception.InvalidTurnInputException} - input rejected by a business rule</li>
 *   <li>{@link com.phillippitts.talkback.exception.TurnConflictException} - a turn is already active in the session</li>
 *   <li>{@link com.phillippitts.talkback.exception.TurnNotFoundException} - REST stop for an unknown turn</li>
 *   <li>{@link com.phillippitts.talkback.exception.ProtocolException} - malformed inbound session message</li>
 * </ul>
 *
 * <p>Cancellation is not an exception: pulls report it through
 * {@link com.phillippitts.talkback.service.stream.StreamResult}.
 *
 * @see com.phillippitts.talkback.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.talkback.exception;

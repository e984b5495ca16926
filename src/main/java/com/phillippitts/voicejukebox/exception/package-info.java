/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicejukebox.exception.VoiceJukeboxException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.SourceUnreachableException} - A backend
 *       could not be reached; converted to a status value by the track resolver</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.TrackResolutionException} - A single
 *       track id or stream locator could not be resolved</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.PopulatorProtocolException} - A background
 *       populator wrote after losing its queue lease without being cancelled</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.InvalidQueueOperationException} - Bad
 *       argument to a queue operation</li>
 * </ul>
 *
 * <p>"Not found" and "queue empty" are states, not exceptions; see
 * {@link com.phillippitts.voicejukebox.domain.MatchStatus} and
 * {@link com.phillippitts.voicejukebox.service.queue.QueueStep}.
 *
 * @see com.phillippitts.voicejukebox.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicejukebox.exception;

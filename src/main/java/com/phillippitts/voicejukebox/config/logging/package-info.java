/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code sessionId} - Voice platform session, when the caller sends one</li>
 *   <li>{@code populatorJob} - Id of the populator job, set on populator worker threads</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [populator-1] [requestId] [populatorJob] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.voicejukebox.config.logging.MdcFilter
 */
package com.phillippitts.voicejukebox.config.logging;

/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voicejukebox.exception.InvalidQueueOperationException} → 400 Bad Request</li>
 *   <li>Bean validation and parameter type failures → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.TrackResolutionException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.voicejukebox.exception.SourceUnreachableException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidQueueOperationException",
 *   "message": "Invalid queue operation",
 *   "details": "offset must be &gt;= 0, got: -5",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Not-found and all-sources-unreachable searches are not errors: they return 200 with a
 * {@code status} field.
 */
package com.phillippitts.voicejukebox.presentation.exception;

/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; they never contain queue or ranking logic.
 *
 * @see com.phillippitts.voicejukebox.presentation.controller
 * @see com.phillippitts.voicejukebox.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicejukebox.presentation;

/**
 * Bundled JSON catalog backend, enabled with {@code jukebox.backends.library.enabled}.
 */
package com.phillippitts.voicejukebox.service.backend.library;

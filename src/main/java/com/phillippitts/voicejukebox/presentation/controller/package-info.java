/**
 * REST controllers: {@code /api/playback} for the intent layer and {@code /api/queue} for operators.
 */
package com.phillippitts.voicejukebox.presentation.controller;

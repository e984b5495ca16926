package com.phillippitts.voicejukebox.presentation.controller;

import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.QueryType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/playback/play}.
 *
 * @param type  query type
 * @param query spoken query text
 * @param mode  playback mode to apply, or {@code null} to keep the current one
 */
record PlayRequest(
        @NotNull QueryType type,
        @NotBlank String query,
        PlaybackMode mode
) {
}

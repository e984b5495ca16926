package com.phillippitts.voicejukebox.service.orchestration;

import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.QueryType;

/**
 * Entry point of the intent layer: turns a spoken query into queued playback.
 *
 * <p><b>Deadline:</b> {@link #resolveAndEnqueue} runs on the request thread and must return within the
 * voice platform's deadline. It only resolves and enqueues a small head slice; the rest of the work is
 * handed to a background populator.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EnqueueOutcome outcome = orchestrator.resolveAndEnqueue(QueryType.ARTIST, "queen", PlaybackMode.SHUFFLE);
 * switch (outcome.status()) {
 *     case FOUND -> speak("Playing " + outcome.headSlice().get(0).artist());
 *     case NOT_FOUND -> speak("I couldn't find that");
 *     case ALL_SOURCES_UNREACHABLE -> speak("Your music servers are not responding");
 * }
 * }</pre>
 */
public interface PlaybackOrchestrator {

    /**
     * Resolves a query and replaces the queue with the matching tracks.
     *
     * <p>Steps: stop the live populator; resolve across backends; on a match, clear the queue,
     * enqueue the head slice, apply the requested mode and start a populator for the remainder.
     * When nothing matches, or no backend answers, the queue is left as it was.
     *
     * @param type          kind of query
     * @param freeText      spoken query text
     * @param requestedMode mode to apply, or {@code null} to keep the current one
     * @return head slice, remainder and match status
     */
    EnqueueOutcome resolveAndEnqueue(QueryType type, String freeText, PlaybackMode requestedMode);

    /**
     * Replaces the queue with a shuffled library-wide selection: random tracks or favourites from
     * every backend.
     *
     * <p>Same flow as {@link #resolveAndEnqueue}, except that the head slice is resolved by id; a
     * reference that fails to resolve is dropped. {@code NOT_FOUND} means no backend listed a
     * playable track.
     *
     * @param source        selection to play
     * @param requestedMode mode to apply, or {@code null} to keep the current one
     * @return head slice, remainder and match status
     */
    EnqueueOutcome playLibrary(LibrarySource source, PlaybackMode requestedMode);

    /**
     * Resolves and ranks a query without changing the queue.
     *
     * @param type     kind of query
     * @param freeText spoken query text
     * @return ranked candidates and match status
     */
    SearchOutcome search(QueryType type, String freeText);
}

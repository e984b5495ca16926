package com.phillippitts.voicejukebox.presentation.controller;

import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.service.orchestration.EnqueueOutcome;
import com.phillippitts.voicejukebox.service.orchestration.PlaybackOrchestrator;
import com.phillippitts.voicejukebox.service.orchestration.SearchOutcome;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.queue.QueueStep;
import com.phillippitts.voicejukebox.service.resolve.TrackResolver;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Intent-layer endpoints: play by query or library selection, search, and transport controls
 * (next, previous, pause...).
 *
 * <p>Navigation responses carry the stream URL of the current entry, resolved lazily through its backend.
 */
@RestController
@RequestMapping("/api/playback")
class PlaybackController {

    private static final Logger LOG = LogManager.getLogger(PlaybackController.class);

    private final PlaybackOrchestrator orchestrator;
    private final PlaybackQueue queue;
    private final TrackResolver resolver;

    PlaybackController(PlaybackOrchestrator orchestrator, PlaybackQueue queue, TrackResolver resolver) {
        this.orchestrator = orchestrator;
        this.queue = queue;
        this.resolver = resolver;
    }

    @PostMapping("/play")
    EnqueueOutcome play(@Valid @RequestBody PlayRequest request) {
        LOG.debug("Play intent: type={}, mode={}", request.type(), request.mode());
        return orchestrator.resolveAndEnqueue(request.type(), request.query(), request.mode());
    }

    /** Random or favourite tracks from every backend, shuffled. */
    @PostMapping("/library/{source}")
    EnqueueOutcome library(@PathVariable LibrarySource source,
                           @RequestParam(required = false) PlaybackMode mode) {
        LOG.debug("Library intent: source={}, mode={}", source, mode);
        return orchestrator.playLibrary(source, mode);
    }

    @GetMapping("/search")
    SearchOutcome search(@RequestParam QueryType type, @RequestParam("q") String query) {
        return orchestrator.search(type, query);
    }

    @GetMapping("/current")
    StepResponse current() {
        return respond(queue.currentEntry());
    }

    @PostMapping("/next")
    StepResponse next() {
        return respond(queue.skip());
    }

    /** Track finished on its own: honors repeat-one, unlike {@link #next()}. */
    @PostMapping("/finished")
    StepResponse finished() {
        return respond(queue.advance());
    }

    /** The player could not play the current entry: flag it and move on, even under repeat-one. */
    @PostMapping("/failed")
    StepResponse failed() {
        return respond(queue.markCurrentFailed());
    }

    @PostMapping("/previous")
    StepResponse previous() {
        return respond(queue.rewind());
    }

    @PostMapping("/restart")
    StepResponse restart() {
        return respond(queue.restart());
    }

    @PostMapping("/pause")
    StepResponse pause(@RequestParam(defaultValue = "0") long offsetMs) {
        return respond(queue.pause(offsetMs));
    }

    @PostMapping("/resume")
    StepResponse resume() {
        return respond(queue.play());
    }

    @PostMapping("/stop")
    StepResponse stop() {
        queue.stop();
        return respond(queue.currentEntry());
    }

    @PutMapping("/mode")
    Map<String, PlaybackMode> mode(@RequestParam PlaybackMode mode) {
        queue.setMode(mode);
        return Map.of("mode", queue.getMode());
    }

    private StepResponse respond(QueueStep step) {
        String streamUrl = step.hasEntry() ? resolver.streamLocatorFor(step.entry().track()) : null;
        return StepResponse.of(step, streamUrl, queue.getStatus());
    }
}

package com.phillippitts.voicejukebox.presentation.controller;

import com.phillippitts.voicejukebox.domain.QueueEntry;
import com.phillippitts.voicejukebox.service.populator.PopulatorJob;
import com.phillippitts.voicejukebox.service.populator.SessionSupervisor;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.queue.QueueSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator views of the queue and its background populator.
 */
@RestController
@RequestMapping("/api/queue")
class QueueController {

    private final PlaybackQueue queue;
    private final SessionSupervisor supervisor;

    QueueController(PlaybackQueue queue, SessionSupervisor supervisor) {
        this.queue = queue;
        this.supervisor = supervisor;
    }

    @GetMapping
    QueueSnapshot snapshot() {
        return queue.snapshot();
    }

    @GetMapping("/history")
    List<QueueEntry> history() {
        return queue.snapshot().history();
    }

    @GetMapping("/upcoming")
    List<QueueEntry> upcoming(@RequestParam(defaultValue = "10") int n) {
        return queue.peekUpcoming(n);
    }

    @GetMapping("/populator")
    ResponseEntity<Map<String, Object>> populator() {
        Optional<PopulatorJob> job = supervisor.currentJob();
        if (job.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        PopulatorJob j = job.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", j.getId());
        body.put("state", j.getState());
        body.put("originBackend", j.getSpec().originBackend());
        body.put("total", j.getSpec().size());
        body.put("appended", j.getAppended());
        body.put("skipped", j.getSkipped());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        supervisor.stopPopulator();
        queue.clear();
        return ResponseEntity.noContent().build();
    }
}

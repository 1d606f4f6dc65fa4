package com.github.stormino.relay.controller;

import com.github.stormino.relay.model.BatchTransferRequest;
import com.github.stormino.relay.model.EnqueueResult;
import com.github.stormino.relay.model.SchedulerStatus;
import com.github.stormino.relay.model.TransferRequest;
import com.github.stormino.relay.service.TransferRequestService;
import com.github.stormino.relay.service.scheduler.TransferScheduler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final TransferRequestService requestService;
    private final TransferScheduler scheduler;

    /**
     * Queue a single object as interactive work
     */
    @PostMapping("/single")
    public ResponseEntity<EnqueueResult> queueSingle(@Valid @RequestBody TransferRequest request) {
        log.info("Single transfer requested: {}", request.getUrl());
        return ResponseEntity.ok(requestService.queueSingle(request));
    }

    /**
     * Queue a batch of episodes as bulk work
     */
    @PostMapping("/batch")
    public ResponseEntity<List<EnqueueResult>> queueBatch(@Valid @RequestBody BatchTransferRequest request) {
        log.info("Batch transfer requested: {} ({} episodes)", request.getGroupContext(), request.getEpisodes().size());
        return ResponseEntity.ok(requestService.queueBatch(request.getGroupContext(), request.getEpisodes()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        boolean cancelled = scheduler.cancel(id);
        return cancelled ? ResponseEntity.ok().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scheduler.status());
    }

    @GetMapping("/{id}/in-progress")
    public ResponseEntity<Map<String, Object>> inProgress(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("id", id, "inProgress", scheduler.isInProgress(id)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected transfer request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}

package com.github.stormino.relay.controller;

import com.github.stormino.relay.service.ProgressBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressBroadcastService progressBroadcastService;

    /**
     * Live transfer events. {@code progress} events carry the bytes staged, the current chunk size
     * and the window throughput of a running transfer, plus a status event when its upload starts;
     * one {@code outcome} event per finished transfer carries COMPLETED with the remote id, or
     * FAILED/CANCELLED with the error message.
     */
    @GetMapping("/stream")
    public SseEmitter streamProgress() {
        log.info("Transfer event stream opened");
        return progressBroadcastService.createEmitter();
    }
}

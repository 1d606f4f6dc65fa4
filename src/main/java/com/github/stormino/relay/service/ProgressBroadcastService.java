package com.github.stormino.relay.service;

import com.github.stormino.relay.model.ProgressUpdate;
import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.scheduler.TransferCompletionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans transfer events out to SSE subscribers: {@value #PROGRESS_EVENT} while a transfer runs,
 * {@value #OUTCOME_EVENT} once it has finished.
 */
@Slf4j
@Service
public class ProgressBroadcastService implements TransferCompletionListener {

    public static final String PROGRESS_EVENT = "progress";
    public static final String OUTCOME_EVENT = "outcome";

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    /**
     * Register a new SSE emitter
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());
        return emitter;
    }

    public void broadcastProgress(ProgressUpdate update) {
        log.trace("Broadcasting {} for task {}: {}%", update.getStatus(), update.getTaskId(), update.getProgress());
        broadcastToSse(PROGRESS_EVENT, update);
    }

    @Override
    public void onTransferFinished(TransferTask task, int slotId, TransferResult result) {
        ProgressUpdate update = ProgressUpdate.forOutcome(task, slotId, result);
        log.trace("Broadcasting outcome {} for task {}", update.getStatus(), task.getId());
        broadcastToSse(OUTCOME_EVENT, update);
    }

    private void broadcastToSse(String eventName, ProgressUpdate update) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(eventName)
                        .data(update));
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }
}

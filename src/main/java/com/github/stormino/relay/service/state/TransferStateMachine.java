package com.github.stormino.relay.service.state;

import com.github.stormino.relay.model.TransferStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates status changes of a tracked transfer.
 *
 * <pre>
 * QUEUED → DOWNLOADING → UPLOADING → COMPLETED
 *    ↓          ↓            ↓
 * CANCELLED  FAILED/CANCELLED
 * </pre>
 */
@Slf4j
@Component
public class TransferStateMachine {

    private final Map<TransferStatus, Set<TransferStatus>> validTransitions = new EnumMap<>(TransferStatus.class);

    public TransferStateMachine() {
        validTransitions.put(TransferStatus.QUEUED,
                EnumSet.of(TransferStatus.DOWNLOADING, TransferStatus.CANCELLED, TransferStatus.FAILED));
        validTransitions.put(TransferStatus.DOWNLOADING,
                EnumSet.of(TransferStatus.UPLOADING, TransferStatus.COMPLETED,
                        TransferStatus.FAILED, TransferStatus.CANCELLED));
        validTransitions.put(TransferStatus.UPLOADING,
                EnumSet.of(TransferStatus.COMPLETED, TransferStatus.FAILED, TransferStatus.CANCELLED));

        validTransitions.put(TransferStatus.COMPLETED, EnumSet.noneOf(TransferStatus.class));
        validTransitions.put(TransferStatus.FAILED, EnumSet.noneOf(TransferStatus.class));
        validTransitions.put(TransferStatus.CANCELLED, EnumSet.noneOf(TransferStatus.class));
    }

    public boolean isValidTransition(@NonNull TransferStatus currentState, @NonNull TransferStatus newState) {
        if (currentState == newState) {
            return true;
        }
        return validTransitions.get(currentState).contains(newState);
    }

    /**
     * @return the new state if the change is allowed, otherwise the current state
     */
    public TransferStatus transition(@NonNull String taskId,
                                     @NonNull TransferStatus currentState,
                                     @NonNull TransferStatus newState) {
        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Task {} state transition: {} → {}", taskId, currentState, newState);
            }
            return newState;
        }
        log.warn("Task {} invalid state transition attempted: {} → {} (rejected)",
                taskId, currentState, newState);
        return currentState;
    }
}

package com.github.stormino.relay.service;

import com.github.stormino.relay.model.EnqueueResult;
import com.github.stormino.relay.model.ObjectLocator;
import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.TransferRequest;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.scheduler.TransferScheduler;
import com.github.stormino.relay.util.LocatorParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns client requests into transfer tasks. Single requests are queued as interactive work,
 * batches as bulk work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferRequestService {

    private final TransferScheduler scheduler;

    public EnqueueResult queueSingle(TransferRequest request) {
        TransferTask task = toTask(request, PriorityClass.INTERACTIVE, null);
        return scheduler.enqueue(task);
    }

    /**
     * Queue every episode of a batch. All links are validated before anything is queued.
     *
     * @return one result per episode, in request order
     */
    public List<EnqueueResult> queueBatch(String groupContext, List<TransferRequest> episodes) {
        List<TransferTask> tasks = new ArrayList<>(episodes.size());
        for (TransferRequest episode : episodes) {
            tasks.add(toTask(episode, PriorityClass.BULK, groupContext));
        }

        List<EnqueueResult> results = new ArrayList<>(tasks.size());
        for (TransferTask task : tasks) {
            results.add(scheduler.enqueue(task));
        }

        long accepted = results.stream().filter(EnqueueResult::isAccepted).count();
        log.info("Batch {}: {} of {} episode(s) queued", groupContext, accepted, results.size());
        return results;
    }

    /**
     * Identifier of the object a link points at.
     */
    public static String taskIdOf(ObjectLocator locator) {
        return locator.getContainer() + "_" + locator.getObjectRef();
    }

    private TransferTask toTask(TransferRequest request, PriorityClass priorityClass, String groupContext) {
        ObjectLocator locator = LocatorParser.parse(request.getUrl())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported message link: " + request.getUrl()));

        return TransferTask.builder()
                .id(taskIdOf(locator))
                .locator(locator)
                .displayName(LocatorParser.displayName(locator, request.getOriginalFilename()))
                .priorityClass(priorityClass)
                .groupContext(groupContext)
                .build();
    }
}

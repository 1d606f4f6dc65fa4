package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.TransferTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending transfers, one first-come-first-served collection per priority class.
 * Not thread-safe: callers hold the scheduler lock.
 */
public class TaskQueue {

    private final Map<PriorityClass, Deque<TransferTask>> pending = new EnumMap<>(PriorityClass.class);

    public TaskQueue() {
        for (PriorityClass priorityClass : PriorityClass.values()) {
            pending.put(priorityClass, new ArrayDeque<>());
        }
    }

    /**
     * Append a task to the tail of its class's collection.
     */
    public void offer(TransferTask task) {
        pending.get(task.getPriorityClass()).addLast(task);
    }

    /**
     * Remove the head of the interactive collection, or of the bulk collection when no
     * interactive work is waiting.
     */
    public Optional<TransferTask> dequeueNext() {
        Optional<TransferTask> interactive = poll(PriorityClass.INTERACTIVE);
        return interactive.isPresent() ? interactive : poll(PriorityClass.BULK);
    }

    public Optional<TransferTask> poll(PriorityClass priorityClass) {
        return Optional.ofNullable(pending.get(priorityClass).pollFirst());
    }

    public boolean hasPending(PriorityClass priorityClass) {
        return !pending.get(priorityClass).isEmpty();
    }

    public Optional<TransferTask> remove(String taskId) {
        for (Deque<TransferTask> tasks : pending.values()) {
            Iterator<TransferTask> it = tasks.iterator();
            while (it.hasNext()) {
                TransferTask task = it.next();
                if (task.getId().equals(taskId)) {
                    it.remove();
                    return Optional.of(task);
                }
            }
        }
        return Optional.empty();
    }

    public int size(PriorityClass priorityClass) {
        return pending.get(priorityClass).size();
    }

    public int size() {
        return pending.values().stream().mapToInt(Deque::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Copy of one collection in admission order.
     */
    public List<TransferTask> snapshot(PriorityClass priorityClass) {
        return new ArrayList<>(pending.get(priorityClass));
    }
}

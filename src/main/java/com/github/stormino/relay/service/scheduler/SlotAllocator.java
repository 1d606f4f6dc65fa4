package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.exception.ConfigurationException;
import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.SlotKind;
import com.github.stormino.relay.model.TransferTask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Fixed pool of execution slots, statically partitioned into bulk-reserved slots
 * {@code [0, bulkSlots)} and interactive-reserved slots {@code [bulkSlots, totalSlots)}.
 * <p>
 * Idle slots live in a single ordered free list. An interactive task takes the first idle
 * interactive-reserved slot and otherwise borrows an idle bulk-reserved one; a bulk task only
 * ever takes a bulk-reserved slot. Not thread-safe: callers hold the scheduler lock.
 */
@Slf4j
public class SlotAllocator {

    private final int bulkSlots;
    private final int interactiveSlots;
    private final Slot[] slots;
    private final NavigableSet<Integer> freeSlots = new TreeSet<>();


    public SlotAllocator(int bulkSlots, int interactiveSlots) {
        if (bulkSlots < 0) {
            throw new ConfigurationException("Bulk slot count cannot be negative",
                    "relay.scheduler.bulk-slots", String.valueOf(bulkSlots));
        }
        if (interactiveSlots < 1) {
            throw new ConfigurationException("At least one interactive slot is required",
                    "relay.scheduler.interactive-slots", String.valueOf(interactiveSlots));
        }

        this.bulkSlots = bulkSlots;
        this.interactiveSlots = interactiveSlots;
        this.slots = new Slot[bulkSlots + interactiveSlots];

        for (int id = 0; id < slots.length; id++) {
            SlotKind kind = id < bulkSlots ? SlotKind.BULK_RESERVED : SlotKind.INTERACTIVE_RESERVED;
            slots[id] = new Slot(id, kind);
            freeSlots.add(id);
        }

        log.info("Slot allocator initialized: bulk slots {}, interactive slots {}, total {}",
                bulkSlots, interactiveSlots, slots.length);
    }

    /**
     * Find an idle slot the given class may occupy, without taking it.
     */
    public OptionalInt findFree(PriorityClass priorityClass) {
        if (priorityClass == PriorityClass.INTERACTIVE) {
            Integer reserved = freeSlots.ceiling(bulkSlots);
            if (reserved != null) {
                return OptionalInt.of(reserved);
            }
        }
        return firstFreeBulkSlot();
    }

    private OptionalInt firstFreeBulkSlot() {
        if (freeSlots.isEmpty()) {
            return OptionalInt.empty();
        }
        int first = freeSlots.first();
        return first < bulkSlots ? OptionalInt.of(first) : OptionalInt.empty();
    }

    /**
     * Put a task into an idle slot.
     *
     * @throws IllegalStateException if the slot is busy or may not hold this task's class
     */
    public Slot occupy(int slotId, TransferTask task) {
        Slot slot = slot(slotId);
        if (!slot.getKind().accepts(task.getPriorityClass())) {
            throw new IllegalStateException(String.format(
                    "%s task %s cannot occupy %s slot %d",
                    task.getPriorityClass(), task.getId(), slot.getKind(), slotId));
        }

        slot.occupy(task);
        freeSlots.remove(slotId);
        return slot;
    }

    /**
     * Return a slot to the free list.
     *
     * @param slotId Slot to release
     * @param taskId Task expected to occupy it
     * @return The released task, or empty if the slot was idle or held a different task
     */
    public Optional<TransferTask> release(int slotId, String taskId) {
        Slot slot = slot(slotId);
        TransferTask occupant = slot.getOccupant();

        if (occupant == null || !occupant.getId().equals(taskId)) {
            log.warn("Ignoring release of slot {} for task {}: slot holds {}",
                    slotId, taskId, occupant != null ? occupant.getId() : "nothing");
            return Optional.empty();
        }

        slot.vacate();
        freeSlots.add(slotId);
        return Optional.of(occupant);
    }

    public Slot slot(int slotId) {
        if (slotId < 0 || slotId >= slots.length) {
            throw new IllegalArgumentException("No such slot: " + slotId);
        }
        return slots[slotId];
    }

    public List<Slot> occupiedSlots() {
        List<Slot> occupied = new ArrayList<>();
        for (Slot slot : slots) {
            if (!slot.isIdle()) {
                occupied.add(slot);
            }
        }
        return Collections.unmodifiableList(occupied);
    }

    public int getTotalSlots() {
        return slots.length;
    }

    public int getBulkSlots() {
        return bulkSlots;
    }

    public int getInteractiveSlots() {
        return interactiveSlots;
    }

    public int getFreeSlotCount() {
        return freeSlots.size();
    }
}

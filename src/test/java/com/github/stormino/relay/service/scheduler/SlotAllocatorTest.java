package com.github.stormino.relay.service.scheduler;

import com.github.stormino.relay.exception.ConfigurationException;
import com.github.stormino.relay.model.ObjectLocator;
import com.github.stormino.relay.model.PriorityClass;
import com.github.stormino.relay.model.SlotKind;
import com.github.stormino.relay.model.TransferTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SlotAllocator")
class SlotAllocatorTest {

    private SlotAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new SlotAllocator(3, 1);
    }

    private static TransferTask task(String id, PriorityClass priorityClass) {
        return TransferTask.builder()
                .id(id)
                .locator(ObjectLocator.of("channel", id))
                .displayName(id + ".mkv")
                .priorityClass(priorityClass)
                .build();
    }

    private int occupyNext(String id, PriorityClass priorityClass) {
        int slotId = allocator.findFree(priorityClass).orElseThrow();
        allocator.occupy(slotId, task(id, priorityClass));
        return slotId;
    }

    @Nested
    @DisplayName("layout")
    class LayoutTests {

        @Test
        @DisplayName("bulk-reserved slots come first, interactive-reserved last")
        void slotKindsArePartitioned() {
            assertEquals(SlotKind.BULK_RESERVED, allocator.slot(0).getKind());
            assertEquals(SlotKind.BULK_RESERVED, allocator.slot(2).getKind());
            assertEquals(SlotKind.INTERACTIVE_RESERVED, allocator.slot(3).getKind());
            assertEquals(4, allocator.getTotalSlots());
            assertEquals(4, allocator.getFreeSlotCount());
        }

        @Test
        @DisplayName("zero bulk slots is a valid layout")
        void zeroBulkSlotsIsValid() {
            SlotAllocator interactiveOnly = new SlotAllocator(0, 2);

            assertFalse(interactiveOnly.findFree(PriorityClass.BULK).isPresent());
            assertTrue(interactiveOnly.findFree(PriorityClass.INTERACTIVE).isPresent());
        }

        @Test
        @DisplayName("invalid counts raise ConfigurationException with the offending key")
        void invalidCountsAreRejected() {
            ConfigurationException bulk = assertThrows(ConfigurationException.class, () -> new SlotAllocator(-1, 1));
            assertEquals("relay.scheduler.bulk-slots", bulk.getConfigKey());

            ConfigurationException interactive = assertThrows(ConfigurationException.class, () -> new SlotAllocator(3, 0));
            assertEquals("relay.scheduler.interactive-slots", interactive.getConfigKey());
        }

        @Test
        @DisplayName("unknown slot id is rejected")
        void unknownSlotIdRejected() {
            assertThrows(IllegalArgumentException.class, () -> allocator.slot(4));
            assertThrows(IllegalArgumentException.class, () -> allocator.slot(-1));
        }
    }

    @Nested
    @DisplayName("findFree")
    class FindFreeTests {

        @Test
        @DisplayName("interactive prefers its reserved slot")
        void interactivePrefersReservedSlot() {
            assertEquals(OptionalInt.of(3), allocator.findFree(PriorityClass.INTERACTIVE));
        }

        @Test
        @DisplayName("interactive borrows an idle bulk slot when its own is busy")
        void interactiveBorrowsIdleBulkSlot() {
            occupyNext("I1", PriorityClass.INTERACTIVE);

            assertEquals(OptionalInt.of(0), allocator.findFree(PriorityClass.INTERACTIVE));
        }

        @Test
        @DisplayName("bulk never takes the interactive-reserved slot")
        void bulkNeverTakesInteractiveSlot() {
            occupyNext("B1", PriorityClass.BULK);
            occupyNext("B2", PriorityClass.BULK);
            occupyNext("B3", PriorityClass.BULK);

            assertFalse(allocator.findFree(PriorityClass.BULK).isPresent());
            assertEquals(OptionalInt.of(3), allocator.findFree(PriorityClass.INTERACTIVE));
        }

        @Test
        @DisplayName("nothing is free once every slot is occupied")
        void nothingFreeWhenFull() {
            for (int i = 0; i < 4; i++) {
                occupyNext("I" + i, PriorityClass.INTERACTIVE);
            }

            assertFalse(allocator.findFree(PriorityClass.INTERACTIVE).isPresent());
            assertFalse(allocator.findFree(PriorityClass.BULK).isPresent());
            assertEquals(0, allocator.getFreeSlotCount());
        }
    }

    @Nested
    @DisplayName("occupy and release")
    class OccupyReleaseTests {

        @Test
        @DisplayName("bulk task cannot be placed in an interactive-reserved slot")
        void bulkCannotOccupyInteractiveSlot() {
            assertThrows(IllegalStateException.class, () -> allocator.occupy(3, task("B1", PriorityClass.BULK)));
            assertEquals(4, allocator.getFreeSlotCount());
        }

        @Test
        @DisplayName("a busy slot cannot be occupied twice")
        void busySlotCannotBeOccupiedTwice() {
            allocator.occupy(0, task("B1", PriorityClass.BULK));

            assertThrows(IllegalStateException.class, () -> allocator.occupy(0, task("B2", PriorityClass.BULK)));
        }

        @Test
        @DisplayName("release returns the slot to the free list exactly once")
        void releaseIsExactlyOnce() {
            int slotId = occupyNext("B1", PriorityClass.BULK);

            assertEquals("B1", allocator.release(slotId, "B1").orElseThrow().getId());
            assertFalse(allocator.release(slotId, "B1").isPresent());
            assertEquals(4, allocator.getFreeSlotCount());
        }

        @Test
        @DisplayName("release for a different occupant is ignored")
        void releaseForWrongTaskIgnored() {
            int slotId = occupyNext("B1", PriorityClass.BULK);

            assertFalse(allocator.release(slotId, "B2").isPresent());
            assertFalse(allocator.slot(slotId).isIdle());
        }

        @Test
        @DisplayName("occupied slots are listed in slot order with their occupants")
        void occupiedSlotsListed() {
            occupyNext("B1", PriorityClass.BULK);
            occupyNext("I1", PriorityClass.INTERACTIVE);
            occupyNext("I2", PriorityClass.INTERACTIVE);

            List<String> occupants = allocator.occupiedSlots().stream()
                    .map(slot -> slot.getOccupant().getId())
                    .collect(Collectors.toList());
            assertEquals(List.of("B1", "I2", "I1"), occupants);
            assertEquals(1, allocator.getFreeSlotCount());
        }
    }
}

package com.github.stormino.relay.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ObjectHandle")
class ObjectHandleTest {

    private static final ObjectLocator LOCATOR = ObjectLocator.of("chan", "42");

    @Test
    @DisplayName("tracks remaining bytes for a known size")
    void tracksRemainingBytes() {
        ObjectHandle handle = new ObjectHandle(LOCATOR, 1000);

        handle.advance(400);

        assertTrue(handle.isSizeKnown());
        assertEquals(400, handle.getPosition());
        assertEquals(600, handle.getRemainingBytes());
    }

    @Test
    @DisplayName("remaining bytes never go negative")
    void remainingNeverNegative() {
        ObjectHandle handle = new ObjectHandle(LOCATOR, 100);

        handle.advance(150);

        assertEquals(0, handle.getRemainingBytes());
    }

    @Test
    @DisplayName("zero size counts as unknown")
    void zeroSizeIsUnknown() {
        ObjectHandle handle = new ObjectHandle(LOCATOR, 0);

        assertFalse(handle.isSizeKnown());
        assertEquals(ObjectHandle.UNKNOWN_SIZE, handle.getSizeBytes());
        assertEquals(ObjectHandle.UNKNOWN_SIZE, handle.getRemainingBytes());
    }

    @Test
    @DisplayName("rejects negative advances")
    void rejectsNegativeAdvance() {
        ObjectHandle handle = new ObjectHandle(LOCATOR, 100);

        assertThrows(IllegalArgumentException.class, () -> handle.advance(-1));
    }
}

package com.github.stormino.relay.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransferResult")
class TransferResultTest {

    @Nested
    @DisplayName("Factory methods")
    class FactoryMethodTests {

        @Test
        @DisplayName("success carries the remote id and byte count")
        void success() {
            TransferResult result = TransferResult.success("abc123", 2048);

            assertTrue(result.isSuccess());
            assertFalse(result.isCancelled());
            assertEquals("abc123", result.getRemoteId());
            assertEquals(2048, result.getBytesTransferred());
            assertNull(result.getFailureReason());
        }

        @Test
        @DisplayName("failure carries reason, message and cause")
        void failure() {
            IOException cause = new IOException("disk full");
            TransferResult result = TransferResult.failure(
                    TransferResult.FailureReason.STAGING_ERROR, "Staging failed", cause);

            assertFalse(result.isSuccess());
            assertEquals(TransferResult.ResultStatus.FAILED, result.getStatus());
            assertEquals(TransferResult.FailureReason.STAGING_ERROR, result.getFailureReason());
            assertEquals("Staging failed", result.getErrorMessage());
            assertSame(cause, result.getCause());
            assertNull(result.getRemoteId());
        }

        @Test
        @DisplayName("cancelled is neither success nor failure")
        void cancelled() {
            TransferResult result = TransferResult.cancelled("stopped");

            assertTrue(result.isCancelled());
            assertFalse(result.isSuccess());
            assertNull(result.getFailureReason());
        }
    }

    @Test
    @DisplayName("maps each outcome to its terminal status")
    void mapsToTerminalStatus() {
        assertEquals(TransferStatus.COMPLETED, TransferResult.success("id", 1).toTransferStatus());
        assertEquals(TransferStatus.FAILED,
                TransferResult.failure(TransferResult.FailureReason.INTERNAL_ERROR, "boom").toTransferStatus());
        assertEquals(TransferStatus.CANCELLED, TransferResult.cancelled("stop").toTransferStatus());
    }
}

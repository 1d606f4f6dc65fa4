package com.github.stormino.relay.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("TransferException")
    class TransferExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new TransferException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new IOException("Root cause");
            TransferException ex = new TransferException("Transfer failed", cause);

            assertEquals("Transfer failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("SourceUnavailableException")
    class SourceUnavailableExceptionTests {

        @Test
        @DisplayName("should carry the locator")
        void shouldCarryLocator() {
            SourceUnavailableException ex = new SourceUnavailableException("Object not found", "chan/42");

            assertInstanceOf(TransferException.class, ex);
            assertEquals("chan/42", ex.getLocator());
        }
    }

    @Nested
    @DisplayName("SourceReadException")
    class SourceReadExceptionTests {

        @Test
        @DisplayName("should carry locator, position and cause")
        void shouldCarryLocatorPositionAndCause() {
            IOException cause = new IOException("Connection reset");
            SourceReadException ex = new SourceReadException("Read failed", cause, "chan/42", 4096);

            assertInstanceOf(TransferException.class, ex);
            assertEquals("chan/42", ex.getLocator());
            assertEquals(4096, ex.getPosition());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("SinkUploadException")
    class SinkUploadExceptionTests {

        @Test
        @DisplayName("should carry the HTTP status when known")
        void shouldCarryHttpStatus() {
            SinkUploadException ex = new SinkUploadException("Too large", "42.mkv", 413);

            assertEquals("42.mkv", ex.getDisplayName());
            assertEquals(413, ex.getHttpStatus());
        }

        @Test
        @DisplayName("should leave the HTTP status empty for transport failures")
        void shouldLeaveStatusEmptyForTransportFailures() {
            SinkUploadException ex = new SinkUploadException("Timed out", new IOException("timeout"), "42.mkv");

            assertNull(ex.getHttpStatus());
            assertInstanceOf(IOException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("ConfigurationException")
    class ConfigurationExceptionTests {

        @Test
        @DisplayName("should carry key and value")
        void shouldCarryKeyAndValue() {
            ConfigurationException ex = new ConfigurationException("Invalid", "relay.scheduler.bulk-slots", "-1");

            assertInstanceOf(TransferException.class, ex);
            assertEquals("relay.scheduler.bulk-slots", ex.getConfigKey());
            assertEquals("-1", ex.getConfigValue());
        }

        @Test
        @DisplayName("should leave key empty when created with message only")
        void shouldLeaveKeyEmpty() {
            ConfigurationException ex = new ConfigurationException("Invalid");

            assertNull(ex.getConfigKey());
            assertNull(ex.getConfigValue());
        }
    }

    @Test
    @DisplayName("TransferCancelledException should name the task")
    void cancelledExceptionNamesTask() {
        TransferCancelledException ex = new TransferCancelledException("chan_42");

        assertEquals("chan_42", ex.getTaskId());
        assertTrue(ex.getMessage().contains("chan_42"));
    }
}

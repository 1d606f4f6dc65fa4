package com.github.stormino.relay.service.source;

import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.exception.SourceReadException;
import com.github.stormino.relay.exception.SourceUnavailableException;
import com.github.stormino.relay.model.ObjectHandle;
import com.github.stormino.relay.model.ObjectLocator;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpTransferSource")
class HttpTransferSourceTest {

    private static final ObjectLocator LOCATOR = ObjectLocator.of("chan", "42");

    private MockWebServer server;
    private HttpTransferSource source;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        RelayProperties properties = new RelayProperties();
        properties.getSource().setBaseUrl(server.url("/media").toString());
        source = new HttpTransferSource(new OkHttpClient(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("reads the object size from a HEAD request")
        void readsSizeFromHead() throws InterruptedException {
            server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Length", "1000"));

            ObjectHandle handle = source.resolve(LOCATOR);

            assertEquals(1000, handle.getSizeBytes());
            assertEquals(0, handle.getPosition());
            RecordedRequest request = server.takeRequest();
            assertEquals("HEAD", request.getMethod());
            assertEquals("/media/chan/42", request.getPath());
        }

        @Test
        @DisplayName("zero length means unknown size")
        void zeroLengthIsUnknown() {
            server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Length", "0"));

            ObjectHandle handle = source.resolve(LOCATOR);

            assertFalse(handle.isSizeKnown());
        }

        @Test
        @DisplayName("404 is reported as source unavailable")
        void notFoundIsUnavailable() {
            server.enqueue(new MockResponse().setResponseCode(404));

            SourceUnavailableException e = assertThrows(SourceUnavailableException.class, () -> source.resolve(LOCATOR));
            assertEquals("chan/42", e.getLocator());
        }

        @Test
        @DisplayName("410 is reported as source unavailable")
        void goneIsUnavailable() {
            server.enqueue(new MockResponse().setResponseCode(410));

            assertThrows(SourceUnavailableException.class, () -> source.resolve(LOCATOR));
        }
    }

    @Nested
    @DisplayName("readChunk")
    class ReadChunkTests {

        @Test
        @DisplayName("requests the next byte range and advances the handle")
        void requestsRangeAndAdvances() throws InterruptedException {
            server.enqueue(new MockResponse().setResponseCode(206).setBody("hello"));
            server.enqueue(new MockResponse().setResponseCode(206).setBody("world"));
            ObjectHandle handle = new ObjectHandle(LOCATOR, 10);

            Optional<byte[]> first = source.readChunk(handle, 5);
            Optional<byte[]> second = source.readChunk(handle, 5);

            assertEquals("hello", new String(first.orElseThrow(), StandardCharsets.UTF_8));
            assertEquals("world", new String(second.orElseThrow(), StandardCharsets.UTF_8));
            assertEquals(10, handle.getPosition());
            assertEquals("bytes=0-4", server.takeRequest().getHeader("Range"));
            assertEquals("bytes=5-9", server.takeRequest().getHeader("Range"));
        }

        @Test
        @DisplayName("416 signals end-of-stream")
        void rangeNotSatisfiableIsEndOfStream() {
            server.enqueue(new MockResponse().setResponseCode(416));

            assertFalse(source.readChunk(new ObjectHandle(LOCATOR, -1), 5).isPresent());
        }

        @Test
        @DisplayName("empty body signals end-of-stream")
        void emptyBodyIsEndOfStream() {
            server.enqueue(new MockResponse().setResponseCode(206));

            assertFalse(source.readChunk(new ObjectHandle(LOCATOR, -1), 5).isPresent());
        }

        @Test
        @DisplayName("full response at offset zero is trimmed to the requested chunk")
        void fullResponseIsTrimmed() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("0123456789"));
            ObjectHandle handle = new ObjectHandle(LOCATOR, 10);

            byte[] chunk = source.readChunk(handle, 4).orElseThrow();

            assertEquals("0123", new String(chunk, StandardCharsets.UTF_8));
            assertEquals(4, handle.getPosition());
        }

        @Test
        @DisplayName("large full response is read only up to the requested chunk")
        void largeFullResponseIsNotBuffered() {
            int objectSize = 8 * 1024 * 1024;
            Buffer object = new Buffer().write(new byte[objectSize]);
            // Streaming the whole object at this rate would take over a minute
            server.enqueue(new MockResponse()
                    .setResponseCode(200)
                    .setBody(object)
                    .throttleBody(128 * 1024, 1, TimeUnit.SECONDS));
            ObjectHandle handle = new ObjectHandle(LOCATOR, objectSize);

            byte[] chunk = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> source.readChunk(handle, 64 * 1024).orElseThrow());

            assertEquals(64 * 1024, chunk.length);
            assertEquals(64 * 1024, handle.getPosition());
        }

        @Test
        @DisplayName("ignored range past offset zero is a read error")
        void ignoredRangeIsReadError() {
            server.enqueue(new MockResponse().setResponseCode(206).setBody("abcd"));
            server.enqueue(new MockResponse().setResponseCode(200).setBody("abcdefgh"));
            ObjectHandle handle = new ObjectHandle(LOCATOR, 8);
            source.readChunk(handle, 4);

            SourceReadException e = assertThrows(SourceReadException.class, () -> source.readChunk(handle, 4));
            assertEquals(4, e.getPosition());
        }

        @Test
        @DisplayName("server error is a read error at the current position")
        void serverErrorIsReadError() {
            server.enqueue(new MockResponse().setResponseCode(503));

            SourceReadException e = assertThrows(SourceReadException.class,
                    () -> source.readChunk(new ObjectHandle(LOCATOR, 100), 10));
            assertEquals(0, e.getPosition());
            assertEquals("chan/42", e.getLocator());
        }
    }
}

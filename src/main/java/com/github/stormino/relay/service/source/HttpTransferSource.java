package com.github.stormino.relay.service.source;

import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.exception.SourceReadException;
import com.github.stormino.relay.exception.SourceUnavailableException;
import com.github.stormino.relay.model.ObjectHandle;
import com.github.stormino.relay.model.ObjectLocator;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads objects from an HTTP origin laid out as {@code <baseUrl>/<container>/<objectRef>}.
 * Sizes come from {@code HEAD}, chunks from {@code Range} requests.
 */
@Slf4j
@Service
public class HttpTransferSource implements TransferSource {

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;

    public HttpTransferSource(@Qualifier("sourceHttpClient") OkHttpClient httpClient, RelayProperties properties) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(properties.getSource().getBaseUrl());
    }

    @Override
    public ObjectHandle resolve(ObjectLocator locator) {
        Request request = new Request.Builder()
                .url(urlFor(locator))
                .head()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404 || response.code() == 410) {
                throw new SourceUnavailableException("Object not found: " + locator, locator.toString());
            }
            if (!response.isSuccessful()) {
                throw new SourceUnavailableException("Unexpected response code " + response.code() + " for " + locator,
                        locator.toString());
            }

            long size = parseLength(response.header("Content-Length"));
            log.debug("Resolved {} ({} bytes)", locator, size);
            return new ObjectHandle(locator, size);

        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to resolve " + locator + ": " + e.getMessage(), e,
                    locator.toString());
        }
    }

    @Override
    public Optional<byte[]> readChunk(ObjectHandle handle, int chunkSizeBytes) {
        ObjectLocator locator = handle.getLocator();
        long start = handle.getPosition();
        long end = start + chunkSizeBytes - 1;

        Request request = new Request.Builder()
                .url(urlFor(locator))
                .header("Range", "bytes=" + start + "-" + end)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 416) {
                return Optional.empty();
            }
            if (response.code() == 404 || response.code() == 410) {
                throw new SourceReadException("Object disappeared: " + locator, locator.toString(), start);
            }
            if (response.code() == 200 && start > 0) {
                throw new SourceReadException("Origin ignored range request for " + locator, locator.toString(), start);
            }
            if (!response.isSuccessful()) {
                throw new SourceReadException("Unexpected response code " + response.code() + " for " + locator,
                        locator.toString(), start);
            }

            ResponseBody body = response.body();
            if (body == null) {
                return Optional.empty();
            }
            // Never buffer more than the chunk: a 200 answer streams the whole object
            BufferedSource source = body.source();
            byte[] data = source.request(chunkSizeBytes)
                    ? source.readByteArray(chunkSizeBytes)
                    : source.readByteArray();
            if (data.length == 0) {
                return Optional.empty();
            }

            handle.advance(data.length);
            return Optional.of(data);

        } catch (IOException e) {
            throw new SourceReadException("Failed to read " + locator + " at byte " + start + ": " + e.getMessage(), e,
                    locator.toString(), start);
        }
    }

    private HttpUrl urlFor(ObjectLocator locator) {
        return baseUrl.newBuilder()
                .addPathSegment(locator.getContainer())
                .addPathSegment(locator.getObjectRef())
                .build();
    }

    private static long parseLength(String header) {
        if (header == null) {
            return ObjectHandle.UNKNOWN_SIZE;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed Content-Length: {}", header);
            return ObjectHandle.UNKNOWN_SIZE;
        }
    }
}

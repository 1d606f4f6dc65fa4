package com.github.stormino.relay.service.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.exception.SinkUploadException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Blob host client: multipart upload to {@code /api/file}, lookups via {@code /api/file/{id}/info}.
 * The API key, when configured, is sent as the basic-auth password with an empty user name.
 */
@Slf4j
@Service
public class HttpTransferSink implements TransferSink {

    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RelayProperties.Sink settings;
    private final HttpUrl baseUrl;

    public HttpTransferSink(@Qualifier("sinkHttpClient") OkHttpClient httpClient,
                            ObjectMapper objectMapper,
                            RelayProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getSink();
        this.baseUrl = HttpUrl.get(settings.getBaseUrl());
    }

    @Override
    public String upload(Path stagingFile, String displayName) {
        if (!Files.isRegularFile(stagingFile)) {
            throw new SinkUploadException("Staged file is missing: " + stagingFile, displayName);
        }
        if (!settings.hasApiKey()) {
            log.warn("No sink API key configured, uploading anonymously: {}", displayName);
        }

        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", displayName, RequestBody.create(stagingFile.toFile(), OCTET_STREAM))
                .build();

        Request request = authorized(new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegments("api/file").build())
                .post(body))
                .build();

        log.info("Uploading {} to {}", displayName, baseUrl);
        try (Response response = httpClient.newCall(request).execute()) {
            String text = bodyText(response);
            if (response.code() != 200 && response.code() != 201) {
                throw new SinkUploadException(describeFailure(response.code(), text), displayName, response.code());
            }

            String remoteId = parseId(text);
            if (remoteId == null) {
                throw new SinkUploadException("Upload response carried no id: " + text, displayName, response.code());
            }
            log.info("Uploaded {} as {}", displayName, remoteId);
            return remoteId;

        } catch (IOException e) {
            throw new SinkUploadException("Upload failed: " + e.getMessage(), e, displayName);
        }
    }

    @Override
    @Retryable(retryFor = UncheckedIOException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public boolean exists(String remoteId) {
        Request request = authorized(new Request.Builder()
                .url(baseUrl.newBuilder()
                        .addPathSegments("api/file")
                        .addPathSegment(remoteId)
                        .addPathSegment("info")
                        .build())
                .get())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return true;
            }
            if (response.code() == 404) {
                return false;
            }
            throw new UncheckedIOException(new IOException(
                    "Unexpected response code " + response.code() + " checking " + remoteId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to check " + remoteId, e);
        }
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (settings.hasApiKey()) {
            builder.header("Authorization", Credentials.basic("", settings.getApiKey()));
        }
        return builder;
    }

    private String parseId(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode node = objectMapper.readTree(json);
        JsonNode id = node.get("id");
        return id != null && !id.isNull() && !id.asText().isBlank() ? id.asText() : null;
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String describeFailure(int code, String text) {
        switch (code) {
            case 401:
                return "Authentication failed, check the sink API key: " + text;
            case 413:
                return "File too large for the sink: " + text;
            case 429:
                return "Sink rate limit exceeded: " + text;
            default:
                return "Upload failed with status " + code + ": " + text;
        }
    }
}

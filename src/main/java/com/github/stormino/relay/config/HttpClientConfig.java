package com.github.stormino.relay.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final RelayProperties properties;

    @Bean(name = "sourceHttpClient")
    public OkHttpClient sourceHttpClient() {
        RelayProperties.Source source = properties.getSource();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(source.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(source.getTimeoutSeconds()))
                .addInterceptor(new UserAgentInterceptor(source.getUserAgent()))
                .addInterceptor(new RetryInterceptor(source.getMaxRetries(), source.getRetryDelayMs()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Uploads are never retried on their own; a failed upload fails the whole transfer.
     */
    @Bean(name = "sinkHttpClient")
    public OkHttpClient sinkHttpClient() {
        RelayProperties.Sink sink = properties.getSink();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(sink.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(sink.getReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(sink.getReadTimeoutSeconds()))
                .retryOnConnectionFailure(false)
                .build();
    }

    static class UserAgentInterceptor implements Interceptor {

        private final String userAgent;

        UserAgentInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request().newBuilder()
                    .header("User-Agent", userAgent)
                    .build();
            return chain.proceed(request);
        }
    }

    /**
     * Retry interceptor with exponential backoff for idempotent source reads.
     */
    static class RetryInterceptor implements Interceptor {

        private final int maxRetries;
        private final long retryDelayMs;

        RetryInterceptor(int maxRetries, long retryDelayMs) {
            this.maxRetries = Math.max(1, maxRetries);
            this.retryDelayMs = retryDelayMs;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request();
            IOException lastException = null;

            for (int attempt = 0; attempt < maxRetries; attempt++) {
                try {
                    Response response = chain.proceed(request);

                    if (response.code() >= 500 && attempt < maxRetries - 1) {
                        log.debug("Server error {} on attempt {}/{} for {}",
                                response.code(), attempt + 1, maxRetries, request.url());
                        response.close();
                        sleep(attempt);
                        continue;
                    }

                    return response;

                } catch (IOException e) {
                    lastException = e;
                    log.warn("Network error on attempt {}/{} for {}: {}",
                            attempt + 1, maxRetries, request.url(), e.getMessage());

                    if (attempt < maxRetries - 1) {
                        sleep(attempt);
                    }
                }
            }

            throw lastException != null ? lastException : new IOException("Max retries exceeded");
        }

        private void sleep(int attempt) throws InterruptedIOException {
            try {
                TimeUnit.MILLISECONDS.sleep(retryDelayMs * (1L << attempt));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while backing off");
            }
        }
    }
}

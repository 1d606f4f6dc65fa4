package com.github.stormino.relay.config;

import com.github.stormino.relay.util.SizeFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private Scheduler scheduler = new Scheduler();
    private Transfer transfer = new Transfer();
    private Source source = new Source();
    private Sink sink = new Sink();
    private Registry registry = new Registry();

    @Data
    public static class Scheduler {
        @Min(0)
        private int bulkSlots = 3;

        @Min(1)
        private int interactiveSlots = 1;

        /**
         * Upper bound on how long the loop sleeps without a wake signal.
         */
        @Min(10)
        private long idleWakeMillis = 2000;

        public int getTotalSlots() {
            return bulkSlots + interactiveSlots;
        }
    }

    @Data
    public static class Transfer {
        @NotBlank
        private String stagingPath = System.getProperty("java.io.tmpdir");

        @Min(1)
        private int minChunkSize = (int) (2 * SizeFormat.BYTES_PER_MIB);

        @Min(1)
        private int defaultChunkSize = (int) (5 * SizeFormat.BYTES_PER_MIB);

        @Min(1)
        private int maxChunkSize = (int) (50 * SizeFormat.BYTES_PER_MIB);

        @Min(1)
        private long sampleWindowSeconds = 5;

        // Throughput thresholds in MiB/s
        @DecimalMin("0.0")
        private double lowThroughputMbps = 2.0;

        @DecimalMin("0.0")
        private double mediumThroughputMbps = 5.0;

        @DecimalMin("0.0")
        private double highThroughputMbps = 10.0;
    }

    @Data
    public static class Source {
        @NotBlank
        private String baseUrl = "http://localhost:8090/media";

        @Min(1)
        private int timeoutSeconds = 60;

        @Min(1)
        private int maxRetries = 3;

        @Min(100)
        private long retryDelayMs = 1000;

        @NotBlank
        private String userAgent = "media-relay/1.0";
    }

    @Data
    public static class Sink {
        @NotBlank
        private String baseUrl = "https://pixeldrain.com";

        private String apiKey;

        @Min(1)
        private int connectTimeoutSeconds = 120;

        @Min(1)
        private int readTimeoutSeconds = 7200;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Registry {
        /**
         * Optional JSON snapshot of stored objects. Empty keeps the registry in memory only.
         */
        private String file;
    }
}

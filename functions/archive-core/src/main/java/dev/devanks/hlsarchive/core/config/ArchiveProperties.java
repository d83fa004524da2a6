package dev.devanks.hlsarchive.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "hls-archive")
public class ArchiveProperties {

    @Data
    @Validated
    public static class CatalogProperties {
        /**
         * Base URL of the CMR search API.
         */
        @NotEmpty
        @URL
        private String url = "https://cmr.earthdata.nasa.gov";

        /**
         * Granules requested per page. CMR refuses anything above 2000.
         */
        @Min(1)
        @Max(2000)
        private int pageSize = 2000;

        /**
         * Sent as the Client-Id header so CMR operators can identify the caller.
         */
        @NotEmpty
        private String clientId = "hls-stac-archive";

        @NotEmpty
        private String documentSuffix = "stac.json";

        @Min(1)
        private int connectTimeoutSeconds = 10;

        @Min(1)
        private int readTimeoutSeconds = 60;
    }

    @Data
    @Validated
    public static class RetryProperties {
        /**
         * Total attempts per remote call, first attempt included.
         */
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long baseDelayMs = 500;
        @Min(0)
        private long maxDelayMs = 10_000;
    }

    @Data
    @Validated
    public static class FetchProperties {
        @Min(1)
        private int maxConcurrentDays = 4;
        @Min(1)
        private int maxConcurrentPerDay = 50;
        @Min(1)
        private int requestTimeoutSeconds = 30;
    }

    @Data
    @Validated
    public static class AggregationProperties {
        /**
         * Output version used when an aggregation request does not name one.
         */
        @NotEmpty
        private String defaultVersion = "v0.1.0";

        /**
         * Highest tolerated share of failed item fetches when complete links are required.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxFailureRate = 0.05;

        @NotEmpty
        private String compression = "ZSTD";
    }

    @Data
    @Validated
    public static class StorageProperties {
        /**
         * Root used when an invocation payload carries no "dest", e.g. gs://bucket/hls.
         */
        private String defaultDestination;

        @NotEmpty
        private String s3Region = "us-west-2";
    }

    @Valid
    @NotNull
    private CatalogProperties catalog = new CatalogProperties();

    @Valid
    @NotNull
    private RetryProperties retry = new RetryProperties();

    @Valid
    @NotNull
    private FetchProperties fetch = new FetchProperties();

    @Valid
    @NotNull
    private AggregationProperties aggregation = new AggregationProperties();

    @Valid
    @NotNull
    private StorageProperties storage = new StorageProperties();
}

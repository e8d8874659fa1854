package com.playarr.livetv.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "livetv")
@Validated
public class LiveTvProperties {

    @NotBlank(message = "livetv.cache-dir is required")
    private String cacheDir = "/app/cache";

    private boolean wipeDisabledUsers = false;

    @Valid
    private final Fetch fetch = new Fetch();

    @Valid
    private final Processing processing = new Processing();

    @Valid
    private final Persistence persistence = new Persistence();

    @Valid
    private final Sync sync = new Sync();

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public boolean isWipeDisabledUsers() {
        return wipeDisabledUsers;
    }

    public void setWipeDisabledUsers(boolean wipeDisabledUsers) {
        this.wipeDisabledUsers = wipeDisabledUsers;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Processing getProcessing() {
        return processing;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Sync getSync() {
        return sync;
    }

    public static class Fetch {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(10);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(120);

        @Min(value = 1, message = "Fetch concurrency must be at least 1")
        private int maxConcurrency = 16;

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }

    public static class Processing {

        @Min(value = 1, message = "Processing concurrency must be at least 1")
        private int maxConcurrency = 4;

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }

    public static class Persistence {

        // BatchWriteItem accepts at most 25 requests per call
        @Min(1)
        @Max(25)
        private int batchSize = 25;

        @Min(value = 1, message = "At least one write attempt is required")
        private int maxWriteAttempts = 5;

        // deadline for one DynamoDB call including SDK retries
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration apiCallTimeout = Duration.ofSeconds(30);

        @Min(0)
        private int sdkRetries = 3;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxWriteAttempts() {
            return maxWriteAttempts;
        }

        public void setMaxWriteAttempts(int maxWriteAttempts) {
            this.maxWriteAttempts = maxWriteAttempts;
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }

        public int getSdkRetries() {
            return sdkRetries;
        }

        public void setSdkRetries(int sdkRetries) {
            this.sdkRetries = sdkRetries;
        }
    }

    public static class Sync {

        private boolean enabled = false;

        @NotBlank
        private String cron = "0 0 */6 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }
}

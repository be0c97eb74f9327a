package com.opsdata.reconciliation.config;

import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    private boolean schedulerEnabled = false;
    private long schedulerFixedDelayMs = 86_400_000;

    @Min(1)
    private int staleThresholdHours = 24;

    @Min(1)
    private int storeTimeoutSeconds = 30;

    @Min(1)
    @Max(64)
    private int rowParallelism = 1;

    @Min(0)
    private int maxRecordedFailures = 200;

    @Valid
    private Sources sources = new Sources();

    public void requireComplete() {
        for (SourceKind kind : SourceKind.values()) {
            Source source = sources.get(kind);
            if (source == null || isBlank(source.getLocation()) || isBlank(source.getFormat())) {
                throw new ConfigurationException("Missing location or format for source " + kind.sourceName());
            }
        }
        if (staleThresholdHours <= 0 || storeTimeoutSeconds <= 0 || rowParallelism <= 0) {
            throw new ConfigurationException("Thresholds, timeouts and parallelism must be positive");
        }
    }

    public Source source(SourceKind kind) {
        return sources.get(kind);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getSchedulerFixedDelayMs() {
        return schedulerFixedDelayMs;
    }

    public void setSchedulerFixedDelayMs(long schedulerFixedDelayMs) {
        this.schedulerFixedDelayMs = schedulerFixedDelayMs;
    }

    public int getStaleThresholdHours() {
        return staleThresholdHours;
    }

    public void setStaleThresholdHours(int staleThresholdHours) {
        this.staleThresholdHours = staleThresholdHours;
    }

    public int getStoreTimeoutSeconds() {
        return storeTimeoutSeconds;
    }

    public void setStoreTimeoutSeconds(int storeTimeoutSeconds) {
        this.storeTimeoutSeconds = storeTimeoutSeconds;
    }

    public int getRowParallelism() {
        return rowParallelism;
    }

    public void setRowParallelism(int rowParallelism) {
        this.rowParallelism = rowParallelism;
    }

    public int getMaxRecordedFailures() {
        return maxRecordedFailures;
    }

    public void setMaxRecordedFailures(int maxRecordedFailures) {
        this.maxRecordedFailures = maxRecordedFailures;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public static class Sources {

        private Source production = new Source();
        private Source quality = new Source();
        private Source shipping = new Source();

        Source get(SourceKind kind) {
            return switch (kind) {
                case PRODUCTION -> production;
                case QUALITY -> quality;
                case SHIPPING -> shipping;
            };
        }

        public Source getProduction() {
            return production;
        }

        public void setProduction(Source production) {
            this.production = production;
        }

        public Source getQuality() {
            return quality;
        }

        public void setQuality(Source quality) {
            this.quality = quality;
        }

        public Source getShipping() {
            return shipping;
        }

        public void setShipping(Source shipping) {
            this.shipping = shipping;
        }
    }

    public static class Source {

        private String location;
        private String format = "csv";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }
}

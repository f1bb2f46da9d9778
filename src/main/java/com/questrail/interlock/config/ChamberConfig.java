package com.questrail.interlock.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration of one chamber.
 *
 * @param deviceName     name used in logs and status reports
 * @param timeouts       confirmation timeouts
 * @param cyclePeriod    interval between control cycles
 * @param partitionSpeed speed magnitude passed to the partition drive
 */
public record ChamberConfig(
    String deviceName,
    ConfirmationTimeouts timeouts,
    Duration cyclePeriod,
    int partitionSpeed
) {
    public ChamberConfig {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(timeouts, "timeouts");
        Objects.requireNonNull(cyclePeriod, "cyclePeriod");

        if (deviceName.isBlank()) {
            throw new IllegalArgumentException("deviceName must not be blank");
        }
        if (cyclePeriod.isNegative() || cyclePeriod.isZero()) {
            throw new IllegalArgumentException("cyclePeriod must be positive");
        }
        if (partitionSpeed <= 0) {
            throw new IllegalArgumentException("partitionSpeed must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String deviceName = "chamber";
        private ConfirmationTimeouts timeouts = ConfirmationTimeouts.defaults();
        private Duration cyclePeriod = Duration.ofMillis(100);
        private int partitionSpeed = 3000;

        public Builder withDeviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder withTimeouts(ConfirmationTimeouts timeouts) {
            this.timeouts = timeouts;
            return this;
        }

        /**
         * Applies per-key timeout overrides on top of the current timeouts.
         */
        public Builder withTimeoutOverrides(Map<String, ?> overrides) {
            this.timeouts = timeouts.withOverrides(overrides);
            return this;
        }

        public Builder withCyclePeriod(Duration cyclePeriod) {
            this.cyclePeriod = cyclePeriod;
            return this;
        }

        public Builder withPartitionSpeed(int partitionSpeed) {
            this.partitionSpeed = partitionSpeed;
            return this;
        }

        public ChamberConfig build() {
            return new ChamberConfig(deviceName, timeouts, cyclePeriod, partitionSpeed);
        }
    }
}

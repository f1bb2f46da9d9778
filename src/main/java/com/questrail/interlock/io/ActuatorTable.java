package com.questrail.interlock.io;

import java.util.Objects;
import java.util.Optional;

/**
 * ActuatorTable
 * -----------------------------------------------------------------------------
 * Write capabilities of one chamber, resolved once at configuration time.
 *
 * <p>The lock relay and the partition drive are mandatory. The indicator lamp
 * is optional; chamber variants without one simply leave it out and the
 * controller skips indicator updates.</p>
 */
public final class ActuatorTable
{
    private final LockActuator lock;
    private final PartitionDrive partition;
    private final IndicatorLamp indicator;

    private ActuatorTable(LockActuator lock, PartitionDrive partition, IndicatorLamp indicator) {
        this.lock = Objects.requireNonNull(lock, "lock");
        this.partition = Objects.requireNonNull(partition, "partition");
        this.indicator = indicator;
    }

    public LockActuator lock() {
        return lock;
    }

    public PartitionDrive partition() {
        return partition;
    }

    public Optional<IndicatorLamp> indicator() {
        return Optional.ofNullable(indicator);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LockActuator lock;
        private PartitionDrive partition;
        private IndicatorLamp indicator;

        private Builder() {}

        public Builder withLock(LockActuator lock) {
            this.lock = lock;
            return this;
        }

        public Builder withPartition(PartitionDrive partition) {
            this.partition = partition;
            return this;
        }

        public Builder withIndicator(IndicatorLamp indicator) {
            this.indicator = indicator;
            return this;
        }

        public ActuatorTable build() {
            return new ActuatorTable(lock, partition, indicator);
        }
    }
}

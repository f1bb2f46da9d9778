package com.questrail.interlock.internal.exec;

import com.questrail.interlock.config.ConfirmationKind;
import com.questrail.interlock.config.ConfirmationTimeouts;
import com.questrail.interlock.core.CommandInbox;
import com.questrail.interlock.core.ConfirmationPredicates;
import com.questrail.interlock.core.SensorSampler;
import com.questrail.interlock.core.watchdog.WatchdogEntry;
import com.questrail.interlock.core.watchdog.WatchdogSupervisor;
import com.questrail.interlock.internal.state.InterlockEffect;
import com.questrail.interlock.internal.state.InterlockEffects;
import com.questrail.interlock.internal.time.WallClock;
import com.questrail.interlock.io.ActuatorTable;
import com.questrail.interlock.observability.FaultKind;
import com.questrail.interlock.observability.InterlockFaultEvent;
import com.questrail.interlock.observability.InterlockObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ChamberEffectExecutor
 * =============================================================================
 * {@link EffectExecutor} for one physical chamber.
 *
 * <h2>Watchdogs</h2>
 * Every {@link InterlockEffect.ArmWatchdog} registers a new entry whose timeout
 * comes from {@link ConfirmationTimeouts} and whose condition is read from the
 * sampler's latest snapshot. Expiry of a regular confirmation is reported as a
 * {@link FaultKind#CONFIRMATION_TIMEOUT}; a warn-only one is just logged.
 *
 * <h2>Failure isolation</h2>
 * Each effect runs in its own try block. A failure is logged, reported as
 * {@link FaultKind#CYCLE_FAILURE} and execution continues with the next effect.
 */
public final class ChamberEffectExecutor implements EffectExecutor {

    private static final Logger log = LoggerFactory.getLogger(ChamberEffectExecutor.class);

    private final String deviceName;
    private final ActuatorTable actuators;
    private final CommandInbox inbox;
    private final WatchdogSupervisor watchdogs;
    private final SensorSampler sampler;
    private final ConfirmationTimeouts timeouts;
    private final int partitionSpeed;
    private final InterlockObservabilitySink sink;
    private final WallClock wallClock;

    public ChamberEffectExecutor(String deviceName,
                                 ActuatorTable actuators,
                                 CommandInbox inbox,
                                 WatchdogSupervisor watchdogs,
                                 SensorSampler sampler,
                                 ConfirmationTimeouts timeouts,
                                 int partitionSpeed,
                                 InterlockObservabilitySink sink,
                                 WallClock wallClock) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.actuators = Objects.requireNonNull(actuators, "actuators");
        this.inbox = Objects.requireNonNull(inbox, "inbox");
        this.watchdogs = Objects.requireNonNull(watchdogs, "watchdogs");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.partitionSpeed = partitionSpeed;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public int execute(InterlockEffects effects) {
        Objects.requireNonNull(effects, "effects");

        int failures = 0;
        for (InterlockEffect effect : effects.asList()) {
            try {
                executeOne(effect);
            } catch (RuntimeException ex) {
                failures++;
                log.error("[{}] Effect {} failed", deviceName, effect, ex);
                report(FaultKind.CYCLE_FAILURE, "Effect failed: " + effect, ex);
            }
        }
        return failures;
    }

    private void executeOne(InterlockEffect effect) {
        if (effect instanceof InterlockEffect.SetLock e) {
            log.debug("[{}] Lock -> {}", deviceName, e.lock());
            actuators.lock().setLock(e.lock());
        } else if (effect instanceof InterlockEffect.MovePartition e) {
            log.info("[{}] Partition moving {}", deviceName, e.direction());
            actuators.partition().move(e.direction(), partitionSpeed);
        } else if (effect instanceof InterlockEffect.ResetMotorFault) {
            log.info("[{}] Resetting partition motor fault", deviceName);
            actuators.partition().resetFault();
        } else if (effect instanceof InterlockEffect.ShowIndicator e) {
            actuators.indicator().ifPresent(lamp -> lamp.show(e.color()));
        } else if (effect instanceof InterlockEffect.TakeCommand e) {
            inbox.take(e.command());
        } else if (effect instanceof InterlockEffect.CompleteCommand e) {
            inbox.complete(e.command(), e.outcome(), e.message());
            log.info("[{}] Command {} -> {}", deviceName, e.command().wireName(), e.outcome());
        } else if (effect instanceof InterlockEffect.ArmWatchdog e) {
            arm(e.kind(), e.warnOnly());
        } else if (effect instanceof InterlockEffect.ReportFault e) {
            report(e.kind(), e.message(), null);
        }
    }

    private void arm(ConfirmationKind kind, boolean warnOnly) {
        Consumer<WatchdogEntry> onTimeout = warnOnly
                ? entry -> log.warn("[{}] {} still unconfirmed, client has not closed the gate",
                        deviceName, entry.name())
                : null;

        watchdogs.register(
                kind.key(),
                ConfirmationPredicates.forKind(kind, sampler::current),
                timeouts.timeoutFor(kind),
                deviceName + ": " + kind.key() + " not confirmed within " + timeouts.timeoutFor(kind).toMillis() + " ms",
                onTimeout,
                Map.of("device", deviceName));
    }

    private void report(FaultKind kind, String message, Throwable cause) {
        sink.onFault(new InterlockFaultEvent(wallClock.now(), deviceName, kind, message, cause));
    }
}

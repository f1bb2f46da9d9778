package com.questrail.interlock.core;

import com.questrail.interlock.api.ChamberCommand;
import com.questrail.interlock.api.ChamberController;
import com.questrail.interlock.api.ChamberQuery;
import com.questrail.interlock.api.ChamberStatus;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.config.ChamberConfig;
import com.questrail.interlock.core.watchdog.WatchdogEntry;
import com.questrail.interlock.core.watchdog.WatchdogSupervisor;
import com.questrail.interlock.internal.exec.ChamberEffectExecutor;
import com.questrail.interlock.internal.exec.EffectExecutor;
import com.questrail.interlock.internal.state.ChamberState;
import com.questrail.interlock.internal.state.InterlockReducer;
import com.questrail.interlock.internal.time.MonotonicClock;
import com.questrail.interlock.internal.time.SystemMonotonicClock;
import com.questrail.interlock.internal.time.SystemWallClock;
import com.questrail.interlock.internal.time.WallClock;
import com.questrail.interlock.io.ActuatorTable;
import com.questrail.interlock.io.SensorTable;
import com.questrail.interlock.observability.FaultKind;
import com.questrail.interlock.observability.InterlockFaultEvent;
import com.questrail.interlock.observability.InterlockObservabilitySink;
import com.questrail.interlock.observability.InterlockTransitionEvent;
import com.questrail.interlock.observability.NullObservabilitySink;
import com.questrail.interlock.observability.Slf4jInterlockObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * InterlockController
 * =============================================================================
 * Control-cycle coordinator of one transfer chamber.
 *
 * <h2>One cycle</h2>
 * <ol>
 *   <li>Refresh the {@link SensorSnapshot}.</li>
 *   <li>Evaluate the confirmation watchdogs against it.</li>
 *   <li>Take an immutable view of the {@link CommandInbox}.</li>
 *   <li>Apply the {@link InterlockReducer}.</li>
 *   <li>Execute the resulting effects.</li>
 *   <li>Report a state transition, if any.</li>
 * </ol>
 * A watchdog armed by a cycle is first evaluated by the next one, against the
 * sensors as they are after the commanded change had time to happen.
 *
 * <h2>Failure semantics</h2>
 * {@link #cycle()} never throws. A sensor read failure skips the reduction (the
 * previous snapshot stays current) but watchdogs are still evaluated. Any other
 * exception is reported as {@link FaultKind#CYCLE_FAILURE} and the next cycle
 * starts from the last committed state.
 *
 * <h2>Threading Model</h2>
 * {@code cycle()} must be invoked serially, normally from the single thread of
 * the chamber runtime. {@code submit}, {@code query} and {@code status} may be
 * called from any thread.
 */
public final class InterlockController implements ChamberController {

    private static final Logger log = LoggerFactory.getLogger(InterlockController.class);

    private final String deviceName;
    private final ActuatorTable actuators;
    private final SensorSampler sampler;
    private final CommandInbox inbox;
    private final WatchdogSupervisor watchdogs;
    private final InterlockReducer reducer;
    private final EffectExecutor executor;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final InterlockObservabilitySink sink;

    private volatile ChamberState state;

    private InterlockController(Builder b) {
        ChamberConfig config = Objects.requireNonNull(b.config, "config");
        this.deviceName = config.deviceName();
        this.actuators = Objects.requireNonNull(b.actuators, "actuators");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.sink = Objects.requireNonNullElse(b.sink, NullObservabilitySink.INSTANCE);
        this.state = Objects.requireNonNull(b.initialState, "initialState");

        this.sampler = new SensorSampler(Objects.requireNonNull(b.sensors, "sensors"));
        this.inbox = new CommandInbox(clock);
        this.watchdogs = new WatchdogSupervisor(clock, this::onConfirmationTimeout);
        this.reducer = new InterlockReducer(actuators.indicator().isPresent());
        this.executor = new ChamberEffectExecutor(
                deviceName,
                actuators,
                inbox,
                watchdogs,
                sampler,
                config.timeouts(),
                config.partitionSpeed(),
                sink,
                wallClock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Control cycle
    // ---------------------------------------------------------------------

    /**
     * Runs one control cycle. Never throws.
     */
    public void cycle() {
        boolean fresh = refreshSensors();

        try {
            watchdogs.evaluate(clock.nowNanos());
        } catch (RuntimeException ex) {
            log.error("[{}] Watchdog evaluation failed", deviceName, ex);
            fault(FaultKind.CYCLE_FAILURE, "Watchdog evaluation failed", ex);
        }

        if (!fresh) {
            return;
        }
        try {
            reduceAndExecute();
        } catch (RuntimeException ex) {
            log.error("[{}] Control cycle failed", deviceName, ex);
            fault(FaultKind.CYCLE_FAILURE, "Control cycle failed", ex);
        }
    }

    private boolean refreshSensors() {
        try {
            sampler.refresh();
            return true;
        } catch (RuntimeException ex) {
            log.error("[{}] Sensor refresh failed, keeping previous snapshot", deviceName, ex);
            fault(FaultKind.SENSOR_READ_FAILURE, ex.getMessage(), ex);
            return false;
        }
    }

    private void reduceAndExecute() {
        ChamberState before = state;
        InterlockReducer.Result result = reducer.apply(before, sampler.current(), inbox.snapshot());

        // Committed before execution; a failing effect never replays the transition.
        state = result.newState();
        executor.execute(result.effects());

        if (before.state() != state.state()) {
            sink.onStateTransition(new InterlockTransitionEvent(
                    wallClock.now(), deviceName, before.state(), state.state()));
        }
        if (before.lifecycle() != state.lifecycle()) {
            log.info("[{}] Lifecycle: {} -> {}", deviceName, before.lifecycle(), state.lifecycle());
        }
    }

    private void onConfirmationTimeout(WatchdogEntry entry) {
        fault(FaultKind.CONFIRMATION_TIMEOUT, entry.description(), null);
    }

    private void fault(FaultKind kind, String message, Throwable cause) {
        try {
            sink.onFault(new InterlockFaultEvent(wallClock.now(), deviceName, kind,
                    message == null ? kind.name() : message, cause));
        } catch (RuntimeException ex) {
            log.error("[{}] Observability sink failed while reporting {}", deviceName, kind, ex);
        }
    }

    /**
     * Stops the partition drive. Called when the runtime shuts down.
     */
    public void haltActuators() {
        try {
            actuators.partition().stop();
        } catch (RuntimeException ex) {
            log.error("[{}] Failed to stop partition drive", deviceName, ex);
        }
    }

    // ---------------------------------------------------------------------
    // ChamberController
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<CommandResult> submit(ChamberCommand command) {
        return inbox.submit(command);
    }

    @Override
    public CompletableFuture<CommandResult> submit(String commandName) {
        return inbox.submit(commandName);
    }

    @Override
    public boolean query(ChamberQuery query) {
        Objects.requireNonNull(query, "query");
        SensorSnapshot s = sampler.current();
        return switch (query) {
            case IS_CHAMBER_OPEN -> s.chamberOpen();
            case IS_PRODUCT_PRESENT -> s.isProductPresent();
            case IS_SAUCE_PRESENT -> s.isSaucePresent();
        };
    }

    @Override
    public int query(String queryName) {
        Optional<ChamberQuery> query = ChamberQuery.fromName(Objects.requireNonNull(queryName, "queryName"));
        if (query.isEmpty()) {
            log.warn("[{}] Unrecognized query '{}'", deviceName, queryName);
            return ChamberQuery.UNRECOGNIZED;
        }
        return query(query.get()) ? 1 : 0;
    }

    @Override
    public ChamberStatus status() {
        ChamberState s = state;
        return new ChamberStatus(deviceName, s.state(), s.lifecycle());
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String deviceName() {
        return deviceName;
    }

    public ChamberState state() {
        return state;
    }

    public SensorSnapshot snapshot() {
        return sampler.current();
    }

    public CommandInbox inbox() {
        return inbox;
    }

    public WatchdogSupervisor watchdogs() {
        return watchdogs;
    }

    InterlockObservabilitySink observabilitySink() {
        return sink;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private ChamberConfig config = ChamberConfig.builder().build();
        private SensorTable sensors;
        private ActuatorTable actuators;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private InterlockObservabilitySink sink = new Slf4jInterlockObservabilitySink();
        private ChamberState initialState = ChamberState.initial();

        private Builder() {}

        public Builder withConfig(ChamberConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSensors(SensorTable sensors) {
            this.sensors = sensors;
            return this;
        }

        public Builder withActuators(ActuatorTable actuators) {
            this.actuators = actuators;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Replaces the default {@link Slf4jInterlockObservabilitySink}.
         * {@code null} discards events.
         */
        public Builder withObservabilitySink(InterlockObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Starting state. Production controllers always start from
         * {@link ChamberState#initial()}; other values are for commissioning and tests.
         */
        public Builder withInitialState(ChamberState initialState) {
            this.initialState = initialState;
            return this;
        }

        public InterlockController build() {
            return new InterlockController(this);
        }
    }
}

package com.questrail.interlock.runtime;

import com.questrail.interlock.config.ChamberConfig;
import com.questrail.interlock.core.InterlockController;
import com.questrail.interlock.internal.time.Cancellable;
import com.questrail.interlock.internal.time.MonotonicClock;
import com.questrail.interlock.internal.time.MonotonicScheduler;
import com.questrail.interlock.internal.time.ScheduledExecutorScheduler;
import com.questrail.interlock.internal.time.SystemMonotonicClock;
import com.questrail.interlock.internal.time.SystemWallClock;
import com.questrail.interlock.internal.time.WallClock;
import com.questrail.interlock.io.ActuatorTable;
import com.questrail.interlock.io.SensorTable;
import com.questrail.interlock.observability.InterlockObservabilitySink;
import com.questrail.interlock.observability.Slf4jInterlockObservabilitySink;
import com.questrail.interlock.transport.DatagramEndpoint;
import com.questrail.interlock.transport.udp.CommandDatagramAdapter;
import com.questrail.interlock.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ChamberRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one chamber.
 *
 * <h2>What it wires</h2>
 * <ul>
 *   <li>An {@link InterlockController} over the given sensor and actuator tables</li>
 *   <li>A periodic control cycle on a single-threaded scheduler</li>
 *   <li>Optionally, a UDP command endpoint in front of the controller</li>
 * </ul>
 *
 * <h2>Cycle cadence</h2>
 * Cycles are scheduled at fixed monotonic deadlines one period apart. When a
 * cycle overruns, the missed deadlines are skipped rather than run back to back.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()  → binds the endpoint, starts cycling
 *   runtime.stop()   → stops cycling, closes the endpoint, stops the partition
 * </pre>
 * A stopped runtime stays stopped; build a new one to resume control.
 */
public final class ChamberRuntime {

    private static final Logger log = LoggerFactory.getLogger(ChamberRuntime.class);

    private final InterlockController controller;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final long periodNanos;
    private final ScheduledExecutorService ownedExecutor;
    private final CommandDatagramAdapter commandAdapter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong();
    private volatile Cancellable nextCycle;
    private long nextDeadline;

    private ChamberRuntime(InterlockController controller,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           long periodNanos,
                           ScheduledExecutorService ownedExecutor,
                           CommandDatagramAdapter commandAdapter) {
        this.controller = controller;
        this.scheduler = scheduler;
        this.clock = clock;
        this.periodNanos = periodNanos;
        this.ownedExecutor = ownedExecutor;
        this.commandAdapter = commandAdapter;
    }

    /**
     * Starts cycling. Idempotent while running. A runtime runs once: it cannot
     * be started again after {@link #stop()}.
     *
     * @throws IllegalStateException if the runtime has been stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Chamber runtime cannot be restarted after stop()");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("[{}] Starting chamber runtime (period={} ms)",
                controller.deviceName(), TimeUnit.NANOSECONDS.toMillis(periodNanos));

        if (commandAdapter != null) {
            commandAdapter.start();
        }
        synchronized (this) {
            nextDeadline = clock.nowNanos();
            nextCycle = scheduler.scheduleAtNanos(nextDeadline, this::runCycle);
        }
    }

    /**
     * Stops cycling and releases owned resources. Idempotent.
     * The partition drive is stopped after the last cycle has finished.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopped.set(true);
        log.info("[{}] Stopping chamber runtime after {} cycles", controller.deviceName(), cycles.get());

        Cancellable c = nextCycle;
        if (c != null) {
            c.cancel();
        }
        if (commandAdapter != null) {
            commandAdapter.stop();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        controller.haltActuators();
    }

    public boolean isRunning() {
        return running.get();
    }

    public InterlockController controller() {
        return controller;
    }

    /**
     * Number of control cycles run so far.
     */
    public long cycleCount() {
        return cycles.get();
    }

    private void runCycle() {
        if (!running.get()) {
            return;
        }

        controller.cycle();
        cycles.incrementAndGet();

        synchronized (this) {
            if (!running.get()) {
                return;
            }
            nextDeadline += periodNanos;
            long now = clock.nowNanos();
            if (nextDeadline - now < 0) {
                long missed = (now - nextDeadline) / periodNanos + 1;
                log.debug("[{}] Cycle overran, skipping {} deadline(s)", controller.deviceName(), missed);
                nextDeadline += missed * periodNanos;
            }
            nextCycle = scheduler.scheduleAtNanos(nextDeadline, this::runCycle);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChamberConfig config = ChamberConfig.builder().build();
        private SensorTable sensors;
        private ActuatorTable actuators;
        private InterlockObservabilitySink observabilitySink = new Slf4jInterlockObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private InetSocketAddress bindAddress;
        private DatagramEndpoint endpoint;

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

        public Builder withObservabilitySink(InterlockObservabilitySink sink) {
            this.observabilitySink = sink;
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
         * Drives cycles through the given scheduler instead of an owned
         * single-threaded executor. The scheduler must run tasks serially.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Exposes the UDP command endpoint on the given local address.
         */
        public Builder withBindAddress(InetSocketAddress address) {
            this.bindAddress = address;
            return this;
        }

        /**
         * Exposes the command protocol on a caller-supplied endpoint.
         * Takes precedence over {@link #withBindAddress}.
         */
        public Builder withEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public ChamberRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(sensors, "sensors");
            Objects.requireNonNull(actuators, "actuators");
            Objects.requireNonNull(clock, "clock");

            // 1. Controller
            InterlockController controller = InterlockController.builder()
                    .withConfig(config)
                    .withSensors(sensors)
                    .withActuators(actuators)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withObservabilitySink(observabilitySink)
                    .build();

            // 2. Cycle scheduler, single-threaded so cycle() stays serialized
            ScheduledExecutorService owned = null;
            MonotonicScheduler cycleScheduler = scheduler;
            if (cycleScheduler == null) {
                String threadName = "chamber-" + config.deviceName() + "-cycle";
                owned = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, threadName);
                    t.setDaemon(true);
                    return t;
                });
                cycleScheduler = new ScheduledExecutorScheduler(owned, clock);
            }

            // 3. Optional command endpoint
            DatagramEndpoint ep = endpoint;
            if (ep == null && bindAddress != null) {
                ep = new NettyUdpDatagramEndpoint(bindAddress);
            }
            CommandDatagramAdapter adapter = ep == null ? null : new CommandDatagramAdapter(controller, ep);

            return new ChamberRuntime(
                    controller,
                    cycleScheduler,
                    clock,
                    config.cyclePeriod().toNanos(),
                    owned,
                    adapter);
        }
    }
}

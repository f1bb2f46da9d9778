package com.questrail.interlock.runtime;

import com.questrail.interlock.api.InterlockState;
import com.questrail.interlock.config.ChamberConfig;
import com.questrail.interlock.io.FakeSensorBank;
import com.questrail.interlock.io.RecordingActuators;
import com.questrail.interlock.io.SignalName;
import com.questrail.interlock.observability.RecordingObservabilitySink;
import com.questrail.interlock.time.DeterministicScheduler;
import com.questrail.interlock.time.ManualMonotonicClock;
import com.questrail.interlock.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChamberRuntimeTest
 * -----------------------------------------------------------------------------
 * Cycle cadence and lifecycle of the runtime on a deterministic scheduler.
 */
class ChamberRuntimeTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeSensorBank sensors;
    private RecordingActuators actuators;
    private RecordingObservabilitySink sink;
    private FakeDatagramEndpoint endpoint;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sensors = FakeSensorBank.minimal();
        actuators = new RecordingActuators();
        sink = new RecordingObservabilitySink();
        endpoint = new FakeDatagramEndpoint();
    }

    private ChamberRuntime runtime() {
        return ChamberRuntime.builder()
                .withConfig(ChamberConfig.builder()
                        .withDeviceName("chamber_1")
                        .withCyclePeriod(Duration.ofMillis(100))
                        .build())
                .withSensors(sensors.table())
                .withActuators(actuators.table(false))
                .withObservabilitySink(sink)
                .withClock(clock)
                .withScheduler(scheduler)
                .withEndpoint(endpoint)
                .build();
    }

    @Test
    void firstCycleRunsAtStart() {
        ChamberRuntime rt = runtime();

        rt.start();
        assertTrue(rt.isRunning());
        assertTrue(endpoint.isStarted());
        assertEquals(1, scheduler.runDueTasks());

        assertEquals(1, rt.cycleCount());
        assertEquals(InterlockState.BLOCKED_OPENING, rt.controller().status().state());
        assertEquals(List.of("lock LOCKED", "move UP 3000"), actuators.calls());
    }

    @Test
    void cyclesRunOncePerPeriod() {
        ChamberRuntime rt = runtime();
        rt.start();
        scheduler.runDueTasks();

        clock.advanceMillis(99);
        assertEquals(0, scheduler.runDueTasks());

        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());

        clock.advanceMillis(100);
        assertEquals(1, scheduler.runDueTasks());
        assertEquals(3, rt.cycleCount());
        assertEquals(1, scheduler.pending());
    }

    @Test
    void overrunDeadlinesAreSkipped() {
        ChamberRuntime rt = runtime();
        rt.start();
        scheduler.runDueTasks();
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        // Next deadline is 200 ms; the cycle sees 450 ms and skips 300 and 400.
        clock.advanceMillis(350);
        assertEquals(1, scheduler.runDueTasks());
        assertEquals(3, rt.cycleCount());

        clock.advanceMillis(49);
        assertEquals(0, scheduler.runDueTasks());
        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());
        assertEquals(4, rt.cycleCount());
    }

    @Test
    void sensorChangesAreObservedByLaterCycles() {
        ChamberRuntime rt = runtime();
        rt.start();
        scheduler.runDueTasks();

        sensors.set(SignalName.PARTITION_UP, true);
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertEquals(InterlockState.BLOCKED_OPENED, rt.controller().status().state());
        assertEquals(2, sink.getStateTransitions().size());
    }

    @Test
    void stopHaltsCyclingAndThePartition() {
        ChamberRuntime rt = runtime();
        rt.start();
        scheduler.runDueTasks();

        rt.stop();

        assertFalse(rt.isRunning());
        assertFalse(endpoint.isStarted());
        assertEquals("stop", actuators.calls().get(actuators.calls().size() - 1));
        assertEquals(0, scheduler.pending());

        clock.advanceMillis(1000);
        assertEquals(0, scheduler.runDueTasks());
        assertEquals(1, rt.cycleCount());
    }

    @Test
    void startAndStopAreIdempotent() {
        ChamberRuntime rt = runtime();

        rt.start();
        rt.start();
        assertEquals(1, scheduler.pending());

        rt.stop();
        rt.stop();
        assertEquals(1, actuators.calls().stream().filter("stop"::equals).count());
    }

    @Test
    void stoppedRuntimeCannotBeRestarted() {
        ChamberRuntime rt = runtime();
        rt.start();
        rt.stop();

        assertThrows(IllegalStateException.class, rt::start);
        assertFalse(rt.isRunning());
        assertEquals(0, scheduler.pending());
    }

    @Test
    void ownedExecutorRuntimeRejectsRestartInsteadOfFailingOnTheExecutor() {
        ChamberRuntime rt = ChamberRuntime.builder()
                .withSensors(sensors.table())
                .withActuators(actuators.table(false))
                .withObservabilitySink(sink)
                .build();
        rt.start();
        rt.stop();

        IllegalStateException ex = assertThrows(IllegalStateException.class, rt::start);
        assertTrue(ex.getMessage().contains("restarted"));
    }

    @Test
    void endpointServesTheController() {
        ChamberRuntime rt = runtime();
        rt.start();
        scheduler.runDueTasks();

        endpoint.injectText(new InetSocketAddress("127.0.0.1", 40002), "STATE");

        assertEquals(List.of("STATE BLOCKED_OPENING INITIALIZING"), endpoint.sentText());
    }

    @Test
    void ownedExecutorCyclesInRealTime() throws InterruptedException {
        ChamberRuntime rt = ChamberRuntime.builder()
                .withConfig(ChamberConfig.builder().withCyclePeriod(Duration.ofMillis(10)).build())
                .withSensors(sensors.table())
                .withActuators(actuators.table(false))
                .withObservabilitySink(sink)
                .build();

        rt.start();
        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        while (rt.cycleCount() < 3 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        rt.stop();

        assertTrue(rt.cycleCount() >= 3, "runtime should have cycled");
        long stopped = rt.cycleCount();
        Thread.sleep(50);
        assertEquals(stopped, rt.cycleCount());
    }
}

package com.questrail.interlock.transport.udp;

import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.api.DeviceLifecycle;
import com.questrail.interlock.api.InterlockState;
import com.questrail.interlock.api.LockState;
import com.questrail.interlock.core.InterlockController;
import com.questrail.interlock.internal.state.ChamberState;
import com.questrail.interlock.io.FakeSensorBank;
import com.questrail.interlock.io.RecordingActuators;
import com.questrail.interlock.io.SignalName;
import com.questrail.interlock.time.ManualMonotonicClock;
import com.questrail.interlock.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandDatagramAdapterTest
 * -----------------------------------------------------------------------------
 * Request parsing and replies, through a fake endpoint and a real controller.
 */
class CommandDatagramAdapterTest {

    private static final SocketAddress CLIENT = new InetSocketAddress("127.0.0.1", 40001);

    private FakeSensorBank sensors;
    private InterlockController controller;
    private FakeDatagramEndpoint endpoint;
    private CommandDatagramAdapter adapter;

    @BeforeEach
    void setUp() {
        sensors = FakeSensorBank.full();
        controller = InterlockController.builder()
                .withSensors(sensors.table())
                .withActuators(new RecordingActuators().table(false))
                .withClock(new ManualMonotonicClock())
                .withInitialState(new ChamberState(
                        InterlockState.BLOCKED_CLOSED, LockState.LOCKED, null, DeviceLifecycle.WORKING))
                .build();
        endpoint = new FakeDatagramEndpoint();
        adapter = new CommandDatagramAdapter(controller, endpoint);
    }

    @Test
    void startAndStopDriveTheEndpoint() {
        adapter.start();
        assertTrue(endpoint.isStarted());

        adapter.stop();
        assertFalse(endpoint.isStarted());
    }

    @Test
    void commandIsRepliedWhenTheCycleCompletesIt() {
        endpoint.injectText(CLIENT, "CMD unblock_for_client");
        assertTrue(endpoint.sent().isEmpty(), "no reply before the command resolves");

        controller.cycle();

        assertEquals(InterlockState.RELEASED_CLOSED, controller.status().state());
        assertEquals(List.of("unblock_for_client SUCCESS"), endpoint.sentText());
        assertEquals(CLIENT, endpoint.sent().get(0).remote());
    }

    @Test
    void prefixedCommandIsRepliedUnderItsWireName() {
        endpoint.injectText(CLIENT, "cmd chamber_unblock_for_client\n");
        controller.cycle();

        assertEquals(List.of("unblock_for_client SUCCESS"), endpoint.sentText());
    }

    @Test
    void rejectedCommandCarriesTheMessage() {
        sensors.set(SignalName.CHAMBER_OPEN, true);
        controller = InterlockController.builder()
                .withSensors(sensors.table())
                .withActuators(new RecordingActuators().table(false))
                .withClock(new ManualMonotonicClock())
                .withInitialState(new ChamberState(
                        InterlockState.INIT_ERROR, null, null, DeviceLifecycle.ERROR))
                .build();
        endpoint = new FakeDatagramEndpoint();
        adapter = new CommandDatagramAdapter(controller, endpoint);

        endpoint.injectText(CLIENT, "CMD initialize");
        controller.cycle();

        assertEquals(1, endpoint.sentText().size());
        assertTrue(endpoint.sentText().get(0).startsWith("initialize ERROR"));
    }

    @Test
    void unknownCommandIsRejectedImmediately() {
        endpoint.injectText(CLIENT, "CMD open_sesame");

        assertEquals(List.of("open_sesame ERROR unknown command"), endpoint.sentText());
    }

    @Test
    void queryAnswersFromTheCurrentSnapshot() {
        sensors.set(SignalName.PRODUCT_2, true);
        controller.cycle();

        endpoint.injectText(CLIENT, "QUERY is_product_present");
        endpoint.injectText(CLIENT, "QUERY is_sauce_present");
        endpoint.injectText(CLIENT, "QUERY is_lid_open");

        assertEquals(List.of(
                "is_product_present 1",
                "is_sauce_present 0",
                "is_lid_open -1"), endpoint.sentText());
    }

    @Test
    void stateReportsStateAndLifecycle() {
        endpoint.injectText(CLIENT, "state");

        assertEquals(List.of("STATE BLOCKED_CLOSED WORKING"), endpoint.sentText());
    }

    @Test
    void malformedRequestsGetAnErrorReply() {
        endpoint.injectText(CLIENT, "   ");
        endpoint.injectText(CLIENT, "CMD");
        endpoint.injectText(CLIENT, "CMD a b");
        endpoint.injectText(CLIENT, "QUERY");
        endpoint.injectText(CLIENT, "RESET now");

        assertEquals(List.of(
                "ERROR empty request",
                "ERROR usage: CMD <name>",
                "ERROR usage: CMD <name>",
                "ERROR usage: QUERY <name>",
                "ERROR unknown request RESET"), endpoint.sentText());
        assertEquals(InterlockState.BLOCKED_CLOSED, controller.status().state());
    }

    @Test
    void oversizedRequestIsRejected() {
        byte[] payload = ("CMD " + "x".repeat(CommandDatagramAdapter.MAX_REQUEST_LENGTH))
                .getBytes(StandardCharsets.US_ASCII);

        endpoint.injectDatagram(CLIENT, payload);

        assertEquals(List.of("ERROR request too long"), endpoint.sentText());
    }

    @Test
    void resultFormatting() {
        assertEquals("partition_up SUCCESS",
                CommandDatagramAdapter.format(new CommandResult("partition_up", CommandResult.Outcome.SUCCESS, Optional.empty())));
        assertEquals("initialize ERROR chamber open",
                CommandDatagramAdapter.format(CommandResult.error("initialize", "chamber open")));
    }
}

package com.questrail.interlock.transport.udp;

import com.questrail.interlock.api.ChamberController;
import com.questrail.interlock.api.ChamberStatus;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.transport.DatagramEndpoint;
import com.questrail.interlock.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * CommandDatagramAdapter
 * =============================================================================
 * Line-oriented ASCII command protocol over datagrams, one request per datagram.
 *
 * <h2>Requests and replies</h2>
 * <pre>
 *   CMD &lt;name&gt;     →  &lt;name&gt; SUCCESS | &lt;name&gt; ERROR [message]   (when the command resolves)
 *   QUERY &lt;name&gt;   →  &lt;name&gt; 1 | 0 | -1
 *   STATE          →  STATE &lt;interlock state&gt; &lt;lifecycle&gt;
 *   anything else  →  ERROR &lt;reason&gt;
 * </pre>
 * Verbs are case-insensitive. A {@code CMD} reply is sent once the command
 * completes, which may be many cycles later; resubmitting a pending command
 * produces one reply per request, all with the same result.
 *
 * <h2>Non-responsibilities</h2>
 * The adapter adds no retries and no timing. It never blocks the transport
 * thread on the control cycle.
 */
public final class CommandDatagramAdapter implements DatagramEndpointListener {

    private static final Logger log = LoggerFactory.getLogger(CommandDatagramAdapter.class);

    /** Longest request accepted, in bytes. */
    public static final int MAX_REQUEST_LENGTH = 256;

    private final ChamberController controller;
    private final DatagramEndpoint endpoint;

    public CommandDatagramAdapter(ChamberController controller, DatagramEndpoint endpoint) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        log.info("Command endpoint up");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause == null) {
            log.info("Command endpoint down");
        } else {
            log.warn("Command endpoint down", cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        if (payload.length > MAX_REQUEST_LENGTH) {
            reply(remote, "ERROR request too long");
            return;
        }

        String request = new String(payload, StandardCharsets.US_ASCII).trim();
        if (request.isEmpty()) {
            reply(remote, "ERROR empty request");
            return;
        }

        String[] parts = request.split("\\s+");
        String verb = parts[0].toUpperCase(Locale.ROOT);

        switch (verb) {
            case "CMD" -> {
                if (parts.length != 2) {
                    reply(remote, "ERROR usage: CMD <name>");
                    return;
                }
                onCommand(remote, parts[1]);
            }
            case "QUERY" -> {
                if (parts.length != 2) {
                    reply(remote, "ERROR usage: QUERY <name>");
                    return;
                }
                reply(remote, parts[1] + " " + controller.query(parts[1]));
            }
            case "STATE" -> {
                ChamberStatus status = controller.status();
                reply(remote, "STATE " + status.state() + " " + status.lifecycle());
            }
            default -> reply(remote, "ERROR unknown request " + parts[0]);
        }
    }

    private void onCommand(SocketAddress remote, String name) {
        log.debug("Command '{}' from {}", name, remote);
        controller.submit(name).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Command '{}' failed", name, error);
                reply(remote, name + " ERROR " + error.getMessage());
            } else {
                reply(remote, format(result));
            }
        });
    }

    static String format(CommandResult result) {
        StringBuilder sb = new StringBuilder(result.command())
                .append(' ')
                .append(result.outcome());
        result.message().ifPresent(m -> sb.append(' ').append(m));
        return sb.toString();
    }

    private void reply(SocketAddress remote, String text) {
        try {
            endpoint.send(remote, text.getBytes(StandardCharsets.US_ASCII));
        } catch (RuntimeException ex) {
            log.warn("Failed to send reply '{}' to {}", text, remote, ex);
        }
    }
}

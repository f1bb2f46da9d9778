package com.questrail.interlock.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>This endpoint is intentionally small. The command adapter above it is
 * responsible for parsing requests, handing commands to the chamber and
 * formatting replies.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}

package org.abstractica.lobby;

import java.io.IOException;

/**
 * Transmits messages to one connected client.
 *
 * <p>Implemented by the network layer, which owns encoding and the socket.
 * The lobby calls it from a single delivery thread per client, in the order
 * messages were enqueued.</p>
 */
@FunctionalInterface
public interface MessageSink
{
    /**
     * Writes a message to the client.
     *
     * @param message the message to send
     * @throws IOException if the connection failed; delivery to this client stops
     */
    void deliver(ServerMessage message) throws IOException;
}

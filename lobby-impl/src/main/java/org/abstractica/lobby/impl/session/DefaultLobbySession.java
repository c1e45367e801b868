package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.LobbySession;
import org.abstractica.lobby.MessageSink;
import org.abstractica.lobby.impl.delivery.DeliveryWorker;
import org.abstractica.lobby.impl.registry.Client;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of the LobbySession interface.
 *
 * <p>Requests are processed on the caller's thread; outgoing messages are
 * written by the session's own delivery worker.</p>
 */
public class DefaultLobbySession implements LobbySession
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultLobbySession.class);

    private final Client client;
    private final DeliveryWorker deliveryWorker;
    private final SessionCallback callback;
    private final AtomicBoolean open;

    /**
     * Creates a session for a registered client.
     *
     * @param client   the registry entry created at login
     * @param sink     where the client's messages are written
     * @param callback callback to the lobby
     */
    DefaultLobbySession(Client client, MessageSink sink, SessionCallback callback)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.deliveryWorker = new DeliveryWorker(client.getOutbox(), sink, this::onDeliveryFailed);
        this.open = new AtomicBoolean(true);
    }

    /**
     * Starts delivering the client's messages.
     */
    void start()
    {
        deliveryWorker.start();
    }

    /**
     * Stops delivering the client's messages.
     */
    void stopDelivery()
    {
        deliveryWorker.stop();
    }

    // ========== LobbySession Interface ==========

    @Override
    public String getPlayerName()
    {
        return client.getName();
    }

    @Override
    public String getAddress()
    {
        return client.getAddress();
    }

    @Override
    public Object getHandle()
    {
        return client.getHandle();
    }

    @Override
    public Optional<String> getCurrentGame()
    {
        return callback.findClient(client.getName()).flatMap(Client::getCurrentGame);
    }

    @Override
    public void handle(ClientRequest request)
    {
        Objects.requireNonNull(request, "request");
        if (!open.get())
        {
            throw new IllegalStateException("Session is closed: " + client.getName());
        }
        callback.dispatch(this, request);
    }

    @Override
    public boolean isOpen()
    {
        return open.get();
    }

    @Override
    public void close()
    {
        if (!open.compareAndSet(true, false))
        {
            return;
        }
        LOG.debug("Closing session of {}", client.getName());
        callback.onSessionClosed(this);
    }

    // ========== Internal Methods ==========

    /**
     * Returns the current registry entry of this session's client.
     *
     * @return the client
     * @throws IllegalStateException if the client is no longer registered
     */
    Client currentClient()
    {
        return callback.findClient(client.getName())
                .orElseThrow(() -> new IllegalStateException("Client not registered: " + client.getName()));
    }

    private void onDeliveryFailed(IOException cause)
    {
        LOG.info("Connection to {} lost, closing session", client.getName());
        close();
    }

    @Override
    public String toString()
    {
        return "LobbySession[" + client.getName() + "@" + client.getAddress() + "]";
    }
}

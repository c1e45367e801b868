package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.LobbyStats;
import org.abstractica.lobby.impl.registry.Registry;
import org.abstractica.lobby.impl.registry.RegistryState;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of LobbyStats.
 */
public class DefaultLobbyStats implements LobbyStats
{
    private final Registry registry;
    private final AtomicLong droppedMessages = new AtomicLong(0);

    /**
     * Creates stats for a registry.
     *
     * @param registry the registry to track
     */
    public DefaultLobbyStats(Registry registry)
    {
        this.registry = registry;
    }

    @Override
    public int getOpenGames()
    {
        return registry.snapshot().games().size();
    }

    @Override
    public int getConnectedClients()
    {
        return registry.snapshot().clients().size();
    }

    @Override
    public long getTransactionRetries()
    {
        return registry.getTransactionRetries();
    }

    @Override
    public long getDroppedMessages()
    {
        return droppedMessages.get();
    }

    /**
     * Records a message dropped by a full outbox.
     */
    public void recordDroppedMessage()
    {
        droppedMessages.incrementAndGet();
    }

    @Override
    public String toString()
    {
        RegistryState state = registry.snapshot();
        return "LobbyStats[games=" + state.games().size()
                + ", clients=" + state.clients().size()
                + ", retries=" + getTransactionRetries()
                + ", dropped=" + getDroppedMessages() + "]";
    }
}

package org.abstractica.lobby;

/**
 * Lobby statistics for monitoring.
 *
 * <p>Values are pollable snapshots.</p>
 */
public interface LobbyStats
{
    /**
     * Returns the number of open games.
     *
     * @return open game count
     */
    int getOpenGames();

    /**
     * Returns the number of logged-in clients.
     *
     * @return connected client count
     */
    int getConnectedClients();

    /**
     * Returns how often a registry transaction was re-run because a
     * concurrent writer committed first.
     *
     * @return transaction retry count
     */
    long getTransactionRetries();

    /**
     * Returns the number of messages dropped because a client's outbox was full.
     *
     * @return dropped message count
     */
    long getDroppedMessages();
}

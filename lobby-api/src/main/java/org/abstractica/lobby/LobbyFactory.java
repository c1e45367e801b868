package org.abstractica.lobby;

/**
 * Factory for creating Lobby instances.
 *
 * <pre>{@code
 * LobbyFactory factory = new DefaultLobbyFactory();
 * Lobby lobby = factory.builder()
 *     .outboxCapacity(512)
 *     .defaultCivilization("random")
 *     .build();
 * }</pre>
 */
public interface LobbyFactory
{
    /**
     * Creates a new lobby builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Lobby.
     */
    interface Builder
    {
        /**
         * Sets how many undelivered messages each client may have queued.
         *
         * <p>Messages beyond this limit are dropped.</p>
         *
         * @param capacity the outbox capacity
         * @return this builder
         */
        Builder outboxCapacity(int capacity);

        /**
         * Sets the civilization new participants start with.
         *
         * @param civilization the default civilization
         * @return this builder
         */
        Builder defaultCivilization(String civilization);

        /**
         * Sets the team new participants start in.
         *
         * @param team the default team
         * @return this builder
         */
        Builder defaultTeam(int team);

        /**
         * Sets the mode new games start with.
         *
         * @param mode the default game mode
         * @return this builder
         */
        Builder defaultMode(String mode);

        /**
         * Builds the lobby.
         *
         * @return the configured lobby
         */
        Lobby build();
    }
}

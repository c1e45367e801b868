package org.abstractica.lobby;

import java.util.Objects;

/**
 * Requests a connected client sends to the lobby.
 *
 * <p>Requests arrive already decoded by the network layer. The sealed
 * hierarchy lets the lobby register exactly one handler per variant.</p>
 */
public sealed interface ClientRequest permits
        ClientRequest.CreateGame,
        ClientRequest.JoinGame,
        ClientRequest.LeaveGame,
        ClientRequest.UpdatePlayer,
        ClientRequest.ListGames,
        ClientRequest.ConfigureGame,
        ClientRequest.StartGame,
        ClientRequest.ChatMessage,
        ClientRequest.Logout
{
    /**
     * Opens a new game hosted by the requester.
     *
     * @param name       the game name, unique among open games
     * @param map        the map to play
     * @param maxPlayers the capacity of the game
     */
    record CreateGame(String name, String map, int maxPlayers) implements ClientRequest
    {
        public CreateGame
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(map, "map");
        }
    }

    /**
     * Joins an open game.
     *
     * @param gameName the game to join
     */
    record JoinGame(String gameName) implements ClientRequest
    {
        public JoinGame
        {
            Objects.requireNonNull(gameName, "gameName");
        }
    }

    /**
     * Leaves a game. When the host leaves, the game is closed.
     *
     * @param gameName the game to leave
     */
    record LeaveGame(String gameName) implements ClientRequest
    {
        public LeaveGame
        {
            Objects.requireNonNull(gameName, "gameName");
        }
    }

    /**
     * Changes the requester's settings in its current game.
     *
     * @param civilization the chosen civilization
     * @param team         the team number
     * @param ready        true when the player is ready to start
     */
    record UpdatePlayer(String civilization, int team, boolean ready) implements ClientRequest
    {
        public UpdatePlayer
        {
            Objects.requireNonNull(civilization, "civilization");
        }
    }

    /**
     * Asks for the list of open games.
     */
    record ListGames() implements ClientRequest
    {
    }

    /**
     * Host-only: changes map, mode and capacity of the current game.
     *
     * @param map        the new map
     * @param mode       the new mode
     * @param maxPlayers the new capacity
     */
    record ConfigureGame(String map, String mode, int maxPlayers) implements ClientRequest
    {
        public ConfigureGame
        {
            Objects.requireNonNull(map, "map");
            Objects.requireNonNull(mode, "mode");
        }
    }

    /**
     * Host-only: starts the current game and hands participants each
     * other's addresses.
     */
    record StartGame() implements ClientRequest
    {
    }

    /**
     * Sends a chat line to everyone in the requester's current game.
     *
     * @param text the chat text
     */
    record ChatMessage(String text) implements ClientRequest
    {
        public ChatMessage
        {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Ends the session. Leaves the current game first.
     */
    record Logout() implements ClientRequest
    {
    }
}

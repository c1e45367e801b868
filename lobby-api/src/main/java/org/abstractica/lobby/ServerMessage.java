package org.abstractica.lobby;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Messages the lobby enqueues for delivery to a client.
 */
public sealed interface ServerMessage permits
        ServerMessage.GameList,
        ServerMessage.Info,
        ServerMessage.Error,
        ServerMessage.GameClosedByHost,
        ServerMessage.GameStarting,
        ServerMessage.GameInfo,
        ServerMessage.Chat
{
    /**
     * Snapshot of the open games.
     *
     * @param games the open games
     */
    record GameList(List<Game> games) implements ServerMessage
    {
        public GameList
        {
            games = List.copyOf(games);
        }
    }

    /**
     * Plain-text confirmation.
     *
     * @param text the confirmation text
     */
    record Info(String text) implements ServerMessage
    {
        public Info
        {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Plain-text rejection. The request that caused it changed nothing.
     *
     * @param text the error text
     */
    record Error(String text) implements ServerMessage
    {
        public Error
        {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The host left and the game no longer exists.
     */
    record GameClosedByHost() implements ServerMessage
    {
    }

    /**
     * The host started the game.
     *
     * @param addresses network address of every participant, keyed by player name
     */
    record GameStarting(Map<String, String> addresses) implements ServerMessage
    {
        public GameStarting
        {
            addresses = Collections.unmodifiableMap(new LinkedHashMap<>(addresses));
        }
    }

    /**
     * Current state of the recipient's game after a change.
     *
     * @param game the game snapshot
     */
    record GameInfo(Game game) implements ServerMessage
    {
        public GameInfo
        {
            Objects.requireNonNull(game, "game");
        }
    }

    /**
     * Chat line from another participant.
     *
     * @param from the sending player
     * @param text the chat text
     */
    record Chat(String from, String text) implements ServerMessage
    {
        public Chat
        {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(text, "text");
        }
    }
}

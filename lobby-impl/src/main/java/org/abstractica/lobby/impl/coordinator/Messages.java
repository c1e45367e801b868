package org.abstractica.lobby.impl.coordinator;

/**
 * Texts of the confirmations and rejections sent to clients.
 */
public final class Messages
{
    public static final String GAME_CREATED = "Game created.";
    public static final String JOINED_GAME = "Joined Game.";
    public static final String LEFT_GAME = "Left Game.";
    public static final String GAME_CONFIGURED = "Game configured.";

    public static final String NAME_TAKEN = "Game name already taken.";
    public static final String GAME_FULL = "Game is full.";
    public static final String NO_SUCH_GAME = "Game does not exist.";
    public static final String ALREADY_IN_GAME = "Already in a game.";
    public static final String NOT_IN_GAME = "Not in a game.";
    public static final String NOT_HOST = "Only the host can do that.";
    public static final String INVALID_PLAYER_COUNT = "Invalid number of players.";

    private Messages()
    {
    }
}

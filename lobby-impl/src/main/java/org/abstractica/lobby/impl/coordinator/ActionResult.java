package org.abstractica.lobby.impl.coordinator;

/**
 * Result of a coordinator transaction.
 *
 * <p>Rejections carry the error text sent to the requester.</p>
 */
public enum ActionResult
{
    JOINED(true, Messages.JOINED_GAME),
    LEFT(true, Messages.LEFT_GAME),
    CLOSED(true, null),
    STARTED(true, null),
    UPDATED(true, null),
    CONFIGURED(true, Messages.GAME_CONFIGURED),
    UNCHANGED(true, null),

    NO_SUCH_GAME(false, Messages.NO_SUCH_GAME),
    GAME_FULL(false, Messages.GAME_FULL),
    ALREADY_IN_GAME(false, Messages.ALREADY_IN_GAME),
    NOT_IN_GAME(false, Messages.NOT_IN_GAME),
    NOT_HOST(false, Messages.NOT_HOST),
    INVALID_PLAYER_COUNT(false, Messages.INVALID_PLAYER_COUNT);

    private final boolean success;
    private final String message;

    ActionResult(boolean success, String message)
    {
        this.success = success;
        this.message = message;
    }

    /**
     * Returns true if the action changed, or was allowed to leave, the registry.
     */
    public boolean isSuccess()
    {
        return success;
    }

    /**
     * Returns the text for the requester, or null if it gets no text reply.
     */
    public String message()
    {
        return message;
    }
}

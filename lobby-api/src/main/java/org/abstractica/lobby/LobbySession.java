package org.abstractica.lobby;

import java.util.Optional;

/**
 * The lobby's view of one logged-in client.
 *
 * <p>A session exists from a successful login until {@link #close()}. The
 * player name is held exclusively for that time; a second login with the
 * same name waits until this session closes.</p>
 */
public interface LobbySession
{
    /**
     * Returns the player name this session is logged in with.
     *
     * @return player name
     */
    String getPlayerName();

    /**
     * Returns the client's network address.
     *
     * @return address as given at login
     */
    String getAddress();

    /**
     * Returns the opaque connection handle given at login.
     *
     * <p>The lobby never interprets it.</p>
     *
     * @return the handle
     */
    Object getHandle();

    /**
     * Returns the game this client currently participates in.
     *
     * @return game name, or empty if not in a game
     */
    Optional<String> getCurrentGame();

    /**
     * Processes one request on the calling thread.
     *
     * <p>Responses and notifications are enqueued for delivery; this method
     * does not wait for them to be sent.</p>
     *
     * @param request the decoded request
     * @throws IllegalStateException if the session is closed
     */
    void handle(ClientRequest request);

    /**
     * Returns whether the session is still open.
     *
     * @return true until closed
     */
    boolean isOpen();

    /**
     * Closes the session: leaves the current game, releases the player name
     * and stops delivery. Repeated calls have no effect.
     */
    void close();
}

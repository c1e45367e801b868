package org.abstractica.lobby;

import org.abstractica.lobby.handlers.ErrorHandler;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The game lobby: open games, logged-in clients and the actions that
 * connect them.
 *
 * <p>The network layer logs a client in once its identity is known, then
 * feeds every decoded request to the returned session from that
 * connection's own thread:</p>
 * <pre>{@code
 * Lobby lobby = lobbyFactory.builder()
 *     .outboxCapacity(512)
 *     .build();
 *
 * LobbySession session = lobby.login(name, address, socket, encoder::write);
 * try
 * {
 *     while (connected)
 *     {
 *         session.handle(decoder.read());
 *     }
 * }
 * finally
 * {
 *     session.close();
 * }
 * }</pre>
 */
public interface Lobby extends AutoCloseable
{
    /**
     * Logs a client in.
     *
     * <p>If another session holds the same player name, this call blocks
     * until that session closes. The wait is cancelled by interrupting the
     * calling thread, which the network layer should do when the connection
     * drops; a cancelled login never registers the client.</p>
     *
     * @param playerName the login identity
     * @param address    the client's network address
     * @param handle     opaque connection handle, kept for the network layer
     * @param sink       where messages for this client are written
     * @return the new session
     * @throws InterruptedException if the wait for the name was cancelled
     * @throws IllegalStateException if the lobby is closed
     */
    LobbySession login(String playerName, String address, Object handle, MessageSink sink)
            throws InterruptedException;

    /**
     * Logs a client in, giving up if the player name is not released in time.
     *
     * @param playerName the login identity
     * @param address    the client's network address
     * @param handle     opaque connection handle
     * @param sink       where messages for this client are written
     * @param timeout    maximum time to wait for the name
     * @return the new session, or empty on timeout
     * @throws InterruptedException if the wait was cancelled
     * @throws IllegalStateException if the lobby is closed
     */
    Optional<LobbySession> login(String playerName, String address, Object handle, MessageSink sink,
                                 Duration timeout) throws InterruptedException;

    /**
     * Returns a snapshot of the open games.
     *
     * @return open games
     */
    List<Game> listGames();

    /**
     * Returns the open sessions.
     *
     * @return unmodifiable collection of sessions
     */
    Collection<LobbySession> getSessions();

    /**
     * Registers an error handler for exceptions thrown while handling a request.
     *
     * @param handler called with the session, request and exception
     */
    void onError(ErrorHandler handler);

    /**
     * Registers a callback for successful logins.
     *
     * @param handler called with the new session
     */
    void onSessionStarted(Consumer<LobbySession> handler);

    /**
     * Registers a callback for closed sessions.
     *
     * @param handler called after the session left its game and released its name
     */
    void onSessionClosed(Consumer<LobbySession> handler);

    /**
     * Returns lobby statistics.
     *
     * @return current statistics
     */
    LobbyStats getStats();

    /**
     * Closes all sessions and rejects further logins.
     */
    @Override
    void close();
}

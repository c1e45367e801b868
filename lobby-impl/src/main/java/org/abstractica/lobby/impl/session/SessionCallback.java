package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.impl.registry.Client;

import java.util.Optional;

/**
 * Callback interface from session to lobby.
 *
 * <p>Used by DefaultLobbySession to dispatch requests, look up its registry
 * entry and report that it closed.</p>
 */
interface SessionCallback
{
    /**
     * Dispatches a request to its handler.
     *
     * @param session the requesting session
     * @param request the request
     */
    void dispatch(DefaultLobbySession session, ClientRequest request);

    /**
     * Looks up the session's current registry entry.
     *
     * @param playerName the player name
     * @return the client, or empty once unregistered
     */
    Optional<Client> findClient(String playerName);

    /**
     * Notifies that a session has closed.
     *
     * @param session the closed session
     */
    void onSessionClosed(DefaultLobbySession session);
}

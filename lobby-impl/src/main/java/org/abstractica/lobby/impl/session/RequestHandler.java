package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.ClientRequest;

/**
 * Handles requests of one type.
 *
 * @param <T> the request type this handler processes
 */
@FunctionalInterface
interface RequestHandler<T extends ClientRequest>
{
    /**
     * Handles a request on the requesting session's thread.
     *
     * @param session the requesting session
     * @param request the request
     */
    void handle(DefaultLobbySession session, T request);
}

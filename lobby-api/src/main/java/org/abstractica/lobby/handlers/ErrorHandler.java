package org.abstractica.lobby.handlers;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.LobbySession;

/**
 * Handles exceptions thrown while a request is processed.
 *
 * <p>The lobby catches the exception, invokes this handler and keeps the
 * session open for further requests.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a request handler.
     *
     * @param session   the session that sent the request
     * @param request   the request being processed
     * @param exception the exception thrown
     */
    void handle(LobbySession session, ClientRequest request, Exception exception);
}

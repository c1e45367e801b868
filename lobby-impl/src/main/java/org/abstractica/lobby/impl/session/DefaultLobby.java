package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.Game;
import org.abstractica.lobby.Lobby;
import org.abstractica.lobby.LobbySession;
import org.abstractica.lobby.LobbyStats;
import org.abstractica.lobby.MessageSink;
import org.abstractica.lobby.handlers.ErrorHandler;
import org.abstractica.lobby.impl.coordinator.SessionCoordinator;
import org.abstractica.lobby.impl.delivery.Outbox;
import org.abstractica.lobby.impl.registry.Client;
import org.abstractica.lobby.impl.registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Default implementation of the Lobby interface.
 *
 * <p>Owns the registry and coordinator, creates sessions at login and
 * dispatches each request to the handler registered for its type.</p>
 */
public class DefaultLobby implements Lobby, SessionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultLobby.class);

    private final Registry registry;
    private final SessionCoordinator coordinator;
    private final int outboxCapacity;

    private final Map<Class<?>, RequestHandler<?>> requestHandlers;
    private final Map<String, DefaultLobbySession> sessions;
    private final List<Consumer<LobbySession>> sessionStartedCallbacks;
    private final List<Consumer<LobbySession>> sessionClosedCallbacks;
    private volatile ErrorHandler errorHandler;

    private final DefaultLobbyStats stats;

    private volatile boolean closed;

    /**
     * Creates a new lobby.
     *
     * <p>Use {@link DefaultLobbyFactory} to create instances.</p>
     */
    DefaultLobby(Registry registry, int outboxCapacity)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.coordinator = new SessionCoordinator(registry);
        this.outboxCapacity = outboxCapacity;

        this.requestHandlers = new ConcurrentHashMap<>();
        this.sessions = new ConcurrentHashMap<>();
        this.sessionStartedCallbacks = new CopyOnWriteArrayList<>();
        this.sessionClosedCallbacks = new CopyOnWriteArrayList<>();
        this.stats = new DefaultLobbyStats(registry);
        this.closed = false;

        registerRequestHandlers();
    }

    private void registerRequestHandlers()
    {
        register(ClientRequest.CreateGame.class,
                (session, request) -> coordinator.createGame(session.currentClient(), request));
        register(ClientRequest.JoinGame.class,
                (session, request) -> coordinator.join(session.currentClient(), request.gameName()));
        register(ClientRequest.LeaveGame.class,
                (session, request) -> coordinator.leave(session.currentClient(), request.gameName()));
        register(ClientRequest.UpdatePlayer.class,
                (session, request) -> coordinator.updatePlayer(session.currentClient(), request));
        register(ClientRequest.ListGames.class,
                (session, request) -> coordinator.listGames(session.currentClient()));
        register(ClientRequest.ConfigureGame.class,
                (session, request) -> coordinator.configureGame(session.currentClient(), request));
        register(ClientRequest.StartGame.class,
                (session, request) -> coordinator.startGame(session.currentClient()));
        register(ClientRequest.ChatMessage.class,
                (session, request) -> coordinator.chat(session.currentClient(), request.text()));
        register(ClientRequest.Logout.class,
                (session, request) -> session.close());
    }

    private <T extends ClientRequest> void register(Class<T> type, RequestHandler<T> handler)
    {
        requestHandlers.put(type, handler);
    }

    // ========== Lobby Interface ==========

    @Override
    public LobbySession login(String playerName, String address, Object handle, MessageSink sink)
            throws InterruptedException
    {
        Objects.requireNonNull(sink, "sink");
        checkOpen();

        Client client = newClient(playerName, address, handle);
        registry.registerClient(client);
        return startSession(client, sink);
    }

    @Override
    public Optional<LobbySession> login(String playerName, String address, Object handle, MessageSink sink,
                                        Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(sink, "sink");
        checkOpen();

        Client client = newClient(playerName, address, handle);
        if (!registry.registerClient(client, timeout))
        {
            LOG.info("Login of {} timed out waiting for the name to be released", playerName);
            return Optional.empty();
        }
        return Optional.of(startSession(client, sink));
    }

    @Override
    public List<Game> listGames()
    {
        return registry.listGames();
    }

    @Override
    public Collection<LobbySession> getSessions()
    {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public void onSessionStarted(Consumer<LobbySession> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionStartedCallbacks.add(handler);
    }

    @Override
    public void onSessionClosed(Consumer<LobbySession> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionClosedCallbacks.add(handler);
    }

    @Override
    public LobbyStats getStats()
    {
        return stats;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }

        LOG.info("Closing lobby");
        closed = true;

        for (DefaultLobbySession session : sessions.values())
        {
            session.close();
        }

        LOG.info("Lobby closed");
    }

    /**
     * Returns the coordinator behind this lobby.
     */
    public SessionCoordinator getCoordinator()
    {
        return coordinator;
    }

    // ========== SessionCallback Interface ==========

    @SuppressWarnings({"rawtypes", "unchecked"})
    @Override
    public void dispatch(DefaultLobbySession session, ClientRequest request)
    {
        RequestHandler handler = requestHandlers.get(request.getClass());
        if (handler == null)
        {
            LOG.debug("No handler for request type: {}", request.getClass().getSimpleName());
            return;
        }

        try
        {
            handler.handle(session, request);
        }
        catch (Exception e)
        {
            ErrorHandler handlerForErrors = errorHandler;
            if (handlerForErrors != null)
            {
                try
                {
                    handlerForErrors.handle(session, request, e);
                }
                catch (Exception e2)
                {
                    LOG.error("Error handler threw exception", e2);
                }
            }
            else
            {
                LOG.error("Request handler exception: player={}, requestType={}",
                        session.getPlayerName(), request.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public Optional<Client> findClient(String playerName)
    {
        return registry.findClient(playerName);
    }

    @Override
    public void onSessionClosed(DefaultLobbySession session)
    {
        try
        {
            registry.unregisterClient(session.getPlayerName(), coordinator::leave);
        }
        catch (RuntimeException e)
        {
            LOG.error("Failed to unregister {}", session.getPlayerName(), e);
        }
        finally
        {
            sessions.remove(session.getPlayerName(), session);
            session.stopDelivery();

            LOG.info("Session closed: {}", session.getPlayerName());

            for (Consumer<LobbySession> callback : sessionClosedCallbacks)
            {
                try
                {
                    callback.accept(session);
                }
                catch (Exception e)
                {
                    LOG.error("Session closed callback error", e);
                }
            }
        }
    }

    // ========== Internal ==========

    private Client newClient(String playerName, String address, Object handle)
    {
        Objects.requireNonNull(playerName, "playerName");
        Objects.requireNonNull(address, "address");
        Outbox outbox = new Outbox(playerName, outboxCapacity, stats::recordDroppedMessage);
        return new Client(playerName, address, handle, outbox);
    }

    private DefaultLobbySession startSession(Client client, MessageSink sink)
    {
        DefaultLobbySession session = new DefaultLobbySession(client, sink, this);
        session.start();
        sessions.put(client.getName(), session);
        if (closed)
        {
            // close() may have run before the put and missed this session
            session.close();
            throw new IllegalStateException("Lobby is closed");
        }
        LOG.info("Session started: {} from {}", client.getName(), client.getAddress());

        for (Consumer<LobbySession> callback : sessionStartedCallbacks)
        {
            try
            {
                callback.accept(session);
            }
            catch (Exception e)
            {
                LOG.error("Session started callback error", e);
            }
        }
        return session;
    }

    private void checkOpen()
    {
        if (closed)
        {
            throw new IllegalStateException("Lobby is closed");
        }
    }
}

package org.abstractica.lobby.impl.registry;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared registry of open games and logged-in clients.
 *
 * <p>Both collections live in a single {@link RegistryState} behind an
 * atomic reference. Every change is a {@link Transaction} committed with
 * compare-and-set and re-run when another writer got there first, so
 * updates spanning both collections are all-or-nothing and callers need
 * no locks of their own.</p>
 *
 * <p>Thread-safe.</p>
 */
public class Registry
{
    private static final Logger LOG = LoggerFactory.getLogger(Registry.class);

    /**
     * Runs the leave-game protocol on behalf of a departing client.
     */
    @FunctionalInterface
    public interface LeaveHandler
    {
        /**
         * Removes the client from the game, or closes the game if it is the host.
         * Afterwards the client's current-game link must be cleared.
         *
         * @param client   the departing client
         * @param gameName the game it is linked to
         */
        void leave(Client client, String gameName);
    }

    private final AtomicReference<RegistryState> state;
    private final AtomicLong retries;
    private final LobbyDefaults defaults;

    // Signalled whenever a client entry is removed, to wake waiting registrations
    private final ReentrantLock identityLock;
    private final Condition identityReleased;

    /**
     * Creates an empty registry with standard defaults.
     */
    public Registry()
    {
        this(LobbyDefaults.STANDARD);
    }

    /**
     * Creates an empty registry.
     *
     * @param defaults initial values for new games and participants
     */
    public Registry(LobbyDefaults defaults)
    {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.state = new AtomicReference<>(RegistryState.empty());
        this.retries = new AtomicLong(0);
        this.identityLock = new ReentrantLock();
        this.identityReleased = identityLock.newCondition();
    }

    // ========== Transactions ==========

    /**
     * Runs a transaction until it commits without conflict.
     *
     * @param transaction the transaction
     * @param <T>         the result type
     * @return the result of the committed run
     */
    public <T> T atomically(Transaction<T> transaction)
    {
        Objects.requireNonNull(transaction, "transaction");

        while (true)
        {
            RegistryState current = state.get();
            Transaction.Result<T> result = transaction.apply(current);
            if (result.state() == current || state.compareAndSet(current, result.state()))
            {
                return result.value();
            }
            retries.incrementAndGet();
        }
    }

    /**
     * Returns the current state. Games and clients are consistent with each other.
     *
     * @return state snapshot
     */
    public RegistryState snapshot()
    {
        return state.get();
    }

    /**
     * Returns how many transaction runs were discarded because of a conflict.
     */
    public long getTransactionRetries()
    {
        return retries.get();
    }

    /**
     * Returns the defaults used for new games and participants.
     */
    public LobbyDefaults getDefaults()
    {
        return defaults;
    }

    // ========== Games ==========

    /**
     * Returns all open games.
     *
     * @return snapshot of open games, in creation order
     */
    public List<Game> listGames()
    {
        return List.copyOf(state.get().games().values());
    }

    /**
     * Finds an open game.
     *
     * @param name the game name
     * @return the game, or empty if not open
     */
    public Optional<Game> findGame(String name)
    {
        Objects.requireNonNull(name, "name");
        return state.get().game(name);
    }

    /**
     * Opens a game hosted by the requester, unless the name is taken.
     *
     * <p>The host is added as the only participant and its current-game
     * link is set in the same transaction.</p>
     *
     * @param requesterName the hosting player
     * @param request       the create request
     * @return the new game, or empty if a game with that name is open
     * @throws IllegalStateException if the requester is not registered
     */
    public Optional<Game> createGame(String requesterName, ClientRequest.CreateGame request)
    {
        Objects.requireNonNull(requesterName, "requesterName");
        Objects.requireNonNull(request, "request");

        Game created = atomically(current ->
        {
            if (current.games().containsKey(request.name()))
            {
                return Transaction.abort(current, null);
            }
            Client host = current.clients().get(requesterName);
            if (host == null)
            {
                throw new IllegalStateException("Client not registered: " + requesterName);
            }
            Game game = Game.open(request.name(), requesterName, request.map(), defaults.mode(), request.maxPlayers())
                    .withParticipant(defaults.newParticipant(requesterName, true));
            return Transaction.commit(current.withGame(game).withClient(host.withCurrentGame(game.name())), game);
        });

        if (created == null)
        {
            LOG.debug("Game name {} already taken, rejected for {}", request.name(), requesterName);
            return Optional.empty();
        }
        LOG.info("Game created: name={}, host={}, map={}, maxPlayers={}",
                created.name(), requesterName, created.map(), created.maxPlayers());
        return Optional.of(created);
    }

    /**
     * Removes a game unconditionally and clears its participants' links.
     *
     * @param name the game name
     * @return the removed game, or empty if it was not open
     */
    public Optional<Game> removeGame(String name)
    {
        Objects.requireNonNull(name, "name");

        Game removed = atomically(current ->
        {
            Game game = current.games().get(name);
            if (game == null)
            {
                return Transaction.abort(current, null);
            }
            return Transaction.commit(current.closeGame(name), game);
        });

        if (removed != null)
        {
            LOG.info("Game removed: {}", name);
        }
        return Optional.ofNullable(removed);
    }

    // ========== Clients ==========

    /**
     * Finds a logged-in client.
     *
     * @param name the player name
     * @return the current registry entry, or empty if not logged in
     */
    public Optional<Client> findClient(String name)
    {
        Objects.requireNonNull(name, "name");
        return state.get().client(name);
    }

    /**
     * Registers a client, waiting while its player name is in use.
     *
     * <p>Interrupting the calling thread cancels the wait; the client is
     * then not registered.</p>
     *
     * @param client the client to register
     * @throws InterruptedException if the wait was cancelled
     */
    public void registerClient(Client client) throws InterruptedException
    {
        Objects.requireNonNull(client, "client");

        identityLock.lockInterruptibly();
        try
        {
            while (!tryRegister(client))
            {
                LOG.debug("Player name {} in use, waiting for release", client.getName());
                identityReleased.await();
            }
        }
        finally
        {
            identityLock.unlock();
        }
        LOG.info("Client registered: {} from {}", client.getName(), client.getAddress());
    }

    /**
     * Registers a client, waiting at most the given time for its player name.
     *
     * @param client  the client to register
     * @param timeout maximum wait
     * @return true if registered, false if the name was not released in time
     * @throws InterruptedException if the wait was cancelled
     */
    public boolean registerClient(Client client, Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(timeout, "timeout");

        long remainingNanos = timeout.toNanos();
        identityLock.lockInterruptibly();
        try
        {
            while (!tryRegister(client))
            {
                if (remainingNanos <= 0)
                {
                    LOG.debug("Gave up waiting for player name {}", client.getName());
                    return false;
                }
                remainingNanos = identityReleased.awaitNanos(remainingNanos);
            }
        }
        finally
        {
            identityLock.unlock();
        }
        LOG.info("Client registered: {} from {}", client.getName(), client.getAddress());
        return true;
    }

    /**
     * Removes a client, leaving its current game first.
     *
     * <p>The entry is deleted only in a state where the client is in no
     * game. If a join or create links it to a game after the leave ran, the
     * leave runs again for the new game before the delete is retried.</p>
     *
     * <p>Unknown names are ignored, so repeated calls are harmless.</p>
     *
     * @param name         the player name
     * @param leaveHandler runs the leave protocol if the client is in a game;
     *                     it must clear the client's current-game link
     * @return true if a client was removed
     */
    public boolean unregisterClient(String name, LeaveHandler leaveHandler)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(leaveHandler, "leaveHandler");

        while (true)
        {
            Optional<Client> client = findClient(name);
            if (client.isEmpty())
            {
                LOG.debug("Unregister of unknown client {} ignored", name);
                return false;
            }

            Optional<String> gameName = client.get().getCurrentGame();
            if (gameName.isPresent())
            {
                leaveHandler.leave(client.get(), gameName.get());
            }

            Removal removal = atomically(current ->
            {
                Client entry = current.clients().get(name);
                if (entry == null)
                {
                    return Transaction.abort(current, Removal.ABSENT);
                }
                if (entry.getCurrentGame().isPresent())
                {
                    return Transaction.abort(current, Removal.STILL_IN_GAME);
                }
                return Transaction.commit(current.withoutClient(name), Removal.REMOVED);
            });

            switch (removal)
            {
                case REMOVED ->
                {
                    signalIdentityReleased();
                    LOG.info("Client unregistered: {}", name);
                    return true;
                }
                case ABSENT ->
                {
                    return false;
                }
                default -> LOG.debug("Client {} joined a game while leaving, leaving again", name);
            }
        }
    }

    private enum Removal
    {
        REMOVED,
        ABSENT,
        STILL_IN_GAME
    }

    private boolean tryRegister(Client client)
    {
        return atomically(current ->
        {
            if (current.clients().containsKey(client.getName()))
            {
                return Transaction.abort(current, false);
            }
            return Transaction.commit(current.withClient(client), true);
        });
    }

    private void signalIdentityReleased()
    {
        identityLock.lock();
        try
        {
            identityReleased.signalAll();
        }
        finally
        {
            identityLock.unlock();
        }
    }
}

package org.abstractica.lobby.impl.registry;

import org.abstractica.lobby.Game;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of both registry collections.
 *
 * <p>Holding games and clients in one value makes every read a consistent
 * view of both, and lets a transaction replace both in one step.</p>
 *
 * @param games   open games by name, in creation order
 * @param clients logged-in clients by player name
 */
public record RegistryState(Map<String, Game> games, Map<String, Client> clients)
{
    private static final RegistryState EMPTY = new RegistryState(Map.of(), Map.of());

    public RegistryState
    {
        games = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(games, "games")));
        clients = Collections.unmodifiableMap(new HashMap<>(Objects.requireNonNull(clients, "clients")));
    }

    /**
     * Returns the state with no games and no clients.
     */
    public static RegistryState empty()
    {
        return EMPTY;
    }

    public Optional<Game> game(String name)
    {
        return Optional.ofNullable(games.get(name));
    }

    public Optional<Client> client(String name)
    {
        return Optional.ofNullable(clients.get(name));
    }

    /**
     * Inserts or replaces a game.
     *
     * @param game the game
     * @return new state
     */
    public RegistryState withGame(Game game)
    {
        Map<String, Game> updated = new LinkedHashMap<>(games);
        updated.put(game.name(), game);
        return new RegistryState(updated, clients);
    }

    /**
     * Removes a game. Client links are left untouched.
     *
     * @param name the game name
     * @return new state
     */
    public RegistryState withoutGame(String name)
    {
        if (!games.containsKey(name))
        {
            return this;
        }
        Map<String, Game> updated = new LinkedHashMap<>(games);
        updated.remove(name);
        return new RegistryState(updated, clients);
    }

    /**
     * Inserts or replaces a client.
     *
     * @param client the client
     * @return new state
     */
    public RegistryState withClient(Client client)
    {
        Map<String, Client> updated = new HashMap<>(clients);
        updated.put(client.getName(), client);
        return new RegistryState(games, updated);
    }

    /**
     * Removes a client.
     *
     * @param name the player name
     * @return new state
     */
    public RegistryState withoutClient(String name)
    {
        if (!clients.containsKey(name))
        {
            return this;
        }
        Map<String, Client> updated = new HashMap<>(clients);
        updated.remove(name);
        return new RegistryState(games, updated);
    }

    /**
     * Removes a game and clears the current-game link of every client
     * that pointed at it.
     *
     * @param name the game name
     * @return new state
     */
    public RegistryState closeGame(String name)
    {
        Map<String, Client> updated = new HashMap<>(clients);
        for (Client client : clients.values())
        {
            if (client.isIn(name))
            {
                updated.put(client.getName(), client.withoutCurrentGame());
            }
        }
        return new RegistryState(games, updated).withoutGame(name);
    }
}

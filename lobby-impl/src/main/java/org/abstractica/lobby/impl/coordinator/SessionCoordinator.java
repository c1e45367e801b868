package org.abstractica.lobby.impl.coordinator;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.Game;
import org.abstractica.lobby.ServerMessage;
import org.abstractica.lobby.impl.registry.Client;
import org.abstractica.lobby.impl.registry.LobbyDefaults;
import org.abstractica.lobby.impl.registry.Registry;
import org.abstractica.lobby.impl.registry.RegistryState;
import org.abstractica.lobby.impl.registry.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lobby actions built from registry transactions and client notifications.
 *
 * <p>Each action decides inside one transaction and resolves the clients to
 * notify from the same state; messages are enqueued only after the
 * transaction has committed. Confirmations and rejections go to the
 * requester, game-wide notifications to every current participant.</p>
 *
 * <p>Thread-safe. Methods are called concurrently from the clients' own
 * threads.</p>
 */
public class SessionCoordinator
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionCoordinator.class);

    private final Registry registry;
    private final LobbyDefaults defaults;

    /**
     * Creates a coordinator over a registry.
     *
     * @param registry the shared registry
     */
    public SessionCoordinator(Registry registry)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.defaults = registry.getDefaults();
    }

    /**
     * Returns the registry this coordinator works on.
     */
    public Registry getRegistry()
    {
        return registry;
    }

    // ========== Game Lifecycle ==========

    /**
     * Sends the requester the list of open games.
     *
     * @param client the requester
     */
    public void listGames(Client client)
    {
        client.send(new ServerMessage.GameList(registry.listGames()));
    }

    /**
     * Opens a game hosted by the requester.
     *
     * @param client  the requester
     * @param request the create request
     * @return true if the game was created
     */
    public boolean createGame(Client client, ClientRequest.CreateGame request)
    {
        Objects.requireNonNull(request, "request");

        if (request.maxPlayers() < 1)
        {
            reply(client, ActionResult.INVALID_PLAYER_COUNT);
            return false;
        }
        if (currentGameOf(client).isPresent())
        {
            reply(client, ActionResult.ALREADY_IN_GAME);
            return false;
        }

        Optional<Game> created = registry.createGame(client.getName(), request);
        if (created.isEmpty())
        {
            client.send(new ServerMessage.Error(Messages.NAME_TAKEN));
            return false;
        }
        client.send(new ServerMessage.Info(Messages.GAME_CREATED));
        return true;
    }

    /**
     * Adds the requester to a game.
     *
     * <p>Existence and capacity are checked in the same transaction that
     * inserts the participant and sets the client's current-game link, so a
     * game never admits more players than its capacity.</p>
     *
     * @param client   the requester
     * @param gameName the game to join
     * @return true if joined
     */
    public boolean join(Client client, String gameName)
    {
        Objects.requireNonNull(gameName, "gameName");
        String name = client.getName();

        Outcome outcome = registry.atomically(state ->
        {
            Game game = state.games().get(gameName);
            if (game == null)
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NO_SUCH_GAME));
            }
            Client current = requireClient(state, name);
            if (current.getCurrentGame().isPresent())
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.ALREADY_IN_GAME));
            }
            if (game.isFull())
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.GAME_FULL));
            }
            Game joined = game.withParticipant(defaults.newParticipant(name, false));
            RegistryState next = state.withGame(joined).withClient(current.withCurrentGame(gameName));
            return Transaction.commit(next, Outcome.of(ActionResult.JOINED, joined, List.of()));
        });

        reply(client, outcome.result());
        if (outcome.result().isSuccess())
        {
            LOG.info("{} joined {} ({}/{})",
                    name, gameName, outcome.game().playerCount(), outcome.game().maxPlayers());
            return true;
        }
        LOG.debug("{} could not join {}: {}", name, gameName, outcome.result());
        return false;
    }

    /**
     * Removes the requester from a game.
     *
     * <p>If the requester hosts the game, the game is closed: every
     * participant, the host included, is sent {@link ServerMessage.GameClosedByHost}
     * and all their current-game links are cleared. Leaving a game the
     * client is not part of changes nothing.</p>
     *
     * @param client   the leaving client
     * @param gameName the game to leave
     */
    public void leave(Client client, String gameName)
    {
        Objects.requireNonNull(gameName, "gameName");
        String name = client.getName();

        Outcome outcome = registry.atomically(state ->
        {
            Game game = state.games().get(gameName);
            Client current = state.clients().get(name);
            if (game == null || !game.hasParticipant(name))
            {
                if (current != null && current.isIn(gameName))
                {
                    // Stale link to a game that is gone
                    return Transaction.commit(state.withClient(current.withoutCurrentGame()),
                            Outcome.rejected(ActionResult.NOT_IN_GAME));
                }
                return Transaction.abort(state, Outcome.rejected(ActionResult.NOT_IN_GAME));
            }
            if (game.isHost(name))
            {
                return Transaction.commit(state.closeGame(gameName),
                        Outcome.of(ActionResult.CLOSED, game, resolveMembers(state, game)));
            }
            Game remaining = game.withoutParticipant(name);
            RegistryState next = state.withGame(remaining);
            if (current != null)
            {
                next = next.withClient(current.withoutCurrentGame());
            }
            return Transaction.commit(next, Outcome.of(ActionResult.LEFT, remaining, List.of()));
        });

        switch (outcome.result())
        {
            case CLOSED ->
            {
                sendToAll(outcome.members(), new ServerMessage.GameClosedByHost());
                LOG.info("Game {} closed by host {}, {} participants notified",
                        gameName, name, outcome.members().size());
            }
            case LEFT ->
            {
                reply(client, ActionResult.LEFT);
                LOG.info("{} left {}", name, gameName);
            }
            default ->
            {
                reply(client, outcome.result());
                LOG.debug("{} is not in game {}, leave ignored", name, gameName);
            }
        }
    }

    /**
     * Host-only: replaces map, mode and capacity of the requester's game.
     *
     * <p>The capacity may not drop below the current number of participants.
     * Participants are sent the updated game.</p>
     *
     * @param client  the requester
     * @param request the new settings
     * @return true if the game was changed
     */
    public boolean configureGame(Client client, ClientRequest.ConfigureGame request)
    {
        Objects.requireNonNull(request, "request");
        String name = client.getName();

        Optional<String> gameName = currentGameOf(client);
        if (gameName.isEmpty())
        {
            reply(client, ActionResult.NOT_IN_GAME);
            return false;
        }

        Outcome outcome = registry.atomically(state ->
        {
            Game game = state.games().get(gameName.get());
            if (game == null)
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NO_SUCH_GAME));
            }
            if (!game.isHost(name))
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NOT_HOST));
            }
            if (request.maxPlayers() < Math.max(1, game.playerCount()))
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.INVALID_PLAYER_COUNT));
            }
            Game configured = game.withSettings(request.map(), request.mode(), request.maxPlayers());
            return Transaction.commit(state.withGame(configured),
                    Outcome.of(ActionResult.CONFIGURED, configured, resolveMembers(state, configured)));
        });

        reply(client, outcome.result());
        if (!outcome.result().isSuccess())
        {
            return false;
        }
        sendToAll(outcome.members(), new ServerMessage.GameInfo(outcome.game()));
        LOG.info("Game {} configured: map={}, mode={}, maxPlayers={}",
                gameName.get(), request.map(), request.mode(), request.maxPlayers());
        return true;
    }

    /**
     * Host-only: starts the requester's game.
     *
     * <p>Every participant is sent the addresses of all participants, then
     * the game is removed from the lobby and the links are cleared.</p>
     *
     * @param client the requester
     * @return true if the game was started
     */
    public boolean startGame(Client client)
    {
        String name = client.getName();

        Optional<String> gameName = currentGameOf(client);
        if (gameName.isEmpty())
        {
            reply(client, ActionResult.NOT_IN_GAME);
            return false;
        }

        Outcome outcome = registry.atomically(state ->
        {
            Game game = state.games().get(gameName.get());
            if (game == null)
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NO_SUCH_GAME));
            }
            if (!game.isHost(name))
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NOT_HOST));
            }
            Map<String, String> addresses = addressesOf(state.clients(), game.participants().keySet());
            return Transaction.commit(state.closeGame(game.name()),
                    new Outcome(ActionResult.STARTED, game, resolveMembers(state, game), addresses));
        });

        reply(client, outcome.result());
        if (!outcome.result().isSuccess())
        {
            return false;
        }
        sendToAll(outcome.members(), new ServerMessage.GameStarting(outcome.addresses()));
        LOG.info("Game {} started by {} with {} players",
                gameName.get(), name, outcome.members().size());
        return true;
    }

    // ========== Players ==========

    /**
     * Applies the requester's civilization, team and ready flag in its
     * current game and sends participants the updated game.
     *
     * @param client  the requester
     * @param request the new settings
     * @return true if the game was changed
     */
    public boolean updatePlayer(Client client, ClientRequest.UpdatePlayer request)
    {
        Objects.requireNonNull(request, "request");
        String name = client.getName();

        Optional<String> gameName = currentGameOf(client);
        if (gameName.isEmpty())
        {
            reply(client, ActionResult.NOT_IN_GAME);
            return false;
        }

        Outcome outcome = registry.atomically(state ->
        {
            Game game = state.games().get(gameName.get());
            if (game == null)
            {
                return Transaction.abort(state, Outcome.rejected(ActionResult.NO_SUCH_GAME));
            }
            Game updated = updatePlayer(name, request.civilization(), request.team(), request.ready(), game);
            if (updated == game)
            {
                return Transaction.abort(state, Outcome.of(ActionResult.UNCHANGED, game, List.of()));
            }
            return Transaction.commit(state.withGame(updated),
                    Outcome.of(ActionResult.UPDATED, updated, resolveMembers(state, updated)));
        });

        reply(client, outcome.result());
        if (outcome.result() != ActionResult.UPDATED)
        {
            return false;
        }
        sendToAll(outcome.members(), new ServerMessage.GameInfo(outcome.game()));
        LOG.debug("{} updated in {}: civilization={}, team={}, ready={}",
                name, gameName.get(), request.civilization(), request.team(), request.ready());
        return true;
    }

    /**
     * Replaces a participant's civilization, team and ready flag.
     *
     * <p>Pure; a name that is not a participant returns the game unchanged.</p>
     *
     * @param playerName   the participant
     * @param civilization the new civilization
     * @param team         the new team
     * @param ready        the new ready flag
     * @param game         the game to transform
     * @return the transformed game
     */
    public static Game updatePlayer(String playerName, String civilization, int team, boolean ready, Game game)
    {
        return game.withPlayerConfig(playerName, civilization, team, ready);
    }

    /**
     * Sends a chat line to everyone in the requester's current game.
     *
     * @param client the sender
     * @param text   the chat text
     * @return true if the sender was in a game
     */
    public boolean chat(Client client, String text)
    {
        Optional<String> gameName = currentGameOf(client);
        if (gameName.isEmpty())
        {
            reply(client, ActionResult.NOT_IN_GAME);
            return false;
        }
        broadcast(gameName.get(), new ServerMessage.Chat(client.getName(), text));
        return true;
    }

    // ========== Notifications ==========

    /**
     * Enqueues a message for every current participant of a game.
     *
     * <p>Membership is read from a snapshot; a player leaving concurrently
     * may still receive the message and one joining concurrently may not.</p>
     *
     * @param gameName the game
     * @param message  the message
     * @return number of participants the message was enqueued for
     */
    public int broadcast(String gameName, ServerMessage message)
    {
        Objects.requireNonNull(gameName, "gameName");
        Objects.requireNonNull(message, "message");

        RegistryState state = registry.snapshot();
        Game game = state.games().get(gameName);
        if (game == null)
        {
            LOG.debug("Broadcast to closed game {} dropped", gameName);
            return 0;
        }
        List<Client> members = resolveMembers(state, game);
        sendToAll(members, message);
        return members.size();
    }

    /**
     * Maps the given players to their network addresses.
     *
     * <p>Names without a registered client are left out.</p>
     *
     * @param clients the registered clients
     * @param names   the players to include
     * @return address by player name, in the order of {@code names}
     */
    public static Map<String, String> addressesOf(Map<String, Client> clients, Collection<String> names)
    {
        Map<String, String> addresses = new LinkedHashMap<>();
        for (String name : names)
        {
            Client client = clients.get(name);
            if (client != null)
            {
                addresses.put(name, client.getAddress());
            }
        }
        return addresses;
    }

    // ========== Internal ==========

    private Optional<String> currentGameOf(Client client)
    {
        return requireClient(registry.snapshot(), client.getName()).getCurrentGame();
    }

    private static Client requireClient(RegistryState state, String name)
    {
        Client client = state.clients().get(name);
        if (client == null)
        {
            throw new IllegalStateException("Client not registered: " + name);
        }
        return client;
    }

    private static List<Client> resolveMembers(RegistryState state, Game game)
    {
        List<Client> members = new ArrayList<>(game.playerCount());
        for (String participant : game.participants().keySet())
        {
            Client client = state.clients().get(participant);
            if (client == null)
            {
                throw new IllegalStateException(
                        "Participant " + participant + " of game " + game.name() + " has no registered client");
            }
            members.add(client);
        }
        return members;
    }

    private static void sendToAll(List<Client> members, ServerMessage message)
    {
        for (Client member : members)
        {
            member.send(message);
        }
    }

    private static void reply(Client client, ActionResult result)
    {
        if (result.message() == null)
        {
            return;
        }
        if (result.isSuccess())
        {
            client.send(new ServerMessage.Info(result.message()));
        }
        else
        {
            client.send(new ServerMessage.Error(result.message()));
        }
    }
}

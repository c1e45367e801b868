package org.abstractica.lobby.impl.coordinator;

import org.abstractica.lobby.ClientRequest;
import org.abstractica.lobby.Game;
import org.abstractica.lobby.Participant;
import org.abstractica.lobby.ServerMessage;
import org.abstractica.lobby.impl.delivery.Outbox;
import org.abstractica.lobby.impl.registry.Client;
import org.abstractica.lobby.impl.registry.Registry;
import org.abstractica.lobby.impl.registry.RegistryState;
import org.abstractica.lobby.impl.registry.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionCoordinator}.
 */
class SessionCoordinatorTest
{
    private Registry registry;
    private SessionCoordinator coordinator;
    private ExecutorService executor;

    private Client alice;
    private Client bob;
    private Client carol;

    @BeforeEach
    void setUp() throws Exception
    {
        registry = new Registry();
        coordinator = new SessionCoordinator(registry);
        executor = Executors.newFixedThreadPool(8);

        alice = login("alice");
        bob = login("bob");
        carol = login("carol");
    }

    @AfterEach
    void tearDown()
    {
        executor.shutdownNow();
    }

    private Client login(String name) throws InterruptedException
    {
        Client client = new Client(name, name + ".example.org", null, new Outbox(name));
        registry.registerClient(client);
        return client;
    }

    private static List<ServerMessage> drain(Client client) throws InterruptedException
    {
        List<ServerMessage> messages = new ArrayList<>();
        ServerMessage message;
        while ((message = client.getOutbox().poll(Duration.ZERO)) != null)
        {
            messages.add(message);
        }
        return messages;
    }

    private void createArena(int maxPlayers) throws InterruptedException
    {
        assertTrue(coordinator.createGame(alice, new ClientRequest.CreateGame("g1", "arena", maxPlayers)));
        drain(alice);
    }

    // ========== Create ==========

    @Test
    void createGame_confirmsToHost() throws Exception
    {
        boolean created = coordinator.createGame(alice, new ClientRequest.CreateGame("g1", "arena", 2));

        assertTrue(created);
        assertEquals(List.of(new ServerMessage.Info("Game created.")), drain(alice));
        Game game = registry.findGame("g1").orElseThrow();
        assertEquals("alice", game.host());
        assertEquals(1, game.playerCount());
    }

    @Test
    void createGame_nameTaken_sendsError() throws Exception
    {
        createArena(2);

        boolean created = coordinator.createGame(bob, new ClientRequest.CreateGame("g1", "islands", 4));

        assertFalse(created);
        assertEquals(List.of(new ServerMessage.Error("Game name already taken.")), drain(bob));
        assertEquals("arena", registry.findGame("g1").orElseThrow().map());
    }

    @Test
    void createGame_invalidPlayerCount_sendsError() throws Exception
    {
        assertFalse(coordinator.createGame(alice, new ClientRequest.CreateGame("g1", "arena", 0)));

        assertEquals(List.of(new ServerMessage.Error("Invalid number of players.")), drain(alice));
        assertTrue(registry.listGames().isEmpty());
    }

    @Test
    void createGame_alreadyInGame_sendsError() throws Exception
    {
        createArena(2);

        assertFalse(coordinator.createGame(alice, new ClientRequest.CreateGame("g2", "arena", 2)));

        assertEquals(List.of(new ServerMessage.Error("Already in a game.")), drain(alice));
        assertEquals(1, registry.listGames().size());
    }

    @Test
    void listGames_repliesWithOpenGames() throws Exception
    {
        createArena(2);

        coordinator.listGames(bob);

        List<ServerMessage> messages = drain(bob);
        assertEquals(1, messages.size());
        ServerMessage.GameList list = assertInstanceOf(ServerMessage.GameList.class, messages.get(0));
        assertEquals("g1", list.games().get(0).name());
    }

    // ========== Join ==========

    @Test
    void join_addsParticipantAndLink() throws Exception
    {
        createArena(2);

        assertTrue(coordinator.join(bob, "g1"));

        assertEquals(List.of(new ServerMessage.Info("Joined Game.")), drain(bob));
        Game game = registry.findGame("g1").orElseThrow();
        assertEquals(2, game.playerCount());
        Participant participant = game.participants().get("bob");
        assertFalse(participant.host());
        assertFalse(participant.ready());
        assertEquals("random", participant.civilization());
        assertEquals(0, participant.team());
        assertTrue(registry.findClient("bob").orElseThrow().isIn("g1"));
    }

    @Test
    void join_fullGame_rejectedWithoutMutation() throws Exception
    {
        createArena(2);
        coordinator.join(bob, "g1");
        Game before = registry.findGame("g1").orElseThrow();

        assertFalse(coordinator.join(carol, "g1"));

        assertEquals(List.of(new ServerMessage.Error("Game is full.")), drain(carol));
        assertEquals(before, registry.findGame("g1").orElseThrow());
        assertTrue(registry.findClient("carol").orElseThrow().getCurrentGame().isEmpty());
    }

    @Test
    void join_missingGame_rejected() throws Exception
    {
        assertFalse(coordinator.join(bob, "nowhere"));

        assertEquals(List.of(new ServerMessage.Error("Game does not exist.")), drain(bob));
    }

    @Test
    void join_whileInAnotherGame_rejected() throws Exception
    {
        createArena(4);
        coordinator.createGame(bob, new ClientRequest.CreateGame("g2", "islands", 4));
        drain(bob);

        assertFalse(coordinator.join(bob, "g1"));

        assertEquals(List.of(new ServerMessage.Error("Already in a game.")), drain(bob));
        assertEquals(1, registry.findGame("g1").orElseThrow().playerCount());
    }

    @Test
    void join_concurrent_neverExceedsCapacity() throws Exception
    {
        createArena(3);
        int joiners = 12;
        List<Client> clients = new ArrayList<>();
        for (int i = 0; i < joiners; i++)
        {
            clients.add(login("joiner" + i));
        }

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (Client client : clients)
        {
            results.add(executor.submit(() ->
            {
                start.await();
                return coordinator.join(client, "g1");
            }));
        }
        start.countDown();

        int joined = 0;
        for (Future<Boolean> result : results)
        {
            if (result.get(5, TimeUnit.SECONDS))
            {
                joined++;
            }
        }
        assertEquals(2, joined);
        assertEquals(3, registry.findGame("g1").orElseThrow().playerCount());
    }

    @Test
    void join_racingUnregister_keepsEveryParticipantRegistered() throws Exception
    {
        for (int i = 0; i < 200; i++)
        {
            Client host = login("host" + i);
            Client joiner = login("joiner" + i);
            String gameName = "race" + i;
            assertTrue(coordinator.createGame(host, new ClientRequest.CreateGame(gameName, "arena", 4)));

            CountDownLatch start = new CountDownLatch(1);
            Future<?> join = executor.submit(() ->
            {
                start.await();
                return coordinator.join(joiner, gameName);
            });
            Future<?> logout = executor.submit(() ->
            {
                start.await();
                return registry.unregisterClient(joiner.getName(), coordinator::leave);
            });
            start.countDown();
            awaitIgnoringUnregistered(join);
            logout.get(5, TimeUnit.SECONDS);

            assertConsistent();
            assertTrue(registry.findClient(joiner.getName()).isEmpty());
            assertEquals(1, registry.findGame(gameName).orElseThrow().playerCount());

            assertTrue(registry.unregisterClient(host.getName(), coordinator::leave));
            assertTrue(registry.findGame(gameName).isEmpty());
        }
    }

    @Test
    void createGame_racingUnregister_leavesNoOrphanedGame() throws Exception
    {
        for (int i = 0; i < 200; i++)
        {
            Client host = login("creator" + i);
            String gameName = "fresh" + i;

            CountDownLatch start = new CountDownLatch(1);
            Future<?> create = executor.submit(() ->
            {
                start.await();
                return coordinator.createGame(host, new ClientRequest.CreateGame(gameName, "arena", 4));
            });
            Future<?> logout = executor.submit(() ->
            {
                start.await();
                return registry.unregisterClient(host.getName(), coordinator::leave);
            });
            start.countDown();
            awaitIgnoringUnregistered(create);
            logout.get(5, TimeUnit.SECONDS);

            assertConsistent();
            assertTrue(registry.findClient(host.getName()).isEmpty());
            assertTrue(registry.findGame(gameName).isEmpty());
        }
    }

    // A request from a client that logged out concurrently fails as unregistered
    private static void awaitIgnoringUnregistered(Future<?> future) throws Exception
    {
        try
        {
            future.get(5, TimeUnit.SECONDS);
        }
        catch (ExecutionException e)
        {
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    private void assertConsistent()
    {
        RegistryState state = registry.snapshot();
        for (Game game : state.games().values())
        {
            for (String participant : game.participants().keySet())
            {
                Client client = state.clients().get(participant);
                assertNotNull(client, participant + " in " + game.name() + " is not registered");
                assertTrue(client.isIn(game.name()), participant + " is not linked to " + game.name());
            }
        }
        for (Client client : state.clients().values())
        {
            client.getCurrentGame().ifPresent(gameName ->
            {
                Game game = state.games().get(gameName);
                assertNotNull(game, client.getName() + " is linked to missing game " + gameName);
                assertTrue(game.hasParticipant(client.getName()));
            });
        }
    }

    // ========== Leave ==========

    @Test
    void leave_nonHost_removesParticipantAndLink() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        coordinator.leave(bob, "g1");

        assertEquals(List.of(new ServerMessage.Info("Left Game.")), drain(bob));
        Game game = registry.findGame("g1").orElseThrow();
        assertEquals(1, game.playerCount());
        assertEquals("alice", game.host());
        assertTrue(registry.findClient("bob").orElseThrow().getCurrentGame().isEmpty());
        assertTrue(drain(alice).isEmpty());
    }

    @Test
    void leave_host_closesGameAndNotifiesEveryone() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        coordinator.join(carol, "g1");
        drain(bob);
        drain(carol);

        coordinator.leave(alice, "g1");

        assertEquals(List.of(new ServerMessage.GameClosedByHost()), drain(alice));
        assertEquals(List.of(new ServerMessage.GameClosedByHost()), drain(bob));
        assertEquals(List.of(new ServerMessage.GameClosedByHost()), drain(carol));
        assertTrue(registry.findGame("g1").isEmpty());
        for (String name : List.of("alice", "bob", "carol"))
        {
            assertTrue(registry.findClient(name).orElseThrow().getCurrentGame().isEmpty(), name);
        }
    }

    @Test
    void leave_notParticipant_changesNothing() throws Exception
    {
        createArena(4);
        Game before = registry.findGame("g1").orElseThrow();

        coordinator.leave(bob, "g1");

        assertEquals(List.of(new ServerMessage.Error("Not in a game.")), drain(bob));
        assertEquals(before, registry.findGame("g1").orElseThrow());
    }

    @Test
    void scenario_fullGameThenHostLeaves() throws Exception
    {
        coordinator.createGame(alice, new ClientRequest.CreateGame("g1", "arena", 2));
        coordinator.join(bob, "g1");
        coordinator.join(carol, "g1");
        coordinator.leave(alice, "g1");

        assertEquals(List.of(new ServerMessage.Info("Game created."), new ServerMessage.GameClosedByHost()),
                drain(alice));
        assertEquals(List.of(new ServerMessage.Info("Joined Game."), new ServerMessage.GameClosedByHost()),
                drain(bob));
        assertEquals(List.of(new ServerMessage.Error("Game is full.")), drain(carol));

        coordinator.listGames(carol);
        assertEquals(List.of(new ServerMessage.GameList(List.of())), drain(carol));
    }

    // ========== Configure / Start ==========

    @Test
    void configureGame_host_updatesAndNotifiesParticipants() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertTrue(coordinator.configureGame(alice, new ClientRequest.ConfigureGame("islands", "deathmatch", 6)));

        Game game = registry.findGame("g1").orElseThrow();
        assertEquals("islands", game.map());
        assertEquals("deathmatch", game.mode());
        assertEquals(6, game.maxPlayers());
        assertEquals(List.of(new ServerMessage.Info("Game configured."), new ServerMessage.GameInfo(game)),
                drain(alice));
        assertEquals(List.of(new ServerMessage.GameInfo(game)), drain(bob));
    }

    @Test
    void configureGame_nonHost_rejected() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertFalse(coordinator.configureGame(bob, new ClientRequest.ConfigureGame("islands", "deathmatch", 6)));

        assertEquals(List.of(new ServerMessage.Error("Only the host can do that.")), drain(bob));
        assertEquals("arena", registry.findGame("g1").orElseThrow().map());
    }

    @Test
    void configureGame_capacityBelowPlayerCount_rejected() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");

        assertFalse(coordinator.configureGame(alice, new ClientRequest.ConfigureGame("arena", "default", 1)));

        assertEquals(List.of(new ServerMessage.Error("Invalid number of players.")), drain(alice));
        assertEquals(4, registry.findGame("g1").orElseThrow().maxPlayers());
    }

    @Test
    void startGame_sendsAddressesAndRemovesGame() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertTrue(coordinator.startGame(alice));

        ServerMessage.GameStarting expected = new ServerMessage.GameStarting(
                Map.of("alice", "alice.example.org", "bob", "bob.example.org"));
        assertEquals(List.of(expected), drain(alice));
        assertEquals(List.of(expected), drain(bob));
        assertTrue(registry.findGame("g1").isEmpty());
        assertTrue(registry.findClient("bob").orElseThrow().getCurrentGame().isEmpty());
    }

    @Test
    void startGame_nonHost_rejected() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertFalse(coordinator.startGame(bob));

        assertEquals(List.of(new ServerMessage.Error("Only the host can do that.")), drain(bob));
        assertTrue(registry.findGame("g1").isPresent());
    }

    @Test
    void startGame_notInGame_rejected() throws Exception
    {
        assertFalse(coordinator.startGame(carol));

        assertEquals(List.of(new ServerMessage.Error("Not in a game.")), drain(carol));
    }

    // ========== Players ==========

    @Test
    void updatePlayer_appliesSettingsAndNotifies() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertTrue(coordinator.updatePlayer(bob, new ClientRequest.UpdatePlayer("celts", 2, true)));

        Participant participant = registry.findGame("g1").orElseThrow().participants().get("bob");
        assertEquals("celts", participant.civilization());
        assertEquals(2, participant.team());
        assertTrue(participant.ready());
        assertEquals(1, drain(alice).size());
        assertEquals(1, drain(bob).size());
    }

    @Test
    void updatePlayer_notInGame_sendsError() throws Exception
    {
        assertFalse(coordinator.updatePlayer(carol, new ClientRequest.UpdatePlayer("celts", 2, true)));

        assertEquals(List.of(new ServerMessage.Error("Not in a game.")), drain(carol));
    }

    @Test
    void updatePlayerTransform_absentName_isSilentNoOp()
    {
        Game game = Game.open("g1", "alice", "arena", "default", 2)
                .withParticipant(Participant.joining("alice", true, "random", 0));

        assertSame(game, SessionCoordinator.updatePlayer("zed", "celts", 1, true, game));
    }

    // ========== Notifications ==========

    @Test
    void chat_reachesAllParticipants() throws Exception
    {
        createArena(4);
        coordinator.join(bob, "g1");
        drain(bob);

        assertTrue(coordinator.chat(bob, "gl hf"));

        ServerMessage.Chat expected = new ServerMessage.Chat("bob", "gl hf");
        assertEquals(List.of(expected), drain(alice));
        assertEquals(List.of(expected), drain(bob));
        assertTrue(drain(carol).isEmpty());
    }

    @Test
    void broadcast_closedGame_reachesNobody()
    {
        assertEquals(0, coordinator.broadcast("gone", new ServerMessage.Info("hello")));
    }

    @Test
    void broadcast_participantWithoutClient_throws() throws Exception
    {
        createArena(4);
        registry.atomically(state -> Transaction.commit(
                state.withGame(state.games().get("g1").withParticipant(Participant.joining("ghost", false, "random", 0))),
                null));

        assertThrows(IllegalStateException.class,
                () -> coordinator.broadcast("g1", new ServerMessage.Info("hello")));
    }

    @Test
    void addressesOf_filtersToKnownPlayersInOrder()
    {
        Map<String, String> addresses = SessionCoordinator.addressesOf(
                registry.snapshot().clients(), List.of("carol", "ghost", "alice"));

        assertEquals(List.of("carol", "alice"), List.copyOf(addresses.keySet()));
        assertEquals("carol.example.org", addresses.get("carol"));
    }
}

package org.abstractica.lobby.impl.registry;

import org.abstractica.lobby.ServerMessage;
import org.abstractica.lobby.impl.delivery.Outbox;

import java.util.Objects;
import java.util.Optional;

/**
 * Registry entry for one logged-in client.
 *
 * <p>Immutable: the current-game link is changed by committing a copy to
 * the registry. Copies share the same outbox, so a message sent through a
 * stale copy still reaches the client.</p>
 */
public final class Client
{
    private final String name;
    private final String address;
    private final Object handle;
    private final Outbox outbox;
    private final String currentGame;

    /**
     * Creates a client that is not in any game.
     *
     * @param name    the player name
     * @param address the network address
     * @param handle  opaque connection handle owned by the network layer
     * @param outbox  the client's outbound queue
     */
    public Client(String name, String address, Object handle, Outbox outbox)
    {
        this(name, address, handle, outbox, null);
    }

    private Client(String name, String address, Object handle, Outbox outbox, String currentGame)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.address = Objects.requireNonNull(address, "address");
        this.handle = handle;
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.currentGame = currentGame;
    }

    public String getName()
    {
        return name;
    }

    public String getAddress()
    {
        return address;
    }

    public Object getHandle()
    {
        return handle;
    }

    public Outbox getOutbox()
    {
        return outbox;
    }

    /**
     * Returns the game this client has joined.
     *
     * @return game name, or empty if none
     */
    public Optional<String> getCurrentGame()
    {
        return Optional.ofNullable(currentGame);
    }

    /**
     * Returns true if the current-game link points at the given game.
     *
     * @param gameName the game name
     * @return true if linked to it
     */
    public boolean isIn(String gameName)
    {
        return gameName.equals(currentGame);
    }

    /**
     * Returns a copy linked to the given game.
     *
     * @param gameName the joined game
     * @return updated client
     */
    public Client withCurrentGame(String gameName)
    {
        Objects.requireNonNull(gameName, "gameName");
        return new Client(name, address, handle, outbox, gameName);
    }

    /**
     * Returns a copy without a current game.
     *
     * @return updated client
     */
    public Client withoutCurrentGame()
    {
        return currentGame == null ? this : new Client(name, address, handle, outbox, null);
    }

    /**
     * Enqueues a message for this client. Never blocks.
     *
     * @param message the message
     * @return false if the outbox was full and the message dropped
     */
    public boolean send(ServerMessage message)
    {
        return outbox.offer(message);
    }

    @Override
    public String toString()
    {
        return "Client[" + name + "@" + address + (currentGame != null ? " in " + currentGame : "") + "]";
    }
}

package org.abstractica.lobby;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An open game lobby.
 *
 * <p>Games are immutable values. Every change produces a new instance that
 * the caller commits to the registry; the {@code with*} methods are pure
 * transforms and never touch shared state.</p>
 *
 * @param name         unique name among open games
 * @param map          the selected map
 * @param mode         the selected game mode
 * @param maxPlayers   the capacity of the game
 * @param host         the name of the hosting player
 * @param participants participants keyed by player name, in join order
 */
public record Game(
        String name,
        String map,
        String mode,
        int maxPlayers,
        String host,
        Map<String, Participant> participants
)
{
    public Game
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(participants, "participants");
        if (maxPlayers < 1)
        {
            throw new IllegalArgumentException("maxPlayers must be positive: " + maxPlayers);
        }
        participants = Collections.unmodifiableMap(new LinkedHashMap<>(participants));
    }

    /**
     * Creates a game without participants.
     *
     * <p>The host still has to be added with {@link #withParticipant}.</p>
     *
     * @param name       the game name
     * @param host       the hosting player
     * @param map        the map name
     * @param mode       the game mode
     * @param maxPlayers the capacity
     * @return the new game
     */
    public static Game open(String name, String host, String map, String mode, int maxPlayers)
    {
        return new Game(name, map, mode, maxPlayers, host, Map.of());
    }

    /**
     * Returns the number of participants.
     */
    public int playerCount()
    {
        return participants.size();
    }

    /**
     * Returns true when no further player can join.
     */
    public boolean isFull()
    {
        return participants.size() >= maxPlayers;
    }

    /**
     * Returns true if the named player is a participant.
     *
     * @param playerName the player name
     * @return true if present
     */
    public boolean hasParticipant(String playerName)
    {
        return participants.containsKey(playerName);
    }

    /**
     * Returns true if the named player hosts this game.
     *
     * @param playerName the player name
     * @return true if host
     */
    public boolean isHost(String playerName)
    {
        return host.equals(playerName);
    }

    /**
     * Replaces map, mode and capacity.
     *
     * @param newMap        the new map
     * @param newMode       the new mode
     * @param newMaxPlayers the new capacity
     * @return updated game
     */
    public Game withSettings(String newMap, String newMode, int newMaxPlayers)
    {
        return new Game(name, newMap, newMode, newMaxPlayers, host, participants);
    }

    /**
     * Inserts a participant, overwriting any entry with the same name.
     *
     * @param participant the participant to add
     * @return updated game
     */
    public Game withParticipant(Participant participant)
    {
        Objects.requireNonNull(participant, "participant");
        Map<String, Participant> updated = new LinkedHashMap<>(participants);
        updated.put(participant.name(), participant);
        return new Game(name, map, mode, maxPlayers, host, updated);
    }

    /**
     * Removes a participant.
     *
     * @param playerName the player to remove
     * @return updated game, or this game if the player was not present
     */
    public Game withoutParticipant(String playerName)
    {
        if (!participants.containsKey(playerName))
        {
            return this;
        }
        Map<String, Participant> updated = new LinkedHashMap<>(participants);
        updated.remove(playerName);
        return new Game(name, map, mode, maxPlayers, host, updated);
    }

    /**
     * Replaces a participant's civilization, team and ready flag.
     *
     * <p>A name that is not a participant leaves the game unchanged.</p>
     *
     * @param playerName   the player to update
     * @param civilization the new civilization
     * @param team         the new team
     * @param ready        the new ready flag
     * @return updated game, or this game if the player was not present
     */
    public Game withPlayerConfig(String playerName, String civilization, int team, boolean ready)
    {
        Participant current = participants.get(playerName);
        if (current == null)
        {
            return this;
        }
        return withParticipant(current.withConfig(civilization, team, ready));
    }
}

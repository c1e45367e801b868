package org.abstractica.lobby;

import java.util.Objects;

/**
 * A player's per-game state inside an open {@link Game}.
 *
 * @param name         the player name (login identity)
 * @param civilization the chosen civilization
 * @param team         the team number
 * @param ready        true once the player has signalled ready
 * @param host         true for the player who created the game
 */
public record Participant(String name, String civilization, int team, boolean ready, boolean host)
{
    public Participant
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(civilization, "civilization");
    }

    /**
     * Creates a participant that is not yet ready.
     *
     * @param name         the player name
     * @param host         true if the player hosts the game
     * @param civilization the initial civilization
     * @param team         the initial team
     * @return the new participant
     */
    public static Participant joining(String name, boolean host, String civilization, int team)
    {
        return new Participant(name, civilization, team, false, host);
    }

    /**
     * Returns a copy with the player-editable fields replaced.
     *
     * <p>The name and host flag are kept.</p>
     *
     * @param civilization the new civilization
     * @param team         the new team
     * @param ready        the new ready flag
     * @return updated participant
     */
    public Participant withConfig(String civilization, int team, boolean ready)
    {
        return new Participant(name, civilization, team, ready, host);
    }
}

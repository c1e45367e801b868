package org.abstractica.lobby.impl.registry;

import org.abstractica.lobby.Participant;

import java.util.Objects;

/**
 * Initial values for new games and participants.
 *
 * @param mode         mode of a newly created game
 * @param civilization civilization of a new participant
 * @param team         team of a new participant
 */
public record LobbyDefaults(String mode, String civilization, int team)
{
    /**
     * Defaults used when none are configured.
     */
    public static final LobbyDefaults STANDARD = new LobbyDefaults("default", "random", 0);

    public LobbyDefaults
    {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(civilization, "civilization");
    }

    /**
     * Creates a participant with default settings.
     *
     * @param playerName the player
     * @param host       true for the game's host
     * @return the participant, not ready
     */
    public Participant newParticipant(String playerName, boolean host)
    {
        return Participant.joining(playerName, host, civilization, team);
    }
}

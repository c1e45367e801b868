package org.abstractica.lobby.impl.session;

import org.abstractica.lobby.Lobby;
import org.abstractica.lobby.LobbyFactory;
import org.abstractica.lobby.impl.delivery.Outbox;
import org.abstractica.lobby.impl.registry.LobbyDefaults;
import org.abstractica.lobby.impl.registry.Registry;

import java.util.Objects;

/**
 * Default implementation of LobbyFactory.
 *
 * <p>Creates DefaultLobby instances using a builder pattern.</p>
 */
public class DefaultLobbyFactory implements LobbyFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int outboxCapacity = Outbox.DEFAULT_CAPACITY;
        private String defaultCivilization = LobbyDefaults.STANDARD.civilization();
        private int defaultTeam = LobbyDefaults.STANDARD.team();
        private String defaultMode = LobbyDefaults.STANDARD.mode();

        @Override
        public Builder outboxCapacity(int capacity)
        {
            if (capacity <= 0)
            {
                throw new IllegalArgumentException("outboxCapacity must be positive: " + capacity);
            }
            this.outboxCapacity = capacity;
            return this;
        }

        @Override
        public Builder defaultCivilization(String civilization)
        {
            Objects.requireNonNull(civilization, "civilization");
            if (civilization.isBlank())
            {
                throw new IllegalArgumentException("Default civilization must not be blank");
            }
            this.defaultCivilization = civilization;
            return this;
        }

        @Override
        public Builder defaultTeam(int team)
        {
            if (team < 0)
            {
                throw new IllegalArgumentException("defaultTeam must be >= 0: " + team);
            }
            this.defaultTeam = team;
            return this;
        }

        @Override
        public Builder defaultMode(String mode)
        {
            Objects.requireNonNull(mode, "mode");
            if (mode.isBlank())
            {
                throw new IllegalArgumentException("Default mode must not be blank");
            }
            this.defaultMode = mode;
            return this;
        }

        @Override
        public Lobby build()
        {
            LobbyDefaults defaults = new LobbyDefaults(defaultMode, defaultCivilization, defaultTeam);
            return new DefaultLobby(new Registry(defaults), outboxCapacity);
        }
    }
}

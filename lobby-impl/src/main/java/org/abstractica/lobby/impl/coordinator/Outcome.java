package org.abstractica.lobby.impl.coordinator;

import org.abstractica.lobby.Game;
import org.abstractica.lobby.impl.registry.Client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a coordinator transaction decided, plus the recipients it resolved
 * from the same registry state.
 *
 * @param result    the decision
 * @param game      the game as committed, or as it was before removal; null on rejection
 * @param members   participants to notify
 * @param addresses player-name to address map for a started game, empty otherwise
 */
record Outcome(ActionResult result, Game game, List<Client> members, Map<String, String> addresses)
{
    Outcome
    {
        Objects.requireNonNull(result, "result");
        members = List.copyOf(members);
        addresses = Collections.unmodifiableMap(new LinkedHashMap<>(addresses));
    }

    static Outcome rejected(ActionResult result)
    {
        return new Outcome(result, null, List.of(), Map.of());
    }

    static Outcome of(ActionResult result, Game game, List<Client> members)
    {
        return new Outcome(result, game, members, Map.of());
    }
}

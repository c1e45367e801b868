package org.abstractica.lobby.impl.registry;

import java.util.Objects;

/**
 * A unit of work over the registry state.
 *
 * <p>A transaction reads the state it is given and returns the state to
 * commit together with a result. It may be run several times when
 * concurrent writers conflict, so it must not have side effects: sending
 * messages or logging belong after {@link Registry#atomically} returns.</p>
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Transaction<T>
{
    /**
     * Computes the next state.
     *
     * @param state the current state
     * @return the state to commit and the result
     */
    Result<T> apply(RegistryState state);

    /**
     * Outcome of one transaction run.
     *
     * @param state the state to commit; the input state commits nothing
     * @param value the result handed back to the caller
     * @param <T>   the result type
     */
    record Result<T>(RegistryState state, T value)
    {
        public Result
        {
            Objects.requireNonNull(state, "state");
        }
    }

    /**
     * Commits a new state.
     *
     * @param next  the state to commit
     * @param value the result
     * @param <T>   the result type
     * @return the transaction result
     */
    static <T> Result<T> commit(RegistryState next, T value)
    {
        return new Result<>(next, value);
    }

    /**
     * Leaves the state unchanged.
     *
     * @param current the state the transaction was given
     * @param value   the result
     * @param <T>     the result type
     * @return the transaction result
     */
    static <T> Result<T> abort(RegistryState current, T value)
    {
        return new Result<>(current, value);
    }
}

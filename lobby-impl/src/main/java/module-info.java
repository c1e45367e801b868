/**
 * Game lobby implementation module.
 *
 * <p>Provides the default implementation of the lobby API.</p>
 */
module lobby.impl
{
    requires lobby.api;
    requires org.slf4j;

    // Export factory implementation for external use
    exports org.abstractica.lobby.impl.session;

    // Export the registry and coordinator for embedding without the session layer
    exports org.abstractica.lobby.impl.registry;
    exports org.abstractica.lobby.impl.coordinator;
    exports org.abstractica.lobby.impl.delivery;
}

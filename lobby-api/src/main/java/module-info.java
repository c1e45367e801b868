/**
 * Game lobby API module.
 *
 * <p>Provides the lobby data model, the request and message protocol, and
 * the interfaces a network layer uses to drive client sessions.</p>
 */
module lobby.api
{
    exports org.abstractica.lobby;
    exports org.abstractica.lobby.handlers;
}

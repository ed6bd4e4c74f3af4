package in.sessiongate.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import in.sessiongate.domain.session.ConnectionState;

/**
 * Connection state transition reported by a {@link ConnectionSupervisor}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionUpdate(
    ConnectionState state,
    Integer statusCode,
    String reason,
    boolean loggedOut,
    String accountJid,
    Long reconnectInMs
) {
    public static ConnectionUpdate of(ConnectionState state) {
        return new ConnectionUpdate(state, null, null, false, null, null);
    }
}

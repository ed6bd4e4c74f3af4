package in.sessiongate.socket;

import java.nio.file.Path;

/**
 * Creates one socket per connection generation of a session.
 */
@FunctionalInterface
public interface SessionSocketFactory {

    /**
     * @param credentialsDir directory holding the session's platform credentials
     */
    SessionSocket create(String sessionId, Path credentialsDir, SessionSocketListener listener);
}

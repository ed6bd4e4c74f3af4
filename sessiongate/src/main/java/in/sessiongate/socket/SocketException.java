package in.sessiongate.socket;

/**
 * Failure of a session socket command or connection.
 */
public class SocketException extends RuntimeException {

    private final String sessionId;

    public SocketException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public SocketException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

package in.sessiongate.socket;

import in.sessiongate.domain.message.OutboundMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to one chat-platform connection of a session.
 *
 * The socket owns the platform handshake and its credentials. Connection,
 * QR, message and status events flow to the {@link SessionSocketListener}
 * passed to the factory; commands return futures completed by the platform.
 */
public interface SessionSocket {

    String sessionId();

    /**
     * Begin connecting. Events start flowing to the listener.
     */
    void open();

    /**
     * Send a message.
     *
     * @return future completing with the platform message id
     */
    CompletableFuture<String> send(String jid, OutboundMessage message);

    /**
     * Check whether a JID is registered on the platform.
     */
    CompletableFuture<Boolean> exists(String jid);

    /**
     * Request a pairing code for phone-number login instead of a QR scan.
     */
    CompletableFuture<String> requestPairingCode(String phoneNumber);

    /**
     * Log the account out. The socket closes with {@code loggedOut = true}.
     */
    CompletableFuture<Void> logout();

    /**
     * Close the connection without logging out. No further events are emitted.
     */
    void close();
}

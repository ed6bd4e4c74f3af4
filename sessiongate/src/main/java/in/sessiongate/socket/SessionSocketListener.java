package in.sessiongate.socket;

import com.fasterxml.jackson.databind.JsonNode;
import in.sessiongate.domain.message.MessageReceipt;

/**
 * Callbacks emitted by a {@link SessionSocket}. Invoked from socket threads.
 */
public interface SessionSocketListener {

    void onQr(String challenge);

    void onOpen(String accountJid);

    /**
     * @param statusCode platform disconnect code, 0 when unknown
     * @param loggedOut  true when the account was logged out and credentials are void
     */
    void onClose(int statusCode, String reason, boolean loggedOut);

    void onInbound(JsonNode message);

    /**
     * @param rawStatus status as reported by the platform (number, name or object)
     */
    void onStatus(String messageId, JsonNode rawStatus);

    void onReceipt(String messageId, MessageReceipt receipt);
}

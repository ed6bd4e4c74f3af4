package in.sessiongate.domain.message;

/**
 * Result of one dispatched send.
 *
 * @param ack first delivery status observed while waiting, null when not awaited or timed out
 */
public record SentMessage(
    String messageId,
    String jid,
    MessageKind kind,
    long timestamp,
    Integer ack
) {
    public SentMessage withAck(Integer status) {
        return new SentMessage(messageId, jid, kind, timestamp, status);
    }
}

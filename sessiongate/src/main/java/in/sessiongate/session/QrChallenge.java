package in.sessiongate.session;

/**
 * Current QR challenge of a session awaiting a scan.
 *
 * @param version   strictly increasing per session, starting at 1
 * @param expiresAt epoch millis after which the challenge is stale
 * @param attempt   pairing attempts since the last successful open
 */
public record QrChallenge(String challenge, int version, long expiresAt, int attempt) {
}

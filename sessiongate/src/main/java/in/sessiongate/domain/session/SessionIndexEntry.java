package in.sessiongate.domain.session;

/**
 * One row of the persisted session index ({@code instances.json}).
 */
public record SessionIndexEntry(
    String id,
    String name,
    String dir,
    String phoneNumber,
    SessionMetadata metadata
) {
}

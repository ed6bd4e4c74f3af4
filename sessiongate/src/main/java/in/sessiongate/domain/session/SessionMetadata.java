package in.sessiongate.domain.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable operator-facing metadata of a session.
 */
public record SessionMetadata(
    String note,
    Instant createdAt,
    Instant updatedAt,
    List<NoteRevision> revisions
) {
    public static final int MAX_REVISIONS = 20;

    public SessionMetadata {
        note = note == null ? "" : note;
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
    }

    public static SessionMetadata created(String note, Instant now) {
        return new SessionMetadata(note, now, now, List.of());
    }

    /**
     * Touch {@code updatedAt} without changing the note.
     */
    public SessionMetadata touched(Instant now) {
        return new SessionMetadata(note, createdAt, now, revisions);
    }

    /**
     * Replace the note, keeping at most {@link #MAX_REVISIONS} revisions (newest last).
     */
    public SessionMetadata withNote(String newNote, Instant now) {
        if (newNote.equals(note)) {
            return touched(now);
        }
        List<NoteRevision> next = new ArrayList<>(revisions);
        next.add(NoteRevision.between(note, newNote, now));
        while (next.size() > MAX_REVISIONS) {
            next.remove(0);
        }
        return new SessionMetadata(newNote, createdAt, now, next);
    }
}

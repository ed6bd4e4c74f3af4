package in.sessiongate.domain.session;

import java.time.Instant;

/**
 * One historical value of a session note.
 *
 * @param note      note text after the change
 * @param updatedAt when the change was made
 * @param added     characters present in the new note but not the old one
 * @param removed   characters present in the old note but not the new one
 */
public record NoteRevision(String note, Instant updatedAt, int added, int removed) {

    /**
     * Build a revision with a common-prefix/suffix diff summary.
     */
    public static NoteRevision between(String previous, String next, Instant at) {
        String a = previous == null ? "" : previous;
        String b = next == null ? "" : next;

        int prefix = 0;
        int max = Math.min(a.length(), b.length());
        while (prefix < max && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++;
        }

        int suffix = 0;
        while (suffix < max - prefix
            && a.charAt(a.length() - 1 - suffix) == b.charAt(b.length() - 1 - suffix)) {
            suffix++;
        }

        int removed = a.length() - prefix - suffix;
        int added = b.length() - prefix - suffix;
        return new NoteRevision(b, at, added, removed);
    }
}

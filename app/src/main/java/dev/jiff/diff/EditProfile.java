package dev.jiff.diff;

/**
 * Counts of the non-equal tokens in a character diff.
 *
 * <p>{@code hints} are advisory markers some matchers emit next to real edits; they count as
 * disruption but not as edit operations.
 */
public record EditProfile(int insertions, int deletions, int hints) {

    public EditProfile {
        if (insertions < 0 || deletions < 0 || hints < 0) {
            throw new IllegalArgumentException("Edit counts must not be negative");
        }
    }

    /** Every emitted token that is not an equal token. */
    public int disruption() {
        return insertions + deletions + hints;
    }

    /** Emitted tokens that are strictly insertions or deletions. */
    public int operations() {
        return insertions + deletions;
    }

    public boolean isIdentical() {
        return disruption() == 0;
    }
}

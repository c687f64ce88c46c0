package dev.jiff.diff;

import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.Sequence;

/**
 * Adapts a list of string tokens (lines or characters) to JGit's {@link Sequence}.
 */
final class TokenSequence extends Sequence {

    private final List<String> tokens;

    TokenSequence(List<String> tokens) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    String get(int index) {
        return tokens.get(index);
    }

    @Override
    public int size() {
        return tokens.size();
    }
}

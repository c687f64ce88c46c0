package dev.jiff.diff;

import org.eclipse.jgit.diff.SequenceComparator;

/**
 * Exact string equality over {@link TokenSequence} elements.
 */
final class TokenSequenceComparator extends SequenceComparator<TokenSequence> {

    static final TokenSequenceComparator INSTANCE = new TokenSequenceComparator();

    private TokenSequenceComparator() {
    }

    @Override
    public boolean equals(TokenSequence a, int ai, TokenSequence b, int bi) {
        return a.get(ai).equals(b.get(bi));
    }

    @Override
    public int hash(TokenSequence seq, int ptr) {
        return seq.get(ptr).hashCode();
    }
}

package dev.jiff.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces line and character level diff chunks on top of a {@link SequenceMatcher}.
 */
public class DiffCalculator {

    private final SequenceMatcher matcher;

    public DiffCalculator() {
        this(new HistogramSequenceMatcher());
    }

    public DiffCalculator(SequenceMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public List<DiffChunk> calculateLineDiff(String left, String right) {
        return calculate(Tokenizer.lines(left), Tokenizer.lines(right));
    }

    public List<DiffChunk> calculateCharDiff(String left, String right) {
        return calculate(Tokenizer.characters(left), Tokenizer.characters(right));
    }

    public List<DiffChunk> calculate(List<String> leftTokens, List<String> rightTokens) {
        List<DiffChunk> chunks = new ArrayList<>();
        for (Opcode opcode : matcher.match(leftTokens, rightTokens)) {
            List<String> before = leftTokens.subList(opcode.leftStart(), opcode.leftEnd());
            List<String> after = rightTokens.subList(opcode.rightStart(), opcode.rightEnd());
            DiffType type = DiffType.of(opcode.kind());
            switch (type) {
                case ADD -> chunks.add(new DiffChunk(type, List.of(), after));
                case REMOVE -> chunks.add(new DiffChunk(type, before, List.of()));
                default -> chunks.add(new DiffChunk(type, before, after));
            }
        }
        return chunks;
    }

    /**
     * Summarises the character diff between two lines. A replaced span counts each of its removed
     * and added characters, the way a character-per-row diff listing would print them.
     */
    public EditProfile profile(String before, String after) {
        List<String> left = Tokenizer.characters(before);
        List<String> right = Tokenizer.characters(after);
        int insertions = 0;
        int deletions = 0;
        for (Opcode opcode : matcher.match(left, right)) {
            if (opcode.kind() == OpcodeKind.EQUAL) {
                continue;
            }
            deletions += opcode.leftLength();
            insertions += opcode.rightLength();
        }
        return new EditProfile(insertions, deletions, 0);
    }
}

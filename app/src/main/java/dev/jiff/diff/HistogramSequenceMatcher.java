package dev.jiff.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;

/**
 * {@link SequenceMatcher} backed by JGit's histogram diff.
 *
 * <p>JGit only reports the edited regions, so the unchanged stretches between them are emitted as
 * {@link OpcodeKind#EQUAL} opcodes to complete the partition.
 */
public class HistogramSequenceMatcher implements SequenceMatcher {

    private final DiffAlgorithm algorithm;

    public HistogramSequenceMatcher() {
        this(DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM));
    }

    public HistogramSequenceMatcher(DiffAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    @Override
    public List<Opcode> match(List<String> left, List<String> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        EditList edits = algorithm.diff(TokenSequenceComparator.INSTANCE,
                new TokenSequence(left), new TokenSequence(right));

        List<Opcode> opcodes = new ArrayList<>(edits.size() * 2 + 1);
        int lastA = 0;
        int lastB = 0;
        for (Edit edit : edits) {
            if (edit.getBeginA() > lastA) {
                opcodes.add(new Opcode(OpcodeKind.EQUAL, lastA, edit.getBeginA(), lastB, edit.getBeginB()));
            }
            OpcodeKind kind = toKind(edit.getType());
            if (kind != null) {
                opcodes.add(new Opcode(kind, edit.getBeginA(), edit.getEndA(), edit.getBeginB(), edit.getEndB()));
            }
            lastA = edit.getEndA();
            lastB = edit.getEndB();
        }
        if (lastA < left.size()) {
            opcodes.add(new Opcode(OpcodeKind.EQUAL, lastA, left.size(), lastB, right.size()));
        }
        return opcodes;
    }

    private static OpcodeKind toKind(Edit.Type type) {
        return switch (type) {
            case INSERT -> OpcodeKind.INSERT;
            case DELETE -> OpcodeKind.DELETE;
            case REPLACE -> OpcodeKind.REPLACE;
            case EMPTY -> null;
        };
    }
}

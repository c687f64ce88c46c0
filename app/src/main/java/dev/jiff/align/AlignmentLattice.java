package dev.jiff.align;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The move graph over consumption states (i, j), with i before-lines and j after-lines consumed.
 *
 * <p>Every node is addressed by the state it lands on and its {@link MoveKind}. A delete lands on
 * (i + 1, j), an insert on (i, j + 1) and a substitution on (i + 1, j + 1); each edge therefore
 * strictly increases i, j or both, so visiting states in row-major order is a topological order.
 * The origin (0, 0) is never materialized.
 */
public final class AlignmentLattice {

    /** Order in which nodes sharing a landing state are swept as relaxation sources. */
    static final List<MoveKind> SWEEP_ORDER = List.of(MoveKind.SUBSTITUTE, MoveKind.DELETE, MoveKind.INSERT);

    private final int beforeCount;
    private final int afterCount;
    private final MoveNode[][] deletes;
    private final MoveNode[][] inserts;
    private final MoveNode[][] substitutes;

    private AlignmentLattice(int beforeCount, int afterCount) {
        this.beforeCount = beforeCount;
        this.afterCount = afterCount;
        this.deletes = new MoveNode[beforeCount + 1][afterCount + 1];
        this.inserts = new MoveNode[beforeCount + 1][afterCount + 1];
        this.substitutes = new MoveNode[beforeCount + 1][afterCount + 1];
    }

    /**
     * Builds the lattice for one replace block, pricing every move with {@code costModel}.
     *
     * @throws IllegalArgumentException if both sides are empty
     */
    public static AlignmentLattice build(List<String> before, List<String> after, LineCostModel costModel) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(costModel, "costModel");
        if (before.isEmpty() && after.isEmpty()) {
            throw new IllegalArgumentException("Cannot align an empty replace block");
        }

        int m = before.size();
        int n = after.size();
        AlignmentLattice lattice = new AlignmentLattice(m, n);

        long[] beforeGaps = new long[m];
        for (int i = 0; i < m; i++) {
            beforeGaps[i] = costModel.gapCost(before.get(i));
        }
        long[] afterGaps = new long[n];
        for (int j = 0; j < n; j++) {
            afterGaps[j] = costModel.gapCost(after.get(j));
        }

        for (int i = 0; i <= m; i++) {
            for (int j = 0; j <= n; j++) {
                if (i > 0) {
                    lattice.deletes[i][j] = new MoveNode(MoveKind.DELETE, i, j, beforeGaps[i - 1]);
                }
                if (j > 0) {
                    lattice.inserts[i][j] = new MoveNode(MoveKind.INSERT, i, j, afterGaps[j - 1]);
                }
                if (i > 0 && j > 0) {
                    long cost = costModel.substitutionCost(before.get(i - 1), after.get(j - 1));
                    lattice.substitutes[i][j] = new MoveNode(MoveKind.SUBSTITUTE, i, j, cost);
                }
            }
        }
        return lattice;
    }

    public int beforeCount() {
        return beforeCount;
    }

    public int afterCount() {
        return afterCount;
    }

    /**
     * The node of {@code kind} landing on ({@code beforeConsumed}, {@code afterConsumed}), or
     * {@code null} when no such move exists.
     */
    public MoveNode node(MoveKind kind, int beforeConsumed, int afterConsumed) {
        if (beforeConsumed < 0 || beforeConsumed > beforeCount || afterConsumed < 0 || afterConsumed > afterCount) {
            return null;
        }
        return switch (kind) {
            case DELETE -> deletes[beforeConsumed][afterConsumed];
            case INSERT -> inserts[beforeConsumed][afterConsumed];
            case SUBSTITUTE -> substitutes[beforeConsumed][afterConsumed];
        };
    }

    /** Moves leaving consumption state ({@code beforeConsumed}, {@code afterConsumed}). */
    List<MoveNode> successorsOf(int beforeConsumed, int afterConsumed) {
        List<MoveNode> successors = new ArrayList<>(3);
        for (MoveKind kind : MoveKind.values()) {
            MoveNode next = node(kind, beforeConsumed + kind.beforeStep(), afterConsumed + kind.afterStep());
            if (next != null) {
                successors.add(next);
            }
        }
        return successors;
    }

    List<MoveNode> successorsOf(MoveNode node) {
        return successorsOf(node.beforeConsumed(), node.afterConsumed());
    }

    /** The move of {@code kind} that completes consumption of both sides, or {@code null}. */
    public MoveNode terminal(MoveKind kind) {
        return node(kind, beforeCount, afterCount);
    }

    public int nodeCount() {
        return beforeCount * (afterCount + 1) + (beforeCount + 1) * afterCount + beforeCount * afterCount;
    }

    /**
     * Renders one row per before-state with the weights of the moves landing there, plus each
     * node's relaxation state when {@code verbose} is set.
     */
    public String describe(boolean verbose) {
        StringBuilder builder = new StringBuilder();
        builder.append("Alignment lattice (")
                .append(beforeCount).append(" x ").append(afterCount)
                .append(", ").append(nodeCount()).append(" moves):")
                .append(System.lineSeparator());
        for (int i = 0; i <= beforeCount; i++) {
            for (int j = 0; j <= afterCount; j++) {
                builder.append(" [");
                for (MoveKind kind : SWEEP_ORDER) {
                    MoveNode node = node(kind, i, j);
                    builder.append(node == null ? "    -" : String.format("%5d", node.weight()));
                }
                builder.append(']');
            }
            builder.append(System.lineSeparator());
        }
        if (verbose) {
            for (int i = 0; i <= beforeCount; i++) {
                for (int j = 0; j <= afterCount; j++) {
                    for (MoveKind kind : SWEEP_ORDER) {
                        MoveNode node = node(kind, i, j);
                        if (node != null) {
                            builder.append("  ").append(node.describe(true)).append(System.lineSeparator());
                        }
                    }
                }
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return describe(false);
    }
}

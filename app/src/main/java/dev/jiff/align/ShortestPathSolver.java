package dev.jiff.align;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-source shortest path over an {@link AlignmentLattice}.
 *
 * <p>The lattice is a DAG whose row-major state order is topological, so one forward sweep that
 * relaxes each node's outgoing edges settles every distance, O(m * n) overall.
 */
public class ShortestPathSolver {

    /**
     * Relaxes every edge of {@code lattice} and returns the cheapest complete path, ordered from the
     * first move after the origin to the terminal move.
     */
    public List<MoveNode> solve(AlignmentLattice lattice) {
        Objects.requireNonNull(lattice, "lattice");

        for (MoveNode first : lattice.successorsOf(0, 0)) {
            first.relax(null, 0L);
        }

        int m = lattice.beforeCount();
        int n = lattice.afterCount();
        for (int i = 0; i <= m; i++) {
            for (int j = 0; j <= n; j++) {
                for (MoveKind kind : AlignmentLattice.SWEEP_ORDER) {
                    MoveNode source = lattice.node(kind, i, j);
                    if (source == null) {
                        continue;
                    }
                    if (!source.isReached()) {
                        throw new IllegalStateException("Sweep reached " + source + " before any predecessor");
                    }
                    for (MoveNode target : lattice.successorsOf(source)) {
                        target.relax(source, source.distance());
                    }
                }
            }
        }

        return walkBack(selectTerminal(lattice));
    }

    /**
     * Picks the terminal move. A final delete wins only when strictly cheaper than both others, then
     * a final insert only when strictly cheaper than a final substitution. Every remaining tie goes
     * to the substitution.
     */
    MoveNode selectTerminal(AlignmentLattice lattice) {
        MoveNode deleteLast = lattice.terminal(MoveKind.DELETE);
        MoveNode insertLast = lattice.terminal(MoveKind.INSERT);
        MoveNode substituteLast = lattice.terminal(MoveKind.SUBSTITUTE);

        long deleteDistance = distanceOf(deleteLast);
        long insertDistance = distanceOf(insertLast);
        long substituteDistance = distanceOf(substituteLast);

        MoveNode chosen;
        if (deleteDistance < insertDistance && deleteDistance < substituteDistance) {
            chosen = deleteLast;
        } else if (insertDistance < substituteDistance) {
            chosen = insertLast;
        } else {
            chosen = substituteLast;
        }
        if (chosen == null) {
            throw new IllegalStateException("Alignment lattice has no terminal move");
        }
        return chosen;
    }

    private static long distanceOf(MoveNode node) {
        return node == null ? MoveNode.UNREACHED : node.distance();
    }

    private static List<MoveNode> walkBack(MoveNode terminal) {
        List<MoveNode> path = new ArrayList<>(terminal.beforeConsumed() + terminal.afterConsumed());
        for (MoveNode current = terminal; current != null; current = current.predecessor()) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}

package dev.jiff.align;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs up the before and after lines of one replace block so that character highlighting inside
 * the block lines up with the most similar counterpart.
 *
 * <p>Instances hold no per-call state: every call builds, solves and drops its own lattice, so one
 * aligner may serve several threads.
 */
public class LineAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineAligner.class);

    private final LineCostModel costModel;
    private final ShortestPathSolver solver;
    private final PathDecoder decoder;
    private final boolean verbose;

    public LineAligner() {
        this(new EditProfileCostModel(), false);
    }

    public LineAligner(LineCostModel costModel, boolean verbose) {
        this(costModel, new ShortestPathSolver(), new PathDecoder(), verbose);
    }

    LineAligner(LineCostModel costModel, ShortestPathSolver solver, PathDecoder decoder, boolean verbose) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.solver = Objects.requireNonNull(solver, "solver");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.verbose = verbose;
    }

    /**
     * Aligns a replace block.
     *
     * @throws IllegalArgumentException if both {@code before} and {@code after} are empty
     */
    public List<AlignedPair> align(List<String> before, List<String> after) {
        AlignmentLattice lattice = AlignmentLattice.build(before, after, costModel);
        List<MoveNode> path = solver.solve(lattice);
        if (verbose && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Solved {}", lattice.describe(true));
        }
        MoveNode terminal = path.get(path.size() - 1);
        LOGGER.debug("Aligned {}x{} block via {} moves at cost {}",
                before.size(), after.size(), path.size(), terminal.distance());
        return decoder.decode(path, before, after);
    }
}

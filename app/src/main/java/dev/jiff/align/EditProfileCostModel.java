package dev.jiff.align;

import dev.jiff.diff.DiffCalculator;
import dev.jiff.diff.EditProfile;
import dev.jiff.diff.Tokenizer;
import java.util.Objects;

/**
 * Default cost model: a gap costs the line's character length, a substitution costs
 * {@code D * ceil(K / 2)} where D counts every non-equal token of the character diff and K counts
 * its insertions and deletions.
 */
public class EditProfileCostModel implements LineCostModel {

    private final DiffCalculator diffCalculator;

    public EditProfileCostModel() {
        this(new DiffCalculator());
    }

    public EditProfileCostModel(DiffCalculator diffCalculator) {
        this.diffCalculator = Objects.requireNonNull(diffCalculator, "diffCalculator");
    }

    @Override
    public long gapCost(String line) {
        return Tokenizer.characterLength(line);
    }

    @Override
    public long substitutionCost(String before, String after) {
        EditProfile profile = diffCalculator.profile(before, after);
        long disruption = profile.disruption();
        long halfOperations = (profile.operations() + 1L) / 2L;
        return disruption * halfOperations;
    }
}

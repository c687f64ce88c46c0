package dev.jiff.align;

/**
 * Prices the moves of the alignment lattice. Both costs must be non-negative.
 */
public interface LineCostModel {

    /** Cost of showing {@code line} unpaired, as a pure removal or addition. */
    long gapCost(String line);

    /** Cost of showing {@code before} and {@code after} paired with character highlighting. */
    long substitutionCost(String before, String after);
}

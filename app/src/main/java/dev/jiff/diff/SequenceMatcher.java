package dev.jiff.diff;

import java.util.List;

/**
 * Compares two token sequences and reports the opcodes that turn the left one into the right one.
 * The returned opcodes partition both inputs, in order, without gaps or overlaps.
 */
public interface SequenceMatcher {

    List<Opcode> match(List<String> left, List<String> right);
}

package dev.jiff.diff;

/**
 * Kind of a matcher opcode, describing how a left range relates to a right range.
 */
public enum OpcodeKind {
    EQUAL,
    INSERT,
    DELETE,
    REPLACE
}

package edu.brandeis.cosi103a.knockout.model;

/**
 * What the frame model does when {@code 0.5 + k * diff} leaves [0, 1].
 */
public enum RangePolicy {
    /** Keep the raw value and report a warning. */
    UNCLAMPED,
    /** Clamp into [0, 1] and report a warning. */
    CLAMP,
    /** Fail with {@link ProbabilityRangeException}. */
    REJECT
}

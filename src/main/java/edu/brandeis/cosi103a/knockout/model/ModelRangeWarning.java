package edu.brandeis.cosi103a.knockout.model;

import java.util.Locale;

/**
 * A frame probability that fell outside [0, 1].
 *
 * @param ratingDiff         rating of player 1 minus rating of player 2
 * @param rawProbability     {@code 0.5 + scalingFactor * ratingDiff}
 * @param appliedProbability the value actually used after the range policy
 * @param context            who was playing, when known (may be empty)
 */
public record ModelRangeWarning(
    double ratingDiff,
    double rawProbability,
    double appliedProbability,
    String context
) {
    public String describe() {
        String where = context.isEmpty() ? "" : " (" + context + ")";
        return String.format(Locale.ROOT, "frame probability %.4f out of range for rating difference %.4f%s, using %.4f",
            rawProbability, ratingDiff, where, appliedProbability);
    }
}

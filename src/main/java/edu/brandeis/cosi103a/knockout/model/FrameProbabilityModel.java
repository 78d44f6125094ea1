package edu.brandeis.cosi103a.knockout.model;

import edu.brandeis.cosi103a.knockout.ConfigurationException;

/**
 * Linear frame model: a player whose rating exceeds the opponent's by {@code d} wins a
 * single frame with probability {@code 0.5 + scalingFactor * d}.
 *
 * <p>The linear form leaves [0, 1] for large differentials. What happens then is
 * decided by the {@link RangePolicy}; every out-of-range value is reported to the
 * {@link ModelRangeListener} unless the policy rejects it outright.
 */
public class FrameProbabilityModel {

    public static final double DEFAULT_SCALING_FACTOR = 0.7;

    private final double scalingFactor;
    private final RangePolicy rangePolicy;
    private final ModelRangeListener listener;

    /**
     * Default model: scaling factor 0.7, unclamped, warnings printed to stderr.
     */
    public FrameProbabilityModel() {
        this(DEFAULT_SCALING_FACTOR, RangePolicy.UNCLAMPED, new WarningPrinter());
    }

    public FrameProbabilityModel(double scalingFactor, RangePolicy rangePolicy, ModelRangeListener listener) {
        if (!Double.isFinite(scalingFactor)) {
            throw new ConfigurationException("Scaling factor must be finite, got " + scalingFactor);
        }
        this.scalingFactor = scalingFactor;
        this.rangePolicy = rangePolicy;
        this.listener = listener;
    }

    /**
     * The raw linear model, no range handling.
     */
    public static double frameWinProb(double ratingDiff, double scalingFactor) {
        return 0.5 + scalingFactor * ratingDiff;
    }

    public static double frameWinProb(double ratingDiff) {
        return frameWinProb(ratingDiff, DEFAULT_SCALING_FACTOR);
    }

    /**
     * Frame-win probability for player 1 with the range policy applied.
     *
     * @param ratingDiff rating of player 1 minus rating of player 2
     * @param context    description of the pairing used in diagnostics
     * @throws ProbabilityRangeException under {@link RangePolicy#REJECT} when out of range
     */
    public double frameWinProb(double ratingDiff, String context) {
        if (!Double.isFinite(ratingDiff)) {
            throw new ConfigurationException("Rating difference must be finite, got " + ratingDiff
                + (context.isEmpty() ? "" : " (" + context + ")"));
        }
        double raw = frameWinProb(ratingDiff, scalingFactor);
        if (raw >= 0.0 && raw <= 1.0) {
            return raw;
        }

        double applied = switch (rangePolicy) {
            case UNCLAMPED -> raw;
            case CLAMP -> Math.max(0.0, Math.min(1.0, raw));
            case REJECT -> throw new ProbabilityRangeException(String.format(
                "Frame probability %.4f outside [0, 1] for rating difference %.4f%s",
                raw, ratingDiff, context.isEmpty() ? "" : " (" + context + ")"));
        };
        listener.onOutOfRange(new ModelRangeWarning(ratingDiff, raw, applied, context));
        return applied;
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    public RangePolicy getRangePolicy() {
        return rangePolicy;
    }
}

package edu.brandeis.cosi103a.knockout.model;

import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;
import edu.brandeis.cosi103a.knockout.ConfigurationException;

/**
 * Turns a frame-win probability into a best-of-N match-win probability by summing over
 * every winning scoreline.
 *
 * <p>A player who wins {@code firstTo = ceil(N / 2)} frames while the opponent takes
 * {@code s} must have won the last frame, so the earlier {@code firstTo - 1 + s} frames
 * can be arranged in {@code C(firstTo - 1 + s, s)} ways. Each arrangement has
 * probability {@code p^firstTo * (1 - p)^s}.
 */
public final class MatchProbabilityModel {

    private MatchProbabilityModel() {}

    /**
     * Probability that the player with frame-win probability {@code frameProb} wins a
     * best-of-{@code bestOf} match.
     *
     * @throws ConfigurationException if {@code bestOf} is not a positive odd number
     */
    public static double matchWinProb(double frameProb, int bestOf) {
        int firstTo = firstTo(bestOf);
        double q = 1.0 - frameProb;
        double total = 0.0;
        for (int lost = 0; lost < firstTo; lost++) {
            total += paths(firstTo, lost) * Math.pow(frameProb, firstTo) * Math.pow(q, lost);
        }
        return total;
    }

    /**
     * Every possible final score of the match, player 1's wins first, each with the
     * probability of the match finishing on it.
     */
    public static ImmutableList<Scoreline> scorelineDistribution(double frameProb, int bestOf) {
        int firstTo = firstTo(bestOf);
        double q = 1.0 - frameProb;
        ImmutableList.Builder<Scoreline> scorelines = ImmutableList.builder();
        for (int lost = 0; lost < firstTo; lost++) {
            double probability = paths(firstTo, lost) * Math.pow(frameProb, firstTo) * Math.pow(q, lost);
            scorelines.add(new Scoreline(firstTo, lost, probability));
        }
        for (int won = firstTo - 1; won >= 0; won--) {
            double probability = paths(firstTo, won) * Math.pow(q, firstTo) * Math.pow(frameProb, won);
            scorelines.add(new Scoreline(won, firstTo, probability));
        }
        return scorelines.build();
    }

    /**
     * Frames needed to win a best-of-{@code bestOf} match.
     *
     * @throws ConfigurationException if {@code bestOf} is not a positive odd number
     */
    public static int firstTo(int bestOf) {
        validateBestOf(bestOf);
        return (bestOf + 1) / 2;
    }

    public static void validateBestOf(int bestOf) {
        if (bestOf <= 0 || bestOf % 2 == 0) {
            throw new ConfigurationException("Best-of length must be a positive odd number, got " + bestOf);
        }
    }

    // Orderings of the frames before the deciding one.
    private static double paths(int firstTo, int opponentFrames) {
        return BigIntegerMath.binomial(firstTo - 1 + opponentFrames, opponentFrames).doubleValue();
    }
}

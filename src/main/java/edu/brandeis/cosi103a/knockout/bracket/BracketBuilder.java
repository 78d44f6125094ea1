package edu.brandeis.cosi103a.knockout.bracket;

import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;
import edu.brandeis.cosi103a.knockout.ConfigurationException;
import edu.brandeis.cosi103a.knockout.model.MatchProbabilityModel;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the match graph of a single-elimination draw.
 *
 * <p>Round 1 holds {@code numEntrants / 2} matches filled in fixture order. Match
 * numbers continue contiguously into later rounds, and match {@code k} of each later
 * round takes the winners of matches {@code 2k} and {@code 2k + 1} of the round before,
 * in that order. This keeps adjacent fixtures on the same side of the draw, as in a
 * printed bracket.
 */
public final class BracketBuilder {

    private BracketBuilder() {}

    /**
     * @param numEntrants    number of players, a power of two and at least 2
     * @param bestOfSchedule best-of length for each round, round 1 first
     * @throws ConfigurationException if the size is not a power of two, the schedule
     *                                length differs from the number of rounds, or a
     *                                best-of length is not a positive odd number
     */
    public static Bracket buildBracket(int numEntrants, List<Integer> bestOfSchedule) {
        if (numEntrants < 2 || !IntMath.isPowerOfTwo(numEntrants)) {
            throw new ConfigurationException("Number of entrants must be a power of two (at least 2), got " + numEntrants);
        }
        int numRounds = IntMath.log2(numEntrants, RoundingMode.UNNECESSARY);
        if (bestOfSchedule.size() != numRounds) {
            throw new ConfigurationException(String.format(
                "A %d-player draw has %d rounds but the best-of schedule has %d entries",
                numEntrants, numRounds, bestOfSchedule.size()));
        }
        for (int i = 0; i < numRounds; i++) {
            Integer bestOf = bestOfSchedule.get(i);
            if (bestOf == null) {
                throw new ConfigurationException("Missing best-of length for round " + (i + 1));
            }
            try {
                MatchProbabilityModel.validateBestOf(bestOf);
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Round " + (i + 1) + ": " + e.getMessage());
            }
        }

        List<Round> rounds = new ArrayList<>();
        int nextIndex = 0;

        ImmutableList.Builder<Match> opening = ImmutableList.builder();
        for (int m = 0; m < numEntrants / 2; m++) {
            opening.add(Match.opening(nextIndex++, m));
        }
        rounds.add(new Round(1, bestOfSchedule.get(0), opening.build()));

        for (int roundNumber = 2; roundNumber <= numRounds; roundNumber++) {
            Round previous = rounds.get(rounds.size() - 1);
            ImmutableList.Builder<Match> matches = ImmutableList.builder();
            for (int m = 0; m < previous.size() / 2; m++) {
                int feeder1 = previous.match(2 * m).index();
                int feeder2 = previous.match(2 * m + 1).index();
                matches.add(new Match(nextIndex++, roundNumber, m, feeder1, feeder2));
            }
            rounds.add(new Round(roundNumber, bestOfSchedule.get(roundNumber - 1), matches.build()));
        }

        return new Bracket(rounds);
    }

    /**
     * True when each round's best-of length is longer than the one before.
     */
    public static boolean isStrictlyIncreasing(List<Integer> bestOfSchedule) {
        for (int i = 1; i < bestOfSchedule.size(); i++) {
            if (bestOfSchedule.get(i) <= bestOfSchedule.get(i - 1)) {
                return false;
            }
        }
        return true;
    }
}

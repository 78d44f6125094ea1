package edu.brandeis.cosi103a.knockout.model;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.knockout.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchProbabilityModelTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void evenFramesGiveEvenMatches() {
        for (int bestOf = 1; bestOf <= 51; bestOf += 2) {
            assertEquals(0.5, MatchProbabilityModel.matchWinProb(0.5, bestOf), TOLERANCE,
                "Equal players should split a best-of-" + bestOf);
        }
    }

    @Test
    void bestOfOneIsASingleFrame() {
        for (double p = 0.0; p <= 1.0; p += 0.125) {
            assertEquals(p, MatchProbabilityModel.matchWinProb(p, 1), TOLERANCE);
        }
    }

    @Test
    void bestOfThreeMatchesHandCalculation() {
        // win 2-0, or 2-1 with the loss in either of the first two frames
        double p = 0.6;
        double expected = p * p + 2 * p * p * (1 - p);
        assertEquals(expected, MatchProbabilityModel.matchWinProb(p, 3), TOLERANCE);
        assertEquals(0.648, MatchProbabilityModel.matchWinProb(p, 3), TOLERANCE);
    }

    @Test
    void increasesWithFrameProbability() {
        double previous = -1.0;
        for (double p = 0.0; p <= 1.0; p += 0.05) {
            double current = MatchProbabilityModel.matchWinProb(p, 19);
            assertTrue(current > previous, "matchWinProb should increase at p=" + p);
            previous = current;
        }
    }

    @Test
    void longerMatchesFavourTheStrongerPlayer() {
        assertTrue(MatchProbabilityModel.matchWinProb(0.6, 19) < MatchProbabilityModel.matchWinProb(0.6, 35));
        double previous = 0.6;
        for (int bestOf = 3; bestOf <= 35; bestOf += 2) {
            double current = MatchProbabilityModel.matchWinProb(0.6, bestOf);
            assertTrue(current > previous, "best-of-" + bestOf + " should beat the shorter format");
            previous = current;
        }
    }

    @Test
    void complementaryFrameProbabilitiesGiveComplementaryMatches() {
        double p = MatchProbabilityModel.matchWinProb(0.57, 25);
        double q = MatchProbabilityModel.matchWinProb(0.43, 25);
        assertEquals(1.0, p + q, 1e-9);
    }

    @Test
    void scorelineDistribution_coversEveryResult() {
        ImmutableList<Scoreline> scorelines = MatchProbabilityModel.scorelineDistribution(0.57, 19);

        assertEquals(20, scorelines.size(), "10 ways to win and 10 ways to lose");
        assertEquals(1.0, scorelines.stream().mapToDouble(Scoreline::probability).sum(), 1e-9);

        double wins = scorelines.stream()
            .filter(Scoreline::player1Wins)
            .mapToDouble(Scoreline::probability)
            .sum();
        assertEquals(MatchProbabilityModel.matchWinProb(0.57, 19), wins, 1e-12);

        assertEquals("10-0", scorelines.get(0).toString());
        assertEquals("0-10", scorelines.get(scorelines.size() - 1).toString());
    }

    @Test
    void veryLongMatchesDoNotOverflow() {
        double p = MatchProbabilityModel.matchWinProb(0.52, 201);
        assertTrue(Double.isFinite(p));
        assertTrue(p > 0.5 && p < 1.0, "got " + p);
    }

    @Test
    void rejectsEvenOrNonPositiveBestOf() {
        assertThrows(ConfigurationException.class, () -> MatchProbabilityModel.matchWinProb(0.6, 4));
        assertThrows(ConfigurationException.class, () -> MatchProbabilityModel.matchWinProb(0.6, 0));
        assertThrows(ConfigurationException.class, () -> MatchProbabilityModel.matchWinProb(0.6, -3));
    }

    @Test
    void firstTo_isHalfRoundedUp() {
        assertEquals(1, MatchProbabilityModel.firstTo(1));
        assertEquals(10, MatchProbabilityModel.firstTo(19));
        assertEquals(18, MatchProbabilityModel.firstTo(35));
    }
}

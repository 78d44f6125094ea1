package edu.brandeis.cosi103a.knockout.simulation;

import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.bracket.Match;
import edu.brandeis.cosi103a.knockout.model.FrameProbabilityModel;

import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Plays one randomized pass through a draw.
 *
 * <p>Matches are played in arena order, which is round by round. Each match consumes
 * exactly one {@code nextDouble()} from the generator: player 1 wins when the draw is
 * below player 1's match-win probability. The simulator keeps no state between calls.
 */
public class TournamentSimulator {

    private final FrameProbabilityModel frameModel;

    public TournamentSimulator() {
        this(new FrameProbabilityModel());
    }

    public TournamentSimulator(FrameProbabilityModel frameModel) {
        this.frameModel = frameModel;
    }

    /**
     * Binds the fixture to the bracket and plays it once. Prefer
     * {@link #simulate(Draw, RandomGenerator)} when running many trials on the same draw.
     */
    public TrialOutcome simulate(Bracket bracket, Map<String, Double> ratings, List<Fixture> round1Fixture,
                                 RandomGenerator rng) {
        return simulate(bind(bracket, ratings, round1Fixture), rng);
    }

    public TrialOutcome simulate(Draw draw, RandomGenerator rng) {
        Bracket bracket = draw.bracket();
        int[] roundsWon = new int[draw.size()];
        int[] winnerSlot = new int[bracket.matches().size()];

        for (Match match : bracket.matches()) {
            int player1;
            int player2;
            if (match.hasFeeders()) {
                player1 = winnerSlot[match.feeder1()];
                player2 = winnerSlot[match.feeder2()];
            } else {
                player1 = 2 * match.position();
                player2 = 2 * match.position() + 1;
            }

            double matchProb = draw.matchWinProbability(player1, player2);
            int winner = rng.nextDouble() < matchProb ? player1 : player2;

            roundsWon[winner] = match.roundNumber();
            winnerSlot[match.index()] = winner;
        }

        return new TrialOutcome(draw, roundsWon);
    }

    public Draw bind(Bracket bracket, Map<String, Double> ratings, List<Fixture> round1Fixture) {
        return Draw.bind(bracket, ratings, round1Fixture, frameModel);
    }
}

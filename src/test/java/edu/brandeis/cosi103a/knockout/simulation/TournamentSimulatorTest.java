package edu.brandeis.cosi103a.knockout.simulation;

import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.knockout.ConfigurationException;
import edu.brandeis.cosi103a.knockout.UnknownPlayerException;
import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.bracket.BracketBuilder;
import edu.brandeis.cosi103a.knockout.model.FrameProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.MatchProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.ModelRangeListener;
import edu.brandeis.cosi103a.knockout.model.RangePolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TournamentSimulatorTest {

    private static final Map<String, Double> RATINGS = Map.of("A", 0.6, "B", 0.5, "C", 0.5, "D", 0.4);
    private static final List<Fixture> FIXTURE = List.of(new Fixture("A", "B"), new Fixture("C", "D"));

    private final TournamentSimulator simulator = new TournamentSimulator(
        new FrameProbabilityModel(0.7, RangePolicy.UNCLAMPED, ModelRangeListener.ignoring()));

    @Test
    void simulate_followsScriptedDraws() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        RandomGenerator rng = mock(RandomGenerator.class);
        // A beats B (0.50 < 0.604), D beats C (0.70 >= 0.604), A beats D (0.10 < 0.705)
        when(rng.nextDouble()).thenReturn(0.5, 0.7, 0.1);

        TrialOutcome outcome = simulator.simulate(bracket, RATINGS, FIXTURE, rng);

        assertEquals(2, outcome.roundsWon("A"));
        assertEquals(0, outcome.roundsWon("B"));
        assertEquals(0, outcome.roundsWon("C"));
        assertEquals(1, outcome.roundsWon("D"));
        assertEquals("A", outcome.champion().name());
        verify(rng, times(3)).nextDouble();
    }

    @Test
    void simulate_drawEqualToProbabilityGoesToPlayer2() {
        Bracket bracket = BracketBuilder.buildBracket(2, List.of(1));
        RandomGenerator rng = mock(RandomGenerator.class);
        when(rng.nextDouble()).thenReturn(0.5);

        TrialOutcome outcome = simulator.simulate(bracket, Map.of("A", 0.5, "B", 0.5), List.of(new Fixture("A", "B")), rng);

        assertEquals("B", outcome.champion().name(), "Player 1 wins only when the draw is strictly below");
    }

    @Test
    void simulate_seededTrialMatchesTheAlgorithmByHand() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        SeededRandomFactory factory = new SeededRandomFactory(2026L);

        TrialOutcome outcome = simulator.simulate(bracket, RATINGS, FIXTURE, factory.forTrial(0));

        RandomGenerator replay = factory.forTrial(0);
        String semi1 = replay.nextDouble() < expectedProb(0.6, 0.5, 3) ? "A" : "B";
        String semi2 = replay.nextDouble() < expectedProb(0.5, 0.4, 3) ? "C" : "D";
        String champion = replay.nextDouble() < expectedProb(RATINGS.get(semi1), RATINGS.get(semi2), 3) ? semi1 : semi2;

        assertEquals(champion, outcome.champion().name());
        assertEquals(2, outcome.roundsWon(champion));
        String runnerUp = champion.equals(semi1) ? semi2 : semi1;
        assertEquals(1, outcome.roundsWon(runnerUp));
    }

    @Test
    void simulate_exactlyOneChampionAndHalvingSurvivors() {
        Bracket bracket = BracketBuilder.buildBracket(32, List.of(19, 25, 25, 33, 35));
        Map<String, Double> ratings = new HashMap<>();
        List<Fixture> fixture = new ArrayList<>();
        for (int m = 0; m < 16; m++) {
            String p1 = "P" + (2 * m);
            String p2 = "P" + (2 * m + 1);
            ratings.put(p1, 0.5 + 0.005 * m);
            ratings.put(p2, 0.5 - 0.004 * m);
            fixture.add(new Fixture(p1, p2));
        }
        Draw draw = simulator.bind(bracket, ratings, fixture);
        SeededRandomFactory factory = new SeededRandomFactory(7L);

        for (int trial = 0; trial < 200; trial++) {
            TrialOutcome outcome = simulator.simulate(draw, factory.forTrial(trial));
            for (int r = 1; r <= 5; r++) {
                int survivors = 0;
                for (int slot = 0; slot < outcome.size(); slot++) {
                    if (outcome.roundsWon(slot) >= r) {
                        survivors++;
                    }
                }
                assertEquals(32 >> r, survivors, "Players through round " + r + " in trial " + trial);
            }
        }
    }

    @Test
    void simulate_asMapListsEveryPlayerInDrawOrder() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        RandomGenerator rng = mock(RandomGenerator.class);
        when(rng.nextDouble()).thenReturn(0.99);

        ImmutableMap<Player, Integer> map = simulator.simulate(bracket, RATINGS, FIXTURE, rng).asMap();

        assertEquals(List.of("A", "B", "C", "D"), map.keySet().stream().map(Player::name).toList());
        assertEquals(List.of(0, 1, 0, 2), List.copyOf(map.values()));
    }

    @Test
    void bind_equalRatingsPriceEveryMeetingAtHalf() {
        Bracket bracket = BracketBuilder.buildBracket(8, List.of(9, 11, 13));
        Map<String, Double> ratings = new HashMap<>();
        List<Fixture> fixture = List.of(new Fixture("a", "b"), new Fixture("c", "d"),
            new Fixture("e", "f"), new Fixture("g", "h"));
        for (String name : List.of("a", "b", "c", "d", "e", "f", "g", "h")) {
            ratings.put(name, 0.55);
        }

        Draw draw = simulator.bind(bracket, ratings, fixture);

        // every pair meets somewhere, with the lower slot as player 1
        for (int s1 = 0; s1 < 8; s1++) {
            for (int s2 = s1 + 1; s2 < 8; s2++) {
                assertEquals(0.5, draw.matchWinProbability(s1, s2), 1e-12, "slots " + s1 + " v " + s2);
            }
        }
    }

    @Test
    void bind_pricesEachPairAtTheRoundTheyMeet() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 7));
        Draw draw = simulator.bind(bracket, RATINGS, FIXTURE);

        assertEquals(expectedProb(0.6, 0.5, 3), draw.matchWinProbability(0, 1), 1e-12, "A v B in round 1");
        assertEquals(expectedProb(0.5, 0.4, 3), draw.matchWinProbability(2, 3), 1e-12, "C v D in round 1");
        assertEquals(expectedProb(0.6, 0.4, 7), draw.matchWinProbability(0, 3), 1e-12, "A v D in the final");
        assertEquals(expectedProb(0.5, 0.5, 7), draw.matchWinProbability(1, 2), 1e-12, "B v C in the final");
    }

    @Test
    void bind_unknownPlayerIsFatal() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        Map<String, Double> ratings = Map.of("A", 0.6, "B", 0.5, "C", 0.5);

        UnknownPlayerException e = assertThrows(UnknownPlayerException.class,
            () -> simulator.simulate(bracket, ratings, FIXTURE, mock(RandomGenerator.class)));
        assertEquals("D", e.playerName());
        assertTrue(e.getMessage().contains("match 2"), e.getMessage());
    }

    @Test
    void bind_rejectsFixtureOfWrongLength() {
        Bracket bracket = BracketBuilder.buildBracket(8, List.of(3, 3, 3));

        assertThrows(ConfigurationException.class, () -> simulator.bind(bracket, RATINGS, FIXTURE));
    }

    @Test
    void bind_rejectsPlayerDrawnTwice() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        List<Fixture> fixture = List.of(new Fixture("A", "B"), new Fixture("C", "A"));

        assertThrows(ConfigurationException.class, () -> simulator.bind(bracket, RATINGS, fixture));
    }

    @Test
    void bind_rejectsNullName() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 3));
        List<Fixture> fixture = List.of(new Fixture("A", "B"), new Fixture("C", null));

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> simulator.bind(bracket, RATINGS, fixture));
        assertTrue(e.getMessage().contains("match 2"), e.getMessage());
    }

    @Test
    void bind_reverseOrientationIsTheComplement() {
        Bracket bracket = BracketBuilder.buildBracket(4, List.of(3, 7));
        Draw draw = simulator.bind(bracket, RATINGS, FIXTURE);

        assertEquals(1.0 - draw.matchWinProbability(0, 3), draw.matchWinProbability(3, 0), 1e-12);
        assertEquals(1.0 - draw.matchWinProbability(2, 3), draw.matchWinProbability(3, 2), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> draw.matchWinProbability(0, 0));
    }

    @Test
    void bind_rejectPolicyFailsOnExtremeRatings() {
        TournamentSimulator strict = new TournamentSimulator(
            new FrameProbabilityModel(0.7, RangePolicy.REJECT, ModelRangeListener.ignoring()));
        Bracket bracket = BracketBuilder.buildBracket(2, List.of(5));

        assertThrows(ConfigurationException.class,
            () -> strict.bind(bracket, Map.of("A", 2.0, "B", 0.1), List.of(new Fixture("A", "B"))));
    }

    private static double expectedProb(double rating1, double rating2, int bestOf) {
        return MatchProbabilityModel.matchWinProb(FrameProbabilityModel.frameWinProb(rating1 - rating2), bestOf);
    }
}

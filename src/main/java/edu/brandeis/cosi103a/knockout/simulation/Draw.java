package edu.brandeis.cosi103a.knockout.simulation;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.knockout.ConfigurationException;
import edu.brandeis.cosi103a.knockout.UnknownPlayerException;
import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.bracket.Match;
import edu.brandeis.cosi103a.knockout.bracket.Round;
import edu.brandeis.cosi103a.knockout.model.FrameProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.MatchProbabilityModel;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A bracket with its players seated and every possible pairing priced.
 *
 * <p>Entrants sit in slots: fixture {@code m} puts its player 1 in slot {@code 2m} and
 * its player 2 in slot {@code 2m + 1}. Two entrants can only ever meet in one match
 * position, the one where their halves of the draw join, and which of them is player 1
 * there is fixed by the feeder order. Binding walks the feeder references once and
 * stores player 1's match-win probability for each pair, so trials only need a table
 * lookup per match.
 */
public final class Draw {

    private final Bracket bracket;
    private final ImmutableList<Player> entrants;
    private final Map<String, Integer> slotsByName;
    // [player1 slot][player2 slot]; the orientation in which the pair does not meet holds the complement
    private final double[][] player1WinProbability;

    private Draw(Bracket bracket, ImmutableList<Player> entrants, Map<String, Integer> slotsByName,
                 double[][] player1WinProbability) {
        this.bracket = bracket;
        this.entrants = entrants;
        this.slotsByName = slotsByName;
        this.player1WinProbability = player1WinProbability;
    }

    /**
     * Seats the fixture and prices every pairing.
     *
     * @throws ConfigurationException if the fixture does not fill the bracket exactly once
     * @throws UnknownPlayerException if a fixtured player has no rating
     */
    public static Draw bind(Bracket bracket, Map<String, Double> ratings, List<Fixture> round1Fixture,
                            FrameProbabilityModel frameModel) {
        int firstRoundMatches = bracket.round(1).size();
        if (round1Fixture.size() != firstRoundMatches) {
            throw new ConfigurationException(String.format(
                "A %d-player bracket needs %d first-round fixtures, got %d",
                bracket.numEntrants(), firstRoundMatches, round1Fixture.size()));
        }

        ImmutableList.Builder<Player> seated = ImmutableList.builder();
        Map<String, Integer> slotsByName = new HashMap<>();
        for (int m = 0; m < round1Fixture.size(); m++) {
            Fixture fixture = round1Fixture.get(m);
            if (fixture == null || fixture.player1() == null || fixture.player2() == null) {
                throw new ConfigurationException(String.format(
                    "Round 1, match %d needs two player names, got %s", m + 1, fixture));
            }
            for (String name : List.of(fixture.player1(), fixture.player2())) {
                Double rating = ratings.get(name);
                if (rating == null) {
                    throw new UnknownPlayerException(name, String.format(
                        "No rating for %s (round 1, match %d: %s)", name, m + 1, fixture));
                }
                if (slotsByName.putIfAbsent(name, slotsByName.size()) != null) {
                    throw new ConfigurationException(name + " appears more than once in the fixture list");
                }
                seated.add(new Player(name, rating));
            }
        }
        ImmutableList<Player> entrants = seated.build();

        int n = entrants.size();
        double[][] table = new double[n][n];
        int[][] slotsUnder = new int[bracket.matches().size()][];
        for (Round round : bracket.rounds()) {
            for (Match match : round.matches()) {
                int[] side1;
                int[] side2;
                if (match.hasFeeders()) {
                    side1 = slotsUnder[match.feeder1()];
                    side2 = slotsUnder[match.feeder2()];
                } else {
                    side1 = new int[] {2 * match.position()};
                    side2 = new int[] {2 * match.position() + 1};
                }
                for (int s1 : side1) {
                    for (int s2 : side2) {
                        double p = price(entrants.get(s1), entrants.get(s2), round, frameModel);
                        table[s1][s2] = p;
                        table[s2][s1] = 1.0 - p;
                    }
                }
                int[] under = new int[side1.length + side2.length];
                System.arraycopy(side1, 0, under, 0, side1.length);
                System.arraycopy(side2, 0, under, side1.length, side2.length);
                slotsUnder[match.index()] = under;
            }
        }

        return new Draw(bracket, entrants, Map.copyOf(slotsByName), table);
    }

    private static double price(Player player1, Player player2, Round round, FrameProbabilityModel frameModel) {
        String context = player1.name() + " v " + player2.name() + ", round " + round.number();
        double frameProb = frameModel.frameWinProb(player1.rating() - player2.rating(), context);
        return MatchProbabilityModel.matchWinProb(frameProb, round.bestOf());
    }

    public Bracket bracket() {
        return bracket;
    }

    /**
     * Entrants in slot order.
     */
    public ImmutableList<Player> entrants() {
        return entrants;
    }

    public Player entrant(int slot) {
        return entrants.get(slot);
    }

    public Optional<Integer> slotOf(String name) {
        return Optional.ofNullable(slotsByName.get(name));
    }

    public int size() {
        return entrants.size();
    }

    /**
     * Probability that the entrant in {@code player1Slot} beats the one in
     * {@code player2Slot} in the one match where they can meet. Swapping the slots gives
     * the complement.
     *
     * @throws IllegalArgumentException if both slots are the same
     */
    public double matchWinProbability(int player1Slot, int player2Slot) {
        if (player1Slot == player2Slot) {
            throw new IllegalArgumentException("An entrant cannot play itself (slot " + player1Slot + ")");
        }
        return player1WinProbability[player1Slot][player2Slot];
    }
}

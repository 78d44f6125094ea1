package edu.brandeis.cosi103a.knockout.simulation;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.stats.WilsonInterval;

import java.util.Comparator;

/**
 * Advancement counts over a whole run, and the probabilities and odds derived from them.
 *
 * <p>{@code count(player, r)} is the number of trials in which the player won its round
 * {@code r} match. Probability is that count over the number of trials; odds are the
 * reciprocal, infinite for a player who never got that far.
 */
public final class AggregateResult {

    private final Draw draw;
    private final AdvancementCounts counts;

    AggregateResult(Draw draw, AdvancementCounts counts) {
        this.draw = draw;
        this.counts = counts;
    }

    public long numTrials() {
        return counts.trials();
    }

    public int numRounds() {
        return draw.bracket().numRounds();
    }

    public Bracket bracket() {
        return draw.bracket();
    }

    public ImmutableList<Player> players() {
        return draw.entrants();
    }

    public long count(String playerName, int round) {
        return counts.count(slot(playerName), checkRound(round));
    }

    public double probability(String playerName, int round) {
        return probability(slot(playerName), checkRound(round));
    }

    public double odds(String playerName, int round) {
        return toOdds(probability(playerName, round));
    }

    /**
     * 95% Wilson interval around {@link #probability(String, int)}.
     */
    public WilsonInterval confidenceInterval(String playerName, int round) {
        return WilsonInterval.of95(count(playerName, round), numTrials());
    }

    /**
     * One row per player in draw order.
     */
    public ImmutableList<PlayerForecast> rows() {
        ImmutableList.Builder<PlayerForecast> rows = ImmutableList.builder();
        for (int slot = 0; slot < draw.size(); slot++) {
            ImmutableList.Builder<Double> probabilities = ImmutableList.builder();
            ImmutableList.Builder<Double> odds = ImmutableList.builder();
            for (int round = 1; round <= numRounds(); round++) {
                double p = probability(slot, round);
                probabilities.add(p);
                odds.add(toOdds(p));
            }
            Player player = draw.entrant(slot);
            rows.add(new PlayerForecast(player.name(), player.rating(), probabilities.build(), odds.build()));
        }
        return rows.build();
    }

    /**
     * Rows ordered by chance of winning the tournament, favourite first. Ties keep draw order.
     */
    public ImmutableList<PlayerForecast> sortedByChampionProbability() {
        return ImmutableList.sortedCopyOf(
            Comparator.comparingDouble(PlayerForecast::championProbability).reversed(), rows());
    }

    public static double toOdds(double probability) {
        return probability == 0.0 ? Double.POSITIVE_INFINITY : 1.0 / probability;
    }

    private double probability(int slot, int round) {
        return (double) counts.count(slot, round) / counts.trials();
    }

    private int slot(String playerName) {
        return draw.slotOf(playerName)
            .orElseThrow(() -> new IllegalArgumentException(playerName + " is not in this draw"));
    }

    private int checkRound(int round) {
        if (round < 1 || round > numRounds()) {
            throw new IllegalArgumentException("Round must be between 1 and " + numRounds() + ", got " + round);
        }
        return round;
    }
}

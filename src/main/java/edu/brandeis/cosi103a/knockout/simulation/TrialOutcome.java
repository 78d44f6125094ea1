package edu.brandeis.cosi103a.knockout.simulation;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;

/**
 * How far each entrant got in one simulated tournament.
 *
 * <p>The value per entrant is the number of matches it won: 0 for a first-round loser,
 * {@code numRounds} for the champion. Winning round {@code r} means reaching stage
 * {@code r}, so a player with value {@code w} counts as having reached every stage
 * from 1 to {@code w}.
 */
public final class TrialOutcome {

    private final Draw draw;
    private final int[] roundsWon;

    TrialOutcome(Draw draw, int[] roundsWon) {
        this.draw = draw;
        this.roundsWon = roundsWon;
    }

    /**
     * @param slot entrant slot in the draw
     */
    public int roundsWon(int slot) {
        return roundsWon[slot];
    }

    /**
     * @throws IllegalArgumentException if the player is not in this draw
     */
    public int roundsWon(String playerName) {
        return draw.slotOf(playerName)
            .map(slot -> roundsWon[slot])
            .orElseThrow(() -> new IllegalArgumentException(playerName + " is not in this draw"));
    }

    public Player champion() {
        int numRounds = draw.bracket().numRounds();
        for (int slot = 0; slot < roundsWon.length; slot++) {
            if (roundsWon[slot] == numRounds) {
                return draw.entrant(slot);
            }
        }
        throw new IllegalStateException("Trial finished without a champion");
    }

    /**
     * Player to rounds won, in draw order.
     */
    public ImmutableMap<Player, Integer> asMap() {
        ImmutableMap.Builder<Player, Integer> map = ImmutableMap.builder();
        for (int slot = 0; slot < roundsWon.length; slot++) {
            map.put(draw.entrant(slot), roundsWon[slot]);
        }
        return map.build();
    }

    public int size() {
        return roundsWon.length;
    }

    @Override
    public String toString() {
        return "TrialOutcome" + Arrays.toString(roundsWon);
    }
}

package edu.brandeis.cosi103a.knockout.bracket;

/**
 * One match slot in the bracket.
 *
 * @param index          position in the bracket-wide match arena, unique across rounds
 * @param roundNumber    1-based round the match belongs to
 * @param position       0-based position within its round
 * @param feeder1        arena index of the match whose winner takes slot 1, or {@link #NO_FEEDER}
 * @param feeder2        arena index of the match whose winner takes slot 2, or {@link #NO_FEEDER}
 */
public record Match(int index, int roundNumber, int position, int feeder1, int feeder2) {

    public static final int NO_FEEDER = -1;

    /**
     * A first-round match, its slots filled from the fixture list.
     */
    public static Match opening(int index, int position) {
        return new Match(index, 1, position, NO_FEEDER, NO_FEEDER);
    }

    public boolean hasFeeders() {
        return feeder1 != NO_FEEDER;
    }
}

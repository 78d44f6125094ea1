package edu.brandeis.cosi103a.knockout.simulation;

/**
 * Running tally of how many trials each entrant survived each round.
 *
 * <p>Not thread-safe. Each worker fills its own instance and the instances are summed
 * with {@link #merge} once the workers finish.
 */
final class AdvancementCounts {

    private final int numRounds;
    // [slot][round - 1]
    private final long[][] counts;
    private long trials;

    AdvancementCounts(int entrants, int numRounds) {
        this.numRounds = numRounds;
        this.counts = new long[entrants][numRounds];
    }

    void record(TrialOutcome outcome) {
        for (int slot = 0; slot < counts.length; slot++) {
            long[] row = counts[slot];
            int won = outcome.roundsWon(slot);
            for (int r = 0; r < won; r++) {
                row[r]++;
            }
        }
        trials++;
    }

    void merge(AdvancementCounts other) {
        if (other.counts.length != counts.length || other.numRounds != numRounds) {
            throw new IllegalArgumentException("Cannot merge tallies of different draws");
        }
        for (int slot = 0; slot < counts.length; slot++) {
            for (int r = 0; r < numRounds; r++) {
                counts[slot][r] += other.counts[slot][r];
            }
        }
        trials += other.trials;
    }

    long count(int slot, int round) {
        return counts[slot][round - 1];
    }

    long trials() {
        return trials;
    }
}

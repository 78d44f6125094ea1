package edu.brandeis.cosi103a.knockout.bracket;

import com.google.common.collect.ImmutableList;

import java.util.BitSet;
import java.util.List;

/**
 * A single-elimination bracket: rounds of matches stored in one arena indexed by match
 * number, each later match pointing back at the two matches that feed it.
 *
 * <p>The constructor checks the layering: every round has half the matches of the one
 * before, match indices run contiguously from 0, and each round's feeder references
 * use every match of the previous round exactly once. A bracket is immutable and can
 * be shared by any number of concurrent trials.
 */
public final class Bracket {

    private final ImmutableList<Round> rounds;
    private final ImmutableList<Match> arena;

    public Bracket(List<Round> rounds) {
        if (rounds.isEmpty()) {
            throw new IllegalArgumentException("A bracket needs at least one round");
        }
        this.rounds = ImmutableList.copyOf(rounds);
        ImmutableList.Builder<Match> all = ImmutableList.builder();
        for (Round round : this.rounds) {
            all.addAll(round.matches());
        }
        this.arena = all.build();
        validate();
    }

    private void validate() {
        int expectedIndex = 0;
        Round previous = null;
        for (int r = 0; r < rounds.size(); r++) {
            Round round = rounds.get(r);
            if (round.number() != r + 1) {
                throw new IllegalArgumentException("Round at position " + r + " is numbered " + round.number());
            }
            if (previous != null && round.size() * 2 != previous.size()) {
                throw new IllegalArgumentException(String.format(
                    "Round %d has %d matches, expected half of %d", round.number(), round.size(), previous.size()));
            }
            int firstOfPrevious = previous == null ? 0 : expectedIndex - previous.size();
            BitSet used = new BitSet();
            for (int m = 0; m < round.size(); m++) {
                Match match = round.match(m);
                if (match.index() != expectedIndex++ || match.position() != m || match.roundNumber() != round.number()) {
                    throw new IllegalArgumentException("Match out of place in round " + round.number() + ": " + match);
                }
                if (previous == null) {
                    if (match.hasFeeders()) {
                        throw new IllegalArgumentException("First-round match has feeders: " + match);
                    }
                    continue;
                }
                for (int feeder : new int[] {match.feeder1(), match.feeder2()}) {
                    int offset = feeder - firstOfPrevious;
                    if (offset < 0 || offset >= previous.size()) {
                        throw new IllegalArgumentException(String.format(
                            "Match %d in round %d is fed by %d, which is not in round %d",
                            match.index(), round.number(), feeder, previous.number()));
                    }
                    if (used.get(offset)) {
                        throw new IllegalArgumentException("Match " + feeder + " feeds more than one slot");
                    }
                    used.set(offset);
                }
            }
            if (previous != null && used.cardinality() != previous.size()) {
                throw new IllegalArgumentException("Round " + previous.number() + " has matches that feed nothing");
            }
            previous = round;
        }
        if (rounds.get(rounds.size() - 1).size() != 1) {
            throw new IllegalArgumentException("The last round must be a single match");
        }
    }

    public ImmutableList<Round> rounds() {
        return rounds;
    }

    /**
     * @param number 1-based round number
     */
    public Round round(int number) {
        return rounds.get(number - 1);
    }

    public int numRounds() {
        return rounds.size();
    }

    public int numEntrants() {
        return rounds.get(0).size() * 2;
    }

    /**
     * All matches, indexed by {@link Match#index()}.
     */
    public ImmutableList<Match> matches() {
        return arena;
    }

    public Match match(int index) {
        return arena.get(index);
    }

    public Match finalMatch() {
        return arena.get(arena.size() - 1);
    }

    public ImmutableList<Integer> bestOfSchedule() {
        return rounds.stream().map(Round::bestOf).collect(ImmutableList.toImmutableList());
    }

    /**
     * Name of the stage reached by a player who has won {@code roundsWon} matches.
     */
    public String stageLabel(int roundsWon) {
        if (roundsWon < 0 || roundsWon > numRounds()) {
            throw new IllegalArgumentException("No stage after " + roundsWon + " wins in a "
                + numRounds() + "-round bracket");
        }
        if (roundsWon == numRounds()) {
            return "Winner";
        }
        int remaining = numEntrants() >> roundsWon;
        return switch (remaining) {
            case 2 -> "Final";
            case 4 -> "Semi-final";
            case 8 -> "Quarter-final";
            default -> "Last " + remaining;
        };
    }
}

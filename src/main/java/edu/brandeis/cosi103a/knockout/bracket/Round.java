package edu.brandeis.cosi103a.knockout.bracket;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.knockout.model.MatchProbabilityModel;

/**
 * The matches of one round, all played over the same best-of length.
 */
public record Round(int number, int bestOf, ImmutableList<Match> matches) {

    public Round {
        MatchProbabilityModel.validateBestOf(bestOf);
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("Round " + number + " has no matches");
        }
    }

    public int size() {
        return matches.size();
    }

    public Match match(int position) {
        return matches.get(position);
    }
}

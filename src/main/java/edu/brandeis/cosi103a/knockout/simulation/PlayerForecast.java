package edu.brandeis.cosi103a.knockout.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * One row of the forecast table: a player's estimated chance of winning each round and
 * the matching decimal odds. Index {@code r - 1} holds round {@code r}; the last entry is
 * the chance of winning the tournament.
 */
public record PlayerForecast(
    @JsonProperty("name") String name,
    @JsonProperty("rating") double rating,
    @JsonProperty("probabilities") ImmutableList<Double> probabilities,
    @JsonProperty("odds") ImmutableList<Double> odds
) {
    public double championProbability() {
        return probabilities.get(probabilities.size() - 1);
    }

    public double championOdds() {
        return odds.get(odds.size() - 1);
    }
}

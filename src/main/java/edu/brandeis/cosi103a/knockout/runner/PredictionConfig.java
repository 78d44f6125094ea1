package edu.brandeis.cosi103a.knockout.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.knockout.model.FrameProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.RangePolicy;
import edu.brandeis.cosi103a.knockout.simulation.Fixture;

import java.util.List;
import java.util.Map;

/**
 * A prediction run as read from its JSON file, with any command-line overrides applied.
 *
 * @param name          run name, also the output subdirectory
 * @param ratings       player name to rating
 * @param fixture       first-round pairings in draw order
 * @param bestOf        best-of length per round, round 1 first
 * @param trials        number of simulated tournaments (default 100000)
 * @param seed          run seed; a fresh one is chosen when absent
 * @param scalingFactor frame model slope (default 0.7)
 * @param rangePolicy   handling of out-of-range frame probabilities (default CLAMP)
 * @param parallelism   worker threads (default: up to 8, one per processor)
 */
public record PredictionConfig(
    @JsonProperty("name") String name,
    @JsonProperty("ratings") Map<String, Double> ratings,
    @JsonProperty("fixture") List<Fixture> fixture,
    @JsonProperty("bestOf") List<Integer> bestOf,
    @JsonProperty("trials") Integer trials,
    @JsonProperty("seed") Long seed,
    @JsonProperty("scalingFactor") Double scalingFactor,
    @JsonProperty("rangePolicy") RangePolicy rangePolicy,
    @JsonProperty("parallelism") Integer parallelism
) {
    public static final int DEFAULT_TRIALS = 100_000;

    public PredictionConfig {
        ratings = ratings == null ? Map.of() : ratings;
        fixture = fixture == null ? List.of() : fixture;
        bestOf = bestOf == null ? List.of() : bestOf;
    }

    public int trialsOrDefault() {
        return trials != null ? trials : DEFAULT_TRIALS;
    }

    public double scalingFactorOrDefault() {
        return scalingFactor != null ? scalingFactor : FrameProbabilityModel.DEFAULT_SCALING_FACTOR;
    }

    public RangePolicy rangePolicyOrDefault() {
        return rangePolicy != null ? rangePolicy : RangePolicy.CLAMP;
    }

    public int numEntrants() {
        return fixture.size() * 2;
    }

    public PredictionConfig withName(String name) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }

    public PredictionConfig withTrials(int trials) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }

    public PredictionConfig withSeed(long seed) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }

    public PredictionConfig withScalingFactor(double scalingFactor) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }

    public PredictionConfig withRangePolicy(RangePolicy rangePolicy) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }

    public PredictionConfig withParallelism(int parallelism) {
        return new PredictionConfig(name, ratings, fixture, bestOf, trials, seed, scalingFactor, rangePolicy, parallelism);
    }
}

package edu.brandeis.cosi103a.knockout.simulation;

import edu.brandeis.cosi103a.knockout.ConfigurationException;
import edu.brandeis.cosi103a.knockout.bracket.Bracket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs many independent trials of a draw and folds them into an {@link AggregateResult}.
 *
 * <p>Trials are split into contiguous chunks, one per worker thread. Each chunk fills its
 * own {@link AdvancementCounts}, and the chunk tallies are summed after every worker has
 * finished. Trial {@code t} always draws from {@code rngFactory.forTrial(t)}, so the
 * result is the same for any number of threads.
 */
public class MonteCarloAggregator {

    private final TournamentSimulator simulator;
    private final int parallelism;

    public MonteCarloAggregator(TournamentSimulator simulator) {
        this(simulator, defaultParallelism());
    }

    /**
     * @param parallelism maximum number of worker threads, at least 1
     */
    public MonteCarloAggregator(TournamentSimulator simulator, int parallelism) {
        if (parallelism < 1) {
            throw new ConfigurationException("Parallelism must be at least 1, got " + parallelism);
        }
        this.simulator = simulator;
        this.parallelism = parallelism;
    }

    public static int defaultParallelism() {
        return Math.min(8, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Binds the fixture and runs {@code numTrials} trials.
     */
    public AggregateResult run(Bracket bracket, Map<String, Double> ratings, List<Fixture> round1Fixture,
                               int numTrials, RandomFactory rngFactory) {
        validateTrials(numTrials);
        return run(simulator.bind(bracket, ratings, round1Fixture), numTrials, rngFactory);
    }

    /**
     * @throws ConfigurationException if {@code numTrials} is less than 1
     */
    public AggregateResult run(Draw draw, int numTrials, RandomFactory rngFactory) {
        validateTrials(numTrials);
        int numRounds = draw.bracket().numRounds();
        int workers = Math.min(parallelism, numTrials);

        if (workers == 1) {
            return new AggregateResult(draw, runChunk(draw, 0, numTrials, rngFactory));
        }

        ExecutorService threadPool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<AdvancementCounts>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                final long start = (long) numTrials * w / workers;
                final long end = (long) numTrials * (w + 1) / workers;
                futures.add(threadPool.submit(() -> runChunk(draw, start, end, rngFactory)));
            }

            AdvancementCounts total = new AdvancementCounts(draw.size(), numRounds);
            for (Future<AdvancementCounts> future : futures) {
                total.merge(await(future));
            }
            return new AggregateResult(draw, total);
        } finally {
            threadPool.shutdownNow();
        }
    }

    private AdvancementCounts runChunk(Draw draw, long start, long end, RandomFactory rngFactory) {
        AdvancementCounts counts = new AdvancementCounts(draw.size(), draw.bracket().numRounds());
        for (long trial = start; trial < end; trial++) {
            counts.record(simulator.simulate(draw, rngFactory.forTrial(trial)));
        }
        return counts;
    }

    private static AdvancementCounts await(Future<AdvancementCounts> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for trials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Trial worker failed", cause);
        }
    }

    private static void validateTrials(int numTrials) {
        if (numTrials < 1) {
            throw new ConfigurationException("Number of trials must be at least 1, got " + numTrials);
        }
    }

    public int getParallelism() {
        return parallelism;
    }
}

package edu.brandeis.cosi103a.knockout.simulation;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Derives an independent {@link SplittableRandom} for every trial from a run seed and
 * the trial index.
 */
public final class SeededRandomFactory implements RandomFactory {

    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private final long runSeed;

    public SeededRandomFactory(long runSeed) {
        this.runSeed = runSeed;
    }

    @Override
    public RandomGenerator forTrial(long trialIndex) {
        return new SplittableRandom(trialSeed(trialIndex));
    }

    long trialSeed(long trialIndex) {
        return mix64(mix64(runSeed) + GOLDEN_GAMMA * (trialIndex + 1));
    }

    public long getRunSeed() {
        return runSeed;
    }

    // SplitMix64 finalizer
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}

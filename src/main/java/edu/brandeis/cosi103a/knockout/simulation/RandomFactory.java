package edu.brandeis.cosi103a.knockout.simulation;

import java.util.random.RandomGenerator;

/**
 * Supplies the random source for each trial. Implementations must return a source that
 * depends only on the trial index, so a run gives the same result whichever worker
 * happens to play which trial.
 */
@FunctionalInterface
public interface RandomFactory {

    RandomGenerator forTrial(long trialIndex);
}

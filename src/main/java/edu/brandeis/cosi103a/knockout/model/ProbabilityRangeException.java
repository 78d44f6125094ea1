package edu.brandeis.cosi103a.knockout.model;

import edu.brandeis.cosi103a.knockout.ConfigurationException;

/**
 * Thrown under {@link RangePolicy#REJECT} when a rating difference maps to a frame
 * probability outside [0, 1].
 */
public class ProbabilityRangeException extends ConfigurationException {
    public ProbabilityRangeException(String message) {
        super(message);
    }
}

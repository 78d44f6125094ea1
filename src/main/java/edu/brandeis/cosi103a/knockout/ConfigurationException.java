package edu.brandeis.cosi103a.knockout;

/**
 * Thrown when a tournament description cannot be simulated as given: a bracket size
 * that is not a power of two, an even best-of length, a trial count below one, or a
 * schedule or fixture whose length does not match the bracket.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}

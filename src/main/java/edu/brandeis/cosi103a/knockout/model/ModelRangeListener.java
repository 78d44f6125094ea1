package edu.brandeis.cosi103a.knockout.model;

/**
 * Receives frame probabilities that fell outside [0, 1].
 */
@FunctionalInterface
public interface ModelRangeListener {

    void onOutOfRange(ModelRangeWarning warning);

    /**
     * A listener that drops every warning.
     */
    static ModelRangeListener ignoring() {
        return warning -> { };
    }
}

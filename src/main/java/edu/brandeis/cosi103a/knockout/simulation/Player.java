package edu.brandeis.cosi103a.knockout.simulation;

/**
 * An entrant and the rating it plays at for the whole run.
 */
public record Player(String name, double rating) {}

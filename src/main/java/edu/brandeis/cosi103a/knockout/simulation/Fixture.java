package edu.brandeis.cosi103a.knockout.simulation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * A first-round pairing by player name. Player 1 is the top line of the draw.
 */
public record Fixture(String player1, String player2) {

    /**
     * Reads the {@code ["A", "B"]} form used in run files.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Fixture fromPair(List<String> pair) {
        if (pair == null || pair.size() != 2 || pair.contains(null)) {
            throw new IllegalArgumentException("A fixture needs exactly two player names, got " + pair);
        }
        return new Fixture(pair.get(0), pair.get(1));
    }

    @JsonValue
    public List<String> asPair() {
        return List.of(player1, player2);
    }

    @Override
    public String toString() {
        return player1 + " v " + player2;
    }
}

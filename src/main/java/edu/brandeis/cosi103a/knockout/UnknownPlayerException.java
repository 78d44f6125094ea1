package edu.brandeis.cosi103a.knockout;

/**
 * Thrown when a fixtured player has no entry in the ratings table.
 */
public class UnknownPlayerException extends RuntimeException {

    private final String playerName;

    public UnknownPlayerException(String playerName, String message) {
        super(message);
        this.playerName = playerName;
    }

    public String playerName() {
        return playerName;
    }
}

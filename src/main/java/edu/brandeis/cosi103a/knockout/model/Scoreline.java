package edu.brandeis.cosi103a.knockout.model;

/**
 * A final match score and the probability of the match ending on it.
 */
public record Scoreline(int player1Frames, int player2Frames, double probability) {

    public boolean player1Wins() {
        return player1Frames > player2Frames;
    }

    @Override
    public String toString() {
        return player1Frames + "-" + player2Frames;
    }
}

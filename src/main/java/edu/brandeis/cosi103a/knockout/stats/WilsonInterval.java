package edu.brandeis.cosi103a.knockout.stats;

import java.util.Locale;

/**
 * Wilson score interval for a binomial proportion. Stays inside [0, 1] and behaves
 * well for proportions near 0 or 1, which is where long-shot advancement estimates sit.
 *
 * @param lower lower bound, a probability
 * @param upper upper bound, a probability
 */
public record WilsonInterval(double lower, double upper) {

    public static final double Z_95 = 1.96;

    /**
     * @param successes number of trials in which the event happened
     * @param total     number of trials
     * @param z         z-score for the confidence level (1.96 for 95%)
     */
    public static WilsonInterval of(long successes, long total, double z) {
        if (total <= 0) {
            return new WilsonInterval(0.0, 1.0);
        }
        if (successes < 0 || successes > total) {
            throw new IllegalArgumentException("successes must be in [0, " + total + "], got " + successes);
        }

        double n = total;
        double p = successes / n;
        double z2 = z * z;

        double denominator = 1.0 + z2 / n;
        double center = (p + z2 / (2.0 * n)) / denominator;
        double spread = (z / denominator) * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * n));

        return new WilsonInterval(Math.max(0.0, center - spread), Math.min(1.0, center + spread));
    }

    public static WilsonInterval of95(long successes, long total) {
        return of(successes, total, Z_95);
    }

    public boolean contains(double probability) {
        return probability >= lower && probability <= upper;
    }

    /**
     * Formats as {@code "52.3% [45.1%, 59.4%]"}.
     */
    public String format(double probability) {
        return String.format(Locale.ROOT, "%.1f%% [%.1f%%, %.1f%%]", probability * 100.0, lower * 100.0, upper * 100.0);
    }
}

package app.cardwise.core.review.algorithm;

import app.cardwise.core.config.SchedulerProps;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * Spreads review intervals so cards learned together don't stay due together.
 */
@Component
public class IntervalFuzzer {

    private final RandomGenerator random;
    private final double fraction;

    public IntervalFuzzer(RandomGenerator random, SchedulerProps props) {
        this.random = random;
        this.fraction = props.fuzzFraction();
    }

    /**
     * A value drawn uniformly from {@code [interval - f, interval + f]} with
     * {@code f = floor(interval * fraction)}; intervals below two days are returned as is.
     */
    public int fuzz(int interval) {
        if (interval < 2) {
            return interval;
        }
        int spread = (int) Math.floor(interval * fraction);
        if (spread <= 0) {
            return interval;
        }
        return interval - spread + random.nextInt(2 * spread + 1);
    }
}

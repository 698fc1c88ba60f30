package app.cardwise.core.review.algorithm;

import app.cardwise.core.config.SchedulerProps;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalFuzzerTest {

    private final IntervalFuzzer fuzzer = new IntervalFuzzer(new Random(42), SchedulerProps.defaults());

    @Test
    void fuzz_staysWithinFivePercent() {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            int value = fuzzer.fuzz(100);
            assertThat(value).isBetween(95, 105);
            seen.add(value);
        }
        assertThat(seen.size()).isGreaterThan(1);
    }

    @Test
    void fuzz_leavesShortIntervalsAlone() {
        assertThat(fuzzer.fuzz(1)).isEqualTo(1);
        assertThat(fuzzer.fuzz(10)).isEqualTo(10);
    }
}

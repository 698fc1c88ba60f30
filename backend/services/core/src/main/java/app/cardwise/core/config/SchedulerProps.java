package app.cardwise.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Every number the scheduler uses, bound from {@code app.scheduler.*}. Missing values fall back to the
 * defaults below.
 *
 * @param learningSteps          delays in minutes between learning steps of a new card, default {@code [1, 10]}
 * @param relearningSteps        delays in minutes between relearning steps after a lapse, default {@code [10]}
 * @param graduatingInterval     days until the first review after the last learning step, default 1
 * @param easyInterval           days until the first review when a learning card is answered Easy, default 4
 * @param initialEase            ease factor given to graduating cards, in permille, default 2500
 * @param minimumEase            floor for the ease factor, in permille, default 1300
 * @param againEaseDelta         ease change on Again for review cards, default -200
 * @param hardEaseDelta          ease change on Hard for review cards, default -150
 * @param easyEaseDelta          ease change on Easy for review cards, default +150
 * @param hardMultiplier         interval multiplier on Hard, default 1.2
 * @param easyBonus              extra interval multiplier on Easy, default 1.3
 * @param intervalModifier       multiplier applied to every review interval, default 1.0
 * @param lapseMultiplier        factor applied to the interval on a lapse, default 0.5
 * @param minimumLapseInterval   smallest post-lapse interval in days, default 1
 * @param maximumInterval        largest interval in days, default 36500
 * @param fuzzFraction           share of the interval used as random spread, default 0.05
 * @param leechThreshold         lapse count at which a card is reported as a leech, default 8
 * @param newPerDay              daily new-card limit for decks created without one, default 20
 * @param reviewsPerDay          daily review limit for decks created without one, default 200
 * @param rolloverHour           local hour at which a new study day starts, default 4
 * @param zone                   zone in which study days are counted, default {@code UTC}
 * @param defaultAlgorithm       scheduling algorithm of decks that do not pick one, default {@code sm2}
 * @param desiredRetention       recall probability FSRS aims for at the due date, default 0.9
 * @param fsrsWeights            FSRS model weights, default the 21 published FSRS-6 defaults
 * @param leitnerIntervals       delay of each Leitner box, default {@code [10m, 1d, 2d, 4d, 8d, 16d, 32d, 64d]}
 * @param leitnerDropBoxes       boxes a Leitner card falls back on Again, 0 sends it to the first box, default 0
 */
@ConfigurationProperties(prefix = "app.scheduler")
public record SchedulerProps(
        List<Integer> learningSteps,
        List<Integer> relearningSteps,
        Integer graduatingInterval,
        Integer easyInterval,
        Integer initialEase,
        Integer minimumEase,
        Integer againEaseDelta,
        Integer hardEaseDelta,
        Integer easyEaseDelta,
        Double hardMultiplier,
        Double easyBonus,
        Double intervalModifier,
        Double lapseMultiplier,
        Integer minimumLapseInterval,
        Integer maximumInterval,
        Double fuzzFraction,
        Integer leechThreshold,
        Integer newPerDay,
        Integer reviewsPerDay,
        Integer rolloverHour,
        ZoneId zone,
        String defaultAlgorithm,
        Double desiredRetention,
        List<Double> fsrsWeights,
        List<Duration> leitnerIntervals,
        Integer leitnerDropBoxes
) {
    public static final List<Double> FSRS_DEFAULT_WEIGHTS = List.of(
            0.212, 1.2931, 2.3065, 8.2956, 6.4133, 0.8334, 3.0194, 0.001, 1.8722, 0.1666,
            0.796, 1.4835, 0.0614, 0.2629, 1.6483, 0.6014, 1.8729, 0.5425, 0.0912, 0.0658, 0.1542
    );

    public static final List<Duration> LEITNER_DEFAULT_INTERVALS = List.of(
            Duration.ofMinutes(10), Duration.ofDays(1), Duration.ofDays(2), Duration.ofDays(4),
            Duration.ofDays(8), Duration.ofDays(16), Duration.ofDays(32), Duration.ofDays(64)
    );

    public SchedulerProps {
        learningSteps = learningSteps == null ? List.of(1, 10) : List.copyOf(learningSteps);
        relearningSteps = relearningSteps == null ? List.of(10) : List.copyOf(relearningSteps);
        graduatingInterval = graduatingInterval == null ? 1 : graduatingInterval;
        easyInterval = easyInterval == null ? 4 : easyInterval;
        initialEase = initialEase == null ? 2500 : initialEase;
        minimumEase = minimumEase == null ? 1300 : minimumEase;
        againEaseDelta = againEaseDelta == null ? -200 : againEaseDelta;
        hardEaseDelta = hardEaseDelta == null ? -150 : hardEaseDelta;
        easyEaseDelta = easyEaseDelta == null ? 150 : easyEaseDelta;
        hardMultiplier = hardMultiplier == null ? 1.2 : hardMultiplier;
        easyBonus = easyBonus == null ? 1.3 : easyBonus;
        intervalModifier = intervalModifier == null ? 1.0 : intervalModifier;
        lapseMultiplier = lapseMultiplier == null ? 0.5 : lapseMultiplier;
        minimumLapseInterval = minimumLapseInterval == null ? 1 : minimumLapseInterval;
        maximumInterval = maximumInterval == null ? 36500 : maximumInterval;
        fuzzFraction = fuzzFraction == null ? 0.05 : fuzzFraction;
        leechThreshold = leechThreshold == null ? 8 : leechThreshold;
        newPerDay = newPerDay == null ? 20 : newPerDay;
        reviewsPerDay = reviewsPerDay == null ? 200 : reviewsPerDay;
        rolloverHour = rolloverHour == null ? 4 : rolloverHour;
        zone = zone == null ? ZoneId.of("UTC") : zone;
        defaultAlgorithm = defaultAlgorithm == null || defaultAlgorithm.isBlank() ? "sm2" : defaultAlgorithm.trim();
        desiredRetention = desiredRetention == null ? 0.9 : desiredRetention;
        fsrsWeights = fsrsWeights == null ? FSRS_DEFAULT_WEIGHTS : List.copyOf(fsrsWeights);
        leitnerIntervals = leitnerIntervals == null ? LEITNER_DEFAULT_INTERVALS : List.copyOf(leitnerIntervals);
        leitnerDropBoxes = leitnerDropBoxes == null ? 0 : leitnerDropBoxes;

        if (rolloverHour < 0 || rolloverHour > 23) {
            throw new IllegalArgumentException("app.scheduler.rollover-hour must be within 0..23");
        }
        if (minimumEase <= 0 || initialEase < minimumEase) {
            throw new IllegalArgumentException("app.scheduler.initial-ease must not be below minimum-ease");
        }
        if (maximumInterval < 1) {
            throw new IllegalArgumentException("app.scheduler.maximum-interval must be positive");
        }
        if (desiredRetention <= 0 || desiredRetention >= 1) {
            throw new IllegalArgumentException("app.scheduler.desired-retention must be within (0, 1)");
        }
        if (fsrsWeights.size() != FSRS_DEFAULT_WEIGHTS.size()) {
            throw new IllegalArgumentException("app.scheduler.fsrs-weights needs " + FSRS_DEFAULT_WEIGHTS.size() + " values");
        }
        if (leitnerIntervals.isEmpty() || leitnerDropBoxes < 0) {
            throw new IllegalArgumentException("app.scheduler.leitner-intervals must not be empty and leitner-drop-boxes must not be negative");
        }
    }

    public static SchedulerProps defaults() {
        return new SchedulerProps(null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public SchedulerProps withLearningSteps(List<Integer> steps, List<Integer> relearning) {
        return new SchedulerProps(steps, relearning, graduatingInterval, easyInterval, initialEase, minimumEase,
                againEaseDelta, hardEaseDelta, easyEaseDelta, hardMultiplier, easyBonus, intervalModifier,
                lapseMultiplier, minimumLapseInterval, maximumInterval, fuzzFraction, leechThreshold,
                newPerDay, reviewsPerDay, rolloverHour, zone, defaultAlgorithm, desiredRetention, fsrsWeights,
                leitnerIntervals, leitnerDropBoxes);
    }

    public SchedulerProps withFuzzFraction(double fraction) {
        return new SchedulerProps(learningSteps, relearningSteps, graduatingInterval, easyInterval, initialEase,
                minimumEase, againEaseDelta, hardEaseDelta, easyEaseDelta, hardMultiplier, easyBonus,
                intervalModifier, lapseMultiplier, minimumLapseInterval, maximumInterval, fraction,
                leechThreshold, newPerDay, reviewsPerDay, rolloverHour, zone, defaultAlgorithm, desiredRetention,
                fsrsWeights, leitnerIntervals, leitnerDropBoxes);
    }
}

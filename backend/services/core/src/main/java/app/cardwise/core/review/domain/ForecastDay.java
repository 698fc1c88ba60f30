package app.cardwise.core.review.domain;

import java.time.LocalDate;

/**
 * Expected workload of one study day.
 *
 * @param estimatedMinutes all three counts times the recent average answer time
 */
public record ForecastDay(
        LocalDate date,
        long dayNumber,
        int newCount,
        int learnCount,
        int reviewCount,
        double estimatedMinutes
) {
    public int total() {
        return newCount + learnCount + reviewCount;
    }
}

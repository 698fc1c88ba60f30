package app.cardwise.core.review.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Review history of a deck tree or the whole collection over a window of study days ending today.
 */
public record ReviewStats(
        Long deckId,
        LocalDate fromDate,
        LocalDate toDate,
        Overview overview,
        Streak streak,
        CardCounts cards,
        List<DailyPoint> daily,
        List<RatingPoint> ratings
) {

    /**
     * @param correctCount answers other than Again
     */
    public record Overview(
            long reviewCount,
            long uniqueCardCount,
            long againCount,
            long correctCount,
            double retentionPercent,
            double againRatePercent,
            long totalTimeMs,
            long avgTimeMs,
            double reviewsPerDay
    ) {
    }

    /**
     * @param currentDays consecutive study days with reviews, ending today
     */
    public record Streak(int currentDays, int longestDays) {
    }

    /**
     * @param dueToday learning cards due before the day ends plus reviews due today, limits ignored
     */
    public record CardCounts(
            long total,
            long newCards,
            long learning,
            long review,
            long suspended,
            long buried,
            long dueToday
    ) {
    }

    public record DailyPoint(
            LocalDate date,
            long reviewCount,
            long correctCount,
            long totalTimeMs,
            long avgTimeMs
    ) {
    }

    public record RatingPoint(Rating rating, long count, double percent) {
    }
}

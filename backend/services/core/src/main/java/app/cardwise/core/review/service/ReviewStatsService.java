package app.cardwise.core.review.service;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.review.domain.ForecastDay;
import app.cardwise.core.review.domain.Rating;
import app.cardwise.core.review.domain.ReviewStats;
import app.cardwise.core.review.util.StudyDays;
import app.cardwise.core.store.EntityStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Workload forecasts and review statistics computed from the cards and the review log. A {@code null}
 * deck id means the whole collection; a deck id covers the deck and its descendants.
 */
@Service
public class ReviewStatsService {

    private static final int MAX_RANGE_DAYS = 366;
    private static final int MAX_FORECAST_DAYS = 365;
    private static final int AVERAGE_WINDOW_DAYS = 30;
    private static final double DEFAULT_SECONDS_PER_CARD = 8.0;

    private final EntityStore store;
    private final StudyDays studyDays;

    public ReviewStatsService(EntityStore store, StudyDays studyDays) {
        this.store = store;
        this.studyDays = studyDays;
    }

    /**
     * Cards expected on each of the next {@code days} study days, today first. Overdue learning and
     * review cards count towards today; new cards only appear today, capped by the daily new limit of
     * each deck.
     */
    public List<ForecastDay> forecast(Long deckId, int days, Instant now) {
        if (days < 1 || days > MAX_FORECAST_DAYS) {
            throw new IllegalArgumentException("forecast days must be in range [1, " + MAX_FORECAST_DAYS + "]");
        }
        Predicate<CardEntity> inScope = scope(deckId);
        long today = studyDays.today(now);
        List<CardEntity> cards = store.findCards(card -> !card.isDeleted() && inScope.test(card));

        int[] learn = new int[days];
        int[] review = new int[days];
        for (CardEntity card : cards) {
            long day;
            if (card.getQueue() == CardQueue.LEARNING) {
                day = studyDays.today(Instant.ofEpochSecond(card.getDue()));
            } else if (card.getQueue() == CardQueue.DAY_LEARNING || card.getQueue() == CardQueue.REVIEW) {
                day = card.getDue();
            } else {
                continue;
            }
            long offset = Math.max(0, day - today);
            if (offset >= days) {
                continue;
            }
            if (card.getQueue() == CardQueue.REVIEW) {
                review[(int) offset]++;
            } else {
                learn[(int) offset]++;
            }
        }

        int newToday = newCardsToday(deckId, cards);
        double secondsPerCard = averageSecondsPerAnswer(deckId, now);
        List<ForecastDay> out = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            int fresh = i == 0 ? newToday : 0;
            double minutes = round2((fresh + learn[i] + review[i]) * secondsPerCard / 60.0);
            out.add(new ForecastDay(studyDays.dateOf(today + i), today + i, fresh, learn[i], review[i], minutes));
        }
        return out;
    }

    /**
     * Statistics over the last {@code days} study days, today included. Streaks look at the whole log.
     */
    public ReviewStats stats(Long deckId, int days, Instant now) {
        if (days < 1 || days > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("stats days must be in range [1, " + MAX_RANGE_DAYS + "]");
        }
        Predicate<CardEntity> inScope = scope(deckId);
        long today = studyDays.today(now);
        long firstDay = today - days + 1;

        List<ReviewLogEntity> all = reviewLogs(deckId, inScope, 0L);
        long windowStart = studyDays.startOf(firstDay).toEpochMilli();
        List<ReviewLogEntity> window = all.stream().filter(entry -> entry.getId() >= windowStart).toList();

        long again = 0;
        long totalTime = 0;
        Set<Long> uniqueCards = new HashSet<>();
        Map<Rating, Long> byRating = new EnumMap<>(Rating.class);
        Map<Long, long[]> byDay = new HashMap<>();
        for (ReviewLogEntity entry : window) {
            Rating rating = Rating.fromCode(entry.getRating());
            byRating.merge(rating, 1L, Long::sum);
            uniqueCards.add(entry.getCardId());
            totalTime += entry.getDurationMs();
            if (rating == Rating.AGAIN) {
                again++;
            }
            long[] bucket = byDay.computeIfAbsent(dayOf(entry), key -> new long[3]);
            bucket[0]++;
            bucket[1] += rating == Rating.AGAIN ? 0 : 1;
            bucket[2] += entry.getDurationMs();
        }

        long count = window.size();
        long correct = count - again;
        ReviewStats.Overview overview = new ReviewStats.Overview(
                count,
                uniqueCards.size(),
                again,
                correct,
                percent(correct, count),
                percent(again, count),
                totalTime,
                count == 0 ? 0 : Math.round((double) totalTime / count),
                round2((double) count / days)
        );

        List<ReviewStats.DailyPoint> daily = new ArrayList<>(days);
        for (long day = firstDay; day <= today; day++) {
            long[] bucket = byDay.getOrDefault(day, new long[3]);
            daily.add(new ReviewStats.DailyPoint(
                    studyDays.dateOf(day),
                    bucket[0],
                    bucket[1],
                    bucket[2],
                    bucket[0] == 0 ? 0 : Math.round((double) bucket[2] / bucket[0])
            ));
        }

        List<ReviewStats.RatingPoint> ratings = new ArrayList<>(Rating.values().length);
        for (Rating rating : Rating.values()) {
            long n = byRating.getOrDefault(rating, 0L);
            ratings.add(new ReviewStats.RatingPoint(rating, n, percent(n, count)));
        }

        LocalDate from = studyDays.dateOf(firstDay);
        LocalDate to = studyDays.dateOf(today);
        return new ReviewStats(deckId, from, to, overview, streak(all, today), cardCounts(inScope, now), daily, ratings);
    }

    private ReviewStats.Streak streak(List<ReviewLogEntity> entries, long today) {
        TreeSet<Long> activeDays = new TreeSet<>();
        entries.forEach(entry -> activeDays.add(dayOf(entry)));

        int current = 0;
        for (long day = today; activeDays.contains(day); day--) {
            current++;
        }

        int longest = 0;
        int run = 0;
        Long previous = null;
        for (long day : activeDays) {
            run = previous != null && day == previous + 1 ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return new ReviewStats.Streak(current, longest);
    }

    private ReviewStats.CardCounts cardCounts(Predicate<CardEntity> inScope, Instant now) {
        long today = studyDays.today(now);
        long dayEnd = studyDays.startOf(today + 1).getEpochSecond();
        long total = 0;
        long fresh = 0;
        long learning = 0;
        long review = 0;
        long suspended = 0;
        long buried = 0;
        long due = 0;
        for (CardEntity card : store.findCards(card -> !card.isDeleted() && inScope.test(card))) {
            total++;
            switch (card.getQueue()) {
                case NEW -> fresh++;
                case LEARNING -> {
                    learning++;
                    due += card.getDue() < dayEnd ? 1 : 0;
                }
                case DAY_LEARNING -> {
                    learning++;
                    due += card.getDue() <= today ? 1 : 0;
                }
                case REVIEW -> {
                    review++;
                    due += card.getDue() <= today ? 1 : 0;
                }
                case SUSPENDED -> suspended++;
                case SCHED_BURIED, USER_BURIED -> buried++;
            }
        }
        return new ReviewStats.CardCounts(total, fresh, learning, review, suspended, buried, due);
    }

    private int newCardsToday(Long deckId, List<CardEntity> cards) {
        if (deckId != null) {
            long fresh = cards.stream().filter(card -> card.getQueue() == CardQueue.NEW).count();
            return (int) Math.min(fresh, store.requireDeck(deckId).getNewPerDay());
        }
        Map<Long, Integer> freshByDeck = new HashMap<>();
        for (CardEntity card : cards) {
            if (card.getQueue() == CardQueue.NEW) {
                freshByDeck.merge(card.getDeckId(), 1, Integer::sum);
            }
        }
        int total = 0;
        for (DeckEntity deck : store.decks()) {
            if (!deck.isFiltered()) {
                total += Math.min(freshByDeck.getOrDefault(deck.getId(), 0), deck.getNewPerDay());
            }
        }
        return total;
    }

    private double averageSecondsPerAnswer(Long deckId, Instant now) {
        long since = now.minusSeconds(AVERAGE_WINDOW_DAYS * 86_400L).toEpochMilli();
        List<ReviewLogEntity> recent = reviewLogs(deckId, scope(deckId), since);
        long totalMs = recent.stream().mapToLong(ReviewLogEntity::getDurationMs).sum();
        if (recent.isEmpty() || totalMs <= 0) {
            return DEFAULT_SECONDS_PER_CARD;
        }
        return totalMs / 1000.0 / recent.size();
    }

    private List<ReviewLogEntity> reviewLogs(Long deckId, Predicate<CardEntity> inScope, long sinceMillis) {
        List<ReviewLogEntity> entries = store.reviewLogsSince(sinceMillis);
        if (deckId == null) {
            return entries;
        }
        List<ReviewLogEntity> out = new ArrayList<>();
        for (ReviewLogEntity entry : entries) {
            Optional<CardEntity> card = store.findCard(entry.getCardId());
            if (card.isPresent() && inScope.test(card.get())) {
                out.add(entry);
            }
        }
        return out;
    }

    private Predicate<CardEntity> scope(Long deckId) {
        if (deckId == null) {
            return card -> true;
        }
        store.requireDeck(deckId);
        Set<Long> deckIds = store.deckTreeIds(deckId);
        return card -> deckIds.contains(card.getDeckId()) || deckIds.contains(card.homeDeckId());
    }

    private long dayOf(ReviewLogEntity entry) {
        return studyDays.today(Instant.ofEpochMilli(entry.getId()));
    }

    private static double percent(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round2((part * 100.0) / total);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

package app.cardwise.core.review.service;

import app.cardwise.core.cloze.ClozeEngine;
import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.entity.ModelEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.deck.domain.entity.ReviewLogEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.deck.domain.type.ReviewKind;
import app.cardwise.core.deck.service.CardService;
import app.cardwise.core.deck.service.DeckService;
import app.cardwise.core.deck.service.ModelService;
import app.cardwise.core.deck.service.NoteService;
import app.cardwise.core.review.domain.ForecastDay;
import app.cardwise.core.review.domain.Rating;
import app.cardwise.core.review.domain.ReviewStats;
import app.cardwise.core.review.util.StudyDays;
import app.cardwise.core.store.EntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReviewStatsServiceTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-05T10:00:00Z");
    private static final long TODAY = 4;

    private EntityStore store;
    private ReviewStatsService stats;
    private DeckService deckService;
    private NoteService noteService;
    private CardService cardService;
    private ModelEntity basic;
    private DeckEntity deck;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(CREATED, ZoneOffset.UTC);
        SchedulerProps props = SchedulerProps.defaults();
        store = new EntityStore(CREATED.getEpochSecond());
        stats = new ReviewStatsService(store, new StudyDays(store, props));
        deckService = new DeckService(store, props, clock);
        noteService = new NoteService(store, new ClozeEngine(), clock);
        cardService = new CardService(store, clock);
        basic = new ModelService(store, clock).createBasicModel("Basic");
        deck = deckService.createDeck("Lang");
    }

    @Test
    void forecast_countsDueCardsPerDayWithOverdueToday() {
        addCard(deck, "new 1");
        addCard(deck, "new 2");
        addCard(deck, "new 3");
        makeReview(addCard(deck, "overdue"), TODAY - 1);
        makeReview(addCard(deck, "later"), TODAY + 2);
        makeLearning(addCard(deck, "learning"), NOW.getEpochSecond() + 3_600);
        cardService.suspend(List.of(addCard(deck, "suspended").getId()));

        List<ForecastDay> forecast = stats.forecast(deck.getId(), 5, NOW);

        assertThat(forecast).hasSize(5);
        ForecastDay today = forecast.get(0);
        assertThat(today.date()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(today.dayNumber()).isEqualTo(TODAY);
        assertThat(today.newCount()).isEqualTo(3);
        assertThat(today.learnCount()).isEqualTo(1);
        assertThat(today.reviewCount()).isEqualTo(1);
        assertThat(today.estimatedMinutes()).isEqualTo(0.67);
        assertThat(forecast.get(2).reviewCount()).isEqualTo(1);
        assertThat(forecast.get(2).newCount()).isZero();
        assertThat(forecast.get(1).total()).isZero();
    }

    @Test
    void forecast_capsNewCardsByEachDeckLimit() {
        DeckEntity other = deckService.createDeck("Other");
        deckService.setLimits(other.getId(), 1, 100);
        addCard(deck, "a");
        addCard(other, "b");
        addCard(other, "c");

        assertThat(stats.forecast(other.getId(), 1, NOW).get(0).newCount()).isEqualTo(1);
        assertThat(stats.forecast(null, 1, NOW).get(0).newCount()).isEqualTo(2);
    }

    @Test
    void forecast_usesRecentAnswerTimeForEstimate() {
        CardEntity card = addCard(deck, "timed");
        makeReview(card, TODAY);
        log(card, NOW.minus(Duration.ofDays(1)), Rating.GOOD, 30_000);

        assertThat(stats.forecast(deck.getId(), 1, NOW).get(0).estimatedMinutes()).isEqualTo(0.5);
    }

    @Test
    void forecast_rejectsOutOfRangeDays() {
        assertThatThrownBy(() -> stats.forecast(null, 0, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stats.forecast(null, 366, NOW)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stats_summarisesReviewLogWindow() {
        CardEntity first = addCard(deck, "first");
        CardEntity second = addCard(deck, "second");
        log(first, NOW, Rating.GOOD, 4_000);
        log(second, NOW.plusSeconds(60), Rating.AGAIN, 2_000);
        log(first, NOW.minus(Duration.ofDays(1)), Rating.GOOD, 6_000);
        log(second, NOW.minus(Duration.ofDays(3)), Rating.EASY, 1_000);

        ReviewStats result = stats.stats(deck.getId(), 7, NOW);

        assertThat(result.fromDate()).isEqualTo(LocalDate.of(2024, 2, 28));
        assertThat(result.toDate()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(result.overview()).isEqualTo(new ReviewStats.Overview(4, 2, 1, 3, 75.0, 25.0, 13_000, 3_250, 0.57));
        assertThat(result.daily()).hasSize(7);
        assertThat(result.daily().get(6)).isEqualTo(new ReviewStats.DailyPoint(LocalDate.of(2024, 3, 5), 2, 1, 6_000, 3_000));
        assertThat(result.daily().get(5).reviewCount()).isEqualTo(1);
        assertThat(result.daily().get(4).reviewCount()).isZero();
        assertThat(result.ratings()).extracting(ReviewStats.RatingPoint::count).containsExactly(1L, 0L, 2L, 1L);
        assertThat(result.ratings().get(2).percent()).isEqualTo(50.0);
        assertThat(result.streak()).isEqualTo(new ReviewStats.Streak(2, 2));
    }

    @Test
    void stats_windowAndScopeFilterEntries() {
        CardEntity mine = addCard(deck, "mine");
        DeckEntity other = deckService.createDeck("Other");
        CardEntity theirs = addCard(other, "theirs");
        log(mine, NOW, Rating.GOOD, 1_000);
        log(mine, NOW.minus(Duration.ofDays(2)), Rating.GOOD, 1_000);
        log(theirs, NOW, Rating.HARD, 1_000);

        assertThat(stats.stats(deck.getId(), 1, NOW).overview().reviewCount()).isEqualTo(1);
        assertThat(stats.stats(deck.getId(), 3, NOW).overview().reviewCount()).isEqualTo(2);
        assertThat(stats.stats(null, 3, NOW).overview().reviewCount()).isEqualTo(3);
        assertThat(stats.stats(deck.getId(), 3, NOW).streak()).isEqualTo(new ReviewStats.Streak(1, 1));
    }

    @Test
    void stats_withoutReviewsReportsZeros() {
        addCard(deck, "idle");

        ReviewStats result = stats.stats(deck.getId(), 30, NOW);

        assertThat(result.overview().reviewCount()).isZero();
        assertThat(result.overview().retentionPercent()).isZero();
        assertThat(result.streak()).isEqualTo(new ReviewStats.Streak(0, 0));
        assertThat(result.daily()).hasSize(30).allMatch(point -> point.reviewCount() == 0);
    }

    @Test
    void stats_countsCardsByQueue() {
        addCard(deck, "new");
        makeReview(addCard(deck, "due"), TODAY);
        makeReview(addCard(deck, "not due"), TODAY + 5);
        makeLearning(addCard(deck, "learning"), NOW.getEpochSecond() + 60);
        cardService.suspend(List.of(addCard(deck, "suspended").getId()));

        ReviewStats.CardCounts counts = stats.stats(deck.getId(), 1, NOW).cards();

        assertThat(counts).isEqualTo(new ReviewStats.CardCounts(5, 1, 1, 2, 1, 0, 2));
    }

    @Test
    void stats_rejectsUnknownDeck() {
        assertThatThrownBy(() -> stats.stats(9_999L, 7, NOW)).isInstanceOf(IllegalArgumentException.class);
    }

    private CardEntity addCard(DeckEntity target, String front) {
        NoteEntity note = noteService.createNote(basic.getId(), target.getId(), List.of(front, "back"), List.of());
        return store.cardsOfNote(note.getId()).get(0);
    }

    private void log(CardEntity card, Instant at, Rating rating, long durationMs) {
        store.appendReviewLog(new ReviewLogEntity(at.toEpochMilli(), card.getId(), rating.code(), 1, 0, 2500,
                durationMs, ReviewKind.REVIEW, CardType.REVIEW));
    }

    private void makeReview(CardEntity card, long due) {
        CardEntity copy = store.requireCard(card.getId());
        copy.setType(CardType.REVIEW);
        copy.setQueue(CardQueue.REVIEW);
        copy.setDue(due);
        copy.setInterval(3);
        copy.setEaseFactor(2500);
        store.replaceCard(copy);
    }

    private void makeLearning(CardEntity card, long dueSeconds) {
        CardEntity copy = store.requireCard(card.getId());
        copy.setType(CardType.LEARNING);
        copy.setQueue(CardQueue.LEARNING);
        copy.setDue(dueSeconds);
        copy.setRemainingSteps(1);
        store.replaceCard(copy);
    }
}

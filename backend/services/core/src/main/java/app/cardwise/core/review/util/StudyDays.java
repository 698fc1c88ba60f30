package app.cardwise.core.review.util;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.store.EntityStore;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Day numbers for review due dates: whole study days since the collection was created, where a study
 * day starts at the configured rollover hour.
 */
@Component
public class StudyDays {

    private final EntityStore store;
    private final SchedulerProps props;

    public StudyDays(EntityStore store, SchedulerProps props) {
        this.store = store;
        this.props = props;
    }

    public long today(Instant now) {
        return dayNumber(studyDate(now));
    }

    public long dayNumber(LocalDate date) {
        return ChronoUnit.DAYS.between(studyDate(Instant.ofEpochSecond(store.createdAt())), date);
    }

    /**
     * Calendar date of the study day containing {@code instant}.
     */
    public LocalDate studyDate(Instant instant) {
        return LocalDate.ofInstant(instant.minus(Duration.ofHours(props.rolloverHour())), props.zone());
    }

    public LocalDate dateOf(long dayNumber) {
        return studyDate(Instant.ofEpochSecond(store.createdAt())).plusDays(dayNumber);
    }

    public Instant startOf(long dayNumber) {
        return dateOf(dayNumber).atTime(props.rolloverHour(), 0).atZone(props.zone()).toInstant();
    }
}

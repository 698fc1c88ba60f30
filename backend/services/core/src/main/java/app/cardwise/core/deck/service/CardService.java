package app.cardwise.core.deck.service;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.domain.type.CardQueue;
import app.cardwise.core.deck.domain.type.CardType;
import app.cardwise.core.store.EntityStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Bulk card edits outside of answering: suspend, bury, flag, move, forget, delete.
 */
@Service
public class CardService {

    static final int MAX_FLAG = 7;

    private final EntityStore store;
    private final Clock clock;

    public CardService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void suspend(Collection<Long> cardIds) {
        update(cardIds, card -> card.setQueue(CardQueue.SUSPENDED));
    }

    public void unsuspend(Collection<Long> cardIds) {
        update(cardIds, card -> {
            if (card.getQueue() == CardQueue.SUSPENDED) {
                card.setQueue(queueForType(card.getType()));
            }
        });
    }

    public void bury(Collection<Long> cardIds) {
        update(cardIds, card -> card.setQueue(CardQueue.USER_BURIED));
    }

    public void unbury(Collection<Long> cardIds) {
        update(cardIds, card -> {
            if (card.getQueue() == CardQueue.USER_BURIED || card.getQueue() == CardQueue.SCHED_BURIED) {
                card.setQueue(queueForType(card.getType()));
            }
        });
    }

    public void setFlag(Collection<Long> cardIds, int flag) {
        if (flag < 0 || flag > MAX_FLAG) {
            throw new IllegalArgumentException("Flag must be within 0.." + MAX_FLAG + ": " + flag);
        }
        update(cardIds, card -> card.setFlags(flag));
    }

    /**
     * Moves cards to another regular deck. Cards currently in a filtered deck keep their place there
     * and only change their home deck.
     */
    public void moveCards(Collection<Long> cardIds, long deckId) {
        DeckEntity deck = store.requireDeck(deckId);
        if (deck.isFiltered()) {
            throw new IllegalArgumentException("Cards cannot be moved into filtered deck " + deckId + " directly");
        }
        update(cardIds, card -> {
            if (card.inFilteredDeck()) {
                card.setOriginalDeckId(deckId);
            } else {
                card.setDeckId(deckId);
            }
        });
    }

    /**
     * Resets cards to brand new, placing them at the end of the new queue. History stays in the review log.
     */
    public void forget(Collection<Long> cardIds) {
        update(cardIds, card -> {
            card.setType(CardType.NEW);
            card.setQueue(CardQueue.NEW);
            card.setDue(store.nextPosition());
            card.setInterval(0);
            card.setEaseFactor(0);
            card.setReps(0);
            card.setLapses(0);
            card.setRemainingSteps(0);
        });
    }

    /**
     * Hard-deletes cards; notes left without any card are deleted too.
     */
    public void deleteCards(Collection<Long> cardIds) {
        Set<Long> notes = new HashSet<>();
        for (Long id : cardIds) {
            notes.add(store.requireCard(id).getNoteId());
        }
        cardIds.forEach(store::removeCard);
        for (Long noteId : notes) {
            if (store.cardsOfNote(noteId).isEmpty()) {
                store.removeNote(noteId);
            }
        }
    }

    static CardQueue queueForType(CardType type) {
        return switch (type) {
            case NEW -> CardQueue.NEW;
            case LEARNING, RELEARNING -> CardQueue.LEARNING;
            case REVIEW -> CardQueue.REVIEW;
        };
    }

    private void update(Collection<Long> cardIds, Consumer<CardEntity> change) {
        long now = clock.instant().getEpochSecond();
        List<CardEntity> updated = new ArrayList<>();
        for (Long id : cardIds) {
            CardEntity card = store.requireCard(id);
            change.accept(card);
            card.setMod(now);
            updated.add(card);
        }
        store.replaceCards(updated);
    }
}

package app.cardwise.core.deck.service;

import app.cardwise.core.config.SchedulerProps;
import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.DeckEntity;
import app.cardwise.core.deck.util.DeckHierarchy;
import app.cardwise.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class DeckService {

    private static final Logger log = LoggerFactory.getLogger(DeckService.class);

    private final EntityStore store;
    private final SchedulerProps props;
    private final Clock clock;

    public DeckService(EntityStore store, SchedulerProps props, Clock clock) {
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Returns the deck with this name, creating it and any missing ancestors first.
     */
    public DeckEntity createDeck(String name) {
        String normalized = DeckHierarchy.normalize(name);
        Optional<DeckEntity> existing = store.findDeckByName(normalized);
        if (existing.isPresent()) {
            return existing.get();
        }
        ensureAncestors(normalized);
        return store.insertDeck(newDeck(normalized, false));
    }

    public DeckEntity createFilteredDeck(String name) {
        String normalized = DeckHierarchy.normalize(name);
        if (store.findDeckByName(normalized).isPresent()) {
            throw new IllegalStateException("Deck already exists: " + normalized);
        }
        ensureAncestors(normalized);
        return store.insertDeck(newDeck(normalized, true));
    }

    public List<DeckEntity> listDecks() {
        return store.decks().stream().sorted(Comparator.comparing(DeckEntity::getName)).toList();
    }

    /**
     * The deck and its descendants, sorted by name.
     */
    public List<DeckEntity> deckTree(long deckId) {
        Set<Long> ids = store.deckTreeIds(deckId);
        return listDecks().stream().filter(deck -> ids.contains(deck.getId())).toList();
    }

    public DeckEntity setLimits(long deckId, int newPerDay, int reviewsPerDay) {
        if (newPerDay < 0 || reviewsPerDay < 0) {
            throw new IllegalArgumentException("Daily limits must be >= 0");
        }
        DeckEntity deck = store.requireDeck(deckId);
        deck.setNewPerDay(newPerDay);
        deck.setReviewsPerDay(reviewsPerDay);
        deck.setMod(clock.instant().getEpochSecond());
        store.replaceDeck(deck);
        return store.requireDeck(deckId);
    }

    /**
     * Renames a deck and moves its whole subtree along with it.
     */
    public DeckEntity renameDeck(long deckId, String newName) {
        if (deckId == EntityStore.DEFAULT_DECK_ID) {
            throw new IllegalArgumentException("The default deck cannot be renamed");
        }
        DeckEntity deck = store.requireDeck(deckId);
        String target = DeckHierarchy.normalize(newName);
        String source = deck.getName();
        if (source.equals(target)) {
            return deck;
        }
        if (!source.equalsIgnoreCase(target) && DeckHierarchy.isSameOrDescendant(target, source)) {
            throw new IllegalArgumentException("Deck " + source + " cannot be moved below itself");
        }
        Optional<DeckEntity> clash = store.findDeckByName(target);
        if (clash.isPresent() && clash.get().getId() != deckId) {
            throw new IllegalStateException("Deck already exists: " + target);
        }

        ensureAncestors(target);
        long now = clock.instant().getEpochSecond();
        List<DeckEntity> moved = new ArrayList<>();
        for (DeckEntity candidate : store.decks()) {
            if (DeckHierarchy.isSameOrDescendant(candidate.getName(), source)) {
                candidate.setName(DeckHierarchy.rebase(candidate.getName(), source, target));
                candidate.setMod(now);
                moved.add(candidate);
            }
        }
        store.replaceDecks(moved);
        log.info("Renamed deck deckId={} from={} to={} subtree={}", deckId, source, target, moved.size());
        return store.requireDeck(deckId);
    }

    /**
     * Deletes a deck with its descendants. Cards are either deleted (with notes left without cards) or
     * moved to the default deck. Cards that sit in a filtered deck being deleted go back home.
     */
    public void deleteDeck(long deckId, boolean deleteCards) {
        if (deckId == EntityStore.DEFAULT_DECK_ID) {
            throw new IllegalArgumentException("The default deck cannot be deleted");
        }
        store.requireDeck(deckId);
        Set<Long> tree = store.deckTreeIds(deckId);
        long now = clock.instant().getEpochSecond();

        List<CardEntity> toUpdate = new ArrayList<>();
        List<CardEntity> toRemove = new ArrayList<>();
        for (CardEntity card : store.findCards(card -> tree.contains(card.getDeckId()) || tree.contains(card.getOriginalDeckId()))) {
            boolean homeInTree = tree.contains(card.homeDeckId());
            if (homeInTree && deleteCards) {
                toRemove.add(card);
                continue;
            }
            if (card.inFilteredDeck() && tree.contains(card.getDeckId())) {
                card.setDeckId(card.getOriginalDeckId());
                card.setDue(card.getOriginalDue());
                card.setOriginalDeckId(0);
                card.setOriginalDue(0);
            }
            if (card.inFilteredDeck() && homeInTree) {
                card.setOriginalDeckId(EntityStore.DEFAULT_DECK_ID);
            } else if (tree.contains(card.getDeckId())) {
                card.setDeckId(EntityStore.DEFAULT_DECK_ID);
            }
            card.setMod(now);
            toUpdate.add(card);
        }

        if (!toUpdate.isEmpty()) {
            store.replaceCards(toUpdate);
        }
        Set<Long> touchedNotes = new HashSet<>();
        for (CardEntity card : toRemove) {
            store.removeCard(card.getId());
            touchedNotes.add(card.getNoteId());
        }
        for (Long noteId : touchedNotes) {
            if (store.cardsOfNote(noteId).isEmpty()) {
                store.removeNote(noteId);
            }
        }

        List<DeckEntity> decks = new ArrayList<>(store.decks().stream().filter(deck -> tree.contains(deck.getId())).toList());
        decks.sort(Comparator.comparing((DeckEntity deck) -> deck.getName().length()).reversed());
        for (DeckEntity deck : decks) {
            store.removeDeck(deck.getId());
        }
        log.info("Deleted deck deckId={} decks={} removedCards={} movedCards={}",
                deckId, decks.size(), toRemove.size(), toUpdate.size());
    }

    private void ensureAncestors(String name) {
        for (String ancestor : DeckHierarchy.ancestors(name)) {
            if (store.findDeckByName(ancestor).isEmpty()) {
                store.insertDeck(newDeck(ancestor, false));
            }
        }
    }

    private DeckEntity newDeck(String name, boolean filtered) {
        DeckEntity deck = new DeckEntity(0, name, props.newPerDay(), props.reviewsPerDay());
        deck.setFiltered(filtered);
        deck.setMod(clock.instant().getEpochSecond());
        return deck;
    }
}

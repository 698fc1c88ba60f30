package app.cardwise.core.search;

import app.cardwise.core.deck.domain.entity.CardEntity;
import app.cardwise.core.deck.domain.entity.NoteEntity;
import app.cardwise.core.store.EntityStore;
import app.cardwise.core.text.PlainText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token index over note fields and tags.
 * <p>
 * The index follows the store lazily. Before a search it re-reads every note the store reports as changed
 * since the last catch-up, and rebuilds from scratch only after the store's tables were replaced
 * wholesale. {@link #indexNote}, {@link #updateNote} and {@link #removeNote} refresh a single entry
 * eagerly; they never mark other notes as current.
 */
@Component
public class SearchIndex {

    private static final Logger log = LoggerFactory.getLogger(SearchIndex.class);

    static final int EXACT_SCORE = 10;
    static final int PREFIX_SCORE = 5;
    static final int SUBSTRING_SCORE = 2;
    static final int TAG_SCORE = 15;

    private static final Pattern NON_WORD_PATTERN = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final String ELLIPSIS = "...";

    private final EntityStore store;
    private final Map<Long, IndexedNote> entries = new LinkedHashMap<>();
    private long syncedVersion = -1;

    public SearchIndex(EntityStore store) {
        this.store = store;
    }

    public void indexAll() {
        entries.clear();
        for (NoteEntity note : store.notes()) {
            entries.put(note.getId(), toEntry(note));
        }
        syncedVersion = store.version();
        log.debug("Search index rebuilt notes={}", entries.size());
    }

    public void indexNote(long noteId) {
        refresh(noteId);
    }

    public void updateNote(long noteId) {
        indexNote(noteId);
    }

    public void removeNote(long noteId) {
        entries.remove(noteId);
    }

    /**
     * Forces a rebuild on the next search.
     */
    public void invalidate() {
        syncedVersion = -1;
    }

    public List<Long> search(String query, SearchOptions options) {
        return searchWithScores(query, options).stream().map(SearchHit::noteId).toList();
    }

    public List<Long> search(String query) {
        return search(query, SearchOptions.defaults());
    }

    /**
     * Ranked hits. A blank or token-free query returns nothing.
     */
    public List<SearchHit> searchWithScores(String query, SearchOptions options) {
        List<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        ensureCurrent();

        Set<Long> deckIds = opts.deckId() == null ? null : store.deckTreeIds(opts.deckId());
        if (deckIds != null && deckIds.isEmpty()) {
            return List.of();
        }
        String tagFilter = opts.tag() == null || opts.tag().isBlank() ? null : opts.tag().trim().toLowerCase(Locale.ROOT);

        List<SearchHit> hits = new ArrayList<>();
        for (IndexedNote entry : entries.values()) {
            if (tagFilter != null && !entry.tags().contains(tagFilter)) {
                continue;
            }
            int score = score(entry, queryTokens);
            if (score <= 0) {
                continue;
            }
            if (deckIds != null && !inDecks(entry.noteId(), deckIds)) {
                continue;
            }
            hits.add(new SearchHit(entry.noteId(), score));
        }
        hits.sort(Comparator.comparingInt(SearchHit::score).reversed());
        return hits.size() > opts.limit() ? List.copyOf(hits.subList(0, opts.limit())) : hits;
    }

    /**
     * Plain text of the note's fields, cut to {@code maxLength} characters plus {@code ...} when longer.
     * Unknown notes yield an empty string.
     */
    public String getPreview(long noteId, int maxLength) {
        String text = store.findNote(noteId)
                .map(note -> PlainText.strip(String.join(" ", note.fieldValues())))
                .orElse("");
        if (maxLength < 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength).stripTrailing() + ELLIPSIS;
    }

    public SearchStats stats() {
        ensureCurrent();
        Set<String> tokens = new HashSet<>();
        entries.values().forEach(entry -> tokens.addAll(entry.tokens()));
        return new SearchStats(entries.size(), tokens.size());
    }

    /**
     * Lowercases, turns punctuation into spaces and drops one-character tokens.
     */
    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = NON_WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE_PATTERN.split(cleaned.trim())) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private void ensureCurrent() {
        long current = store.version();
        if (syncedVersion == current) {
            return;
        }
        if (syncedVersion < 0 || store.resetVersion() > syncedVersion) {
            indexAll();
            return;
        }
        Set<Long> changed = store.notesChangedSince(syncedVersion);
        changed.forEach(this::refresh);
        syncedVersion = current;
        log.debug("Search index caught up changedNotes={}", changed.size());
    }

    private void refresh(long noteId) {
        store.findNote(noteId).ifPresentOrElse(
                note -> entries.put(noteId, toEntry(note)),
                () -> entries.remove(noteId)
        );
    }

    private int score(IndexedNote entry, List<String> queryTokens) {
        int score = 0;
        for (String queryToken : queryTokens) {
            for (String token : entry.tokens()) {
                if (token.equals(queryToken)) {
                    score += EXACT_SCORE;
                } else if (token.startsWith(queryToken)) {
                    score += PREFIX_SCORE;
                } else if (token.contains(queryToken)) {
                    score += SUBSTRING_SCORE;
                }
            }
            for (String tag : entry.tags()) {
                if (tag.contains(queryToken)) {
                    score += TAG_SCORE;
                }
            }
        }
        return score;
    }

    private boolean inDecks(long noteId, Set<Long> deckIds) {
        for (CardEntity card : store.cardsOfNote(noteId)) {
            if (!card.isDeleted() && deckIds.contains(card.getDeckId())) {
                return true;
            }
        }
        return false;
    }

    private IndexedNote toEntry(NoteEntity note) {
        String text = PlainText.strip(String.join(" ", note.fieldValues())).toLowerCase(Locale.ROOT);
        Set<String> tags = new LinkedHashSet<>();
        note.tagSet().forEach(tag -> tags.add(tag.toLowerCase(Locale.ROOT)));
        return new IndexedNote(note.getId(), new LinkedHashSet<>(tokenize(text)), tags);
    }

    private record IndexedNote(long noteId, Set<String> tokens, Set<String> tags) {
    }
}

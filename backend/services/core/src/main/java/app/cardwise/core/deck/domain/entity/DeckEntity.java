package app.cardwise.core.deck.domain.entity;

/**
 * Deck row. Hierarchy is derived from the {@code ::}-separated name, see
 * {@link app.cardwise.core.deck.util.DeckHierarchy}.
 */
public class DeckEntity {

    private long id;
    private String name;
    private String description = "";
    private int newPerDay;
    private int reviewsPerDay;
    private boolean collapsed;
    private boolean browserCollapsed;
    private boolean filtered;
    private long mod;
    private String algorithm = "";

    public DeckEntity() {
    }

    public DeckEntity(
            long id,
            String name,
            int newPerDay,
            int reviewsPerDay
    ) {
        this.id = id;
        this.name = name;
        this.newPerDay = newPerDay;
        this.reviewsPerDay = reviewsPerDay;
    }

    public DeckEntity copy() {
        DeckEntity copy = new DeckEntity();
        copy.id = id;
        copy.name = name;
        copy.description = description;
        copy.newPerDay = newPerDay;
        copy.reviewsPerDay = reviewsPerDay;
        copy.collapsed = collapsed;
        copy.browserCollapsed = browserCollapsed;
        copy.filtered = filtered;
        copy.mod = mod;
        copy.algorithm = algorithm;
        return copy;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getNewPerDay() {
        return newPerDay;
    }

    public void setNewPerDay(int newPerDay) {
        this.newPerDay = newPerDay;
    }

    public int getReviewsPerDay() {
        return reviewsPerDay;
    }

    public void setReviewsPerDay(int reviewsPerDay) {
        this.reviewsPerDay = reviewsPerDay;
    }

    public boolean isCollapsed() {
        return collapsed;
    }

    public void setCollapsed(boolean collapsed) {
        this.collapsed = collapsed;
    }

    public boolean isBrowserCollapsed() {
        return browserCollapsed;
    }

    public void setBrowserCollapsed(boolean browserCollapsed) {
        this.browserCollapsed = browserCollapsed;
    }

    public boolean isFiltered() {
        return filtered;
    }

    public void setFiltered(boolean filtered) {
        this.filtered = filtered;
    }

    public long getMod() {
        return mod;
    }

    public void setMod(long mod) {
        this.mod = mod;
    }

    /**
     * Id of the scheduling algorithm for cards whose home is this deck; blank means the collection default.
     */
    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm == null ? "" : algorithm;
    }

}

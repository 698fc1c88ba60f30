package app.cardwise.core.deck.domain.entity;

import app.cardwise.core.text.PlainText;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public class NoteEntity {

    private static final Pattern SEPARATOR_PATTERN = Pattern.compile(PlainText.FIELD_SEPARATOR, Pattern.LITERAL);

    private long id;
    private String guid;
    private long modelId;
    private String fields = "";
    private String tags = "";
    private long mod;

    public NoteEntity() {
    }

    public NoteEntity(
            long id,
            String guid,
            long modelId,
            String fields,
            String tags
    ) {
        this.id = id;
        this.guid = guid;
        this.modelId = modelId;
        this.fields = fields;
        this.tags = tags;
    }

    public NoteEntity copy() {
        NoteEntity copy = new NoteEntity();
        copy.id = id;
        copy.guid = guid;
        copy.modelId = modelId;
        copy.fields = fields;
        copy.tags = tags;
        copy.mod = mod;
        return copy;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getGuid() {
        return guid;
    }

    public void setGuid(String guid) {
        this.guid = guid;
    }

    public long getModelId() {
        return modelId;
    }

    public void setModelId(long modelId) {
        this.modelId = modelId;
    }

    public String getFields() {
        return fields;
    }

    public void setFields(String fields) {
        this.fields = fields;
    }

    public String getTags() {
        return tags;
    }

    public void setTags(String tags) {
        this.tags = tags;
    }

    public long getMod() {
        return mod;
    }

    public void setMod(long mod) {
        this.mod = mod;
    }

    public List<String> fieldValues() {
        return unpack(fields);
    }

    public Set<String> tagSet() {
        Set<String> set = new LinkedHashSet<>();
        if (tags == null) {
            return set;
        }
        for (String tag : tags.trim().split("\\s+")) {
            if (!tag.isEmpty()) {
                set.add(tag);
            }
        }
        return set;
    }

    public static String pack(List<String> values) {
        for (String value : values) {
            if (value != null && value.contains(PlainText.FIELD_SEPARATOR)) {
                throw new IllegalArgumentException("Field value contains the field separator");
            }
        }
        return String.join(PlainText.FIELD_SEPARATOR, values.stream().map(v -> v == null ? "" : v).toList());
    }

    public static List<String> unpack(String packed) {
        if (packed == null) {
            return List.of();
        }
        return Arrays.asList(SEPARATOR_PATTERN.split(packed, -1));
    }

    /**
     * Tags in the stored form: space separated with a leading and trailing space, so a
     * {@code " tag "} substring test is an exact membership test.
     */
    public static String joinTags(Iterable<String> tags) {
        StringBuilder out = new StringBuilder();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            out.append(' ').append(tag.trim());
        }
        return out.length() == 0 ? "" : out.append(' ').toString();
    }
}

package app.cardwise.core.deck.domain.entity;

import app.cardwise.core.deck.domain.type.ModelType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Note type: ordered field names plus the card templates that decide how many cards a note yields.
 */
public class ModelEntity {

    private static final Pattern CLOZE_REFERENCE_PATTERN = Pattern.compile("\\{\\{(?:[^}:]*:)*cloze:([^}]+)}}");

    private long id;
    private String name;
    private ModelType type = ModelType.STANDARD;
    private List<String> fields = new ArrayList<>();
    private List<CardTemplate> templates = new ArrayList<>();
    private int sortField;
    private String css = "";
    private long mod;

    public ModelEntity() {
    }

    public ModelEntity(
            long id,
            String name,
            ModelType type,
            List<String> fields,
            List<CardTemplate> templates
    ) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.fields = new ArrayList<>(fields);
        this.templates = new ArrayList<>(templates);
    }

    public ModelEntity copy() {
        ModelEntity copy = new ModelEntity();
        copy.id = id;
        copy.name = name;
        copy.type = type;
        copy.fields = new ArrayList<>(fields);
        copy.templates = new ArrayList<>(templates);
        copy.sortField = sortField;
        copy.css = css;
        copy.mod = mod;
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

    public ModelType getType() {
        return type;
    }

    public void setType(ModelType type) {
        this.type = type;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = new ArrayList<>(fields);
    }

    public List<CardTemplate> getTemplates() {
        return templates;
    }

    public void setTemplates(List<CardTemplate> templates) {
        this.templates = new ArrayList<>(templates);
    }

    public int getSortField() {
        return sortField;
    }

    public void setSortField(int sortField) {
        this.sortField = sortField;
    }

    public String getCss() {
        return css;
    }

    public void setCss(String css) {
        this.css = css;
    }

    public long getMod() {
        return mod;
    }

    public void setMod(long mod) {
        this.mod = mod;
    }

    public int fieldIndex(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).equalsIgnoreCase(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Field holding the cloze text: the one referenced as {@code {{cloze:Name}}} by the first template,
     * falling back to the first field.
     */
    public int clozeFieldIndex() {
        if (!templates.isEmpty() && templates.get(0).questionFormat() != null) {
            Matcher matcher = CLOZE_REFERENCE_PATTERN.matcher(templates.get(0).questionFormat());
            if (matcher.find()) {
                int index = fieldIndex(matcher.group(1).trim());
                if (index >= 0) {
                    return index;
                }
            }
        }
        return 0;
    }

    public boolean usesCloze() {
        return type == ModelType.CLOZE;
    }
}

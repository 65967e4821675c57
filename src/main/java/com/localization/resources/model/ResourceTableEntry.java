package com.localization.resources.model;

import com.localization.resources.exception.DuplicateKeyException;
import com.localization.resources.exception.ResourceImmutableException;
import com.localization.resources.validation.StringFormatParameterValidator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One resource key with its values and comments in every culture of the owning entity.
 *
 * <p>The first language of the map passed at construction is the neutral language. It holds the
 * comment of the entry and is the baseline for format parameter checks.</p>
 *
 * <p>Entries are equal if they have the same owner and key. The key can change, so an entry must
 * not be renamed while it is held in a hash based collection.</p>
 *
 * <p>Not thread-safe. Property change events are fired on the calling thread after the entry's
 * state has been updated; they carry no old or new values, listeners are expected to re-read.</p>
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ResourceTableEntry {
    private static final Logger log = LoggerFactory.getLogger(ResourceTableEntry.class);

    @Getter
    @EqualsAndHashCode.Include
    private final ResourceEntity owner;

    private final Map<CultureKey, ResourceLanguage> languages;

    @Getter
    private final ResourceLanguage neutralLanguage;

    @Getter
    private final ResourceTableValues<Boolean> fileExists;

    @Getter
    private final ResourceTableValues<String> errors;

    private final PropertyChangeSupport changeSupport = new PropertyChangeSupport(this);

    private final ValueChangedListener valuesListener = (source, culture) -> notifyChanged(EntryProperty.VALUES);
    private final ValueChangedListener commentsListener = (source, culture) -> notifyChanged(EntryProperty.COMMENT);

    @Getter
    @EqualsAndHashCode.Include
    private String key;

    @Getter
    private ResourceTableValues<String> values;

    @Getter
    private ResourceTableValues<String> comments;

    @Getter
    private List<CodeReference> codeReferences = List.of();

    /**
     * @param owner the entity this entry belongs to
     * @param key the resource key, not empty
     * @param languages the languages of the owner in order, the neutral language first
     */
    ResourceTableEntry(@NonNull ResourceEntity owner, String key, @NonNull Map<CultureKey, ResourceLanguage> languages) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Resource key must not be empty");
        }
        if (languages.isEmpty()) {
            throw new IllegalArgumentException("At least one language is required for key " + key);
        }

        this.owner = owner;
        this.key = key;
        this.languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));

        this.neutralLanguage = this.languages.values().iterator().next();
        this.neutralLanguage.setNeutralLanguage(true);

        this.fileExists = new ResourceTableValues<>(this.languages, language -> Boolean.TRUE, (language, value) -> false);
        this.errors = new ResourceTableValues<>(this.languages, this::getError, (language, value) -> false);

        createTableValues();
    }

    /**
     * Rename this resource in all cultures.
     *
     * <p>All cultures are checked before any is modified, the rename is applied completely or not
     * at all. A rejected rename leaves the key unchanged but still fires a {@code Key} change event,
     * so bound views re-read the key and show that the edit did not take effect. Listeners must not
     * take a {@code Key} event as proof of success.</p>
     *
     * @throws IllegalArgumentException if the new key is empty
     * @throws DuplicateKeyException if any culture or another entry of the owner already has the new key
     * @throws ResourceImmutableException if any culture cannot be changed
     */
    public void setKey(String newKey) {
        if (key.equals(newKey)) {
            return;
        }
        if (newKey == null || newKey.isEmpty()) {
            throw new IllegalArgumentException("Resource key must not be empty");
        }

        Collection<ResourceLanguage> resourceLanguages = languages.values();

        // an entry added to the owner is stored in no culture until it gets a value
        if (owner.findEntry(newKey).isPresent()
                || resourceLanguages.stream().anyMatch(language -> language.keyExists(newKey))) {
            log.warn("Rejected rename of '{}' in {}: key '{}' already exists", key, owner, newKey);
            fireChanged(EntryProperty.KEY);
            throw new DuplicateKeyException(newKey);
        }

        List<CultureKey> readOnlyCultures = resourceLanguages.stream()
                .filter(language -> !language.canChange())
                .map(ResourceLanguage::getCultureKey)
                .collect(Collectors.toList());
        if (!readOnlyCultures.isEmpty()) {
            log.warn("Rejected rename of '{}' in {}: read-only cultures {}", key, owner, readOnlyCultures);
            fireChanged(EntryProperty.KEY);
            throw new ResourceImmutableException(newKey, readOnlyCultures);
        }

        for (ResourceLanguage language : resourceLanguages) {
            language.renameKey(key, newKey);
        }

        log.debug("Renamed '{}' to '{}' in {}", key, newKey, owner);
        key = newKey;

        createTableValues();
        notifyChanged(EntryProperty.KEY);
    }

    /**
     * @return the comment of the neutral language, empty if there is none
     */
    public String getComment() {
        String comment = neutralLanguage.getComment(key);
        return comment != null ? comment : "";
    }

    /**
     * Set the comment of the neutral language. Other cultures are not touched.
     */
    public void setComment(String comment) {
        if (neutralLanguage.setComment(key, comment)) {
            notifyChanged(EntryProperty.COMMENT);
        }
    }

    public boolean isInvariant() {
        return indexOfMarker(getComment()) >= 0;
    }

    /**
     * Mark or unmark this entry as not requiring translation. Unmarking removes every occurrence
     * of the marker from the comment.
     */
    public void setInvariant(boolean invariant) {
        String comment = getComment();

        if (invariant) {
            if (indexOfMarker(comment) < 0) {
                setComment(comment + marker());
            }
            return;
        }

        int index;
        while ((index = indexOfMarker(comment)) >= 0) {
            comment = comment.substring(0, index) + comment.substring(index + marker().length());
        }
        setComment(comment);
    }

    /**
     * @return {@code true} if the non-empty values of this entry use different format parameters;
     * always {@code false} for invariant entries
     */
    public boolean hasAnyStringFormatParameterMismatches() {
        return !isInvariant() && StringFormatParameterValidator.hasMismatches(values.asMap().values());
    }

    /**
     * Compare the format parameters of the given cultures only. Invariance is not considered.
     *
     * @throws com.localization.resources.exception.CultureNotFoundException for an unknown culture
     */
    public boolean hasStringFormatParameterMismatches(Collection<CultureKey> cultures) {
        List<String> selected = cultures.stream()
                .map(values::get)
                .collect(Collectors.toList());
        return StringFormatParameterValidator.hasMismatches(selected);
    }

    /**
     * Replace the code references found for this key. The list is not interpreted.
     */
    public void setCodeReferences(List<CodeReference> codeReferences) {
        this.codeReferences = codeReferences != null ? List.copyOf(codeReferences) : List.of();
        notifyChanged(EntryProperty.CODE_REFERENCES);
    }

    public boolean canEdit(CultureKey culture) {
        return owner.canEdit(culture);
    }

    /**
     * Tell listeners to re-read values and comments, e.g. after the languages were reloaded.
     */
    public void refresh() {
        notifyChanged(EntryProperty.VALUES);
        notifyChanged(EntryProperty.COMMENT);
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changeSupport.addPropertyChangeListener(listener);
    }

    public void addPropertyChangeListener(EntryProperty property, PropertyChangeListener listener) {
        changeSupport.addPropertyChangeListener(property.getPropertyName(), listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changeSupport.removePropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(EntryProperty property, PropertyChangeListener listener) {
        changeSupport.removePropertyChangeListener(property.getPropertyName(), listener);
    }

    @Override
    public String toString() {
        return "ResourceTableEntry[" + owner.getBaseName() + ":" + key + "]";
    }

    // getters and setters capture the current key, so they are replaced on every rename
    private void createTableValues() {
        if (values != null) {
            values.removeValueChangedListener(valuesListener);
            comments.removeValueChangedListener(commentsListener);
        }

        String currentKey = key;
        values = new ResourceTableValues<>(languages,
                language -> language.getValue(currentKey),
                (language, value) -> language.setValue(currentKey, value));
        values.addValueChangedListener(valuesListener);

        comments = new ResourceTableValues<>(languages,
                language -> language.getComment(currentKey),
                (language, value) -> language.setComment(currentKey, value));
        comments.addValueChangedListener(commentsListener);
    }

    private String getError(ResourceLanguage language) {
        if (language == neutralLanguage) {
            return null;
        }

        String value = language.getValue(key);
        if (value == null || value.isEmpty()) {
            return null;
        }

        String neutralValue = neutralLanguage.getValue(key);
        if (neutralValue == null || neutralValue.isEmpty()) {
            return null;
        }

        if (StringFormatParameterValidator.hasMismatches(neutralValue, value)) {
            return owner.getConfig().getFormatParameterMismatchError();
        }
        return null;
    }

    private String marker() {
        return owner.getConfig().getInvariantMarker();
    }

    private int indexOfMarker(String comment) {
        String marker = marker();
        if (marker.isEmpty()) {
            return -1;
        }
        for (int i = 0; i + marker.length() <= comment.length(); i++) {
            if (comment.regionMatches(true, i, marker, 0, marker.length())) {
                return i;
            }
        }
        return -1;
    }

    private void notifyChanged(EntryProperty property) {
        for (EntryProperty affected : property.affected()) {
            fireChanged(affected);
        }
    }

    private void fireChanged(EntryProperty property) {
        changeSupport.firePropertyChange(property.getPropertyName(), null, null);
    }
}

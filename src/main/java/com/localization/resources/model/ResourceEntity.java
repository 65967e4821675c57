package com.localization.resources.model;

import com.localization.resources.exception.DuplicateKeyException;
import com.localization.resources.exception.ResourceImmutableException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named resource (e.g. one bundle base name) with its languages and one entry per key.
 *
 * <p>The entity is the only party that adds or removes keys; entries only edit and rename them.</p>
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ResourceEntity {
    private static final Logger log = LoggerFactory.getLogger(ResourceEntity.class);

    @Getter
    @EqualsAndHashCode.Include
    private final String projectName;

    @Getter
    @EqualsAndHashCode.Include
    private final String baseName;

    @Getter
    private final ResourceTableConfig config;

    private final Map<CultureKey, ResourceLanguage> languages;
    private final List<ResourceTableEntry> entries = new ArrayList<>();

    /**
     * @param languages the languages in display order; the first one is the neutral language
     */
    public ResourceEntity(@NonNull String projectName, @NonNull String baseName,
                          @NonNull Map<CultureKey, ResourceLanguage> languages, ResourceTableConfig config) {
        if (languages.isEmpty()) {
            throw new IllegalArgumentException("Resource entity " + baseName + " has no languages");
        }
        this.projectName = projectName;
        this.baseName = baseName;
        this.languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        this.config = config != null ? config : ResourceTableConfig.defaults();

        Set<String> keys = new LinkedHashSet<>();
        for (ResourceLanguage language : this.languages.values()) {
            keys.addAll(language.getKeys());
        }
        for (String key : keys) {
            entries.add(new ResourceTableEntry(this, key, this.languages));
        }
        log.debug("Loaded {} with {} keys in {} cultures", baseName, entries.size(), this.languages.size());
    }

    public List<ResourceTableEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Optional<ResourceTableEntry> findEntry(String key) {
        return entries.stream()
                .filter(entry -> entry.getKey().equals(key))
                .findFirst();
    }

    public Set<CultureKey> getCultureKeys() {
        return languages.keySet();
    }

    public Optional<ResourceLanguage> getLanguage(CultureKey culture) {
        return Optional.ofNullable(languages.get(culture));
    }

    public ResourceLanguage getNeutralLanguage() {
        return languages.values().iterator().next();
    }

    public boolean canEdit(CultureKey culture) {
        ResourceLanguage language = languages.get(culture);
        return language != null && language.canChange();
    }

    /**
     * Add an entry for a key that no culture contains yet. The key is stored in a culture
     * as soon as a value or comment is set through the entry.
     *
     * @throws DuplicateKeyException if any culture already contains the key
     */
    public ResourceTableEntry add(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Resource key must not be empty");
        }
        if (findEntry(key).isPresent() || languages.values().stream().anyMatch(language -> language.keyExists(key))) {
            throw new DuplicateKeyException(key);
        }

        ResourceTableEntry entry = new ResourceTableEntry(this, key, languages);
        entries.add(entry);
        log.debug("Added key '{}' to {}", key, baseName);
        return entry;
    }

    /**
     * Remove the entry's key from every culture and drop the entry.
     *
     * @return {@code false} if the entry does not belong to this entity
     * @throws ResourceImmutableException if any culture cannot be changed
     */
    public boolean remove(ResourceTableEntry entry) {
        if (!entries.contains(entry)) {
            return false;
        }

        List<CultureKey> readOnlyCultures = languages.values().stream()
                .filter(language -> !language.canChange())
                .map(ResourceLanguage::getCultureKey)
                .collect(Collectors.toList());
        if (!readOnlyCultures.isEmpty()) {
            throw new ResourceImmutableException(entry.getKey(), readOnlyCultures);
        }

        entries.remove(entry);
        for (ResourceLanguage language : languages.values()) {
            language.removeKey(entry.getKey());
        }
        log.debug("Removed key '{}' from {}", entry.getKey(), baseName);
        return true;
    }

    @Override
    public String toString() {
        return projectName + "/" + baseName;
    }
}

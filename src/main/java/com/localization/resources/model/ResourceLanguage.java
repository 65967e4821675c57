package com.localization.resources.model;

import com.localization.resources.exception.DuplicateKeyException;
import com.localization.resources.exception.ResourceImmutableException;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Values and comments of all resource keys for one culture.
 *
 * <p>One language instance is shared by every entry of its resource entity.
 * Keys keep their insertion order, a rename keeps the key's position.</p>
 */
public class ResourceLanguage {
    private static final Logger log = LoggerFactory.getLogger(ResourceLanguage.class);

    @Getter
    private final CultureKey cultureKey;

    @Getter
    private final boolean readOnly;

    @Getter
    @Setter
    private boolean neutralLanguage;

    private Map<String, ResourceNode> nodes = new LinkedHashMap<>();

    public ResourceLanguage(@NonNull CultureKey cultureKey) {
        this(cultureKey, Map.of(), false);
    }

    public ResourceLanguage(@NonNull CultureKey cultureKey, @NonNull Map<String, String> values, boolean readOnly) {
        this.cultureKey = cultureKey;
        this.readOnly = readOnly;
        values.forEach((key, value) -> nodes.put(key, new ResourceNode(value, null)));
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public boolean keyExists(String key) {
        return nodes.containsKey(key);
    }

    public boolean canChange() {
        return !readOnly;
    }

    /**
     * @return the value, or {@code null} if the key does not exist
     */
    public String getValue(String key) {
        ResourceNode node = nodes.get(key);
        return node != null ? node.value : null;
    }

    /**
     * @return {@code true} if the stored value changed
     */
    public boolean setValue(String key, String value) {
        if (!canChange()) {
            log.debug("Ignoring value change of '{}' in read-only culture {}", key, cultureKey);
            return false;
        }

        ResourceNode node = nodes.get(key);
        if (node == null) {
            if (isNullOrEmpty(value)) {
                return false;
            }
            nodes.put(key, new ResourceNode(value, null));
            log.debug("Added key '{}' to culture {}", key, cultureKey);
            return true;
        }

        if (Objects.equals(node.value, value)) {
            return false;
        }
        node.value = value;
        log.debug("Changed value of '{}' in culture {}", key, cultureKey);
        return true;
    }

    /**
     * @return the comment, or {@code null} if the key does not exist or has no comment
     */
    public String getComment(String key) {
        ResourceNode node = nodes.get(key);
        return node != null ? node.comment : null;
    }

    /**
     * @return {@code true} if the stored comment changed
     */
    public boolean setComment(String key, String comment) {
        if (!canChange()) {
            log.debug("Ignoring comment change of '{}' in read-only culture {}", key, cultureKey);
            return false;
        }

        ResourceNode node = nodes.get(key);
        if (node == null) {
            if (isNullOrEmpty(comment)) {
                return false;
            }
            nodes.put(key, new ResourceNode(null, comment));
            log.debug("Added key '{}' to culture {}", key, cultureKey);
            return true;
        }

        if (Objects.equals(node.comment, comment)) {
            return false;
        }
        node.comment = comment;
        log.debug("Changed comment of '{}' in culture {}", key, cultureKey);
        return true;
    }

    /**
     * Move the value and comment stored under {@code oldKey} to {@code newKey}.
     * Does nothing if {@code oldKey} does not exist in this culture.
     *
     * @throws ResourceImmutableException if this language is read-only
     * @throws DuplicateKeyException if {@code newKey} already exists
     */
    public void renameKey(String oldKey, String newKey) {
        if (!canChange()) {
            throw new ResourceImmutableException(newKey, List.of(cultureKey));
        }
        if (keyExists(newKey)) {
            throw new DuplicateKeyException(newKey);
        }
        if (!keyExists(oldKey)) {
            return;
        }

        Map<String, ResourceNode> renamed = new LinkedHashMap<>();
        nodes.forEach((key, node) -> renamed.put(key.equals(oldKey) ? newKey : key, node));
        nodes = renamed;
        log.debug("Renamed key '{}' to '{}' in culture {}", oldKey, newKey, cultureKey);
    }

    /**
     * @return {@code true} if the key existed and was removed
     * @throws ResourceImmutableException if this language is read-only
     */
    public boolean removeKey(String key) {
        if (!canChange()) {
            throw new ResourceImmutableException(key, List.of(cultureKey));
        }
        boolean removed = nodes.remove(key) != null;
        if (removed) {
            log.debug("Removed key '{}' from culture {}", key, cultureKey);
        }
        return removed;
    }

    @Override
    public String toString() {
        return "ResourceLanguage[" + cultureKey + (neutralLanguage ? ", neutral" : "") + "]";
    }

    private static boolean isNullOrEmpty(String s) {
        return s == null || s.isEmpty();
    }

    private static final class ResourceNode {
        private String value;
        private String comment;

        private ResourceNode(String value, String comment) {
            this.value = value;
            this.comment = comment;
        }
    }
}

package com.localization.resources.model;

import com.localization.resources.exception.CultureNotFoundException;
import lombok.NonNull;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Projects one attribute of a resource key (its value, comment, error, ...) across all cultures.
 *
 * <p>The culture set is fixed when the projection is created. Reads and writes are delegated to
 * the getter and setter supplied by the owner; listeners are told about every write the setter
 * reports as a change.</p>
 *
 * @param <T> the projected attribute type
 */
public class ResourceTableValues<T> implements Iterable<Map.Entry<CultureKey, T>> {

    private final Map<CultureKey, ResourceLanguage> languages;
    private final Function<ResourceLanguage, T> getter;
    private final BiPredicate<ResourceLanguage, T> setter;
    private final List<ValueChangedListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param languages the languages to project over, iterated in the map's order
     * @param getter reads the attribute from a language
     * @param setter writes the attribute to a language and reports whether the store changed
     */
    public ResourceTableValues(@NonNull Map<CultureKey, ResourceLanguage> languages,
                               @NonNull Function<ResourceLanguage, T> getter,
                               @NonNull BiPredicate<ResourceLanguage, T> setter) {
        this.languages = Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * @throws CultureNotFoundException if the culture is not part of this projection
     */
    public T get(CultureKey culture) {
        return getter.apply(languageOf(culture));
    }

    /**
     * Write a value for one culture. Listeners are notified once if the underlying store changed.
     *
     * @return {@code true} if the store reported a change
     * @throws CultureNotFoundException if the culture is not part of this projection
     */
    public boolean set(CultureKey culture, T value) {
        boolean changed = setter.test(languageOf(culture), value);
        if (changed) {
            for (ValueChangedListener listener : listeners) {
                listener.valueChanged(this, culture);
            }
        }
        return changed;
    }

    public Set<CultureKey> getCultures() {
        return languages.keySet();
    }

    public boolean containsCulture(CultureKey culture) {
        return languages.containsKey(culture);
    }

    public int size() {
        return languages.size();
    }

    public Stream<Map.Entry<CultureKey, T>> stream() {
        return languages.entrySet().stream()
                .<Map.Entry<CultureKey, T>>map(e -> new AbstractMap.SimpleImmutableEntry<>(e.getKey(), getter.apply(e.getValue())));
    }

    @Override
    public Iterator<Map.Entry<CultureKey, T>> iterator() {
        return stream().iterator();
    }

    /**
     * Snapshot of the current values in culture order. Null values are kept.
     */
    public Map<CultureKey, T> asMap() {
        Map<CultureKey, T> result = new LinkedHashMap<>();
        languages.forEach((culture, language) -> result.put(culture, getter.apply(language)));
        return result;
    }

    public void addValueChangedListener(@NonNull ValueChangedListener listener) {
        listeners.add(listener);
    }

    public void removeValueChangedListener(ValueChangedListener listener) {
        listeners.remove(listener);
    }

    private ResourceLanguage languageOf(CultureKey culture) {
        ResourceLanguage language = languages.get(culture);
        if (language == null) {
            throw new CultureNotFoundException(culture);
        }
        return language;
    }
}

package com.localization.resources.model;

/**
 * Receives a callback after a {@link ResourceTableValues} write changed the underlying store.
 */
@FunctionalInterface
public interface ValueChangedListener {

    void valueChanged(ResourceTableValues<?> source, CultureKey culture);
}

package com.localization.resources.exception;

import com.localization.resources.model.CultureKey;

import java.util.List;

/**
 * Thrown when one or more resource languages refuse modification,
 * e.g. because the underlying file is read-only.
 */
public class ResourceImmutableException extends ResourceKeyException {

	private static final long serialVersionUID = 1L;
	private final transient List<CultureKey> readOnlyCultures;

    public ResourceImmutableException(String key, List<CultureKey> readOnlyCultures) {
        super(key, "Cannot change key '" + key + "', read-only cultures: " + readOnlyCultures);
        this.readOnlyCultures = List.copyOf(readOnlyCultures);
    }

    public List<CultureKey> getReadOnlyCultures() {
        return readOnlyCultures;
    }
}

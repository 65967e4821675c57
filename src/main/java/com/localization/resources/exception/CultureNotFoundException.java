package com.localization.resources.exception;

import com.localization.resources.model.CultureKey;

import java.util.NoSuchElementException;

/**
 * Thrown when a culture is queried that the resource does not contain.
 * Indicates a caller bug rather than a recoverable condition.
 */
public class CultureNotFoundException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;
	private final transient CultureKey culture;

    public CultureNotFoundException(CultureKey culture) {
        super("Culture not found: " + culture);
        this.culture = culture;
    }

    public CultureKey getCulture() {
        return culture;
    }
}

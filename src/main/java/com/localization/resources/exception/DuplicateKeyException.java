package com.localization.resources.exception;

/**
 * Thrown when a key is already used by another resource in at least one culture.
 */
public class DuplicateKeyException extends ResourceKeyException {

	private static final long serialVersionUID = 1L;

    public DuplicateKeyException(String key) {
        super(key, "Key already exists: " + key);
    }
}

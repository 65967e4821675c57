package com.localization.resources.exception;

/**
 * Base class for failures that reject a change to a resource key.
 * The entry that raised it keeps its previous key.
 */
public abstract class ResourceKeyException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final String key;

    protected ResourceKeyException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * @return the key that was rejected
     */
    public String getKey() {
        return key;
    }
}

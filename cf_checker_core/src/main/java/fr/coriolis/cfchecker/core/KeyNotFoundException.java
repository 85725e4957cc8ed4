package fr.coriolis.cfchecker.core;

/**
 * A key, attribute or variable name could not be matched, even after the case
 * and punctuation insensitive fallback, and no default was supplied.
 */
public class KeyNotFoundException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	private final String key;

	public KeyNotFoundException(String key) {
		this(key, "Key not found: '" + key + "'");
	}

	public KeyNotFoundException(String key, String message) {
		super(message);
		this.key = key;
	}

	/** Name that was looked up */
	public String getKey() {
		return key;
	}
}

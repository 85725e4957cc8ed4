package fr.coriolis.cfchecker.core;

/**
 * Base class of the errors raised while checking the CF metadata of a dataset.
 * <p>
 * Callers processing a batch of variables catch this type per variable and go
 * on with the remaining ones.
 */
public class CfMetadataException extends Exception {

	private static final long serialVersionUID = 1L;

	public CfMetadataException(String message) {
		super(message);
	}

	public CfMetadataException(String message, Throwable cause) {
		super(message, cause);
	}
}

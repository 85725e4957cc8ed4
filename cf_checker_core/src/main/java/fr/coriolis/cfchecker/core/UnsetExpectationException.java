package fr.coriolis.cfchecker.core;

/**
 * Our record of an attribute is unset while the dataset defines it, and we were
 * not allowed to take the dataset's value.
 */
public class UnsetExpectationException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	public UnsetExpectationException(String message) {
		super(message);
	}
}

package fr.coriolis.cfchecker.core;

/**
 * Both our record and the dataset define an attribute, but the values
 * disagree.
 */
public class AttributeMismatchException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	private final String ownerName;
	private final String attributeName;
	private final Object expected;
	private final Object found;

	public AttributeMismatchException(String ownerName, String attributeName, Object expected, Object found) {
		super("Found unexpected " + attributeName + " for variable '" + ownerName + "': '" + found + "' (expected '"
				+ expected + "').");
		this.ownerName = ownerName;
		this.attributeName = attributeName;
		this.expected = expected;
		this.found = found;
	}

	public String getOwnerName() {
		return ownerName;
	}

	public String getAttributeName() {
		return attributeName;
	}

	/** Value of our record before the comparison */
	public Object getExpected() {
		return expected;
	}

	/** Value found in the dataset */
	public Object getFound() {
		return found;
	}
}

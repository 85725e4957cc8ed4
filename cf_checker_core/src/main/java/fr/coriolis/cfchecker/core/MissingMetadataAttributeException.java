package fr.coriolis.cfchecker.core;

/**
 * A checked variable has no <i>standard_name</i> or <i>units</i> attribute at
 * all and the corresponding check was not disabled.
 */
public class MissingMetadataAttributeException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	private final String variableName;
	private final String attributeName;

	public MissingMetadataAttributeException(String variableName, String attributeName, String message) {
		super(message);
		this.variableName = variableName;
		this.attributeName = attributeName;
	}

	public String getVariableName() {
		return variableName;
	}

	public String getAttributeName() {
		return attributeName;
	}
}

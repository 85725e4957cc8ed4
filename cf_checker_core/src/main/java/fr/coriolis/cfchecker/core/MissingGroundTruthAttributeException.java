package fr.coriolis.cfchecker.core;

/**
 * The dataset lacks an attribute we expect and we were not allowed to set it
 * from our own record.
 */
public class MissingGroundTruthAttributeException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	public MissingGroundTruthAttributeException(String message) {
		super(message);
	}
}

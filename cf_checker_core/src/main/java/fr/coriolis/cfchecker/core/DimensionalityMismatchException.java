package fr.coriolis.cfchecker.core;

/**
 * The axes of a variable cannot be mapped unambiguously onto its coordinates, or
 * the axis set found in the dataset differs from the expected one.
 */
public class DimensionalityMismatchException extends CfMetadataException {

	private static final long serialVersionUID = 1L;

	public DimensionalityMismatchException(String message) {
		super(message);
	}
}

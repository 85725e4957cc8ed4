package fr.coriolis.cfchecker.specs;

/**
 * Read-only view shared by real coordinate variables and by coordinates only
 * known by name ({@link PlaceholderScalarCoordinate}).
 */
public interface CoordinateInfo {

	String getName();

	/** Attribute lookup; absent if not set */
	AttributeValue getAttribute(String attrName);

	/** True if there is no data array behind this coordinate */
	boolean isPlaceholder();
}

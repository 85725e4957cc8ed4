package fr.coriolis.cfchecker.specs;

/**
 * Attributes shared by the expected description of a variable and of its
 * coordinates: the name in the dataset, the CF standard name and the units.
 * <p>
 * The reconciler corrects these in place to match what is found in the data.
 */
public abstract class ExpectedEntry {

	// ..attribute names understood by getAttribute/setAttribute
	public static final String NAME = "name";
	public static final String STANDARD_NAME = "standard_name";
	public static final String UNITS = "units";

	private String name;
	private String standardName;
	private String units;

	protected ExpectedEntry(String name, String standardName, String units) {
		this.name = name;
		this.standardName = standardName;
		this.units = units;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getStandardName() {
		return standardName;
	}

	public void setStandardName(String standardName) {
		this.standardName = standardName;
	}

	public String getUnits() {
		return units;
	}

	public void setUnits(String units) {
		this.units = units;
	}

	/**
	 * Retrieves one of the reconciled attributes by its netCDF name
	 * 
	 * @param attrName "name", "standard_name" or "units"
	 * @return the value; absent if unset
	 */
	public AttributeValue getAttribute(String attrName) {
		if (NAME.equals(attrName)) {
			return AttributeValue.ofNullable(name);
		} else if (STANDARD_NAME.equals(attrName)) {
			return AttributeValue.ofNullable(standardName);
		} else if (UNITS.equals(attrName)) {
			return AttributeValue.ofNullable(units);
		}
		throw new IllegalArgumentException("Not a reconciled attribute: '" + attrName + "'");
	}

	/**
	 * Sets one of the reconciled attributes by its netCDF name. The value is
	 * stored in its string form.
	 */
	public void setAttribute(String attrName, Object value) {
		String s = (value == null) ? null : value.toString();
		if (NAME.equals(attrName)) {
			name = s;
		} else if (STANDARD_NAME.equals(attrName)) {
			standardName = s;
		} else if (UNITS.equals(attrName)) {
			units = s;
		} else {
			throw new IllegalArgumentException("Not a reconciled attribute: '" + attrName + "'");
		}
	}
}

package fr.coriolis.cfchecker.specs;

/**
 * Semantic role of a coordinate. Each axis also knows the CF coordinate type it
 * corresponds to, which is used when no coordinate declares the axis itself.
 */
public enum AxisLabel {
	X("longitude"), Y("latitude"), Z("vertical"), T("time");

	public final String coordinateType;

	AxisLabel(String coordinateType) {
		this.coordinateType = coordinateType;
	}

	/**
	 * Lookup on the one-letter label, case-insensitive
	 * 
	 * @return the axis; null if the name is not an axis label
	 */
	public static AxisLabel getAxis(String name) {
		if (name == null) {
			return null;
		}
		String n = name.trim();
		for (AxisLabel a : AxisLabel.values()) {
			if (a.name().equalsIgnoreCase(n)) {
				return a;
			}
		}
		return null;
	}
}

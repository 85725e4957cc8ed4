package fr.coriolis.cfchecker.units;

/**
 * Unit arithmetic needed to compare the units of our record with those of a
 * dataset. Unit strings may carry a numeric factor ("500 hPa"), which is how
 * scalar coordinate values are compared.
 */
public interface UnitSystem {

	/**
	 * @return true if quantities in the two units describe the same physical
	 *         quantity (a conversion between them exists)
	 */
	boolean unitsEquivalent(String a, String b);

	/**
	 * @param rtol relative tolerance on the conversion factor
	 * @return true if the two units are equivalent and their conversion factor is
	 *         1 within <i>rtol</i>
	 */
	boolean unitsEqual(String a, String b, double rtol);

	/** Canonical spelling of a unit string; the input itself if it cannot be parsed */
	String toCanonicalForm(String unit);
}

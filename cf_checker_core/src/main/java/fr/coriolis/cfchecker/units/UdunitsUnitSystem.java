package fr.coriolis.cfchecker.units;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import ucar.units.Unit;
import ucar.units.UnitException;
import ucar.units.UnitFormat;
import ucar.units.UnitFormatManager;

/**
 * {@link UnitSystem} backed by the Unidata UDUNITS library.
 * <p>
 * Besides plain unit compatibility, precipitation given as a depth rate
 * (mm/day) is accepted as equivalent to a mass flux (kg m-2 s-1), through the
 * density of liquid water.
 */
public class UdunitsUnitSystem implements UnitSystem {
	private static final Logger log = LogManager.getLogger("UdunitsUnitSystem");

	static final String WATER_DENSITY = "1000 kg m-3";

	private final UnitFormat format;
	private final Unit waterDensity;

	public UdunitsUnitSystem() {
		format = UnitFormatManager.instance();
		try {
			waterDensity = format.parse(WATER_DENSITY);
		} catch (UnitException e) {
			// ..the unit database itself is broken
			throw new IllegalStateException("UDUNITS database not usable: " + e.getMessage(), e);
		}
	}

	/**
	 * Parses a unit string
	 * 
	 * @throws UnitException if the string is not a valid unit
	 */
	public Unit parse(String unit) throws UnitException {
		return format.parse(unit.trim());
	}

	@Override
	public boolean unitsEquivalent(String a, String b) {
		try {
			Unit ua = parse(a);
			Unit ub = parse(b);
			if (ua.isCompatible(ub)) {
				return true;
			}
			return ua.multiplyBy(waterDensity).isCompatible(ub) || ub.multiplyBy(waterDensity).isCompatible(ua);

		} catch (UnitException e) {
			log.debug("unitsEquivalent('{}', '{}'): {}", a, b, e.getMessage());
			return false;
		}
	}

	@Override
	public boolean unitsEqual(String a, String b, double rtol) {
		try {
			Unit ua = parse(a);
			Unit ub = parse(b);
			if (!ua.isCompatible(ub)) {
				return false;
			}
			double factor = ua.convertTo(1.0, ub);
			return Math.abs(factor - 1.0) <= rtol;

		} catch (UnitException e) {
			log.debug("unitsEqual('{}', '{}'): {}", a, b, e.getMessage());
			return false;
		}
	}

	@Override
	public String toCanonicalForm(String unit) {
		if (unit == null) {
			return null;
		}
		try {
			return parse(unit).getCanonicalString();

		} catch (UnitException e) {
			log.warn("Unable to parse units '{}': {}", unit, e.getMessage());
			return unit;
		}
	}
}

package fr.coriolis.cfchecker.decoders;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AxisLabel;

/**
 * Axis detection based on the CF conventions.
 * <p>
 * A coordinate is recognized in two passes:
 * <ol>
 * <li>as the <i>axis</i> itself: <i>axis</i> attribute, the axis-specific
 * standard names (e.g. projection_x_coordinate), <i>_CoordinateAxisType</i>,
 * or a <i>positive</i> attribute for Z.
 * <li>only if nothing was found: as the corresponding <i>coordinate type</i>
 * (longitude, latitude, vertical, time): standard name, units, and finally the
 * coordinate name.
 * </ol>
 * A coordinate that declares a different axis in its <i>axis</i> attribute is
 * never matched.
 */
public class CfAxisGuesser implements AxisClassification {
	private static final Logger log = LogManager.getLogger("CfAxisGuesser");

	// ......"axis" criteria......
	static final Map<AxisLabel, Set<String>> axisStandardNames;
	static final Map<AxisLabel, Set<String>> axisTypes;
	// ......"coordinate type" criteria......
	static final Map<AxisLabel, Set<String>> coordStandardNames;
	static final Map<AxisLabel, Set<String>> coordUnits;
	static final Map<AxisLabel, Set<String>> coordTypes;
	static final Map<AxisLabel, Pattern> coordNamePatterns;

	static Pattern pTimeUnits; // ..<unit> since <reference date>
	static Pattern pSplit;

	static {
		Map<AxisLabel, Set<String>> temp = new EnumMap<AxisLabel, Set<String>>(AxisLabel.class);
		temp.put(AxisLabel.X, set("projection_x_coordinate", "grid_longitude"));
		temp.put(AxisLabel.Y, set("projection_y_coordinate", "grid_latitude"));
		temp.put(AxisLabel.Z,
				set("model_level_number", "atmosphere_ln_pressure_coordinate", "atmosphere_sigma_coordinate",
						"atmosphere_hybrid_sigma_pressure_coordinate", "atmosphere_hybrid_height_coordinate",
						"atmosphere_sleve_coordinate", "ocean_sigma_coordinate", "ocean_s_coordinate",
						"ocean_s_coordinate_g1", "ocean_s_coordinate_g2", "ocean_sigma_z_coordinate",
						"ocean_double_sigma_coordinate"));
		temp.put(AxisLabel.T, set());
		axisStandardNames = Collections.unmodifiableMap(temp);

		temp = new EnumMap<AxisLabel, Set<String>>(AxisLabel.class);
		temp.put(AxisLabel.X, set("GeoX"));
		temp.put(AxisLabel.Y, set("GeoY"));
		temp.put(AxisLabel.Z, set("GeoZ"));
		temp.put(AxisLabel.T, set("Time"));
		axisTypes = Collections.unmodifiableMap(temp);

		temp = new EnumMap<AxisLabel, Set<String>>(AxisLabel.class);
		temp.put(AxisLabel.X, set("longitude"));
		temp.put(AxisLabel.Y, set("latitude"));
		temp.put(AxisLabel.Z, set("air_pressure", "height", "depth", "altitude", "geopotential_height",
				"height_above_geopotential_datum", "height_above_reference_ellipsoid", "height_above_mean_sea_level"));
		temp.put(AxisLabel.T, set("time"));
		coordStandardNames = Collections.unmodifiableMap(temp);

		temp = new EnumMap<AxisLabel, Set<String>>(AxisLabel.class);
		temp.put(AxisLabel.X, set("degrees_east", "degree_east", "degree_E", "degrees_E", "degreeE", "degreesE"));
		temp.put(AxisLabel.Y,
				set("degrees_north", "degree_north", "degree_N", "degrees_N", "degreeN", "degreesN"));
		temp.put(AxisLabel.Z, set("Pa", "hPa", "kPa", "mb", "mbar", "millibar", "bar", "dbar", "decibar", "atm"));
		temp.put(AxisLabel.T, set());
		coordUnits = Collections.unmodifiableMap(temp);

		temp = new EnumMap<AxisLabel, Set<String>>(AxisLabel.class);
		temp.put(AxisLabel.X, set("Lon"));
		temp.put(AxisLabel.Y, set("Lat"));
		temp.put(AxisLabel.Z, set("Height", "Pressure"));
		temp.put(AxisLabel.T, set());
		coordTypes = Collections.unmodifiableMap(temp);

		Map<AxisLabel, Pattern> ptemp = new EnumMap<AxisLabel, Pattern>(AxisLabel.class);
		ptemp.put(AxisLabel.X, Pattern.compile("x|nlon|ni|x?(nav_lon|lon|glam)[a-z0-9]*", Pattern.CASE_INSENSITIVE));
		ptemp.put(AxisLabel.Y, Pattern.compile("y|nlat|nj|y?(nav_lat|lat|gphi)[a-z0-9]*", Pattern.CASE_INSENSITIVE));
		ptemp.put(AxisLabel.Z, Pattern.compile(
				"(z|nav_lev|gdep|lv_|o*lev|p?lev|bottom_top|sigma|h(ei)?ght|altitude|depth|isobaric|pres|isotherm)[a-z_]*[0-9]*",
				Pattern.CASE_INSENSITIVE));
		ptemp.put(AxisLabel.T, Pattern.compile("t|(time|min|hour|day|week|month|year)[0-9]*", Pattern.CASE_INSENSITIVE));
		coordNamePatterns = Collections.unmodifiableMap(ptemp);

		pTimeUnits = Pattern.compile("^\\s*\\w+\\s+since\\s+.+$", Pattern.CASE_INSENSITIVE);
		pSplit = Pattern.compile("\\s+");
	}

	public CfAxisGuesser() {
	}

	@Override
	public List<String> axisNames(GriddedDataset ds, String varName, AxisLabel axis) {
		Set<String> candidates = candidateNames(ds, varName);

		// ..pass 1: declared as the axis
		List<String> names = new ArrayList<String>();
		for (String c : candidates) {
			DatasetVariable var = ds.getVariable(c);
			if (var != null && declaresOtherAxis(var, axis)) {
				continue;
			}
			if (var != null && isAxis(var, axis)) {
				names.add(c);
			}
		}

		// ..pass 2: recognized as the coordinate type of the axis
		if (names.isEmpty()) {
			for (String c : candidates) {
				DatasetVariable var = ds.getVariable(c);
				if (var != null && declaresOtherAxis(var, axis)) {
					continue;
				}
				if (isCoordinateType(c, var, axis)) {
					names.add(c);
				}
			}
			if (!names.isEmpty()) {
				log.debug("{}: {} axis found from {} coordinates: {}", varName, axis, axis.coordinateType, names);
			}
		}

		Collections.sort(names);
		return names;
	}

	/**
	 * Names that can be coordinates: dimension coordinate variables and the names
	 * listed in <i>coordinates</i> attributes (which may not be variables of the
	 * dataset).
	 */
	Set<String> candidateNames(GriddedDataset ds, String varName) {
		Set<String> names = new LinkedHashSet<String>();
		if (varName == null) {
			for (DatasetVariable var : ds.getVariables()) {
				if (ds.isDimension(var.getName())) {
					names.add(var.getName());
				}
				addCoordinateNames(names, var);
			}

		} else {
			DatasetVariable var = ds.getVariable(varName);
			if (var == null) {
				return names;
			}
			for (String d : var.getDimensions()) {
				if (ds.hasVariable(d)) {
					names.add(d);
				}
			}
			addCoordinateNames(names, var);
		}
		names.addAll(ds.getCoordinateNames());
		return names;
	}

	private static void addCoordinateNames(Set<String> names, DatasetVariable var) {
		names.addAll(var.getCoordinateNames());
		Object raw = var.getAttributes().get("coordinates");
		if (raw instanceof String && !((String) raw).trim().isEmpty()) {
			names.addAll(Arrays.asList(pSplit.split(((String) raw).trim())));
		}
	}

	private static boolean declaresOtherAxis(DatasetVariable var, AxisLabel axis) {
		String declared = attr(var, "axis");
		if (declared == null) {
			return false;
		}
		AxisLabel a = AxisLabel.getAxis(declared);
		return a != null && a != axis;
	}

	private static boolean isAxis(DatasetVariable var, AxisLabel axis) {
		if (AxisLabel.getAxis(attr(var, "axis")) == axis) {
			return true;
		}
		String stdName = attr(var, "standard_name");
		if (stdName != null && axisStandardNames.get(axis).contains(stdName)) {
			return true;
		}
		String axisType = attr(var, "_CoordinateAxisType");
		if (axisType != null && axisTypes.get(axis).contains(axisType)) {
			return true;
		}
		if (axis == AxisLabel.Z) {
			String positive = attr(var, "positive");
			if (positive != null && (positive.equalsIgnoreCase("up") || positive.equalsIgnoreCase("down"))) {
				return true;
			}
		}
		return false;
	}

	private static boolean isCoordinateType(String name, DatasetVariable var, AxisLabel axis) {
		if (var != null) {
			String stdName = attr(var, "standard_name");
			if (stdName != null && coordStandardNames.get(axis).contains(stdName)) {
				return true;
			}
			String units = attr(var, "units");
			if (units != null) {
				if (coordUnits.get(axis).contains(units)) {
					return true;
				}
				if (axis == AxisLabel.T && pTimeUnits.matcher(units).matches()) {
					return true;
				}
			}
			if (axis == AxisLabel.T && var.getDecodedCalendar() != null) {
				return true;
			}
			String axisType = attr(var, "_CoordinateAxisType");
			if (axisType != null && coordTypes.get(axis).contains(axisType)) {
				return true;
			}
		}
		return coordNamePatterns.get(axis).matcher(name).matches();
	}

	/** Attribute as a trimmed string, looked up in attributes then encoding */
	private static String attr(DatasetVariable var, String key) {
		Object v = var.getAttributes().get(key);
		if (v == null) {
			v = var.getEncoding().get(key);
		}
		if (v == null) {
			return null;
		}
		String s = v.toString().trim();
		return s.isEmpty() ? null : s;
	}

	private static Set<String> set(String... values) {
		return Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(values)));
	}
}

package fr.coriolis.cfchecker.validators;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.DimensionalityMismatchException;
import fr.coriolis.cfchecker.core.KeyNotFoundException;
import fr.coriolis.cfchecker.decoders.AxisClassification;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AttributeValue;
import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.CoordinateInfo;
import fr.coriolis.cfchecker.specs.PlaceholderScalarCoordinate;

/**
 * Classification of the coordinates of a dataset, or of one of its variables,
 * by axis (X, Y, Z, T).
 * <p>
 * Wraps an {@link AxisClassification} and adds checks at the variable level:
 * at most one coordinate per axis, and every dimension of the variable
 * assigned to an axis. A single leftover dimension is assigned to the single
 * axis left unassigned.
 * <p>
 * Coordinates named in <i>coordinates</i> attributes that are not variables of
 * the dataset are returned as {@link PlaceholderScalarCoordinate}s.
 */
public class AxisClassifier {
	private static final Logger log = LogManager.getLogger("AxisClassifier");

	static Pattern pFormulaSep; // ..blanks around the ":" of formula_terms
	static Pattern pBlank;

	static {
		pFormulaSep = Pattern.compile("\\s*:\\s*");
		pBlank = Pattern.compile("\\s+");
	}

	private final AxisClassification classification;

	public AxisClassifier(AxisClassification classification) {
		this.classification = classification;
	}

	public AxisClassification getClassification() {
		return classification;
	}

	// =====================
	// Names, by axis
	// =====================

	/**
	 * Coordinate names of the whole dataset by axis. Axes with no coordinate are
	 * left out; an axis may have several coordinates.
	 */
	public Map<AxisLabel, List<String>> axisNames(GriddedDataset ds) {
		Map<AxisLabel, List<String>> names = new EnumMap<AxisLabel, List<String>>(AxisLabel.class);
		for (AxisLabel axis : AxisLabel.values()) {
			List<String> n = classification.axisNames(ds, null, axis);
			if (!n.isEmpty()) {
				List<String> sorted = new ArrayList<String>(n);
				Collections.sort(sorted);
				names.put(axis, sorted);
			}
		}
		return names;
	}

	/**
	 * Coordinate names of one variable by axis, one name per axis.
	 * 
	 * @throws KeyNotFoundException           if the variable is not in the
	 *                                        dataset
	 * @throws DimensionalityMismatchException if an axis has several
	 *                                        coordinates, or if dimensions of
	 *                                        the variable cannot be assigned to
	 *                                        an axis
	 */
	public Map<AxisLabel, List<String>> axisNames(GriddedDataset ds, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		DatasetVariable var = ds.getVariable(varName);
		if (var == null) {
			throw new KeyNotFoundException(varName, "Variable '" + varName + "' not found in dataset");
		}

		Map<AxisLabel, List<String>> vardict = new EnumMap<AxisLabel, List<String>>(AxisLabel.class);
		List<AxisLabel> emptyAxes = new ArrayList<AxisLabel>();
		List<String> unassigned = new ArrayList<String>(var.getDimensions());

		for (AxisLabel axis : AxisLabel.values()) {
			List<String> n = classification.axisNames(ds, varName, axis);
			if (n.size() > 1) {
				log.error("Too many {} axes found for '{}': {}", axis, varName, n);
				throw new DimensionalityMismatchException(
						"Too many " + axis + " axes found for variable '" + varName + "': " + n);
			} else if (n.size() == 1) {
				vardict.put(axis, Collections.singletonList(n.get(0)));
				unassigned.remove(n.get(0));
			} else {
				emptyAxes.add(axis);
			}
		}

		if (!unassigned.isEmpty()) {
			if (unassigned.size() == 1 && emptyAxes.size() == 1) {
				log.warn("Guessing that dimension '{}' is the {} axis of '{}'", unassigned.get(0), emptyAxes.get(0),
						varName);
				vardict.put(emptyAxes.get(0), Collections.singletonList(unassigned.get(0)));
			} else {
				log.error("Couldn't identify the axes of '{}': dims {} unassigned (found {})", varName, unassigned,
						vardict);
				throw new DimensionalityMismatchException("Missing axes for variable '" + varName
						+ "': couldn't assign dimensions " + unassigned + " (found axes " + vardict + ")");
			}
		}
		return vardict;
	} // ..end axisNames

	// =====================
	// Coordinates, by axis
	// =====================

	/** Coordinates of the whole dataset by axis */
	public Map<AxisLabel, List<CoordinateInfo>> axes(GriddedDataset ds) {
		Map<AxisLabel, List<CoordinateInfo>> axes = new EnumMap<AxisLabel, List<CoordinateInfo>>(AxisLabel.class);
		for (Map.Entry<AxisLabel, List<String>> e : axisNames(ds).entrySet()) {
			List<CoordinateInfo> coords = new ArrayList<CoordinateInfo>();
			for (String c : e.getValue()) {
				coords.add(resolve(ds, c, e.getKey()));
			}
			axes.put(e.getKey(), coords);
		}
		return axes;
	}

	/**
	 * Coordinates of one variable by axis
	 * 
	 * @param filter only coordinates with these names are kept; null for all
	 */
	public Map<AxisLabel, CoordinateInfo> axes(GriddedDataset ds, String varName, Collection<String> filter)
			throws KeyNotFoundException, DimensionalityMismatchException {
		Map<AxisLabel, CoordinateInfo> axes = new EnumMap<AxisLabel, CoordinateInfo>(AxisLabel.class);
		for (Map.Entry<AxisLabel, List<String>> e : axisNames(ds, varName).entrySet()) {
			List<CoordinateInfo> coords = new ArrayList<CoordinateInfo>();
			for (String c : e.getValue()) {
				if (filter == null || filter.contains(c)) {
					coords.add(resolve(ds, c, e.getKey()));
				}
			}
			if (coords.isEmpty()) {
				continue;
			}
			if (coords.size() > 1) {
				throw new DimensionalityMismatchException(
						"Expected one " + e.getKey() + " coordinate for '" + varName + "', found " + coords.size());
			}
			axes.put(e.getKey(), coords.get(0));
		}
		return axes;
	}

	public Map<AxisLabel, CoordinateInfo> axes(GriddedDataset ds, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		return axes(ds, varName, null);
	}

	/** Dimension coordinates of the whole dataset by axis */
	public Map<AxisLabel, List<CoordinateInfo>> dimAxes(GriddedDataset ds) {
		Map<AxisLabel, List<CoordinateInfo>> dimAxes = new EnumMap<AxisLabel, List<CoordinateInfo>>(
				AxisLabel.class);
		for (Map.Entry<AxisLabel, List<CoordinateInfo>> e : axes(ds).entrySet()) {
			List<CoordinateInfo> coords = new ArrayList<CoordinateInfo>();
			for (CoordinateInfo c : e.getValue()) {
				if (ds.isDimension(c.getName())) {
					coords.add(c);
				}
			}
			if (!coords.isEmpty()) {
				dimAxes.put(e.getKey(), coords);
			}
		}
		return dimAxes;
	}

	/** Dimension coordinates of one variable by axis */
	public Map<AxisLabel, CoordinateInfo> dimAxes(GriddedDataset ds, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		DatasetVariable var = ds.getVariable(varName);
		if (var == null) {
			throw new KeyNotFoundException(varName, "Variable '" + varName + "' not found in dataset");
		}
		return axes(ds, varName, var.getDimensions());
	}

	public Set<AxisLabel> axesSet(GriddedDataset ds) {
		return toSet(axisNames(ds).keySet());
	}

	public Set<AxisLabel> dimAxesSet(GriddedDataset ds) {
		return toSet(dimAxes(ds).keySet());
	}

	public Set<AxisLabel> dimAxesSet(GriddedDataset ds, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		return toSet(dimAxes(ds, varName).keySet());
	}

	// =====================
	// Scalar coordinates
	// =====================

	/**
	 * Scalar coordinates: classified coordinates that are not a dimension (of the
	 * variable, or of the dataset when <i>varName</i> is null), plus vertical
	 * coordinates of length 1.
	 */
	public List<AxisCoordinate> scalarCoords(GriddedDataset ds, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		Map<AxisLabel, List<String>> names;
		Collection<String> dims;
		if (varName == null) {
			names = axisNames(ds);
			dims = ds.getDimensionNames();
		} else {
			names = axisNames(ds, varName);
			dims = ds.getVariable(varName).getDimensions();
		}

		List<AxisCoordinate> scalars = new ArrayList<AxisCoordinate>();
		for (Map.Entry<AxisLabel, List<String>> e : names.entrySet()) {
			AxisLabel axis = e.getKey();
			for (String c : e.getValue()) {
				if (ds.hasVariable(c)) {
					if (!dims.contains(c) || (axis == AxisLabel.Z && ds.sizeOf(c) == 1)) {
						scalars.add(new AxisCoordinate(axis, ds.getVariable(c)));
					}
				} else if (!dims.contains(c)) {
					scalars.add(new AxisCoordinate(axis, new PlaceholderScalarCoordinate(c, axis)));
				}
			}
		}
		return scalars;
	}

	/**
	 * The scalar coordinate of a given axis
	 * 
	 * @return the coordinate; null if there is none
	 */
	public CoordinateInfo getScalar(GriddedDataset ds, AxisLabel axis, String varName)
			throws KeyNotFoundException, DimensionalityMismatchException {
		for (AxisCoordinate ac : scalarCoords(ds, varName)) {
			if (ac.getAxis() == axis) {
				return ac.getCoordinate();
			}
		}
		return null;
	}

	// =====================
	// Time axis
	// =====================

	/** True if the dataset has no time axis */
	public boolean isStatic(GriddedDataset ds) {
		return !axisNames(ds).containsKey(AxisLabel.T);
	}

	/**
	 * Calendar attribute of the time coordinate
	 * 
	 * @return the calendar; null if no time axis or no calendar
	 */
	public String calendar(GriddedDataset ds) {
		List<String> t = axisNames(ds).get(AxisLabel.T);
		if (t == null) {
			return null;
		}
		DatasetVariable var = ds.getVariable(t.get(0));
		if (var == null) {
			return null;
		}
		return var.getAttribute("calendar").asString();
	}

	// =====================
	// Parametric coordinates
	// =====================

	/**
	 * Parses the <i>formula_terms</i> attribute of a parametric vertical
	 * coordinate ("a: var1 b: var2") into a map of term to variable name.
	 * 
	 * @return the terms; empty if the attribute is not set
	 */
	public static Map<String, String> formulaTerms(DatasetVariable var) {
		Map<String, String> terms = new LinkedHashMap<String, String>();
		AttributeValue ft = var.getAttribute("formula_terms");
		if (ft.isEmpty()) {
			return terms;
		}
		String s = pFormulaSep.matcher(ft.asString().trim()).replaceAll(":");
		for (String token : pBlank.split(s)) {
			int i = token.indexOf(':');
			if (i <= 0 || i == token.length() - 1) {
				log.warn("'{}': malformed formula_terms entry '{}'", var.getName(), token);
				continue;
			}
			terms.put(token.substring(0, i), token.substring(i + 1));
		}
		return terms;
	}

	// ..placeholder for names that aren't variables
	private static CoordinateInfo resolve(GriddedDataset ds, String name, AxisLabel axis) {
		DatasetVariable var = ds.getVariable(name);
		if (var != null) {
			return var;
		}
		return new PlaceholderScalarCoordinate(name, axis);
	}

	private static Set<AxisLabel> toSet(Set<AxisLabel> keys) {
		if (keys.isEmpty()) {
			return EnumSet.noneOf(AxisLabel.class);
		}
		return EnumSet.copyOf(keys);
	}
}

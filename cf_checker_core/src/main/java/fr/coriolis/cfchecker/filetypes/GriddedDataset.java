package fr.coriolis.cfchecker.filetypes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.KeyNotFoundException;
import fr.coriolis.cfchecker.specs.AttributeValue;

/**
 * In-memory view of the metadata of a gridded netCDF dataset: named dimensions,
 * variables and global attributes.
 * <p>
 * Datasets are usually built from a file with
 * {@link NetcdfDatasetLoader#load(String)}. A dataset object is not meant to be
 * shared between threads: parsing mutates its attribute maps in place.
 */
public class GriddedDataset {
	private static final Logger log = LogManager.getLogger("GriddedDataset");

	private final Map<String, Integer> dimensions = new LinkedHashMap<String, Integer>();
	private final Map<String, DatasetVariable> variables = new LinkedHashMap<String, DatasetVariable>();
	private Map<String, Object> attributes = new LinkedHashMap<String, Object>();
	private final List<String> coordinateNames = new ArrayList<String>();

	public GriddedDataset() {
	}

	// .........................................
	// DIMENSIONS
	// .........................................

	public GriddedDataset addDimension(String name, int length) {
		dimensions.put(name, length);
		return this;
	}

	public Set<String> getDimensionNames() {
		return Collections.unmodifiableSet(dimensions.keySet());
	}

	public boolean isDimension(String name) {
		return dimensions.containsKey(name);
	}

	/** Length of a dimension; -1 if not defined */
	public int getDimensionLength(String name) {
		Integer len = dimensions.get(name);
		return (len == null) ? -1 : len;
	}

	// .........................................
	// VARIABLES
	// .........................................

	/**
	 * Adds (or replaces) a variable. Its dimensions must already be defined.
	 */
	public GriddedDataset addVariable(DatasetVariable var) {
		for (String d : var.getDimensions()) {
			if (!dimensions.containsKey(d)) {
				throw new IllegalArgumentException(
						"Variable '" + var.getName() + "': dimension '" + d + "' not defined in dataset");
			}
		}
		variables.put(var.getName(), var);
		return this;
	}

	/** Retrieve a variable; null if not in the dataset */
	public DatasetVariable getVariable(String name) {
		return variables.get(name);
	}

	public boolean hasVariable(String name) {
		return variables.containsKey(name);
	}

	public Set<String> getVariableNames() {
		return Collections.unmodifiableSet(variables.keySet());
	}

	public Collection<DatasetVariable> getVariables() {
		return Collections.unmodifiableCollection(variables.values());
	}

	/**
	 * Number of values of a variable: the product of its dimension lengths (1 for
	 * a variable without dimensions)
	 */
	public long sizeOf(String varName) {
		DatasetVariable var = variables.get(varName);
		if (var == null) {
			return 0;
		}
		long size = 1;
		for (String d : var.getDimensions()) {
			size *= dimensions.get(d);
		}
		return size;
	}

	// .........................................
	// ATTRIBUTES
	// .........................................

	/** Live global attribute map */
	public Map<String, Object> getAttributes() {
		return attributes;
	}

	public void setAttributes(Map<String, Object> attributes) {
		this.attributes = new LinkedHashMap<String, Object>(attributes);
	}

	public AttributeValue getAttribute(String attrName) {
		return AttributeValue.ofNullable(attributes.get(attrName));
	}

	/** Names from the decoded global coordinates attribute */
	public List<String> getCoordinateNames() {
		return coordinateNames;
	}

	/**
	 * Finds the variable holding the cell boundaries of a coordinate, as named by
	 * the coordinate's <i>bounds</i> attribute.
	 * 
	 * @param coordName name of the coordinate variable
	 * @return the bounds variable
	 * @throws KeyNotFoundException if the coordinate has no bounds attribute or
	 *                              the variable it names is not in the dataset
	 */
	public DatasetVariable findBounds(String coordName) throws KeyNotFoundException {
		DatasetVariable coord = variables.get(coordName);
		if (coord == null) {
			throw new KeyNotFoundException(coordName, "Coordinate '" + coordName + "' not found in dataset");
		}
		AttributeValue boundsAttr = coord.getAttribute("bounds");
		if (boundsAttr.isEmpty()) {
			throw new KeyNotFoundException("bounds", "No bounds attribute on '" + coordName + "'");
		}
		String boundsName = boundsAttr.asString().trim();
		DatasetVariable bounds = variables.get(boundsName);
		if (bounds == null) {
			log.debug("bounds '{}' of '{}' not in dataset", boundsName, coordName);
			throw new KeyNotFoundException(boundsName,
					"Bounds variable '" + boundsName + "' of '" + coordName + "' not found in dataset");
		}
		return bounds;
	}

	/** Deep copy of the metadata */
	public GriddedDataset copy() {
		GriddedDataset ds = new GriddedDataset();
		ds.dimensions.putAll(dimensions);
		for (DatasetVariable v : variables.values()) {
			ds.variables.put(v.getName(), v.copy());
		}
		ds.attributes.putAll(attributes);
		ds.coordinateNames.addAll(coordinateNames);
		return ds;
	}
}

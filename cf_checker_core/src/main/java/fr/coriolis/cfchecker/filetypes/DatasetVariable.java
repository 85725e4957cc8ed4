package fr.coriolis.cfchecker.filetypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import fr.coriolis.cfchecker.specs.AttributeValue;
import fr.coriolis.cfchecker.specs.CoordinateInfo;

/**
 * A variable of a {@link GriddedDataset}: its dimensions, its attributes and,
 * once the dataset has been decoded, the attributes that decoding moved aside
 * (<i>encoding</i>), the names parsed from its <i>coordinates</i> attribute
 * and the calendar of its decoded time values.
 * <p>
 * Data values are only carried for small variables (scalar coordinates).
 */
public class DatasetVariable implements CoordinateInfo {

	private final String name;
	private final List<String> dimensions;
	private Map<String, Object> attributes = new LinkedHashMap<String, Object>();
	private final Map<String, Object> encoding = new LinkedHashMap<String, Object>();
	private final List<String> coordinateNames = new ArrayList<String>();
	private double[] values = null;
	private String decodedCalendar = null;

	public DatasetVariable(String name, String... dimensions) {
		this(name, Arrays.asList(dimensions));
	}

	public DatasetVariable(String name, List<String> dimensions) {
		this.name = name;
		this.dimensions = Collections.unmodifiableList(new ArrayList<String>(dimensions));
	}

	// .........................................
	// ACCESSORS
	// .........................................

	@Override
	public String getName() {
		return name;
	}

	/** Dimension names, in order */
	public List<String> getDimensions() {
		return dimensions;
	}

	/** Live attribute map; String or Number values */
	public Map<String, Object> getAttributes() {
		return attributes;
	}

	/** Replaces the attribute map (keeps the given map's iteration order) */
	public void setAttributes(Map<String, Object> attributes) {
		this.attributes = new LinkedHashMap<String, Object>(attributes);
	}

	@Override
	public AttributeValue getAttribute(String attrName) {
		return AttributeValue.ofNullable(attributes.get(attrName));
	}

	/** Convenience setter, returns this for chaining */
	public DatasetVariable attr(String attrName, Object value) {
		attributes.put(attrName, value);
		return this;
	}

	/** Attributes moved out of the attribute map by decoding */
	public Map<String, Object> getEncoding() {
		return encoding;
	}

	/** Names listed in the variable's (decoded) coordinates attribute */
	public List<String> getCoordinateNames() {
		return coordinateNames;
	}

	/** Copy of the data values; null if none were read */
	public double[] getValues() {
		return (values == null) ? null : values.clone();
	}

	public void setValues(double... values) {
		this.values = (values == null) ? null : values.clone();
	}

	/**
	 * Value of a single-valued variable
	 * 
	 * @throws IllegalStateException if no data was read for the variable
	 */
	public double getScalarValue() {
		if (values == null || values.length == 0) {
			throw new IllegalStateException("No data values read for '" + name + "'");
		}
		return values[0];
	}

	/** Calendar of the decoded time values; null if not a decoded time axis */
	public String getDecodedCalendar() {
		return decodedCalendar;
	}

	public void setDecodedCalendar(String decodedCalendar) {
		this.decodedCalendar = decodedCalendar;
	}

	@Override
	public boolean isPlaceholder() {
		return false;
	}

	/** Deep copy of the metadata (data values are shared) */
	public DatasetVariable copy() {
		DatasetVariable v = new DatasetVariable(name, dimensions);
		v.attributes.putAll(attributes);
		v.encoding.putAll(encoding);
		v.coordinateNames.addAll(coordinateNames);
		v.values = values;
		v.decodedCalendar = decodedCalendar;
		return v;
	}

	@Override
	public String toString() {
		return name + dimensions;
	}
}

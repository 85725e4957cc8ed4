package fr.coriolis.cfchecker.validators;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import fr.coriolis.cfchecker.specs.AttributeValue;

/**
 * Snapshot of the attributes of one dataset, taken before CF decoding, so that
 * attributes dropped by the decoder can be restored.
 * <p>
 * The per-variable maps hold the normalized attributes (standard_name, units
 * and calendar found under a tolerant lookup). A backup belongs to a single
 * parse of a single dataset.
 */
public class AttributeBackup {

	private final Map<String, AttributeValue> datasetAttributes = new LinkedHashMap<String, AttributeValue>();
	private final Map<String, Map<String, AttributeValue>> variableAttributes = new LinkedHashMap<String, Map<String, AttributeValue>>();

	public void setDatasetAttributes(Map<String, Object> attributes) {
		datasetAttributes.clear();
		for (Map.Entry<String, Object> e : attributes.entrySet()) {
			datasetAttributes.put(e.getKey(), AttributeValue.ofNullable(e.getValue()));
		}
	}

	public Map<String, AttributeValue> getDatasetAttributes() {
		return Collections.unmodifiableMap(datasetAttributes);
	}

	public void putVariableAttributes(String varName, Map<String, AttributeValue> attributes) {
		variableAttributes.put(varName, new LinkedHashMap<String, AttributeValue>(attributes));
	}

	/** Backed-up attributes of a variable; null if the variable was not backed up */
	public Map<String, AttributeValue> getVariableAttributes(String varName) {
		Map<String, AttributeValue> m = variableAttributes.get(varName);
		return (m == null) ? null : Collections.unmodifiableMap(m);
	}

	public Set<String> getVariableNames() {
		return Collections.unmodifiableSet(variableAttributes.keySet());
	}
}

package fr.coriolis.cfchecker.validators;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;

/**
 * Finds names that variables of a dataset refer to but that the dataset does
 * not define.
 * <p>
 * References are taken from the dimensions of each variable, from the CF
 * attributes that name other variables (bounds, climatology,
 * ancillary_variables, coordinates, grid_mapping, cell_measures) and from
 * <i>formula_terms</i>. A name is defined if it is a dimension, a variable, or
 * an attribute (of the dataset or of any variable).
 */
public final class ReferenceIntegrityChecker {
	private static final Logger log = LogManager.getLogger("ReferenceIntegrityChecker");

	static final List<String> ASSOCIATION_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList("bounds",
			"climatology", "ancillary_variables", "coordinates", "grid_mapping", "cell_measures"));

	static Pattern pBlank = Pattern.compile("\\s+");

	private ReferenceIntegrityChecker() {
	}

	/**
	 * @return missing name to the names of the variables referring to it, both
	 *         sorted; empty if every reference resolves
	 */
	public static Map<String, Set<String>> getUnmappedNames(GriddedDataset ds) {
		Set<String> arrayNames = new HashSet<String>(ds.getDimensionNames());
		arrayNames.addAll(ds.getVariableNames());

		Set<String> attrNames = new HashSet<String>(ds.getAttributes().keySet());
		for (DatasetVariable var : ds.getVariables()) {
			attrNames.addAll(var.getAttributes().keySet());
		}

		Map<String, Set<String>> lookup = new TreeMap<String, Set<String>>();
		for (DatasetVariable var : ds.getVariables()) {
			for (String ref : references(var)) {
				lookup.computeIfAbsent(ref, k -> new TreeSet<String>()).add(var.getName());
			}
		}

		Map<String, Set<String>> missing = new TreeMap<String, Set<String>>();
		for (Map.Entry<String, Set<String>> e : lookup.entrySet()) {
			if (!arrayNames.contains(e.getKey()) && !attrNames.contains(e.getKey())) {
				missing.put(e.getKey(), e.getValue());
			}
		}

		if (!missing.isEmpty()) {
			log.debug("unmapped names: {}", missing);
		}
		return missing;
	}

	/** Every name a variable refers to */
	static Set<String> references(DatasetVariable var) {
		Set<String> refs = new LinkedHashSet<String>(var.getDimensions());
		for (String attr : ASSOCIATION_ATTRIBUTES) {
			addNames(refs, var.getAttributes().get(attr));
			addNames(refs, var.getEncoding().get(attr));
		}
		refs.addAll(var.getCoordinateNames());
		refs.addAll(AxisClassifier.formulaTerms(var).values());
		return refs;
	}

	// ..cell_measures and extended grid_mapping are "key: name" lists
	private static void addNames(Set<String> refs, Object value) {
		if (!(value instanceof String)) {
			return;
		}
		String s = ((String) value).trim();
		if (s.isEmpty()) {
			return;
		}
		for (String token : pBlank.split(s)) {
			if (!token.endsWith(":")) {
				refs.add(token);
			}
		}
	}
}

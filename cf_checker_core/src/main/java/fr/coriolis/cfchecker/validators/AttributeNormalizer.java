package fr.coriolis.cfchecker.validators;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.KeyNotFoundException;
import fr.coriolis.cfchecker.core.ParserSettings;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AttributeValue;
import fr.coriolis.cfchecker.specs.CfCalendar;

/**
 * Initial clean-up of the attributes of a dataset, before any CF decoding.
 * <p>
 * Real-world files often misspell the keys we rely on ("Units",
 * "standard name", "Calendar_type") or use values outside the CF vocabulary.
 * The normalizer finds these under a tolerant lookup:
 * <ol>
 * <li>exact key match
 * <li>case and punctuation insensitive match, accepted only if it is unique
 * <li>for some keys, a key starting with an expected prefix ("unit", "cal")
 * </ol>
 * The live attributes are left alone (apart from blank stripping and the
 * repair of misread units): the normalized values are stored in an
 * {@link AttributeBackup} and put back by {@link #restoreAttrs} once the
 * dataset has been decoded.
 */
public class AttributeNormalizer {
	private static final Logger log = LogManager.getLogger("AttributeNormalizer");

	/** Exact string comparison */
	public static final BiPredicate<String, String> EQUALS = (option, name) -> option.equals(name);
	/** Accepts an option starting with the expected string */
	public static final BiPredicate<String, String> STARTS_WITH = (option, name) -> option.startsWith(name);

	static Pattern pMunge; // ..everything but lowercase alphanumerics
	static Pattern pMillibar; // .."mb" not adjacent to another letter

	static {
		pMunge = Pattern.compile("[^a-z0-9]+");

		// .."mb" is read as millibarn (an area) by UDUNITS
		pMillibar = Pattern.compile("(?<![a-zA-Z])[mM][bB](?![a-zA-Z])");
	}

	private final ParserSettings settings;

	public AttributeNormalizer(ParserSettings settings) {
		this.settings = settings;
	}

	// =====================
	// Tolerant key matching
	// =====================

	/**
	 * Selects the element of <i>options</i> equal to <i>name</i>. If none are
	 * equal, tries a case and punctuation insensitive match, which must be unique.
	 *
	 * @param description  description of what is being looked up (log messages
	 *                     only)
	 * @param name         expected name
	 * @param options      names present in the data
	 * @param defaultValue returned if no match; null to throw instead
	 * @param comparison   comparison of (option, name); null for {@link #EQUALS}
	 * @return the matching option, or <i>defaultValue</i>
	 * @throws KeyNotFoundException if nothing matches and no default was given
	 */
	public static String guessAttr(String description, String name, Collection<String> options, String defaultValue,
			BiPredicate<String, String> comparison) throws KeyNotFoundException {
		if (comparison == null) {
			comparison = EQUALS;
		}

		// ..exact pass
		String found = null;
		int nExact = 0;
		for (String opt : options) {
			if (comparison.test(opt, name)) {
				if (found == null) {
					found = opt;
				}
				nExact++;
			}
		}
		if (nExact > 1) {
			log.debug("Found multiple values of '{}' set for '{}'.", name, description);
		}
		if (nExact >= 1) {
			return found;
		}

		// ..insensitive pass
		String mungedName = munge(name);
		List<String> matches = new ArrayList<String>();
		for (String opt : options) {
			if (comparison.test(munge(opt), mungedName)) {
				matches.add(opt);
			}
		}
		if (matches.size() == 1) {
			log.debug("Correcting '{}' to '{}' as the intended value for '{}'.", name, matches.get(0), description);
			return matches.get(0);
		} else if (matches.size() > 1) {
			log.debug("Ambiguous values for '{}' ('{}'): {}", description, name, matches);
		}

		if (defaultValue != null) {
			return defaultValue;
		}
		throw new KeyNotFoundException(name);
	} // ..end guessAttr

	public static String guessAttr(String description, String name, Collection<String> options, String defaultValue)
			throws KeyNotFoundException {
		return guessAttr(description, name, options, defaultValue, EQUALS);
	}

	public static String guessAttr(String description, String name, Collection<String> options)
			throws KeyNotFoundException {
		return guessAttr(description, name, options, null, EQUALS);
	}

	/** Lower case, alphanumerics only */
	static String munge(String s) {
		return pMunge.matcher(s.toLowerCase()).replaceAll("");
	}

	// ========================
	// Attribute normalization
	// ========================

	/**
	 * Looks up <i>keyName</i> in <i>source</i> and stores its value in
	 * <i>target</i> under <i>keyName</i>. If the key is not found, a key starting
	 * with <i>keyPrefix</i> is accepted instead. If still nothing is found, the
	 * value is stored as absent. <i>source</i> is never changed.
	 *
	 * @param target    receives the value
	 * @param source    attributes to search
	 * @param keyName   expected key
	 * @param keyPrefix accepted key prefix; null for none
	 */
	public void normalizeAttr(Map<String, AttributeValue> target, Map<String, ?> source, String keyName,
			String keyPrefix) {
		String key;
		try {
			key = guessAttr(keyName, keyName, source.keySet(), null, EQUALS);

		} catch (KeyNotFoundException e) {
			key = null;
			if (keyPrefix != null) {
				try {
					key = guessAttr(keyName, keyPrefix, source.keySet(), null, STARTS_WITH);
				} catch (KeyNotFoundException e2) {
					log.debug("'{}' not found (prefix '{}')", keyName, keyPrefix);
				}
			}
		}

		if (key == null) {
			target.put(keyName, AttributeValue.absent());
		} else {
			target.put(keyName, AttributeValue.ofNullable(source.get(key)));
		}
	}

	public void normalizeStandardName(Map<String, AttributeValue> target, Map<String, ?> source) {
		normalizeAttr(target, source, "standard_name", "standard");
	}

	/**
	 * Finds the units and repairs unit strings known to be misread: "mb" is
	 * rewritten as "millibar".
	 */
	public void normalizeUnit(Map<String, AttributeValue> target, Map<String, ?> source) {
		normalizeAttr(target, source, "units", "unit");
		AttributeValue units = target.get("units");
		if (units.isString()) {
			String repaired = repairUnits(units.asString());
			target.put("units", AttributeValue.of(repaired));
		}
	}

	/** Unit string repairs */
	public static String repairUnits(String units) {
		return pMillibar.matcher(units).replaceAll("millibar");
	}

	/**
	 * Finds the calendar attribute in <i>attrs</i> and rewrites it, in place, as
	 * a canonical CF calendar. Without a calendar the key is removed (normal for
	 * anything but a time axis).
	 */
	public void normalizeCalendar(Map<String, Object> attrs) {
		Map<String, AttributeValue> found = new LinkedHashMap<String, AttributeValue>();
		normalizeAttr(found, attrs, "calendar", "cal");
		AttributeValue cal = found.get("calendar");
		if (cal.isEmpty()) {
			attrs.remove("calendar");
		} else {
			attrs.put("calendar", canonicalCalendar(cal.asString()));
		}
	}

	/**
	 * Maps a calendar name onto the CF vocabulary, aliases resolved
	 * 
	 * @return the canonical calendar name; the fallback calendar if not recognized
	 */
	public String canonicalCalendar(String calendar) {
		String guess;
		try {
			guess = guessAttr("calendar", calendar.trim(), CfCalendar.vocabulary(), settings.getFallbackCalendar(),
					EQUALS);
		} catch (KeyNotFoundException e) {
			// ..not reached: a default is always given
			guess = settings.getFallbackCalendar();
		}
		CfCalendar cal = CfCalendar.forName(guess);
		return (cal == null) ? settings.getFallbackCalendar() : cal.getName();
	}

	// ===================
	// Dataset-wide passes
	// ===================

	/**
	 * Strips blanks from all string attributes and repairs the <i>units</i> of
	 * every variable (see {@link #repairUnits}), then backs up the dataset
	 * attributes and the normalized attributes of every variable.
	 * 
	 * @param ds     the raw dataset
	 * @param backup receives the snapshots
	 */
	public void normalizeDatasetAttrs(GriddedDataset ds, AttributeBackup backup) {
		ds.setAttributes(stripAttrs(ds.getAttributes()));
		backup.setDatasetAttributes(ds.getAttributes());

		for (DatasetVariable var : ds.getVariables()) {
			Map<String, Object> d = stripAttrs(var.getAttributes());
			repairUnitsInPlace(var.getName(), d);
			var.setAttributes(d);

			Map<String, AttributeValue> normalized = new LinkedHashMap<String, AttributeValue>();
			normalizeStandardName(normalized, d);
			normalizeUnit(normalized, d);

			Map<String, Object> withCalendar = new LinkedHashMap<String, Object>(d);
			normalizeCalendar(withCalendar);

			Map<String, AttributeValue> restore = new LinkedHashMap<String, AttributeValue>();
			for (Map.Entry<String, Object> e : withCalendar.entrySet()) {
				restore.put(e.getKey(), AttributeValue.ofNullable(e.getValue()));
			}
			restore.putAll(normalized);
			backup.putVariableAttributes(var.getName(), restore);
		}

		if (log.isDebugEnabled()) {
			log.debug("backed up attributes of {} variable(s): {}", backup.getVariableNames().size(),
					backup.getVariableNames());
		}
	} // ..end normalizeDatasetAttrs

	/**
	 * Puts back the backed-up attributes that decoding removed. Where an attribute
	 * exists on both sides with different values, the decoded value is kept and
	 * the discrepancy logged.
	 */
	public void restoreAttrs(GriddedDataset ds, AttributeBackup backup) {
		restoreOne("Dataset", backup.getDatasetAttributes(), ds.getAttributes());
		for (DatasetVariable var : ds.getVariables()) {
			Map<String, AttributeValue> saved = backup.getVariableAttributes(var.getName());
			if (saved == null) {
				log.debug("no backup for '{}' (added by decoding)", var.getName());
				continue;
			}
			restoreOne(var.getName(), saved, var.getAttributes());
		}
	}

	private void restoreOne(String name, Map<String, AttributeValue> saved, Map<String, Object> attrs) {
		for (Map.Entry<String, AttributeValue> e : saved.entrySet()) {
			String key = e.getKey();
			AttributeValue v = e.getValue();
			if (!attrs.containsKey(key)) {
				if (v.isPresent()) {
					attrs.put(key, v.get());
				}
				continue;
			}
			if (v.isPresent() && !v.get().equals(attrs.get(key))) {
				log.warn("{}: discrepancy for attr '{}': '{}' != '{}'.", name, key, v, attrs.get(key));
			}
		}
	}

	// ..restoreAttrs keeps live values, so the repair must be made on the live map too
	private static void repairUnitsInPlace(String varName, Map<String, Object> attrs) {
		Object units = attrs.get("units");
		if (!(units instanceof String)) {
			return;
		}
		String repaired = repairUnits((String) units);
		if (!repaired.equals(units)) {
			log.debug("'{}': units '{}' read as '{}'", varName, units, repaired);
			attrs.put("units", repaired);
		}
	}

	private static Map<String, Object> stripAttrs(Map<String, Object> attrs) {
		Map<String, Object> d = new LinkedHashMap<String, Object>();
		for (Map.Entry<String, Object> e : attrs.entrySet()) {
			Object v = e.getValue();
			d.put(e.getKey().trim(), (v instanceof String) ? ((String) v).trim() : v);
		}
		return d;
	}
}

package fr.coriolis.cfchecker.decoders;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.KeyNotFoundException;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.CfCalendar;
import fr.coriolis.cfchecker.validators.AttributeNormalizer;

/**
 * Default CF decoding step.
 * <p>
 * Like the decoders of the common netCDF libraries, this moves the attributes it
 * has interpreted from the attribute map to the variable's <i>encoding</i>:
 * <ul>
 * <li><i>coordinates</i> (parsed into the list of coordinate names)
 * <li><i>units</i> and <i>calendar</i> of time axes ("&lt;unit&gt; since
 * &lt;date&gt;") whose calendar is understood; the calendar key is matched
 * regardless of case and punctuation ("Calendar")
 * <li>the packing and fill attributes
 * </ul>
 * The global <i>coordinates</i> attribute is handled the same way.
 */
public class CfMetadataDecoder implements MetadataDecoder {
	private static final Logger log = LogManager.getLogger("CfMetadataDecoder");

	// ..attributes consumed by masking and unpacking
	static final List<String> packingAttributes = Arrays.asList("_FillValue", "missing_value", "scale_factor",
			"add_offset");

	// ..calendar assumed by CF when a time axis has none
	static final String DEFAULT_TIME_CALENDAR = "standard";

	static Pattern pTimeUnits; // ..<unit> since <reference date>
	static Pattern pSplit;

	static {
		pTimeUnits = Pattern.compile("^\\s*\\w+\\s+since\\s+.+$", Pattern.CASE_INSENSITIVE);
		pSplit = Pattern.compile("\\s+");
	}

	private final AxisClassification axisClassification;

	public CfMetadataDecoder(AxisClassification axisClassification) {
		this.axisClassification = axisClassification;
	}

	@Override
	public GriddedDataset decode(GriddedDataset raw) {
		GriddedDataset ds = raw.copy();

		Object globalCoords = ds.getAttributes().remove("coordinates");
		if (globalCoords != null) {
			ds.getCoordinateNames().addAll(splitNames(globalCoords));
		}

		for (DatasetVariable var : ds.getVariables()) {
			Object coords = var.getAttributes().remove("coordinates");
			if (coords != null) {
				var.getEncoding().put("coordinates", coords);
				var.getCoordinateNames().addAll(splitNames(coords));
			}

			for (String key : packingAttributes) {
				Object v = var.getAttributes().remove(key);
				if (v != null) {
					var.getEncoding().put(key, v);
				}
			}

			Object units = var.getAttributes().get("units");
			if (units instanceof String && pTimeUnits.matcher((String) units).matches()) {
				decodeTime(var);
			}
		}
		return ds;
	}

	/**
	 * Moves the time units and calendar to the encoding. A time axis whose
	 * calendar is not understood is left undecoded.
	 */
	private void decodeTime(DatasetVariable var) {
		String calKey = calendarKey(var);
		Object rawCal = (calKey == null) ? null : var.getAttributes().get(calKey);
		String calName = (rawCal == null) ? DEFAULT_TIME_CALENDAR : rawCal.toString();
		CfCalendar cal = CfCalendar.forName(calName);
		if (cal == null) {
			log.warn("Unable to decode time axis '{}': unknown calendar '{}'", var.getName(), calName);
			return;
		}

		var.getEncoding().put("units", var.getAttributes().remove("units"));
		if (rawCal != null) {
			var.getEncoding().put("calendar", var.getAttributes().remove(calKey));
		}
		var.setDecodedCalendar(calName.trim().toLowerCase());
		log.debug("decoded time axis '{}': calendar '{}'", var.getName(), var.getDecodedCalendar());
	}

	/** Key of the calendar attribute, tolerating case and punctuation; null if none */
	private static String calendarKey(DatasetVariable var) {
		try {
			return AttributeNormalizer.guessAttr("calendar", "calendar", var.getAttributes().keySet());

		} catch (KeyNotFoundException e) {
			log.debug("'{}': no calendar attribute", var.getName());
			return null;
		}
	}

	@Override
	public GriddedDataset guessCoordinateAxes(GriddedDataset ds) {
		for (AxisLabel axis : AxisLabel.values()) {
			for (String name : axisClassification.axisNames(ds, null, axis)) {
				DatasetVariable var = ds.getVariable(name);
				if (var != null && !var.getAttributes().containsKey("axis")) {
					log.debug("setting axis '{}' on '{}'", axis, name);
					var.getAttributes().put("axis", axis.name());
				}
			}
		}
		return ds;
	}

	private static List<String> splitNames(Object attr) {
		String s = attr.toString().trim();
		if (s.isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.asList(pSplit.split(s));
	}
}

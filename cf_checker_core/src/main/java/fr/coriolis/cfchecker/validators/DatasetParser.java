package fr.coriolis.cfchecker.validators;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.CfMetadataException;
import fr.coriolis.cfchecker.core.CheckerRuntime;
import fr.coriolis.cfchecker.core.MissingMetadataAttributeException;
import fr.coriolis.cfchecker.core.ParseReport;
import fr.coriolis.cfchecker.core.ParserSettings;
import fr.coriolis.cfchecker.decoders.AxisClassification;
import fr.coriolis.cfchecker.decoders.MetadataDecoder;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.CoordinateInfo;
import fr.coriolis.cfchecker.specs.ExpectedVariable;
import fr.coriolis.cfchecker.units.UnitSystem;

/**
 * Parses the metadata of a freshly opened dataset and validates it against
 * what we expect of its variables.
 * <p>
 * The steps, in order:
 * <ol>
 * <li>blank stripping and tolerant normalization of the attributes (backed up)
 * <li>CF decoding ({@link MetadataDecoder#decode})
 * <li>axis guessing ({@link MetadataDecoder#guessCoordinateAxes})
 * <li>restoration of the attributes lost by decoding
 * <li>reconciliation with the expected variable, if any
 * <li>calendar and presence checks (standard_name, units)
 * </ol>
 * A parser keeps no state about the datasets it has parsed; the same parser
 * can be used for several datasets.
 */
public class DatasetParser {
	private static final Logger log = LogManager.getLogger("DatasetParser");

	private final ParserSettings settings;
	private final MetadataDecoder decoder;
	private final AttributeNormalizer normalizer;
	private final AxisClassifier classifier;
	private final AttributeReconciler reconciler;

	public DatasetParser(ParserSettings settings, MetadataDecoder decoder, AxisClassification axisClassification,
			UnitSystem unitSystem) {
		this.settings = settings;
		this.decoder = decoder;
		this.normalizer = new AttributeNormalizer(settings);
		this.classifier = new AxisClassifier(axisClassification);
		this.reconciler = new AttributeReconciler(settings, unitSystem, classifier);
	}

	/**
	 * Parser using the collaborators of the {@link CheckerRuntime}
	 * 
	 * @throws IllegalStateException if the runtime is not initialized
	 */
	public static DatasetParser fromRuntime(ParserSettings settings) {
		CheckerRuntime rt = CheckerRuntime.get();
		return new DatasetParser(settings, rt.getDecoder(), rt.getAxisClassification(), rt.getUnitSystem());
	}

	// ...........................................
	// PARSING
	// ...........................................

	/**
	 * Parses a dataset and, if <i>expected</i> is given, reconciles it with the
	 * dataset. <i>expected</i> may be corrected in place.
	 * 
	 * @param ds       the dataset as read from file; its attributes get stripped
	 *                 of blanks
	 * @param expected expected variable; null to only check the dataset
	 * @return the decoded dataset, with normalized and restored attributes
	 * @throws CfMetadataException if the dataset does not match the expectation
	 *                             or lacks required attributes
	 */
	public GriddedDataset parse(GriddedDataset ds, ExpectedVariable expected) throws CfMetadataException {
		GriddedDataset decoded = prepare(ds);
		if (expected != null) {
			reconciler.reconcileVariable(expected, decoded);
		}
		checkDatasetAttrs(decoded, expected);
		return decoded;
	}

	public GriddedDataset parse(GriddedDataset ds) throws CfMetadataException {
		return parse(ds, null);
	}

	/**
	 * Parses a dataset and reconciles it with each of the expected variables in
	 * turn. A failure on one variable is logged and recorded in the report; the
	 * other variables are still processed.
	 */
	public ParseReport parseAll(GriddedDataset ds, List<ExpectedVariable> expectations) {
		GriddedDataset decoded = prepare(ds);
		ParseReport report = new ParseReport(decoded);
		checkCalendar(decoded);

		for (ExpectedVariable expected : expectations) {
			String name = expected.getName();
			try {
				reconciler.reconcileVariable(expected, decoded);
				checkVariableAttrs(decoded, expected);
				report.addAccepted(name);

			} catch (CfMetadataException e) {
				log.error("'{}' rejected: {}", name, e.getMessage());
				report.addRejected(name, e);
			}
		}

		log.info("Parsed dataset: {} variable(s) accepted, {} rejected", report.getAccepted().size(),
				report.nRejected());
		return report;
	}

	/** Steps shared by all parses: normalize, decode, guess axes, restore */
	GriddedDataset prepare(GriddedDataset ds) {
		AttributeBackup backup = new AttributeBackup();
		normalizer.normalizeDatasetAttrs(ds, backup);

		GriddedDataset decoded = decoder.decode(ds);
		decoded = decoder.guessCoordinateAxes(decoded);

		normalizer.restoreAttrs(decoded, backup);
		return decoded;
	}

	// ...........................................
	// FINAL CHECKS
	// ...........................................

	/**
	 * Calendar check, then presence of standard_name and units on the expected
	 * variable and its dimension coordinates (on every variable if
	 * <i>expected</i> is null)
	 */
	public void checkDatasetAttrs(GriddedDataset ds, ExpectedVariable expected)
			throws MissingMetadataAttributeException {
		checkCalendar(ds);
		checkVariableAttrs(ds, expected);
	}

	private void checkVariableAttrs(GriddedDataset ds, ExpectedVariable expected)
			throws MissingMetadataAttributeException {
		List<String> names = new ArrayList<String>();
		if (expected == null) {
			names.addAll(ds.getVariableNames());
		} else {
			names.add(expected.getName());
			for (String d : ds.getVariable(expected.getName()).getDimensions()) {
				if (ds.hasVariable(d)) {
					names.add(d);
				} else {
					log.debug("dimension '{}' has no coordinate variable: not checked", d);
				}
			}
		}

		for (String name : names) {
			DatasetVariable var = ds.getVariable(name);
			reconciler.checkStandardName(var);
			reconciler.checkUnit(var);
		}
	}

	/**
	 * Sets the <i>calendar</i> attribute of the time coordinate, if there is
	 * one. The calendar is taken from the decoded time axis, else from the
	 * encoding or the attributes of the time coordinate, else from the global
	 * attributes, else the fallback calendar is used. It is always written in
	 * canonical form.
	 */
	public void checkCalendar(GriddedDataset ds) {
		List<CoordinateInfo> tCoords = classifier.axes(ds).get(AxisLabel.T);
		if (tCoords == null || tCoords.isEmpty()) {
			log.debug("No time axis: assuming static data");
			return;
		}
		if (tCoords.size() > 1) {
			log.error("Found multiple time axes. Ignoring all but '{}'.", tCoords.get(0).getName());
		}
		CoordinateInfo tCoord = tCoords.get(0);
		if (!(tCoord instanceof DatasetVariable)) {
			log.warn("Time coordinate '{}' is not a variable of the dataset: calendar not set", tCoord.getName());
			return;
		}
		DatasetVariable tVar = (DatasetVariable) tCoord;

		String calendar = tVar.getDecodedCalendar();
		if (calendar == null) {
			log.warn("Calendar info parse failed on '{}'.", tVar.getName());
			calendar = calendarFrom(tVar.getEncoding());
		}
		if (calendar == null) {
			calendar = calendarFrom(tVar.getAttributes());
		}
		if (calendar == null) {
			calendar = calendarFrom(ds.getAttributes());
		}
		if (calendar == null) {
			log.error("No calendar associated with '{}' found; using '{}'.", tVar.getName(),
					settings.getFallbackCalendar());
			calendar = settings.getFallbackCalendar();
		}
		tVar.getAttributes().put("calendar", normalizer.canonicalCalendar(calendar));
	} // ..end checkCalendar

	private String calendarFrom(Map<String, Object> attrs) {
		Map<String, Object> d = new LinkedHashMap<String, Object>(attrs);
		normalizer.normalizeCalendar(d);
		Object cal = d.get("calendar");
		return (cal == null) ? null : cal.toString();
	}

	// .........................................
	// ACCESSORS
	// .........................................

	public AxisClassifier getClassifier() {
		return classifier;
	}
}

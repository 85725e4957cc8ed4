package fr.coriolis.cfchecker.validators;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.core.AttributeMismatchException;
import fr.coriolis.cfchecker.core.CfMetadataException;
import fr.coriolis.cfchecker.core.DimensionalityMismatchException;
import fr.coriolis.cfchecker.core.KeyNotFoundException;
import fr.coriolis.cfchecker.core.MissingGroundTruthAttributeException;
import fr.coriolis.cfchecker.core.MissingMetadataAttributeException;
import fr.coriolis.cfchecker.core.ParserSettings;
import fr.coriolis.cfchecker.core.UnsetExpectationException;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AttributeValue;
import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.CoordinateInfo;
import fr.coriolis.cfchecker.specs.ExpectedCoordinate;
import fr.coriolis.cfchecker.specs.ExpectedEntry;
import fr.coriolis.cfchecker.specs.ExpectedVariable;
import fr.coriolis.cfchecker.specs.ScalarQuantity;
import fr.coriolis.cfchecker.units.UnitSystem;

/**
 * Reconciles what we expect of a variable ({@link ExpectedVariable}, from the
 * naming convention of the data source) with what the dataset actually holds.
 * <p>
 * The dataset is the ground truth. Depending on the call, a disagreement
 * corrects our expectation, fills in a missing dataset attribute, or is
 * reported as a {@link CfMetadataException}. See
 * {@link #compareAttr(AttributeRef, AttributeRef, BiPredicate, boolean, boolean)}.
 */
public class AttributeReconciler {
	private static final Logger log = LogManager.getLogger("AttributeReconciler");

	/** Relative tolerance on scalar coordinate values */
	public static final double SCALAR_RTOL = 1.0e-5;
	/** Relative tolerance for two unit strings to be "equal" */
	public static final double UNITS_RTOL = 1.0e-8;

	static final String SCALAR_VALUE = "scalar_value";

	public static final BiPredicate<Object, Object> EQUALS = (a, b) -> a.equals(b);

	private final ParserSettings settings;
	private final UnitSystem unitSystem;
	private final AxisClassifier classifier;

	// ..unit comparisons, on the string form of the values
	private final BiPredicate<Object, Object> unitsEquivalent;
	private final BiPredicate<Object, Object> unitsEqual;
	// ..comparisons of (value, units) pairs
	private final BiPredicate<Object, Object> quantityEquivalent;
	private final BiPredicate<Object, Object> quantityEqual;
	private final BiPredicate<Object, Object> valueEqual;

	public AttributeReconciler(ParserSettings settings, UnitSystem unitSystem, AxisClassifier classifier) {
		this.settings = settings;
		this.unitSystem = unitSystem;
		this.classifier = classifier;

		unitsEquivalent = (a, b) -> unitSystem.unitsEquivalent(a.toString(), b.toString());
		unitsEqual = (a, b) -> unitSystem.unitsEqual(a.toString(), b.toString(), UNITS_RTOL);
		quantityEquivalent = (a, b) -> unitSystem.unitsEquivalent(((ScalarQuantity) a).getUnits(),
				((ScalarQuantity) b).getUnits());
		quantityEqual = (a, b) -> quantitiesEqual((ScalarQuantity) a, (ScalarQuantity) b);
		valueEqual = (a, b) -> closeEnough(((Number) a).doubleValue(), ((Number) b).doubleValue());
	}

	// ======================
	// Comparison primitive
	// ======================

	/**
	 * Compares an attribute of our expectation with the same attribute in the
	 * dataset:
	 * <ul>
	 * <li>dataset value empty: written from ours if <i>updateTheirs</i>, else
	 * {@link MissingGroundTruthAttributeException}
	 * <li>our value empty: taken from the dataset if <i>updateOurs</i>, else
	 * {@link UnsetExpectationException}
	 * <li>values differ under <i>comparison</i>: ours is replaced by the dataset
	 * value if <i>updateOurs</i>, and in any case
	 * {@link AttributeMismatchException} is thrown
	 * <li>values agree: nothing
	 * </ul>
	 *
	 * @param ours         our side
	 * @param theirs       dataset side
	 * @param comparison   comparison of (ours, theirs) values; null for equality
	 * @param updateOurs   our side may take the dataset value
	 * @param updateTheirs the dataset may take our value where it has none
	 */
	public void compareAttr(AttributeRef ours, AttributeRef theirs, BiPredicate<Object, Object> comparison,
			boolean updateOurs, boolean updateTheirs) throws CfMetadataException {
		if (comparison == null) {
			comparison = EQUALS;
		}
		AttributeValue ourValue = ours.getValue();
		AttributeValue theirValue = theirs.getValue();
		String attrName = theirs.getAttrName();

		if (theirValue.isEmpty()) {
			if (!updateTheirs) {
				throw new MissingGroundTruthAttributeException("No " + attrName + " for '" + ours.getOwnerName()
						+ "' (= " + ourValue + ") found in dataset.");
			}
			if (ourValue.isEmpty()) {
				// ..nothing to write: the presence checks will catch it
				log.debug("No {} for '{}' on either side", attrName, ours.getOwnerName());
				return;
			}
			log.warn("No {} for '{}' found in dataset; setting to '{}'.", attrName, ours.getOwnerName(), ourValue);
			theirs.update(ourValue.get().toString());
			return;
		}

		if (ourValue.isEmpty()) {
			if (!updateOurs) {
				throw new UnsetExpectationException("'" + ours.getOwnerName() + "' not set but " + attrName
						+ " (= " + theirValue + ") present in dataset.");
			}
			if (!(ExpectedEntry.NAME.equals(ours.getAttrName()) && theirValue.get().equals(ours.getOwnerName()))) {
				log.debug("Updating {} for '{}' to value '{}' from dataset.", ours.getAttrName(),
						ours.getOwnerName(), theirValue);
			}
			ours.update(theirValue.get());
			return;
		}

		if (!comparison.test(ourValue.get(), theirValue.get())) {
			if (updateOurs) {
				ours.update(theirValue.get());
			}
			throw new AttributeMismatchException(ours.getOwnerName(), ours.getAttrName(), ourValue.get(),
					theirValue.get());
		}
	} // ..end compareAttr

	// ======================
	// Names and attributes
	// ======================

	/**
	 * @param forceUpdate always take the name found in the dataset
	 */
	public void reconcileName(ExpectedEntry ours, String dsName, boolean forceUpdate) throws CfMetadataException {
		AttributeValue ourName = forceUpdate ? AttributeValue.absent() : AttributeValue.ofNullable(ours.getName());
		String ownerName = (ours.getName() == null) ? dsName : ours.getName();
		compareAttr(new AttributeRef(ownerName, ExpectedEntry.NAME, ourName, v -> ours.setName(v.toString())),
				AttributeRef.readOnly(dsName, ExpectedEntry.NAME, AttributeValue.ofNullable(dsName)), EQUALS, true,
				false);
	}

	/**
	 * Checks that <i>dsName</i> is a variable of the dataset, then reconciles the
	 * name and the standard name
	 * 
	 * @throws KeyNotFoundException if <i>dsName</i> is not in the dataset
	 */
	public void reconcileNames(ExpectedEntry ours, GriddedDataset ds, String dsName, boolean forceUpdate)
			throws CfMetadataException {
		if (!ds.hasVariable(dsName)) {
			throw new KeyNotFoundException(dsName,
					"Variable name '" + dsName + "' not found in dataset: " + ds.getVariableNames() + ".");
		}
		reconcileName(ours, dsName, forceUpdate);
		reconcileAttr(ours, ds.getVariable(dsName), ExpectedEntry.STANDARD_NAME, EQUALS, true, true);
	}

	public void reconcileAttr(ExpectedEntry ours, DatasetVariable theirs, String attrName,
			BiPredicate<Object, Object> comparison, boolean updateOurs, boolean updateTheirs)
			throws CfMetadataException {
		compareAttr(AttributeRef.of(ours, attrName), AttributeRef.of(theirs, attrName), comparison, updateOurs,
				updateTheirs);
	}

	/**
	 * Reconciles units: they must be present in the dataset, and physically
	 * equivalent to ours. Equivalent but different units are only logged, and our
	 * units put in canonical form; the conversion is left to later processing.
	 */
	public void reconcileUnits(ExpectedEntry ours, DatasetVariable theirs) throws CfMetadataException {
		checkUnit(theirs);
		boolean lenient = settings.isDisableUnitChecks();

		// ..inequivalent units are fatal
		reconcileAttr(ours, theirs, ExpectedEntry.UNITS, unitsEquivalent, true, lenient);

		try {
			reconcileAttr(ours, theirs, ExpectedEntry.UNITS, unitsEqual, false, lenient);

		} catch (AttributeMismatchException e) {
			log.warn("Caught {}", e.getMessage());
			ours.setUnits(unitSystem.toCanonicalForm(ours.getUnits()));
		}
	}

	// ======================
	// Coordinates
	// ======================

	/**
	 * The bounds of a coordinate inherit its standard name and units when they
	 * have none. Records the bounds variable name on <i>ours</i> (null if the
	 * coordinate has no bounds).
	 */
	public void reconcileCoordBounds(ExpectedCoordinate ours, GriddedDataset ds, String dsCoordName)
			throws CfMetadataException {
		DatasetVariable bounds;
		try {
			bounds = ds.findBounds(dsCoordName);
		} catch (KeyNotFoundException e) {
			log.debug("'{}': no bounds ({})", dsCoordName, e.getMessage());
			ours.setBoundsName(null);
			return;
		}

		reconcileAttr(ours, bounds, ExpectedEntry.STANDARD_NAME, EQUALS, false, true);
		reconcileAttr(ours, bounds, ExpectedEntry.UNITS, unitsEqual, false, true);
		if (!bounds.getName().equals(ours.getBoundsName())) {
			log.debug("Updating bounds for '{}' to value '{}' from dataset.", ours.getName(), bounds.getName());
		}
		ours.setBoundsName(bounds.getName());
	}

	/**
	 * Reconciles the (value, units) of a scalar coordinate with a size 1
	 * coordinate of the dataset. Units must be equivalent; a difference beyond
	 * {@link #SCALAR_RTOL} only gets logged, our side taking the dataset values.
	 * <p>
	 * If the dataset gives no units and unit checks are disabled, only the value
	 * is compared and our units are written into the dataset.
	 */
	public void reconcileScalarValueAndUnits(ExpectedCoordinate ours, DatasetVariable theirs)
			throws CfMetadataException {
		if (!ours.isScalar()) {
			throw new IllegalArgumentException("'" + ours.getName() + "' is not a scalar coordinate");
		}
		double[] values = theirs.getValues();
		if (values == null || values.length != 1) {
			log.warn("No single value read for scalar coordinate '{}'; checking units only", theirs.getName());
			reconcileUnits(ours, theirs);
			return;
		}
		double dsValue = values[0];

		AttributeValue dsUnits = theirs.getAttribute(ExpectedEntry.UNITS);
		if (dsUnits.isEmpty()) {
			if (!settings.isDisableUnitChecks()) {
				throw new MissingGroundTruthAttributeException(
						"No units for scalar coordinate '" + theirs.getName() + "' found in dataset.");
			}
			compareValueOnly(ours, theirs, dsValue);
			return;
		}

		ScalarQuantity dsQuantity = new ScalarQuantity(dsValue, dsUnits.asString());
		// ..inequivalent units are fatal
		compareQuantity(ours, theirs.getName(), dsQuantity, quantityEquivalent);

		try {
			compareQuantity(ours, theirs.getName(), dsQuantity, quantityEqual);

		} catch (AttributeMismatchException e) {
			log.warn("Caught {}", e.getMessage());
			ours.setUnits(unitSystem.toCanonicalForm(ours.getUnits()));
		}
	} // ..end reconcileScalarValueAndUnits

	private void compareQuantity(ExpectedCoordinate ours, String dsName, ScalarQuantity dsQuantity,
			BiPredicate<Object, Object> comparison) throws CfMetadataException {
		AttributeValue ourQuantity = AttributeValue.absent();
		if (ours.getValue() != null && ours.getUnits() != null) {
			ourQuantity = AttributeValue.of(new ScalarQuantity(ours.getValue(), ours.getUnits()));
		}
		AttributeRef ourRef = new AttributeRef(ours.getName(), SCALAR_VALUE, ourQuantity, v -> {
			ScalarQuantity q = (ScalarQuantity) v;
			ours.setValue(q.getValue());
			ours.setUnits(unitSystem.toCanonicalForm(q.getUnits()));
			log.debug("Updated (value, units) of '{}' to ({}, {}).", ours.getName(), ours.getValue(),
					ours.getUnits());
		});
		compareAttr(ourRef, AttributeRef.readOnly(dsName, SCALAR_VALUE, AttributeValue.of(dsQuantity)), comparison,
				true, false);
	}

	private void compareValueOnly(ExpectedCoordinate ours, DatasetVariable theirs, double dsValue)
			throws CfMetadataException {
		AttributeRef ourRef = new AttributeRef(ours.getName(), SCALAR_VALUE,
				AttributeValue.ofNullable(ours.getValue()), v -> ours.setValue(((Number) v).doubleValue()));
		compareAttr(ourRef, AttributeRef.readOnly(theirs.getName(), SCALAR_VALUE, AttributeValue.of(dsValue)),
				valueEqual, true, false);

		// ..the dataset takes our units
		compareAttr(AttributeRef.of(ours, ExpectedEntry.UNITS), AttributeRef.of(theirs, ExpectedEntry.UNITS),
				EQUALS, false, true);
	}

	/**
	 * Reconciles the dimension coordinates of a variable: same set of axes on
	 * both sides, then for each axis the name, standard name, units and bounds.
	 * 
	 * @throws DimensionalityMismatchException if the axes differ
	 */
	public void reconcileDimensionCoords(ExpectedVariable ours, GriddedDataset ds) throws CfMetadataException {
		Map<AxisLabel, CoordinateInfo> dsAxes = classifier.dimAxes(ds, ours.getName());
		Set<AxisLabel> ourAxesSet = ours.getDimAxesSet();
		Set<AxisLabel> dsAxesSet = dsAxes.isEmpty() ? EnumSet.noneOf(AxisLabel.class)
				: EnumSet.copyOf(dsAxes.keySet());
		if (!ourAxesSet.equals(dsAxesSet)) {
			throw new DimensionalityMismatchException("Variable " + ours.getName()
					+ " has unexpected dimensionality: expected axes " + ourAxesSet + ", got " + dsAxesSet + ".");
		}

		for (ExpectedCoordinate coord : ours.getDimAxes().values()) {
			String dsCoordName = dsAxes.get(coord.getAxis()).getName();
			reconcileNames(coord, ds, dsCoordName, true);
			reconcileUnits(coord, ds.getVariable(dsCoordName));
			reconcileCoordBounds(coord, ds, dsCoordName);
		}

		CoordinateInfo z = dsAxes.get(AxisLabel.Z);
		for (String d : ds.getVariable(ours.getName()).getDimensions()) {
			if (ds.getDimensionLength(d) == 1) {
				if (z != null && d.equals(z.getName())) {
					log.warn("Dataset has dimension coordinate '{}' of size 1 not identified as scalar coord.", d);
				} else {
					// ..single-column models
					log.debug("Dataset has dimension coordinate '{}' of size 1.", d);
				}
			}
		}
	} // ..end reconcileDimensionCoords

	/**
	 * Reconciles the scalar coordinates of a variable. Only vertical scalar
	 * coordinates are supported. A scalar coordinate the dataset only knows by
	 * name (in a <i>coordinates</i> attribute) gets its name reconciled, its value
	 * and units are assumed correct.
	 */
	public void reconcileScalarCoords(ExpectedVariable ours, GriddedDataset ds) throws CfMetadataException {
		List<ExpectedCoordinate> ourScalars = ours.getScalarCoords();
		List<AxisLabel> ourAxes = new ArrayList<AxisLabel>();
		for (ExpectedCoordinate c : ourScalars) {
			ourAxes.add(c.getAxis());
		}
		List<AxisLabel> dsAxes = new ArrayList<AxisLabel>();
		List<AxisCoordinate> dsScalars = classifier.scalarCoords(ds, ours.getName());
		for (AxisCoordinate c : dsScalars) {
			dsAxes.add(c.getAxis());
		}

		if (!ourAxes.isEmpty() && !EnumSet.of(AxisLabel.Z).equals(EnumSet.copyOf(ourAxes))) {
			log.error("Scalar coordinates on non-vertical axes not supported: {}", ourScalars);
		}
		if (!ourAxes.isEmpty() && dsAxes.isEmpty()) {
			log.debug("Dataset did not provide any scalar coordinate information, expected {}.", ourScalars);
		} else if (!ourAxes.equals(dsAxes)) {
			log.warn("Conflict in scalar coordinates for {}: expected {}; dataset has {}.", ours.getName(),
					ourScalars, dsScalars);
		}

		Map<AxisLabel, CoordinateInfo> varAxes = classifier.axes(ds, ours.getName());
		for (ExpectedCoordinate coord : ourScalars) {
			CoordinateInfo dsCoord = varAxes.get(coord.getAxis());
			if (dsCoord == null) {
				continue;
			}
			String dsCoordName = dsCoord.getName();
			if (ds.hasVariable(dsCoordName)) {
				long size = ds.sizeOf(dsCoordName);
				reconcileNames(coord, ds, dsCoordName, true);
				if (size == 1) {
					reconcileScalarValueAndUnits(coord, ds.getVariable(dsCoordName));
				} else {
					log.error("Dataset has scalar coordinate '{}' of size {} != 1.", dsCoordName, size);
				}
			} else {
				log.warn("Dataset only records scalar coordinate '{}' as a name attribute; "
						+ "assuming value and units are correct.", dsCoordName);
				reconcileName(coord, dsCoordName, true);
			}
		}
	} // ..end reconcileScalarCoords

	/**
	 * Reconciles a variable with the dataset: names and units of the variable
	 * itself, then its dimension coordinates, then its scalar coordinates
	 */
	public void reconcileVariable(ExpectedVariable ours, GriddedDataset ds) throws CfMetadataException {
		reconcileNames(ours, ds, ours.getName(), false);
		reconcileUnits(ours, ds.getVariable(ours.getName()));
		reconcileDimensionCoords(ours, ds);
		reconcileScalarCoords(ours, ds);
	}

	// ======================
	// Presence checks
	// ======================

	/**
	 * @throws MissingMetadataAttributeException if the variable has no
	 *                                           standard_name (unless the check
	 *                                           is disabled)
	 */
	public void checkStandardName(DatasetVariable var) throws MissingMetadataAttributeException {
		if (var.getAttribute(ExpectedEntry.STANDARD_NAME).isAbsent()) {
			if (settings.isDisableStandardNameChecks()) {
				log.warn("'standard_name' attribute not found on {}.", var.getName());
			} else {
				throw new MissingMetadataAttributeException(var.getName(), ExpectedEntry.STANDARD_NAME,
						"Netcdf metadata attribute 'standard_name' not found on variable " + var.getName()
								+ ". Please provide this attribute in input data or set "
								+ ParserSettings.DISABLE_STANDARD_NAME_CHECKS + ".");
			}
		}
	}

	/**
	 * @throws MissingMetadataAttributeException if the variable has no units
	 *                                           (unless the check is disabled)
	 */
	public void checkUnit(DatasetVariable var) throws MissingMetadataAttributeException {
		if (var.getAttribute(ExpectedEntry.UNITS).isAbsent()) {
			if (settings.isDisableUnitChecks()) {
				log.warn("'units' attribute not found on {}.", var.getName());
			} else {
				throw new MissingMetadataAttributeException(var.getName(), ExpectedEntry.UNITS,
						"Netcdf metadata attribute 'units' not found on variable " + var.getName()
								+ ". Please provide this attribute in input data or set "
								+ ParserSettings.DISABLE_UNIT_CHECKS + ".");
			}
		}
	}

	// ......value comparisons......

	private boolean quantitiesEqual(ScalarQuantity a, ScalarQuantity b) {
		if (a.getValue() == 0.0 || b.getValue() == 0.0) {
			// ..a zero value would make the scaled unit meaningless
			return closeEnough(a.getValue(), b.getValue())
					&& unitSystem.unitsEqual(a.getUnits(), b.getUnits(), SCALAR_RTOL);
		}
		return unitSystem.unitsEqual(a.toUnitString(), b.toUnitString(), SCALAR_RTOL);
	}

	private static boolean closeEnough(double a, double b) {
		return Math.abs(a - b) <= SCALAR_RTOL * Math.max(Math.abs(a), Math.abs(b));
	}
}

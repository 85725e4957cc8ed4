package fr.coriolis.cfchecker.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.decoders.AxisClassification;
import fr.coriolis.cfchecker.decoders.CfAxisGuesser;
import fr.coriolis.cfchecker.decoders.CfMetadataDecoder;
import fr.coriolis.cfchecker.decoders.MetadataDecoder;
import fr.coriolis.cfchecker.units.UdunitsUnitSystem;
import fr.coriolis.cfchecker.units.UnitSystem;

/**
 * Process-wide collaborators of the checker: the unit system, the axis
 * classification and the metadata decoder.
 * <p>
 * {@link #initialize()} must be called once before {@link #get()}; loading the
 * UDUNITS database is the expensive part. Tests can install their own
 * collaborators with {@link #initialize(UnitSystem, AxisClassification, MetadataDecoder)}.
 */
public class CheckerRuntime {
	private static final Logger log = LogManager.getLogger("CheckerRuntime");

	private static CheckerRuntime instance = null;

	private final UnitSystem unitSystem;
	private final AxisClassification axisClassification;
	private final MetadataDecoder decoder;

	private CheckerRuntime(UnitSystem unitSystem, AxisClassification axisClassification, MetadataDecoder decoder) {
		this.unitSystem = unitSystem;
		this.axisClassification = axisClassification;
		this.decoder = decoder;
	}

	/**
	 * Sets up the default collaborators (UDUNITS, CF axis detection). Calling it
	 * again has no effect.
	 */
	public static synchronized CheckerRuntime initialize() {
		if (instance == null) {
			AxisClassification axes = new CfAxisGuesser();
			instance = new CheckerRuntime(new UdunitsUnitSystem(), axes, new CfMetadataDecoder(axes));
			log.info("Checker runtime initialized (UDUNITS units, CF axis detection)");
		}
		return instance;
	}

	/** Replaces the collaborators */
	public static synchronized CheckerRuntime initialize(UnitSystem unitSystem,
			AxisClassification axisClassification, MetadataDecoder decoder) {
		if (unitSystem == null || axisClassification == null || decoder == null) {
			throw new IllegalArgumentException("CheckerRuntime: null collaborator");
		}
		instance = new CheckerRuntime(unitSystem, axisClassification, decoder);
		log.debug("Checker runtime initialized with {}, {}, {}", unitSystem.getClass().getSimpleName(),
				axisClassification.getClass().getSimpleName(), decoder.getClass().getSimpleName());
		return instance;
	}

	/**
	 * @throws IllegalStateException if not initialized
	 */
	public static synchronized CheckerRuntime get() {
		if (instance == null) {
			throw new IllegalStateException("CheckerRuntime.initialize() has not been called");
		}
		return instance;
	}

	public static synchronized boolean isInitialized() {
		return instance != null;
	}

	public static synchronized void shutdown() {
		instance = null;
	}

	// .........................................
	// ACCESSORS
	// .........................................

	public UnitSystem getUnitSystem() {
		return unitSystem;
	}

	public AxisClassification getAxisClassification() {
		return axisClassification;
	}

	public MetadataDecoder getDecoder() {
		return decoder;
	}
}

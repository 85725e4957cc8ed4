package fr.coriolis.cfchecker.core;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import fr.coriolis.cfchecker.specs.CfCalendar;

/**
 * Options recognized by the metadata parser.
 * <p>
 * The settings are read from a plain properties file:
 * 
 * <pre>
 * disable_standard_name_checks = false
 * disable_unit_checks = false
 * fallback_calendar = proleptic_gregorian
 * </pre>
 * 
 * <ul>
 * <li><b>disable_standard_name_checks</b>: a missing <i>standard_name</i> is
 * logged as a warning instead of failing the variable
 * <li><b>disable_unit_checks</b>: a missing <i>units</i> is logged as a
 * warning, and the dataset is allowed to take our units where it has none
 * <li><b>fallback_calendar</b>: calendar used when none (or an unrecognized
 * one) is found on the time axis
 * </ul>
 */
public class ParserSettings {
	private static final Logger log = LogManager.getLogger("ParserSettings");

	// ..property keys
	public static final String DISABLE_STANDARD_NAME_CHECKS = "disable_standard_name_checks";
	public static final String DISABLE_UNIT_CHECKS = "disable_unit_checks";
	public static final String FALLBACK_CALENDAR = "fallback_calendar";

	public static final String DEFAULT_FALLBACK_CALENDAR = CfCalendar.PROLEPTIC_GREGORIAN.getName();

	// ..classpath resource read by loadDefault()
	public static final String RESOURCE_NAME = "cf-checker.properties";

	private boolean disableStandardNameChecks = false;
	private boolean disableUnitChecks = false;
	private String fallbackCalendar = DEFAULT_FALLBACK_CALENDAR;

	public ParserSettings() {
	}

	public ParserSettings(boolean disableStandardNameChecks, boolean disableUnitChecks, String fallbackCalendar) {
		this.disableStandardNameChecks = disableStandardNameChecks;
		this.disableUnitChecks = disableUnitChecks;
		setFallbackCalendar(fallbackCalendar);
	}

	// .........................................
	// ACCESSORS
	// .........................................

	public boolean isDisableStandardNameChecks() {
		return disableStandardNameChecks;
	}

	public void setDisableStandardNameChecks(boolean disableStandardNameChecks) {
		this.disableStandardNameChecks = disableStandardNameChecks;
	}

	public boolean isDisableUnitChecks() {
		return disableUnitChecks;
	}

	public void setDisableUnitChecks(boolean disableUnitChecks) {
		this.disableUnitChecks = disableUnitChecks;
	}

	public String getFallbackCalendar() {
		return fallbackCalendar;
	}

	/**
	 * Sets the fallback calendar. Aliases are stored under their canonical name;
	 * a name outside the CF vocabulary is rejected in favor of the default.
	 */
	public void setFallbackCalendar(String calendar) {
		CfCalendar cal = (calendar == null) ? null : CfCalendar.forName(calendar);
		if (cal == null) {
			log.warn("Unrecognized fallback calendar '{}'; using '{}'", calendar, DEFAULT_FALLBACK_CALENDAR);
			this.fallbackCalendar = DEFAULT_FALLBACK_CALENDAR;
		} else {
			this.fallbackCalendar = cal.getName();
		}
	}

	// .........................................
	// LOADING
	// .........................................

	/**
	 * Builds settings from a Properties object. Missing keys keep their default
	 * value.
	 */
	public static ParserSettings fromProperties(Properties props) {
		ParserSettings settings = new ParserSettings();
		settings.disableStandardNameChecks = Boolean
				.parseBoolean(props.getProperty(DISABLE_STANDARD_NAME_CHECKS, "false").trim());
		settings.disableUnitChecks = Boolean.parseBoolean(props.getProperty(DISABLE_UNIT_CHECKS, "false").trim());
		settings.setFallbackCalendar(props.getProperty(FALLBACK_CALENDAR, DEFAULT_FALLBACK_CALENDAR).trim());
		log.debug("settings: {}", settings);
		return settings;
	}

	/**
	 * Reads the settings from a properties file
	 * 
	 * @param fileName name of the properties file
	 * @return the settings
	 * @throws IOException If the file cannot be read
	 */
	public static ParserSettings load(String fileName) throws IOException {
		File file = new File(fileName);
		if (!file.canRead()) {
			log.error("'{}' cannot be read", fileName);
			throw new IOException("Settings file '" + fileName + "' cannot be read");
		}

		Properties props = new Properties();
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			props.load(reader);
		}
		log.info("settings file = '{}'", fileName);
		return fromProperties(props);
	}

	/**
	 * Reads the settings from the {@value #RESOURCE_NAME} classpath resource, if
	 * there is one. Returns the defaults otherwise.
	 * 
	 * @throws IOException If the resource exists but cannot be read
	 */
	public static ParserSettings loadDefault() throws IOException {
		try (InputStream in = ParserSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
			if (in == null) {
				log.debug("no '{}' on the classpath; using defaults", RESOURCE_NAME);
				return new ParserSettings();
			}
			Properties props = new Properties();
			props.load(in);
			return fromProperties(props);
		}
	}

	@Override
	public String toString() {
		return DISABLE_STANDARD_NAME_CHECKS + "=" + disableStandardNameChecks + ", " + DISABLE_UNIT_CHECKS + "="
				+ disableUnitChecks + ", " + FALLBACK_CALENDAR + "=" + fallbackCalendar;
	}
}

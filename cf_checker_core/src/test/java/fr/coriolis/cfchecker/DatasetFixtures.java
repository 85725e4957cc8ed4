package fr.coriolis.cfchecker;

import fr.coriolis.cfchecker.core.ParserSettings;
import fr.coriolis.cfchecker.decoders.CfAxisGuesser;
import fr.coriolis.cfchecker.decoders.CfMetadataDecoder;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.ExpectedCoordinate;
import fr.coriolis.cfchecker.specs.ExpectedVariable;
import fr.coriolis.cfchecker.validators.DatasetParser;

/** In-memory datasets and expectations shared by the tests */
public final class DatasetFixtures {

	private DatasetFixtures() {
	}

	/** pr(time, lat, lon) in mm/day, noleap time axis with bounds */
	public static GriddedDataset prDataset() {
		GriddedDataset ds = new GriddedDataset();
		ds.addDimension("time", 3).addDimension("lat", 2).addDimension("lon", 2).addDimension("bnds", 2);
		ds.getAttributes().put("Conventions", "CF-1.7");
		ds.addVariable(new DatasetVariable("time", "time").attr("standard_name", "time")
				.attr("units", "days since 2000-01-01").attr("calendar", "noleap").attr("bounds", "time_bnds"));
		ds.addVariable(new DatasetVariable("time_bnds", "time", "bnds"));
		ds.addVariable(
				new DatasetVariable("lat", "lat").attr("standard_name", "latitude").attr("units", "degrees_north"));
		ds.addVariable(
				new DatasetVariable("lon", "lon").attr("standard_name", "longitude").attr("units", "degrees_east"));
		ds.addVariable(new DatasetVariable("pr", "time", "lat", "lon").attr("standard_name", "precipitation_flux")
				.attr("units", "mm/day"));
		return ds;
	}

	public static ExpectedVariable expectedPr() {
		return new ExpectedVariable("pr", "precipitation_flux", "kg m-2 s-1")
				.addCoordinate(new ExpectedCoordinate("time", AxisLabel.T, "time", "days since 2000-01-01"))
				.addCoordinate(new ExpectedCoordinate("lat", AxisLabel.Y, "latitude", "degrees_north"))
				.addCoordinate(new ExpectedCoordinate("lon", AxisLabel.X, "longitude", "degrees_east"));
	}

	/** ta(time, plev19, lat, lon) */
	public static GriddedDataset taDataset() {
		GriddedDataset ds = new GriddedDataset();
		ds.addDimension("time", 2).addDimension("plev19", 19).addDimension("lat", 2).addDimension("lon", 2);
		ds.addVariable(new DatasetVariable("time", "time").attr("standard_name", "time").attr("units",
				"hours since 1980-01-01 00:00:00"));
		ds.addVariable(
				new DatasetVariable("plev19", "plev19").attr("standard_name", "air_pressure").attr("units", "Pa"));
		ds.addVariable(
				new DatasetVariable("lat", "lat").attr("standard_name", "latitude").attr("units", "degrees_north"));
		ds.addVariable(
				new DatasetVariable("lon", "lon").attr("standard_name", "longitude").attr("units", "degrees_east"));
		ds.addVariable(new DatasetVariable("ta", "time", "plev19", "lat", "lon").attr("standard_name", "air_temperature")
				.attr("units", "K"));
		return ds;
	}

	/** ua(time, lat, lon) on the 850 hPa level, given as a scalar coordinate */
	public static GriddedDataset uaDataset() {
		GriddedDataset ds = new GriddedDataset();
		ds.addDimension("time", 2).addDimension("lat", 2).addDimension("lon", 2);
		ds.addVariable(new DatasetVariable("time", "time").attr("standard_name", "time").attr("units",
				"days since 1850-01-01"));
		ds.addVariable(
				new DatasetVariable("lat", "lat").attr("standard_name", "latitude").attr("units", "degrees_north"));
		ds.addVariable(
				new DatasetVariable("lon", "lon").attr("standard_name", "longitude").attr("units", "degrees_east"));
		DatasetVariable plev = new DatasetVariable("plev").attr("standard_name", "air_pressure").attr("units", "Pa");
		plev.setValues(85000.0);
		ds.addVariable(plev);
		ds.addVariable(new DatasetVariable("ua", "time", "lat", "lon").attr("standard_name", "eastward_wind")
				.attr("units", "m s-1").attr("coordinates", "plev"));
		return ds;
	}

	public static ExpectedVariable expectedUa(Double level, String levelUnits) {
		return new ExpectedVariable("ua", "eastward_wind", "m/s")
				.addCoordinate(new ExpectedCoordinate("time", AxisLabel.T, "time", "days since 1850-01-01"))
				.addCoordinate(new ExpectedCoordinate("lat", AxisLabel.Y, "latitude", "degrees_north"))
				.addCoordinate(new ExpectedCoordinate("lon", AxisLabel.X, "longitude", "degrees_east"))
				.addCoordinate(ExpectedCoordinate.scalar("plev", AxisLabel.Z, "air_pressure", levelUnits, level));
	}

	/** Parser with CF decoding and the stub unit system */
	public static DatasetParser parser(ParserSettings settings) {
		CfAxisGuesser guesser = new CfAxisGuesser();
		return new DatasetParser(settings, new CfMetadataDecoder(guesser), guesser, new StubUnitSystem());
	}

	public static DatasetParser parser() {
		return parser(new ParserSettings());
	}
}

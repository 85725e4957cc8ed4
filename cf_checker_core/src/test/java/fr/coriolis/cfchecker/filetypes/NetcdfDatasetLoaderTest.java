package fr.coriolis.cfchecker.filetypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import ucar.ma2.Array;
import ucar.ma2.ArrayDouble;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;

@DisplayName("Reading netCDF metadata")
@Tag("netcdf")
class NetcdfDatasetLoaderTest {

	@TempDir
	Path dir;

	private String writeUaFile() throws IOException, InvalidRangeException {
		String path = dir.resolve("ua_850.nc").toString();
		NetcdfFileWriter writer = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, path);

		writer.addDimension(null, "time", 2);
		writer.addDimension(null, "lat", 3);
		writer.addGroupAttribute(null, new Attribute("Conventions", "CF-1.7"));

		Variable time = writer.addVariable(null, "time", DataType.DOUBLE, "time");
		writer.addVariableAttribute(time, new Attribute("units", "days since 1850-01-01"));
		writer.addVariableAttribute(time, new Attribute("calendar", "noleap"));

		Variable lat = writer.addVariable(null, "lat", DataType.FLOAT, "lat");
		writer.addVariableAttribute(lat, new Attribute("units", "degrees_north"));
		writer.addVariableAttribute(lat, new Attribute("valid_range", Arrays.asList(-90.0f, 90.0f)));

		Variable plev = writer.addVariable(null, "plev", DataType.DOUBLE, new ArrayList<Dimension>());
		writer.addVariableAttribute(plev, new Attribute("units", "Pa"));

		Variable ua = writer.addVariable(null, "ua", DataType.FLOAT, "time lat");
		writer.addVariableAttribute(ua, new Attribute("units", "m s-1"));
		writer.addVariableAttribute(ua, new Attribute("coordinates", "plev"));

		writer.create();
		ArrayDouble.D0 level = new ArrayDouble.D0();
		level.set(85000.0);
		writer.write(plev, level);
		writer.close();
		return path;
	}

	@Test
	void load_shouldReadDimensionsAndAttributes() throws IOException, InvalidRangeException {
		GriddedDataset ds = NetcdfDatasetLoader.load(writeUaFile());

		assertEquals(2, ds.getDimensionLength("time"));
		assertEquals(3, ds.getDimensionLength("lat"));
		assertEquals("CF-1.7", ds.getAttribute("Conventions").get());
		assertEquals(Arrays.asList("time", "lat"), ds.getVariable("ua").getDimensions());
		assertEquals("plev", ds.getVariable("ua").getAttribute("coordinates").get());
		assertEquals("noleap", ds.getVariable("time").getAttribute("calendar").get());
		assertTrue(ds.getVariable("lat").getAttribute("valid_range").get() instanceof List);
	}

	@Test
	void load_shouldReadScalarValues() throws IOException, InvalidRangeException {
		GriddedDataset ds = NetcdfDatasetLoader.load(writeUaFile());

		assertEquals(85000.0, ds.getVariable("plev").getScalarValue(), 1.0e-9);
		assertNull(ds.getVariable("lat").getValues());
	}

	private String writeFlagFile() throws IOException, InvalidRangeException {
		String path = dir.resolve("flag.nc").toString();
		NetcdfFileWriter writer = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, path);

		Variable flag = writer.addVariable(null, "flag", DataType.BYTE, new ArrayList<Dimension>());
		writer.addVariableAttribute(flag, new Attribute(NetcdfDatasetLoader.UNSIGNED, "true"));
		writer.addVariableAttribute(flag, new Attribute("valid_range",
				Array.factory(DataType.BYTE, new int[] { 2 }, new byte[] { 0, (byte) 250 })));
		Variable level = writer.addVariable(null, "level", DataType.BYTE, new ArrayList<Dimension>());

		writer.create();
		writer.write(flag, Array.factory(DataType.BYTE, new int[0], new byte[] { (byte) 200 }));
		writer.write(level, Array.factory(DataType.BYTE, new int[0], new byte[] { (byte) 200 }));
		writer.close();
		return path;
	}

	@Test
	void load_shouldWidenUnsignedValues() throws IOException, InvalidRangeException {
		GriddedDataset ds = NetcdfDatasetLoader.load(writeFlagFile());
		DatasetVariable flag = ds.getVariable("flag");

		assertEquals(200.0, flag.getScalarValue(), 0.0);
		List<?> range = (List<?>) flag.getAttribute("valid_range").get();
		assertEquals(0, ((Number) range.get(0)).intValue());
		assertEquals(250, ((Number) range.get(1)).intValue());
		// ..no _Unsigned flag: signed
		assertEquals(-56.0, ds.getVariable("level").getScalarValue(), 0.0);
	}

	@ParameterizedTest(name = "{1} {0} read as unsigned is {2}")
	@CsvSource({ "-56, BYTE, 200", "-1, SHORT, 65535", "-1, INT, 4294967295", "100, INT, 100", "-1, DOUBLE, -1" })
	void widen_shouldReadSignedStorageAsUnsigned(long stored, String type, long expected) {
		Number value = Long.valueOf(stored);
		DataType dataType = DataType.DOUBLE;
		if ("BYTE".equals(type)) {
			dataType = DataType.BYTE;
		} else if ("SHORT".equals(type)) {
			dataType = DataType.SHORT;
		} else if ("INT".equals(type)) {
			dataType = DataType.INT;
		} else {
			value = Double.valueOf(stored);
		}
		assertEquals(expected, NetcdfDatasetLoader.widen(value, dataType).longValue());
	}

	@Test
	void load_shouldThrow_WhenFileMissing() {
		assertThrows(IOException.class, () -> NetcdfDatasetLoader.load(dir.resolve("none.nc").toString()));
	}

	@Test
	void load_shouldThrow_WhenFileEmpty() throws IOException {
		Path empty = Files.createFile(dir.resolve("empty.nc"));
		assertThrows(IOException.class, () -> NetcdfDatasetLoader.load(empty.toString()));
	}
}

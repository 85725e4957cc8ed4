package fr.coriolis.cfchecker.filetypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import fr.coriolis.cfchecker.DatasetFixtures;
import fr.coriolis.cfchecker.core.KeyNotFoundException;

class GriddedDatasetTest {

	@Test
	void findBounds_shouldReturnBoundsVariable() throws KeyNotFoundException {
		GriddedDataset ds = DatasetFixtures.prDataset();
		assertEquals("time_bnds", ds.findBounds("time").getName());
	}

	@Test
	void findBounds_shouldThrow_WhenNoBounds() {
		GriddedDataset ds = DatasetFixtures.prDataset();

		assertThrows(KeyNotFoundException.class, () -> ds.findBounds("lat"));
		assertThrows(KeyNotFoundException.class, () -> ds.findBounds("nope"));

		ds.getVariable("lat").attr("bounds", "lat_bnds");
		KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> ds.findBounds("lat"));
		assertEquals("lat_bnds", e.getKey());
	}

	@Test
	void sizeOf_shouldMultiplyDimensionLengths() {
		GriddedDataset ds = DatasetFixtures.uaDataset();

		assertEquals(8, ds.sizeOf("ua"));
		assertEquals(1, ds.sizeOf("plev"));
		assertEquals(0, ds.sizeOf("nope"));
	}

	@Test
	void addVariable_shouldThrow_WhenDimensionUndefined() {
		GriddedDataset ds = new GriddedDataset().addDimension("time", 1);
		assertThrows(IllegalArgumentException.class, () -> ds.addVariable(new DatasetVariable("x", "lon")));
	}

	@Test
	void copy_shouldNotShareAttributes() {
		GriddedDataset ds = DatasetFixtures.prDataset();
		GriddedDataset copy = ds.copy();

		copy.getVariable("pr").getAttributes().put("units", "kg m-2 s-1");

		assertNotSame(ds.getVariable("pr"), copy.getVariable("pr"));
		assertEquals("mm/day", ds.getVariable("pr").getAttribute("units").get());
	}

	@Test
	void values_shouldNotShareCallerArrays() {
		DatasetVariable plev = new DatasetVariable("plev");
		double[] given = { 85000.0 };
		plev.setValues(given);

		given[0] = 1.0;
		plev.getValues()[0] = 2.0;

		assertEquals(85000.0, plev.getScalarValue());
		assertEquals(85000.0, plev.copy().getScalarValue());
	}
}

package fr.coriolis.cfchecker.decoders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import fr.coriolis.cfchecker.DatasetFixtures;
import fr.coriolis.cfchecker.filetypes.DatasetVariable;
import fr.coriolis.cfchecker.filetypes.GriddedDataset;

@DisplayName("CF decoding")
class CfMetadataDecoderTest {

	private final CfMetadataDecoder decoder = new CfMetadataDecoder(new CfAxisGuesser());

	@Test
	void decode_shouldMoveTimeEncodingAside() {
		GriddedDataset raw = DatasetFixtures.prDataset();
		GriddedDataset ds = decoder.decode(raw);
		DatasetVariable time = ds.getVariable("time");

		assertEquals("noleap", time.getDecodedCalendar());
		assertFalse(time.getAttributes().containsKey("units"));
		assertFalse(time.getAttributes().containsKey("calendar"));
		assertEquals("days since 2000-01-01", time.getEncoding().get("units"));
		// ..the input is not changed
		assertEquals("noleap", raw.getVariable("time").getAttribute("calendar").get());
	}

	@Test
	void decode_shouldFindMisspelledCalendarKey() {
		GriddedDataset raw = DatasetFixtures.prDataset();
		raw.getVariable("time").getAttributes().remove("calendar");
		raw.getVariable("time").attr("Calendar", "365_day");

		DatasetVariable time = decoder.decode(raw).getVariable("time");

		assertEquals("365_day", time.getDecodedCalendar());
		assertEquals("365_day", time.getEncoding().get("calendar"));
		assertFalse(time.getAttributes().containsKey("Calendar"));
	}

	@Test
	void decode_shouldAssumeStandardCalendar_WhenTimeHasNone() {
		GriddedDataset ds = decoder.decode(DatasetFixtures.uaDataset());
		assertEquals("standard", ds.getVariable("time").getDecodedCalendar());
	}

	@Test
	void decode_shouldLeaveTimeUndecoded_WhenCalendarUnknown() {
		GriddedDataset raw = DatasetFixtures.prDataset();
		raw.getVariable("time").attr("calendar", "martian");

		DatasetVariable time = decoder.decode(raw).getVariable("time");

		assertNull(time.getDecodedCalendar());
		assertEquals("days since 2000-01-01", time.getAttribute("units").get());
	}

	@Test
	void decode_shouldParseCoordinatesAttributes() {
		GriddedDataset raw = DatasetFixtures.uaDataset();
		raw.getAttributes().put("coordinates", "height  area");
		raw.getVariable("ua").attr("_FillValue", 1.0e20f);

		GriddedDataset ds = decoder.decode(raw);
		DatasetVariable ua = ds.getVariable("ua");

		assertEquals(Arrays.asList("plev"), ua.getCoordinateNames());
		assertEquals("plev", ua.getEncoding().get("coordinates"));
		assertTrue(ua.getEncoding().containsKey("_FillValue"));
		assertFalse(ua.getAttributes().containsKey("coordinates"));
		assertEquals(Arrays.asList("height", "area"), ds.getCoordinateNames());
		assertFalse(ds.getAttributes().containsKey("coordinates"));
	}

	@Test
	void guessCoordinateAxes_shouldSetAxisAttribute() {
		GriddedDataset ds = decoder.guessCoordinateAxes(decoder.decode(DatasetFixtures.taDataset()));

		assertEquals("X", ds.getVariable("lon").getAttribute("axis").get());
		assertEquals("Y", ds.getVariable("lat").getAttribute("axis").get());
		assertEquals("Z", ds.getVariable("plev19").getAttribute("axis").get());
		assertEquals("T", ds.getVariable("time").getAttribute("axis").get());
		assertTrue(ds.getVariable("ta").getAttribute("axis").isAbsent());
	}
}

package fr.coriolis.cfchecker.specs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("CF calendar vocabulary")
class CfCalendarTest {

	@ParameterizedTest(name = "''{0}'' is the calendar {1}")
	@CsvSource({ "gregorian,GREGORIAN", "standard,GREGORIAN", "std,GREGORIAN", "' Standard ',GREGORIAN",
			"365_day,NOLEAP", "noleap,NOLEAP", "366_day,ALL_LEAP", "360_day,DAY_360", "julian,JULIAN",
			"proleptic_gregorian,PROLEPTIC_GREGORIAN" })
	void forName_shouldResolveAliases(String name, CfCalendar expected) {
		assertEquals(expected, CfCalendar.forName(name));
	}

	@Test
	void forName_shouldReturnNull_WhenNotInVocabulary() {
		assertNull(CfCalendar.forName("martian"));
		assertNull(CfCalendar.forName(null));
	}

	@Test
	void vocabulary_shouldListCanonicalNamesFirst() {
		assertEquals("gregorian", CfCalendar.vocabulary().get(0));
		assertTrue(CfCalendar.vocabulary().contains("365_day"));
		assertTrue(CfCalendar.vocabulary().indexOf("none") < CfCalendar.vocabulary().indexOf("standard"));
	}
}

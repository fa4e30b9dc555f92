package org.metricshub.timewarp.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringReader;
import java.util.Locale;
import org.junit.Test;

public class TwSettingsTest {

	@Test
	public void testDefaults() {
		TwSettings settings = new TwSettings();
		assertEquals(Locale.US, settings.getLocale());
		assertEquals(14, settings.getPrintZoneWidth());
		assertEquals(1L, settings.getRandomSeed());
		assertFalse(settings.isOccursCheck());
		assertEquals(10000, settings.getMaxCallDepth());
		assertEquals(0L, settings.getMaxInstructions());
		assertFalse(settings.isGraphicsTrace());
	}

	@Test
	public void testDescription() {
		TwSettings settings = new TwSettings();
		settings.setRandomSeed(7L);
		settings.setOccursCheck(true);
		String description = settings.toDescriptionString();
		assertTrue(description.contains("randomSeed = 7\n"));
		assertTrue(description.contains("occursCheck = true\n"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeInstructionBudget() {
		new TwSettings().setMaxInstructions(-1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyPrintZone() {
		new TwSettings().setPrintZoneWidth(0);
	}

	@Test
	public void testProgramSourceReadsWholeText() throws IOException {
		ProgramSource source = new ProgramSource("buffer", new StringReader("10 PRINT 1\n20 END\n"));
		assertEquals("10 PRINT 1\n20 END\n", source.readText());
		assertEquals("buffer", source.toString());
	}

	@Test
	public void testMissingProgramFile() {
		ProgramFileSource source = new ProgramFileSource("no-such-dir/missing.twb");
		assertEquals("no-such-dir/missing.twb", source.getDescription());
		try {
			source.readText();
			fail("Read a missing file");
		} catch (IOException e) {
			assertEquals("Program file not found: no-such-dir/missing.twb", e.getMessage());
		}
	}
}

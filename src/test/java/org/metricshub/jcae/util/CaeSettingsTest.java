package org.metricshub.jcae.util;

import static org.junit.Assert.*;

import java.io.StringReader;
import org.junit.Test;

public class CaeSettingsTest {

	@Test
	public void testDefaults() {
		CaeSettings settings = new CaeSettings();
		assertSame(System.in, settings.getInput());
		assertSame(System.out, settings.getOutputStream());
		assertEquals(EndOfInputPolicy.ZERO, settings.getEndOfInputPolicy());
		assertEquals(0, settings.getMaxCallDepth());
		assertTrue(settings.toDescriptionString().contains("maxCallDepth = unlimited"));
	}

	@Test
	public void testMaxCallDepthMustNotBeNegative() {
		CaeSettings settings = new CaeSettings();
		settings.setMaxCallDepth(12);
		assertTrue(settings.toDescriptionString().contains("maxCallDepth = 12"));
		assertThrows(IllegalArgumentException.class, () -> settings.setMaxCallDepth(-1));
		assertEquals(12, settings.getMaxCallDepth());
	}

	@Test
	public void testEndOfInputPolicyNames() {
		assertEquals(EndOfInputPolicy.ZERO, EndOfInputPolicy.fromName("zero"));
		assertEquals(EndOfInputPolicy.UNCHANGED, EndOfInputPolicy.fromName("Unchanged"));
		assertEquals(EndOfInputPolicy.ERROR, EndOfInputPolicy.fromName("ERROR"));
		assertThrows(IllegalArgumentException.class, () -> EndOfInputPolicy.fromName("eof"));
	}

	@Test
	public void testScriptSource() throws Exception {
		StringReader reader = new StringReader("proc main:;");
		ScriptSource source = new ScriptSource("inline", reader);
		assertEquals("inline", source.getDescription());
		assertSame(reader, source.getReader());
		assertEquals("/tmp/x.cae", new ScriptFileSource("/tmp/x.cae").getDescription());
	}
}

package org.metricshub.jcae;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jcae.frontend.BracketScopeException;
import org.metricshub.jcae.frontend.LexerException;
import org.metricshub.jcae.frontend.MissingEntryPointException;
import org.metricshub.jcae.frontend.UndefinedReferenceException;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.jrt.RegionStore;
import org.metricshub.jcae.util.CaeSettings;
import org.metricshub.jcae.util.ScriptSource;

public class CaeTest {

	private static ScriptSource example(String name) {
		InputStream in = CaeTest.class.getResourceAsStream("/examples/" + name);
		assertNotNull("missing example " + name, in);
		return new ScriptSource(name, new InputStreamReader(in, StandardCharsets.UTF_8));
	}

	private static CaeSettings settings(String input, ByteArrayOutputStream output) {
		CaeSettings settings = new CaeSettings();
		settings.setInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.ISO_8859_1)));
		settings.setOutputStream(output);
		return settings;
	}

	@Test
	public void testAdderExample() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RegionStore regions = new Cae().invoke(example("adder.cae"), settings("34", out));
		assertEquals("7", new String(out.toByteArray(), StandardCharsets.ISO_8859_1));
		assertArrayEquals(new int[] { 7, 0 }, regions.get("main").snapshot());
	}

	@Test
	public void testBackReferenceExample() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		RegionStore regions = new Cae().invoke(example("back_reference.cae"), settings("", out));
		assertEquals("*", new String(out.toByteArray(), StandardCharsets.ISO_8859_1));
		assertEquals(42, regions.get("main").get(0));
		assertArrayEquals(new int[] { 0, 0, 0, 0 }, regions.get("foreign").snapshot());
	}

	@Test
	public void testRunWithStrings() throws Exception {
		assertEquals("Hi", new Cae().run("region main[1]; proc main: \"48 . \"69 .;", ""));
		assertEquals("", new Cae().run("region main[1]; proc main:;", "ignored"));
	}

	@Test
	public void testRunWithBytes() throws Exception {
		byte[] output = new Cae().run("region main[1]; proc main: , - . , .;", new byte[] { 0 });
		assertArrayEquals(new byte[] { (byte) 0xFF, 0 }, output);
	}

	@Test
	public void testEcho() throws Exception {
		// copies the input until a zero byte or the end of input
		assertEquals("hello", new Cae().run("region main[1]; proc main: , [ . , ];", "hello"));
	}

	@Test
	public void testRunWithStreams() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		new Cae()
				.run(
						new StringReader("region main[1]; proc main: , + .;"),
						new ByteArrayInputStream(new byte[] { 'a' }),
						out);
		assertArrayEquals(new byte[] { 'b' }, out.toByteArray());
	}

	@Test
	public void testCompileSeveralSources() throws Exception {
		CaeProgram program = new Cae()
				.compile(
						new ScriptSource("regions", new StringReader("region main[1]; region io[1];")),
						new ScriptSource("procs", new StringReader("proc main: p@io; proc p: +;")));
		assertEquals(2, program.getRegionCapacities().size());
		assertEquals(2, program.getProcedures().size());
		assertEquals("procs", program.getProcedure("p").getSourceDescription());
	}

	@Test
	public void testCompileNothing() throws Exception {
		assertThrows(java.io.IOException.class, () -> new Cae().compile(Arrays.<ScriptSource>asList()));
	}

	@Test
	public void testLoadErrorsPreventExecution() throws Exception {
		Cae cae = new Cae();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		assertThrows(
				UndefinedReferenceException.class,
				() -> cae.run(new StringReader("region main[1]; proc main: \"41 . missing;"), new ByteArrayInputStream(new byte[0]), out));
		assertThrows(
				BracketScopeException.class,
				() -> cae.run(new StringReader("region main[1]; proc main: \"41 . [;"), new ByteArrayInputStream(new byte[0]), out));
		assertThrows(
				LexerException.class,
				() -> cae.run(new StringReader("region main[1]; proc main: \"41 . !;"), new ByteArrayInputStream(new byte[0]), out));
		assertThrows(
				MissingEntryPointException.class,
				() -> cae.run(new StringReader("region main[1]; proc start: \"41 .;"), new ByteArrayInputStream(new byte[0]), out));
		assertEquals("nothing is printed by a program that does not load", 0, out.size());
	}

	@Test
	public void testEachRunStartsFromZeroedMemory() throws Exception {
		Cae cae = new Cae();
		CaeProgram program = cae.compile("region main[1]; proc main: + .;");
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		cae.invoke(program, settings("", out));
		cae.invoke(program, settings("", out));
		assertArrayEquals(new byte[] { 1, 1 }, out.toByteArray());
	}
}

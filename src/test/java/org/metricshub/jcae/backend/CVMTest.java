package org.metricshub.jcae.backend;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import org.junit.Test;
import org.metricshub.jcae.Cae;
import org.metricshub.jcae.jrt.CallDepthExceededException;
import org.metricshub.jcae.jrt.EndOfInputException;
import org.metricshub.jcae.jrt.RegionStore;
import org.metricshub.jcae.util.CaeSettings;
import org.metricshub.jcae.util.EndOfInputPolicy;

public class CVMTest {

	private ByteArrayOutputStream output;

	private CVM run(String script, byte[] input, CaeSettings settings) throws Exception {
		output = new ByteArrayOutputStream();
		settings.setInput(new ByteArrayInputStream(input));
		settings.setOutputStream(output);
		CVM cvm = new CVM(settings);
		cvm.interpret(new Cae().compile(script));
		return cvm;
	}

	private RegionStore run(String script) throws Exception {
		return run(script, new byte[0], new CaeSettings()).getRegions();
	}

	@Test
	public void testEmptyMain() throws Exception {
		CVM cvm = run("region main[2]; proc main:;", new byte[0], new CaeSettings());
		assertEquals(0, output.size());
		assertEquals(0, cvm.getExecutedInstructions());
		assertArrayEquals(new int[] { 0, 0 }, cvm.getRegions().get("main").snapshot());
	}

	@Test
	public void testValuesAndHeadWrap() throws Exception {
		run("region main[3]; proc main: - . < \"07 . ~ .;");
		assertArrayEquals(new byte[] { (byte) 255, 7, (byte) 255 }, output.toByteArray());
	}

	@Test
	public void testLoopIsTestedBeforeEachIteration() throws Exception {
		RegionStore regions = run("region main[2]; proc main: [ \"41 . ] \"03 [ > + < - ] > .;");
		assertArrayEquals(new byte[] { 3 }, output.toByteArray());
		assertArrayEquals(new int[] { 0, 3 }, regions.get("main").snapshot());
		assertEquals(1, regions.get("main").getHead());
	}

	@Test
	public void testNestedLoops() throws Exception {
		// 3 * 4 into the third cell
		RegionStore regions = run("region main[3]; proc main: \"03 [ > \"04 [ > + < - ] < - ];");
		assertArrayEquals(new int[] { 0, 0, 12 }, regions.get("main").snapshot());
	}

	@Test
	public void testSendAndReceive() throws Exception {
		RegionStore regions = run("region main[1]; region r[2]; proc main: \"05 ^r \"00 &r .;");
		assertArrayEquals(new byte[] { 5 }, output.toByteArray());
		assertArrayEquals(new int[] { 5, 0 }, regions.get("r").snapshot());
	}

	@Test
	public void testSendUsesTheHeadOfTheTarget() throws Exception {
		RegionStore regions = run("region main[1]; region r[3]; proc right: >>; proc main: right@r \"09 ^r;");
		assertArrayEquals(new int[] { 0, 0, 9 }, regions.get("r").snapshot());
	}

	@Test
	public void testCallWithRegionClause() throws Exception {
		RegionStore regions = run("region main[1]; region io[1]; proc inc: + ^$; proc main: \"10 inc@io;");
		assertEquals(1, regions.get("io").get());
		assertEquals("the callee's origin is the caller's here", 1, regions.get("main").get());
	}

	@Test
	public void testCallWithoutClauseKeepsBothBindings() throws Exception {
		run("region main[1]; region io[1]; proc put: \"41 ^$; proc helper: put; proc main: helper@io .;");
		assertArrayEquals(new byte[] { 'A' }, output.toByteArray());
	}

	@Test
	public void testBackReferenceClausePropagates() throws Exception {
		RegionStore regions = run(
				"region main[1]; region a[1]; region b[1];"
						+ "proc w: +; proc z: w@$ +; proc y: z@$; proc x: y@b; proc main: x@a;");
		assertEquals(2, regions.get("a").get());
		assertEquals(0, regions.get("b").get());
		assertEquals(0, regions.get("main").get());
	}

	@Test
	public void testBackReferenceExample() throws Exception {
		RegionStore regions = run(
				"region main[4]; region foreign[4];"
						+ "proc blah: \"2A; proc very_happy: > (( blah@$ )); proc main: very_happy@foreign .;");
		assertArrayEquals(new byte[] { '*' }, output.toByteArray());
		assertEquals(42, regions.get("main").get(0));
		assertArrayEquals(new int[] { 0, 0, 0, 0 }, regions.get("foreign").snapshot());
		assertEquals(1, regions.get("foreign").getHead());
	}

	@Test
	public void testAnonymousProcedureOnRegion() throws Exception {
		RegionStore regions = run("region main[1]; region io[2]; proc main: (> \"07)@io (+)$;");
		assertArrayEquals(new int[] { 0, 7 }, regions.get("io").snapshot());
		assertEquals(1, regions.get("main").get());
	}

	@Test
	public void testRecursion() throws Exception {
		RegionStore regions = run("region main[1]; region count[1]; proc down: [ - (+)@count down ]; proc main: \"0A down;");
		assertEquals(0, regions.get("main").get());
		assertEquals(10, regions.get("count").get());
	}

	@Test
	public void testInput() throws Exception {
		run("region main[1]; proc main: , + . , + .;", "AB".getBytes("ISO-8859-1"), new CaeSettings());
		assertArrayEquals(new byte[] { 'B', 'C' }, output.toByteArray());
	}

	@Test
	public void testEndOfInputZero() throws Exception {
		run("region main[1]; proc main: \"07 , .;", new byte[0], new CaeSettings());
		assertArrayEquals(new byte[] { 0 }, output.toByteArray());
	}

	@Test
	public void testEndOfInputUnchanged() throws Exception {
		CaeSettings settings = new CaeSettings();
		settings.setEndOfInputPolicy(EndOfInputPolicy.UNCHANGED);
		run("region main[1]; proc main: \"07 , .;", new byte[0], settings);
		assertArrayEquals(new byte[] { 7 }, output.toByteArray());
	}

	@Test
	public void testEndOfInputError() throws Exception {
		CaeSettings settings = new CaeSettings();
		settings.setEndOfInputPolicy(EndOfInputPolicy.ERROR);
		EndOfInputException e = assertThrows(
				EndOfInputException.class,
				() -> run("region main[1];\nproc main: \"07 . , .;", new byte[0], settings));
		assertEquals(2, e.getLineNumber());
		assertArrayEquals("output before the failure is kept", new byte[] { 7 }, output.toByteArray());
	}

	@Test
	public void testCallDepthLimit() throws Exception {
		String script = "region main[1]; proc down: [ - down ]; proc main: \"FF down;";
		CaeSettings settings = new CaeSettings();
		settings.setMaxCallDepth(300);
		run(script, new byte[0], settings);

		settings.setMaxCallDepth(100);
		CallDepthExceededException e = assertThrows(
				CallDepthExceededException.class,
				() -> run(script, new byte[0], settings));
		assertEquals(100, e.getMaxCallDepth());
	}

	@Test
	public void testDeepCallChain() throws Exception {
		int depth = 50000;
		StringBuilder script = new StringBuilder("region main[1]; proc main: p0;\n");
		for (int i = 0; i < depth; i++) {
			script.append("proc p").append(i).append(": p").append(i + 1).append(";\n");
		}
		script.append("proc p").append(depth).append(": + .;\n");
		RegionStore regions = run(script.toString());
		assertEquals(1, regions.get("main").get());
		assertArrayEquals(new byte[] { 1 }, output.toByteArray());
	}
}

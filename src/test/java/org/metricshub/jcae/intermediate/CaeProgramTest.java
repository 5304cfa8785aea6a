package org.metricshub.jcae.intermediate;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jcae.Cae;

public class CaeProgramTest {

	@Test
	public void testDump() throws Exception {
		CaeProgram program = new Cae().compile("region main[1]; proc p:; proc main: +[-]\"41 ^$ (>)@main p$;");
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(bytes, true, "UTF-8");
		program.dump(ps);
		String nl = System.lineSeparator();
		assertEquals(
				"region main[1];" + nl
						+ "proc p: ;" + nl
						+ "proc main: +[-]\"41 ^$ (>)@main p@$;" + nl
						+ "# main-anon-1: (>)" + nl,
				new String(bytes.toByteArray(), StandardCharsets.UTF_8));
	}

	@Test
	public void testInstructionToString() {
		assertEquals("\"0A", Instruction.writeLiteral(10, 1, 1).toString());
		assertEquals("^$", Instruction.send(RegionReference.BACK_REFERENCE, 1, 1).toString());
		assertEquals("&io", Instruction.receive(RegionReference.named("io"), 1, 1).toString());
		assertEquals("f", Instruction.call("f", null, 1, 1).toString());
		assertEquals("f@io", Instruction.call("f", RegionReference.named("io"), 1, 1).toString());
	}

	@Test
	public void testRegionReference() {
		assertEquals(RegionReference.named("io"), RegionReference.named("io"));
		assertNotEquals(RegionReference.named("io"), RegionReference.BACK_REFERENCE);
		assertTrue(RegionReference.BACK_REFERENCE.isBackReference());
		assertEquals("$", RegionReference.BACK_REFERENCE.toString());
	}

	@Test
	public void testProgramNeedsMain() {
		Map<String, Integer> regions = new LinkedHashMap<String, Integer>();
		regions.put("main", 1);
		assertThrows(
				IllegalArgumentException.class,
				() -> new CaeProgram(regions, Collections.<String, Procedure>emptyMap(), Collections.<Procedure>emptyList()));
	}

	@Test
	public void testUnknownNames() throws Exception {
		CaeProgram program = new Cae().compile("region main[3]; proc main:;");
		assertEquals(3, program.getRegionCapacity("main"));
		assertThrows(IllegalStateException.class, () -> program.getRegionCapacity("other"));
		assertThrows(IllegalStateException.class, () -> program.getProcedure("other"));
	}
}

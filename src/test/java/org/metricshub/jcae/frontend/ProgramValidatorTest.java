package org.metricshub.jcae.frontend;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.util.ScriptSource;

public class ProgramValidatorTest {

	private static CaeProgram validate(String script) throws IOException {
		ParsedProgram parsed = new CaeParser().parse(new ScriptSource("test", new StringReader(script)));
		return new ProgramValidator().validate(parsed);
	}

	@Test
	public void testMinimalProgram() throws Exception {
		CaeProgram program = validate("region main[1]; proc main:;");
		assertEquals(Integer.valueOf(1), program.getRegionCapacities().get("main"));
		assertEquals("main", program.getMainProcedure().getName());
		assertTrue(program.getAnonymousProcedures().isEmpty());
	}

	@Test
	public void testDeclarationOrderDoesNotMatter() throws Exception {
		CaeProgram program = validate("proc main: helper@io; proc helper: ^$; region io[2]; region main[1];");
		assertEquals(2, program.getRegionCapacity("io"));
		assertNotNull(program.getProcedure("helper"));
	}

	@Test
	public void testDuplicateRegion() throws Exception {
		DuplicateDeclarationException e = assertThrows(
				DuplicateDeclarationException.class,
				() -> validate("region main[1];\nregion main[2];\nproc main:;"));
		assertEquals(SymbolKind.REGION, e.getKind());
		assertEquals("main", e.getName());
		assertEquals(2, e.getLineNumber());
		assertEquals(1, e.getColumn());
		assertEquals("Duplicate region 'main'", e.getMessage());
	}

	@Test
	public void testDuplicateProcedure() throws Exception {
		DuplicateDeclarationException e = assertThrows(
				DuplicateDeclarationException.class,
				() -> validate("region main[1]; proc main:; proc main: +;"));
		assertEquals(SymbolKind.PROCEDURE, e.getKind());
		assertEquals("Duplicate procedure 'main'", e.getMessage());
	}

	@Test
	public void testRegionAndProcedureMayShareAName() throws Exception {
		CaeProgram program = validate("region main[1]; region io[1]; proc io: .; proc main: io@io;");
		assertNotNull(program.getProcedure("io"));
	}

	@Test
	public void testUndefinedProcedure() throws Exception {
		UndefinedReferenceException e = assertThrows(
				UndefinedReferenceException.class,
				() -> validate("region main[1];\nproc main: nothing;"));
		assertEquals(SymbolKind.PROCEDURE, e.getKind());
		assertEquals("nothing", e.getName());
		assertEquals("Undefined procedure 'nothing'", e.getMessage());
		assertEquals(2, e.getLineNumber());
		assertEquals(12, e.getColumn());
	}

	@Test
	public void testUndefinedRegions() throws Exception {
		assertEquals(
				"io",
				assertThrows(UndefinedReferenceException.class, () -> validate("region main[1]; proc main: ^io;"))
						.getName());
		assertEquals(
				"io",
				assertThrows(UndefinedReferenceException.class, () -> validate("region main[1]; proc main: &io;"))
						.getName());
		UndefinedReferenceException e = assertThrows(
				UndefinedReferenceException.class,
				() -> validate("region main[1]; proc main: main@io;"));
		assertEquals(SymbolKind.REGION, e.getKind());
	}

	@Test
	public void testReferencesInsideLoopsAndAnonymousBodies() throws Exception {
		assertThrows(UndefinedReferenceException.class, () -> validate("region main[1]; proc main: [[ lost ]];"));
		assertThrows(UndefinedReferenceException.class, () -> validate("region main[1]; proc main: ([ ^lost ]);"));
		assertThrows(UndefinedReferenceException.class, () -> validate("region main[1]; proc main: (+)@lost;"));
	}

	@Test
	public void testBackReferenceIsAlwaysValid() throws Exception {
		validate("region main[1]; proc p: ^$ &$; proc main: p$ p@$ (.)$;");
	}

	@Test
	public void testMissingMainRegion() throws Exception {
		MissingEntryPointException e = assertThrows(
				MissingEntryPointException.class,
				() -> validate("region other[1]; proc main:;"));
		assertEquals(SymbolKind.REGION, e.getKind());
		assertEquals(-1, e.getLineNumber());
		assertEquals("", e.getLocation());
	}

	@Test
	public void testMissingMainProcedure() throws Exception {
		MissingEntryPointException e = assertThrows(
				MissingEntryPointException.class,
				() -> validate("region main[1]; proc other:;"));
		assertEquals(SymbolKind.PROCEDURE, e.getKind());
	}

	@Test
	public void testDuplicatesAreReportedBeforeMissingEntryPoints() throws Exception {
		assertThrows(DuplicateDeclarationException.class, () -> validate("proc p:; proc p:;"));
		assertThrows(UndefinedReferenceException.class, () -> validate("proc p: q;"));
	}

	@Test
	public void testAnonymousProceduresAreCollectedInPreOrder() throws Exception {
		CaeProgram program = validate("region main[1]; proc main: ((+) (-)) [(.)];");
		assertEquals(4, program.getAnonymousProcedures().size());
		assertEquals("main-anon-1", program.getAnonymousProcedures().get(0).getLabel());
		assertEquals("main-anon-1-anon-1", program.getAnonymousProcedures().get(1).getLabel());
		assertEquals("main-anon-1-anon-2", program.getAnonymousProcedures().get(2).getLabel());
		assertEquals("main-anon-2", program.getAnonymousProcedures().get(3).getLabel());
	}
}

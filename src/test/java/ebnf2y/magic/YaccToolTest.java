package ebnf2y.magic;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class YaccToolTest {

	@Test
	public void testParseConflictSummary(){
		ConflictReport report = YaccTool.parse("grammar.y: conflicts: 2 shift/reduce, 1 reduce/reduce\n", 0);
		assertFalse(report.rejected);
		assertEquals(2, report.shiftReduce);
		assertEquals(1, report.reduceReduce);
		assertEquals(4, report.score(1, 1));
	}

	@Test
	public void testParseWarnings(){
		ConflictReport report = YaccTool.parse(String.join("\n",
				"grammar.y: warning: 3 shift/reduce conflicts [-Wconflicts-sr]",
				"grammar.y: warning: 4 reduce/reduce conflicts [-Wconflicts-rr]",
				"grammar.y: note: rerun with option '-Wcounterexamples' to generate conflict counterexamples"), 0);
		assertEquals(3, report.shiftReduce);
		assertEquals(4, report.reduceReduce);
		assertEquals(3 + 2 * 4, report.score(2, 1));
	}

	@Test
	public void testParseWithoutConflicts(){
		ConflictReport report = YaccTool.parse("", 0);
		assertFalse(report.rejected);
		assertEquals(0, report.score(1, 1));
	}

	@Test
	public void testNonZeroExitIsRejection(){
		ConflictReport report = YaccTool.parse("grammar.y:12.3-5: error: symbol Foo is used, but is not defined\n", 1);
		assertTrue(report.rejected);
		assertEquals(ConflictReport.INFINITE, report.score(1, 1));
		assertTrue(report.diagnostic.contains("symbol Foo"));
	}

	@Test
	public void testMissingExecutable(@TempDir Path tmpDir){
		YaccTool tool = new YaccTool("ebnf2y-test-no-such-yacc --verbose", tmpDir, 5);
		assertEquals("ebnf2y-test-no-such-yacc --verbose", tool.toString());
		assertThrows(ToolFailureError.class, () -> tool.check("%%\nS: ;\n"));
	}
}

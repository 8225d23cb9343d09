package ebnf2y.generator;

import org.junit.jupiter.api.Test;

import ebnf2y.TestGrammars;
import ebnf2y.grammar.Grammar;
import ebnf2y.transform.Inliner;
import ebnf2y.transform.InliningLevel;

import static ebnf2y.TestGrammars.desugar;
import static ebnf2y.TestGrammars.read;
import static org.junit.jupiter.api.Assertions.*;

public class SkeletonGeneratorTest {

	private static String generate(String prefix, String start, String... lines){
		return new SkeletonGenerator(prefix).generate(desugar(start, lines), start);
	}

	@Test
	public void testRules(){
		String output = generate("", "Opt", TestGrammars.OPT);
		assertTrue(output.contains("%language \"Java\"\n"));
		assertTrue(output.contains("%start\tOpt\n"));
		assertTrue(output.contains("Opt:\n\t'a' Opt1 'c'\n\t{\n\t\t$$ = new Node(\"Opt\", \"a\", $2, \"c\");\n\t}\n;\n"),
				output);
		assertTrue(output.contains("Opt1:\n\t/* empty */\n\t{\n\t\t$$ = new Node(\"Opt1\");\n\t}\n"
				+ "|\t'b'\n\t{\n\t\t$$ = new Node(\"Opt11\", \"b\");\n\t}\n;\n"), output);
		assertTrue(output.endsWith("\n%%\n"));
	}

	@Test
	public void testNodeClass(){
		String output = generate("", "Opt", TestGrammars.OPT);
		assertTrue(output.contains("%code {"));
		assertTrue(output.contains("public static final class Node {"));
	}

	@Test
	public void testTokenNames(){
		String output = generate("_", "S", "S = ident \"<<\" \"<<\" \"&^\" andnot \"+\" .", "ident = .",
				"andnot = \"&^\" .");
		assertTrue(output.contains("%token\t_IDENT\n"), output);
		assertTrue(output.contains("%token\t_ANDNOT\n"), output);
		assertTrue(output.contains("%token\t_LTLT\t\"<<\"\n"), output);
		assertTrue(output.contains("%token\t_ANDXOR\t\"&^\"\n"), output);
		assertTrue(output.contains("S:\n\t_IDENT _LTLT _LTLT _ANDXOR _ANDNOT '+'\n"), output);
		assertTrue(output.contains("$$ = new Node(\"S\", $1, \"<<\", \"<<\", \"&^\", $5, \"+\");"), output);
	}

	@Test
	public void testTokenNamesDoNotCollide(){
		String output = generate("", "S", "S = ident IDENT \"==\" \"EQEQ\" \"1st\" .", "IDENT = \"x\" .", "ident = .");
		assertTrue(output.contains("%token\tIDENT1\n"), output);
		assertTrue(output.contains("%token\tEQEQ\t\"==\"\n"), output);
		assertTrue(output.contains("%token\tEQEQ1\t\"EQEQ\"\n"), output);
		assertTrue(output.contains("%token\t_1ST\t\"1st\"\n"), output);
		assertTrue(output.contains("S:\n\tIDENT1 IDENT EQEQ EQEQ1 _1ST\n"), output);
	}

	@Test
	public void testCharacterLiterals(){
		String output = generate("", "S", "S = \"'\" \"\\\\\" \"\\n\" .");
		assertTrue(output.contains("S:\n\t'\\'' '\\\\' U000A\n"), output);
		assertTrue(output.contains("$$ = new Node(\"S\", \"'\", \"\\\\\", \"\\n\");"), output);
		assertTrue(output.contains("%token\tU000A\n"), output);
	}

	@Test
	public void testDeterminism(){
		Grammar grammar = Inliner.inline(desugar("Expression", TestGrammars.resource("demo.ebnf")),
				InliningLevel.USED_ONCE, "Expression");
		assertEquals(new SkeletonGenerator("p").generate(grammar, "Expression"),
				new SkeletonGenerator("p").generate(grammar, "Expression"));
	}

	@Test
	public void testEbnfGrammarIsRejected(){
		assertThrows(IllegalArgumentException.class,
				() -> new SkeletonGenerator("").generate(read(TestGrammars.OPT), "Opt"));
	}
}

package ebnf2y.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ebnf2y.TestGrammars;
import ebnf2y.reader.EbnfReader;

import static ebnf2y.TestGrammars.read;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarPrinterTest {

	@Test
	public void testPrintProduction(){
		assertEquals("Opt = \"a\" [ \"b\" ] \"c\" .\n", GrammarPrinter.print(read(TestGrammars.OPT)));
	}

	@Test
	public void testNamesArePadded(){
		assertEquals("Expr = Term { \"+\" Term } .\nTerm = num .\nnum  = .\n",
				GrammarPrinter.print(read("Expr = Term { \"+\" Term } .", "Term = num .", "num = .")));
	}

	@Test
	public void testEmptyAlternativeIsPrintedAsOption(){
		Grammar bnf = TestGrammars.desugar("Opt", TestGrammars.OPT);
		assertEquals("Opt1 = [ \"b\" ] .", GrammarPrinter.printProduction(bnf.getProduction("Opt1")));
	}

	@Test
	public void testTokensAreListed(){
		Grammar bnf = TestGrammars.desugar("Digits", TestGrammars.DIGITS);
		assertTrue(GrammarPrinter.print(bnf).startsWith("// tokens: digit\n"));
	}

	@Test
	public void testEscapedTokens(){
		Grammar grammar = new Grammar(java.util.Collections.singletonList(new Production(0, "A",
				Expression.sequence(Term.token("\"\\\n\u00e9"), Term.range("a", "z", null)))));
		assertEquals("A = \"\\\"\\\\\\n\\u00e9\" \"a\" \u2026 \"z\" .", GrammarPrinter.printProduction(grammar.getProduction("A")));
		assertEquals(grammar, EbnfReader.read(GrammarPrinter.print(grammar)));
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"Opt = \"a\" [ \"b\" ] \"c\" .",
			"A = b | ( b | c ) [ d ] | { b } .\nb = .\nc = .\nd = .",
			"A = { [ \"x\" \u2026 \"z\" ] ( B | `raw` ) } .\nB = .",
			"A = \"\\t\" | \"\\u2026\" | \"\\U0001F600\" ."
	})
	public void testRoundTrip(String input){
		Grammar grammar = read(input);
		assertEquals(grammar, EbnfReader.read(GrammarPrinter.print(grammar)));
	}

	@Test
	public void testDemoRoundTrip(){
		Grammar grammar = read(TestGrammars.resource("demo.ebnf"));
		assertEquals(grammar, EbnfReader.read(GrammarPrinter.print(grammar)));
	}
}

package ebnf2y.reader;

import java.io.IOException;
import java.io.StringReader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ebnf2y.TestGrammars;
import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Expression;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Term;
import ebnf2y.grammar.UndeclaredReferenceError;

import static ebnf2y.TestGrammars.read;
import static org.junit.jupiter.api.Assertions.*;

public class EbnfReaderTest {

	@Test
	public void testSimpleGrammar(){
		Grammar grammar = read("Expr = Term { \"+\" Term } .", "Term = number .", "number = .");
		assertEquals(3, grammar.size());
		Alternative alternative = grammar.getProduction("Expr").body.get(0);
		assertEquals(Term.ref("Term"), alternative.get(0));
		assertEquals(Term.Kind.REPETITION, alternative.get(1).kind);
		assertEquals(Expression.sequence(Term.token("+"), Term.ref("Term")), alternative.get(1).expression);
		assertEquals(Expression.EMPTY, grammar.getProduction("number").body);
	}

	@Test
	public void testAlternativesAndNesting(){
		Grammar grammar = read("A = b | ( b | c ) [ d ] | { b } .", "b = .", "c = .", "d = .");
		Expression body = grammar.getProduction("A").body;
		assertEquals(3, body.size());
		assertEquals(Term.Kind.GROUP, body.get(1).get(0).kind);
		assertEquals(2, body.get(1).get(0).expression.size());
		assertEquals(Term.Kind.OPTION, body.get(1).get(1).kind);
		assertEquals(Term.Kind.REPETITION, body.get(2).get(0).kind);
	}

	@Test
	public void testEscapes(){
		Grammar grammar = read("A = \"\\x41\\u00e9\\n\\101\\t\" | `raw\\n` .");
		Expression body = grammar.getProduction("A").body;
		assertEquals(Term.token("A\u00e9\nA\t"), body.get(0).get(0));
		assertEquals(Term.token("raw\\n"), body.get(1).get(0));
	}

	@Test
	public void testComments(){
		Grammar grammar = read("// line comment", "A /* block", "comment */ = b . // trailing", "b = .");
		assertEquals(2, grammar.size());
	}

	@Test
	public void testRange(){
		Term range = read("a = \"0\" \u2026 \"9\" .").getProduction("a").body.get(0).get(0);
		assertTrue(range.isRange());
		assertEquals("0", range.text);
		assertEquals("9", range.rangeEnd);
	}

	@Test
	public void testLocations(){
		Grammar grammar = read("A = b .", "", "  b = .");
		Production b = grammar.getProduction("b");
		assertEquals(3, b.location.line);
		assertEquals(3, b.location.column);
		assertEquals("test.ebnf", b.location.source);
	}

	@Test
	public void testSyntaxErrorLocation(){
		SyntaxError error = assertThrows(SyntaxError.class, () -> read("A = b | ."));
		assertEquals(1, error.errorLocation.line);
		assertEquals(9, error.errorLocation.column);
		assertEquals("test.ebnf:1:9: expected term, found \".\"", error.getMessage());
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"",
			"// only a comment",
			"A = b | .",
			"A = ( ) .",
			"A = [ ] .",
			"A = { } .",
			"A = \"\" .",
			"A = \"ab\" \u2026 \"c\" .",
			"A = \"c\" \u2026 \"a\" .",
			"A = \"a\" \u2026 b .",
			"A = b",
			"A b .",
			"= b .",
			"A = b . A = b .",
			"A = # .",
			"A = \"abc .",
			"A = \"a\nb\" .",
			"A = `abc .",
			"A = b . /* open",
			"A = \"\\q\" .",
			"A = \"\\x4\" .",
			"A = \"\\777\" .",
			"A = ( b .",
			"A = b ] ."
	})
	public void testSyntaxErrors(String input){
		assertThrows(SyntaxError.class, () -> read(input));
	}

	@Test
	public void testDuplicateProductionMessage(){
		SyntaxError error = assertThrows(SyntaxError.class, () -> read("A = b .", "b = .", "A = b ."));
		assertTrue(error.getMessage().contains("A declared already"), error.getMessage());
		assertEquals(3, error.errorLocation.line);
	}

	@Test
	public void testUndeclaredReference(){
		UndeclaredReferenceError error = assertThrows(UndeclaredReferenceError.class, () -> read("A = B c .", "c = ."));
		assertEquals("B", error.name);
		assertEquals(5, error.errorLocation.column);
	}

	@Test
	public void testReadFromReader() throws IOException {
		Grammar grammar = EbnfReader.read("demo.ebnf", new StringReader(TestGrammars.resource("demo.ebnf")));
		assertEquals(16, grammar.size());
		assertTrue(grammar.hasProduction("QualifiedIdent"));
		assertTrue(grammar.getProduction("boolean").isLexical());
	}
}

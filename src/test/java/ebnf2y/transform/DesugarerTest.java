package ebnf2y.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import ebnf2y.ConfigurationError;
import ebnf2y.TestGrammars;
import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Expression;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Provenance;
import ebnf2y.grammar.StartProductionNotFoundError;
import ebnf2y.grammar.Term;
import ebnf2y.reader.SyntaxError;

import static ebnf2y.TestGrammars.desugar;
import static ebnf2y.TestGrammars.read;
import static ebnf2y.grammar.Term.ref;
import static ebnf2y.grammar.Term.token;
import static org.junit.jupiter.api.Assertions.*;

public class DesugarerTest {

	private static Grammar grammar(List<String> tokens, Production... productions){
		return new Grammar(Arrays.asList(productions), tokens);
	}

	private static Production production(String name, Alternative... alternatives){
		return new Production(0, name, Expression.of(alternatives));
	}

	private static Alternative alt(Term... terms){
		return Alternative.of(terms);
	}

	@Test
	public void testRepetition(){
		Grammar expected = grammar(Collections.singletonList("digit"),
				production("Digits", alt(ref("digit"), ref("Digits1"))),
				production("Digits1", alt(), alt(ref("Digits1"), ref("digit"))));
		assertEquals(expected, desugar("Digits", TestGrammars.DIGITS));
	}

	@Test
	public void testOption(){
		Grammar expected = grammar(Collections.emptyList(),
				production("Opt", alt(token("a"), ref("Opt1"), token("c"))),
				production("Opt1", alt(), alt(token("b"))));
		assertEquals(expected, desugar("Opt", TestGrammars.OPT));
	}

	@Test
	public void testOptionWithChoice(){
		Grammar bnf = desugar("A", "A = [ \"x\" | \"y\" ] .");
		assertEquals(Expression.of(alt(token("x")), alt(token("y"))), bnf.getProduction("A1").body);
		assertEquals(Expression.of(alt(), alt(ref("A1"))), bnf.getProduction("A2").body);
		assertEquals(Expression.of(alt(ref("A2"))), bnf.getProduction("A").body);
	}

	@Test
	public void testGroupWithChoice(){
		Grammar bnf = desugar("A", "A = ( b | c ) d .", "b = .", "c = .", "d = .");
		assertEquals(Expression.of(alt(ref("A1"), ref("d"))), bnf.getProduction("A").body);
		assertEquals(Expression.of(alt(ref("b")), alt(ref("c"))), bnf.getProduction("A1").body);
		assertEquals(Arrays.asList("b", "c", "d"), bnf.getTokens());
	}

	@Test
	public void testSingleAlternativeGroupIsSpliced(){
		Grammar bnf = desugar("A", "A = ( b c ) d .", "b = .", "c = .", "d = .");
		assertEquals(1, bnf.size());
		assertEquals(Expression.of(alt(ref("b"), ref("c"), ref("d"))), bnf.getProduction("A").body);
	}

	@Test
	public void testNestedTermsAreLoweredInnermostFirst(){
		Grammar bnf = desugar("A", "A = { b [ c ] } .", "b = .", "c = .");
		List<String> names = new ArrayList<>();
		for (Production production : bnf.getProductions()) {
			names.add(production.name);
		}
		assertEquals(Arrays.asList("A", "A1", "A2"), names);
		assertEquals(Expression.of(alt(), alt(ref("c"))), bnf.getProduction("A1").body);
		assertEquals(Expression.of(alt(), alt(ref("A2"), ref("b"), ref("A1"))), bnf.getProduction("A2").body);
		assertEquals(Expression.of(alt(ref("A2"))), bnf.getProduction("A").body);
	}

	@Test
	public void testRepetitionWithChoice(){
		Grammar bnf = desugar("A", "A = { b | c } .", "b = .", "c = .");
		assertEquals(Expression.of(alt(ref("b")), alt(ref("c"))), bnf.getProduction("A1").body);
		assertEquals(Expression.of(alt(), alt(ref("A2"), ref("A1"))), bnf.getProduction("A2").body);
		assertEquals(Expression.of(alt(ref("A2"))), bnf.getProduction("A").body);
	}

	@Test
	public void testRange(){
		Grammar bnf = desugar("A", "A = \"a\" \u2026 \"c\" .");
		assertEquals(Expression.of(alt(ref("A1"))), bnf.getProduction("A").body);
		assertEquals(Expression.of(alt(token("a")), alt(token("b")), alt(token("c"))), bnf.getProduction("A1").body);
	}

	@Test
	public void testLargeRange(){
		assertThrows(SyntaxError.class, () -> desugar("A", "A = \"\\x00\" \u2026 \"\\u0fff\" ."));
	}

	@Test
	public void testSyntheticNamesSkipTakenNames(){
		Grammar bnf = desugar("A", "A = [ b ] A1 .", "A1 = b .", "b = .");
		assertEquals(Expression.of(alt(ref("A2"), ref("A1"))), bnf.getProduction("A").body);
		assertEquals(Expression.of(alt(), alt(ref("b"))), bnf.getProduction("A2").body);
		assertEquals("A2", bnf.getProductions().get(1).name);
	}

	@Test
	public void testNameCollision(){
		StringBuilder builder = new StringBuilder("Foo = [ x ]");
		for (int i = 1; i <= Desugarer.MAX_NAME_RETRIES; i++){
			builder.append(" Foo").append(i);
		}
		builder.append(" .\nx = .\n");
		for (int i = 1; i <= Desugarer.MAX_NAME_RETRIES; i++){
			builder.append("Foo").append(i).append(" = x .\n");
		}
		Grammar grammar = read(builder.toString());
		assertThrows(NameCollisionError.class, () -> Desugarer.desugar(grammar, "Foo"));
	}

	@Test
	public void testProvenance(){
		DesugarResult result = Desugarer.desugar(read(TestGrammars.OPT), "Opt");
		assertEquals(new Provenance("Opt", 1, 1), result.provenance.get("Opt1"));
		assertTrue(result.grammar.getProduction("Opt1").isSynthetic());
		assertFalse(result.grammar.getProduction("Opt").isSynthetic());
	}

	@Test
	public void testUnreachableProductionsAreDropped(){
		Grammar bnf = desugar("A", "A = b .", "B = c .", "b = .", "c = .");
		assertEquals(1, bnf.size());
		assertFalse(bnf.hasProduction("B"));
		assertEquals(Collections.singletonList("b"), bnf.getTokens());
	}

	@Test
	public void testLexicalProductionsBecomeTokens(){
		Grammar bnf = desugar("A", "A = andnot boolean .", "andnot = \"&^\" .", "boolean = \"true\" | \"false\" .");
		assertEquals(1, bnf.size());
		assertEquals(Arrays.asList("andnot", "boolean"), bnf.getTokens());
		assertTrue(bnf.isToken("andnot"));
	}

	@Test
	public void testResultIsBnf(){
		Grammar bnf = desugar("Expression", TestGrammars.resource("demo.ebnf"));
		assertTrue(bnf.isBnf());
		bnf.verify();
	}

	@Test
	public void testMissingStartProduction(){
		StartProductionNotFoundError error = assertThrows(StartProductionNotFoundError.class,
				() -> desugar("SourceFile", TestGrammars.OPT));
		assertEquals("SourceFile", error.name);
	}

	@Test
	public void testLexicalStartProduction(){
		assertThrows(ConfigurationError.class, () -> desugar("a", "a = \"x\" ."));
	}
}

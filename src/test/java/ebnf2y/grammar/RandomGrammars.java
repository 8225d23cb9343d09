package ebnf2y.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;

/**
 * Generates EBNF grammars that the reader could have produced.
 *
 * Nonterminals are called N0, N1, …, lexical productions t0, t1, …, the start production is N0.
 */
public class RandomGrammars extends Generator<Grammar> {

	public static final String START = "N0";

	private static final List<String> LITERALS = Arrays.asList("a", "+", "<<", "if", "\"", "\\", "é", "\n");

	private static final int MAX_DEPTH = 2;

	public RandomGrammars() {
		super(Grammar.class);
	}

	@Override
	public Grammar generate(SourceOfRandomness random, GenerationStatus status) {
		List<String> nonTerminals = new ArrayList<>();
		for (int i = 0, n = random.nextInt(1, 5); i < n; i++){
			nonTerminals.add("N" + i);
		}
		List<String> tokens = new ArrayList<>();
		for (int i = 0, n = random.nextInt(1, 3); i < n; i++){
			tokens.add("t" + i);
		}
		List<Production> productions = new ArrayList<>();
		for (String name : nonTerminals) {
			productions.add(new Production(productions.size(), name,
					expression(random, nonTerminals, tokens, 0)));
		}
		for (String name : tokens) {
			Expression body = random.nextBoolean() ? Expression.EMPTY
					: Expression.sequence(Term.token(random.choose(LITERALS)));
			productions.add(new Production(productions.size(), name, body));
		}
		return new Grammar(productions);
	}

	private Expression expression(SourceOfRandomness random, List<String> nonTerminals, List<String> tokens, int depth){
		List<Alternative> alternatives = new ArrayList<>();
		for (int i = 0, n = random.nextInt(1, 3); i < n; i++){
			List<Term> terms = new ArrayList<>();
			for (int j = 0, m = random.nextInt(1, 3); j < m; j++){
				terms.add(term(random, nonTerminals, tokens, depth));
			}
			alternatives.add(new Alternative(terms));
		}
		return new Expression(alternatives);
	}

	private Term term(SourceOfRandomness random, List<String> nonTerminals, List<String> tokens, int depth){
		switch (random.nextInt(0, depth >= MAX_DEPTH ? 3 : 6)){
			case 0:
				return Term.ref(random.choose(nonTerminals));
			case 1:
				return Term.ref(random.choose(tokens));
			case 2:
				return Term.token(random.choose(LITERALS));
			case 3:
				return random.nextBoolean() ? Term.range("a", "c", null) : Term.range("0", "9", null);
			case 4:
				return Term.group(expression(random, nonTerminals, tokens, depth + 1));
			case 5:
				return Term.option(expression(random, nonTerminals, tokens, depth + 1));
			default:
				return Term.repetition(expression(random, nonTerminals, tokens, depth + 1));
		}
	}
}

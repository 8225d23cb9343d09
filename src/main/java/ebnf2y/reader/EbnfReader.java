package ebnf2y.reader;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Expression;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Term;
import ebnf2y.util.Utils;

/**
 * Recursive descent reader for grammars in the EBNF flavor of the Go language specification:
 *
 * <pre>
 * Production  = production_name "=" [ Expression ] "." .
 * Expression  = Alternative { "|" Alternative } .
 * Alternative = Term { Term } .
 * Term        = production_name | token [ "…" token ] | Group | Option | Repetition .
 * Group       = "(" Expression ")" .
 * Option      = "[" Expression "]" .
 * Repetition  = "{" Expression "}" .
 * </pre>
 *
 * The first error aborts reading, there is no error recovery.
 */
public class EbnfReader {

	private final Scanner scanner;
	private Token current;

	private EbnfReader(String source, String input) {
		this.scanner = new Scanner(source, input);
		this.current = scanner.next();
	}

	/**
	 * Read and verify a grammar
	 *
	 * @param source name of the source used in error locations, may be empty
	 * @param input EBNF text
	 * @throws SyntaxError if the input is malformed
	 * @throws ebnf2y.grammar.UndeclaredReferenceError if a referenced production isn't declared
	 */
	public static Grammar read(String source, String input){
		Grammar grammar = new EbnfReader(source, input).parseGrammar();
		grammar.verify();
		return grammar;
	}

	public static Grammar read(String input){
		return read("", input);
	}

	public static Grammar read(String source, Reader reader) throws IOException {
		StringBuilder builder = new StringBuilder();
		char[] buffer = new char[8192];
		int count;
		while ((count = reader.read(buffer)) != -1){
			builder.append(buffer, 0, count);
		}
		return read(source, builder.toString());
	}

	private Token next(){
		Token token = current;
		current = scanner.next();
		return token;
	}

	private Token expect(Token.Type type){
		if (!current.is(type)){
			throw SyntaxError.expected(current, type.description);
		}
		return next();
	}

	private Grammar parseGrammar(){
		List<Production> productions = new ArrayList<>();
		Map<String, Production> declared = new HashMap<>();
		if (current.is(Token.Type.EOF)){
			throw SyntaxError.expected(current, "production");
		}
		while (!current.is(Token.Type.EOF)){
			Production production = parseProduction(productions.size());
			Production previous = declared.put(production.name, production);
			if (previous != null){
				throw new SyntaxError(production.location, String.format("%s declared already (at %s)",
						production.name, previous.location));
			}
			productions.add(production);
		}
		return new Grammar(productions);
	}

	private Production parseProduction(int id){
		if (!current.is(Token.Type.IDENT)){
			throw SyntaxError.expected(current, "production name");
		}
		Token name = next();
		expect(Token.Type.ASSIGN);
		Expression body = Expression.EMPTY;
		if (!current.is(Token.Type.PERIOD)){
			body = parseExpression();
		}
		expect(Token.Type.PERIOD);
		return new Production(id, name.value, body, null, name.location);
	}

	private Expression parseExpression(){
		List<Alternative> alternatives = new ArrayList<>();
		alternatives.add(parseAlternative());
		while (current.is(Token.Type.OR)){
			next();
			alternatives.add(parseAlternative());
		}
		return new Expression(alternatives);
	}

	private Alternative parseAlternative(){
		List<Term> terms = new ArrayList<>();
		Term term;
		while ((term = parseTerm()) != null){
			terms.add(term);
		}
		if (terms.isEmpty()){
			throw SyntaxError.expected(current, "term");
		}
		return new Alternative(terms);
	}

	/**
	 * @return parsed term or null if the current token can't start a term
	 */
	private Term parseTerm(){
		Location location = current.location;
		switch (current.type){
			case IDENT:
				return Term.ref(next().value, location);
			case STRING:
				return parseToken();
			case LPAREN:
				next();
				Expression group = parseExpression();
				expect(Token.Type.RPAREN);
				return Term.group(group, location);
			case LBRACK:
				next();
				Expression option = parseExpression();
				expect(Token.Type.RBRACK);
				return Term.option(option, location);
			case LBRACE:
				next();
				Expression repetition = parseExpression();
				expect(Token.Type.RBRACE);
				return Term.repetition(repetition, location);
			default:
				return null;
		}
	}

	private Term parseToken(){
		Token start = next();
		checkNotEmpty(start);
		if (!current.is(Token.Type.ELLIPSIS)){
			return Term.token(start.value, start.location);
		}
		next();
		Token end = expect(Token.Type.STRING);
		checkNotEmpty(end);
		checkSingleCharacter(start);
		checkSingleCharacter(end);
		if (start.value.codePointAt(0) > end.value.codePointAt(0)){
			throw new SyntaxError(end.location, String.format("invalid character range %s … %s",
					start.describe(), end.describe()));
		}
		return Term.range(start.value, end.value, start.location);
	}

	private static void checkNotEmpty(Token token){
		if (token.value.isEmpty()){
			throw new SyntaxError(token.location, "empty token");
		}
	}

	private static void checkSingleCharacter(Token token){
		if (Utils.codePointLength(token.value) != 1){
			throw new SyntaxError(token.location, String.format("single character expected in range, found %s",
					token.describe()));
		}
	}
}

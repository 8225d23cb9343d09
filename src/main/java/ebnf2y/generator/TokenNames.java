package ebnf2y.generator;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Grammars;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Term;

/**
 * Assigns the symbol names of the tokens of a BNF grammar.
 *
 * <ul>
 *     <li>lexical tokens: prefix + upper case name, <code>identifier</code> becomes <code>IDENTIFIER</code></li>
 *     <li>single printable ASCII characters: character literals, <code>"+"</code> becomes <code>'+'</code></li>
 *     <li>other literals: prefix + upper case letters and digits with spelled out punctuation,
 *     <code>"&lt;&lt;"</code> becomes <code>LTLT</code></li>
 * </ul>
 * Names that are already taken get a numbered suffix, in the order in which the tokens appear in the grammar.
 */
class TokenNames {

	private static final Map<Character, String> PUNCTUATION = new HashMap<>();

	static {
		String[][] names = {
				{"<", "LT"}, {">", "GT"}, {"=", "EQ"}, {"!", "NOT"}, {"&", "AND"}, {"|", "OR"},
				{"^", "XOR"}, {"+", "PLUS"}, {"-", "MINUS"}, {"*", "MUL"}, {"/", "DIV"}, {"%", "MOD"},
				{".", "DOT"}, {",", "COMMA"}, {":", "COLON"}, {";", "SEMICOLON"}, {"(", "LPAREN"},
				{")", "RPAREN"}, {"[", "LBRACK"}, {"]", "RBRACK"}, {"{", "LBRACE"}, {"}", "RBRACE"},
				{"~", "TILDE"}, {"?", "QUESTION"}, {"@", "AT"}, {"#", "HASH"}, {"$", "DOLLAR"}
		};
		for (String[] pair : names) {
			PUNCTUATION.put(pair[0].charAt(0), pair[1]);
		}
	}

	/**
	 * Symbols that the parser generator defines itself
	 */
	private static final Set<String> RESERVED = new HashSet<>(Arrays.asList("error", "EOF", "YYEOF", "YYerror",
			"YYUNDEF"));

	private final String prefix;
	private final Set<String> taken = new HashSet<>(RESERVED);

	/**
	 * Lexical token name → symbol
	 */
	private final Map<String, String> lexical = new LinkedHashMap<>();

	/**
	 * Literal text → symbol name, only literals that need a %token declaration
	 */
	private final Map<String, String> literals = new LinkedHashMap<>();

	TokenNames(Grammar grammar, String prefix) {
		this.prefix = prefix;
		for (Production production : grammar.getProductions()) {
			taken.add(production.name);
		}
		for (Production production : grammar.getProductions()) {
			Grammars.walkTerms(production.body, term -> register(grammar, term));
		}
		for (String token : grammar.getTokens()) {
			lexical.computeIfAbsent(token, t -> reserve(prefix + t.toUpperCase(Locale.ROOT)));
		}
	}

	private void register(Grammar grammar, Term term){
		switch (term.kind){
			case REF:
				if (grammar.isToken(term.name)){
					lexical.computeIfAbsent(term.name, t -> reserve(prefix + t.toUpperCase(Locale.ROOT)));
				}
				break;
			case TOKEN:
				if (!isCharacterLiteral(term.text)){
					literals.computeIfAbsent(term.text, t -> reserve(identifier(t)));
				}
				break;
			case GROUP:
			case OPTION:
			case REPETITION:
				break;
		}
	}

	private String reserve(String base){
		String name = base;
		for (int i = 1; !taken.add(name); i++){
			name = base + i;
		}
		return name;
	}

	static boolean isCharacterLiteral(String text){
		return text.length() == 1 && text.charAt(0) >= ' ' && text.charAt(0) <= '~';
	}

	private String identifier(String text){
		StringBuilder builder = new StringBuilder(prefix);
		for (char c : text.toCharArray()) {
			if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_'){
				builder.append(Character.toUpperCase(c));
			} else if (PUNCTUATION.containsKey(c)){
				builder.append(PUNCTUATION.get(c));
			} else {
				builder.append(String.format("U%04X", (int)c));
			}
		}
		if (builder.length() == 0 || Character.isDigit(builder.charAt(0))){
			builder.insert(0, '_');
		}
		return builder.toString();
	}

	/**
	 * Symbol for a reference to a lexical token
	 */
	String lexical(String name){
		return lexical.get(name);
	}

	/**
	 * Symbol for a literal token, a character literal or a declared token name
	 */
	String literal(String text){
		if (isCharacterLiteral(text)){
			char c = text.charAt(0);
			if (c == '\'' || c == '\\'){
				return "'\\" + c + "'";
			}
			return "'" + c + "'";
		}
		return literals.get(text);
	}

	Map<String, String> lexicalTokens(){
		return lexical;
	}

	Map<String, String> literalTokens(){
		return literals;
	}
}

package ebnf2y.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Term;
import ebnf2y.util.Utils;

/**
 * Renders a BNF grammar as a bison grammar file for the Java skeleton.
 *
 * Every rule builds a generic <code>Node</code> whose tag is the production name for the first
 * alternative and the production name followed by the alternative number for the others.
 * Literal tokens contribute their text, all other symbols their semantic value.
 *
 * The output only depends on the grammar, the prefix and the start production.
 */
public class SkeletonGenerator {

	private static final String NODE_CLASS = String.join("\n",
			"%code {",
			"\t/**",
			"\t * Generic parse tree node",
			"\t */",
			"\tpublic static final class Node {",
			"\t\tpublic final String tag;",
			"\t\tpublic final java.util.List<Object> children;",
			"",
			"\t\tpublic Node(String tag, Object... children) {",
			"\t\t\tthis.tag = tag;",
			"\t\t\tthis.children = java.util.Arrays.asList(children);",
			"\t\t}",
			"",
			"\t\t@Override",
			"\t\tpublic String toString() {",
			"\t\t\treturn tag + children;",
			"\t\t}",
			"\t}",
			"}");

	private final String prefix;

	/**
	 * @param prefix prefix of the generated token names
	 */
	public SkeletonGenerator(String prefix) {
		this.prefix = prefix;
	}

	/**
	 * Render the grammar
	 *
	 * @param grammar BNF grammar
	 * @param start name of the start production
	 * @throws IllegalArgumentException if the grammar isn't a BNF grammar
	 */
	public String generate(Grammar grammar, String start){
		if (!grammar.isBnf()){
			throw new IllegalArgumentException("Only BNF grammars can be rendered");
		}
		TokenNames names = new TokenNames(grammar, prefix);
		StringBuilder builder = new StringBuilder();
		builder.append("// Generated by ebnf2y, start production ").append(start).append("\n\n");
		builder.append("%language \"Java\"\n");
		builder.append("%define api.parser.class {Parser}\n");
		builder.append("%define api.value.type {Object}\n\n");
		builder.append(NODE_CLASS).append("\n\n");
		for (String token : names.lexicalTokens().values()) {
			builder.append("%token\t").append(token).append("\n");
		}
		for (Map.Entry<String, String> token : names.literalTokens().entrySet()) {
			builder.append("%token\t").append(token.getValue());
			if (token.getKey().chars().allMatch(c -> c > ' ' && c <= '~')){
				builder.append("\t").append(Utils.toPrintableRepresentation(token.getKey()));
			}
			builder.append("\n");
		}
		builder.append("\n%start\t").append(start).append("\n\n%%\n");
		for (Production production : grammar.getProductions()) {
			builder.append("\n");
			appendRule(builder, production, names);
		}
		builder.append("\n%%\n");
		return builder.toString();
	}

	private void appendRule(StringBuilder builder, Production production, TokenNames names){
		builder.append(production.name).append(":\n");
		List<Alternative> alternatives = production.body.alternatives;
		for (int i = 0; i < alternatives.size(); i++){
			builder.append(i == 0 ? "\t" : "|\t");
			Alternative alternative = alternatives.get(i);
			List<String> symbols = new ArrayList<>();
			List<String> values = new ArrayList<>();
			values.add(Utils.toPrintableRepresentation(i == 0 ? production.name : production.name + i));
			for (int j = 0; j < alternative.size(); j++){
				Term term = alternative.get(j);
				switch (term.kind){
					case REF: {
						String token = names.lexical(term.name);
						symbols.add(token == null ? term.name : token);
						values.add("$" + (j + 1));
						break;
					}
					case TOKEN:
						symbols.add(names.literal(term.text));
						values.add(Utils.toPrintableRepresentation(term.text));
						break;
					case GROUP:
					case OPTION:
					case REPETITION:
						throw new IllegalArgumentException("Unexpected EBNF term " + term);
				}
			}
			builder.append(symbols.isEmpty() ? "/* empty */" : String.join(" ", symbols)).append("\n");
			builder.append("\t{\n\t\t$$ = new Node(").append(String.join(", ", values)).append(");\n\t}\n");
		}
		builder.append(";\n");
	}
}

package ebnf2y.grammar;

import java.util.ArrayList;
import java.util.List;

import ebnf2y.util.Utils;

/**
 * Renders grammars as EBNF that the {@link ebnf2y.reader.EbnfReader} accepts again.
 *
 * The EBNF notation has no empty alternative inside an alternation, an expression
 * with an empty alternative next to others is therefore printed as an option over
 * the remaining alternatives.
 */
public class GrammarPrinter {

	private GrammarPrinter(){
	}

	public static String print(Grammar grammar){
		StringBuilder builder = new StringBuilder();
		if (!grammar.getTokens().isEmpty()){
			builder.append("// tokens: ").append(String.join(" ", grammar.getTokens())).append("\n\n");
		}
		int width = 0;
		for (Production production : grammar.getProductions()) {
			width = Math.max(width, production.name.length());
		}
		for (Production production : grammar.getProductions()) {
			builder.append(printProduction(production, width)).append("\n");
		}
		return builder.toString();
	}

	public static String printProduction(Production production){
		return printProduction(production, 0);
	}

	private static String printProduction(Production production, int width){
		StringBuilder builder = new StringBuilder(production.name);
		for (int i = production.name.length(); i < width; i++){
			builder.append(' ');
		}
		builder.append(" =");
		String body = printExpression(production.body);
		if (!body.isEmpty()){
			builder.append(' ').append(body);
		}
		return builder.append(" .").toString();
	}

	public static String printExpression(Expression expression){
		List<String> parts = new ArrayList<>();
		boolean hasEmpty = false;
		for (Alternative alternative : expression.alternatives) {
			String printed = printAlternative(alternative);
			if (printed.isEmpty()){
				hasEmpty = true;
			} else {
				parts.add(printed);
			}
		}
		String joined = String.join(" | ", parts);
		if (hasEmpty && !parts.isEmpty()){
			return "[ " + joined + " ]";
		}
		return joined;
	}

	public static String printAlternative(Alternative alternative){
		List<String> parts = new ArrayList<>();
		for (Term term : alternative.terms) {
			String printed = printTerm(term);
			if (!printed.isEmpty()){
				parts.add(printed);
			}
		}
		return String.join(" ", parts);
	}

	public static String printTerm(Term term){
		switch (term.kind){
			case REF:
				return term.name;
			case TOKEN:
				if (term.rangeEnd != null){
					return Utils.toPrintableRepresentation(term.text) + " … "
							+ Utils.toPrintableRepresentation(term.rangeEnd);
				}
				return Utils.toPrintableRepresentation(term.text);
			case GROUP:
				return bracket("(", term.expression, ")");
			case OPTION:
				return bracket("[", term.expression, "]");
			case REPETITION:
				return bracket("{", term.expression, "}");
		}
		throw new IllegalStateException("Unknown term kind " + term.kind);
	}

	/**
	 * Brackets around an expression that only derives the empty word are left out
	 * together with the expression.
	 */
	private static String bracket(String open, Expression expression, String close){
		String printed = printExpression(expression);
		if (printed.isEmpty()){
			return "";
		}
		return open + " " + printed + " " + close;
	}
}

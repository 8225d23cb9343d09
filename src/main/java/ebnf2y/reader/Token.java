package ebnf2y.reader;

import ebnf2y.util.Utils;

/**
 * A token of the EBNF notation.
 */
public class Token {

	public static enum Type {
		IDENT("production name"),
		STRING("token"),
		ELLIPSIS("\"…\""),
		ASSIGN("\"=\""),
		PERIOD("\".\""),
		OR("\"|\""),
		LPAREN("\"(\""),
		RPAREN("\")\""),
		LBRACK("\"[\""),
		RBRACK("\"]\""),
		LBRACE("\"{\""),
		RBRACE("\"}\""),
		EOF("end of input");

		public final String description;

		Type(String description){
			this.description = description;
		}
	}

	public final Type type;

	/**
	 * Identifier name or the decoded token text
	 */
	public final String value;

	public final Location location;

	public Token(Type type, String value, Location location) {
		this.type = type;
		this.value = value;
		this.location = location;
	}

	public boolean is(Type type){
		return this.type == type;
	}

	/**
	 * Description used in error messages
	 */
	public String describe(){
		switch (type){
			case IDENT:
				return value;
			case STRING:
				return Utils.toPrintableRepresentation(value);
			default:
				return type.description;
		}
	}

	@Override
	public String toString() {
		return type + "(" + describe() + ")@" + location;
	}
}

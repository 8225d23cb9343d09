package ebnf2y.reader;

/**
 * Splits EBNF source text into tokens, comments and white space are skipped.
 *
 * <pre>
 * IDENT    = letter { letter | digit } .       letter includes "_"
 * STRING   = `"` { char | escape } `"` | "`" { char } "`" .
 * COMMENT  = "//" ... end of line | "/*" ... "*&#47;" .
 * </pre>
 */
public class Scanner {

	private final String source;
	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public Scanner(String source, String input) {
		this.source = source;
		this.input = input;
	}

	private boolean atEnd(){
		return pos >= input.length();
	}

	private int peek(){
		return atEnd() ? -1 : input.codePointAt(pos);
	}

	private int peek(int offset){
		int p = pos;
		for (int i = 0; i < offset && p < input.length(); i++){
			p += Character.charCount(input.codePointAt(p));
		}
		return p >= input.length() ? -1 : input.codePointAt(p);
	}

	private int advance(){
		int c = input.codePointAt(pos);
		pos += Character.charCount(c);
		if (c == '\n'){
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private Location location(){
		return new Location(source, line, column);
	}

	private void skipWhitespaceAndComments(){
		while (!atEnd()){
			int c = peek();
			if (Character.isWhitespace(c)){
				advance();
			} else if (c == '/' && peek(1) == '/'){
				while (!atEnd() && peek() != '\n'){
					advance();
				}
			} else if (c == '/' && peek(1) == '*'){
				Location start = location();
				advance();
				advance();
				while (!(peek() == '*' && peek(1) == '/')){
					if (atEnd()){
						throw new SyntaxError(start, "comment not terminated");
					}
					advance();
				}
				advance();
				advance();
			} else {
				return;
			}
		}
	}

	/**
	 * Returns the next token, {@link Token.Type#EOF} at the end of the input
	 *
	 * @throws SyntaxError for illegal characters and malformed tokens
	 */
	public Token next(){
		skipWhitespaceAndComments();
		Location start = location();
		if (atEnd()){
			return new Token(Token.Type.EOF, "", start);
		}
		int c = peek();
		if (isLetter(c)){
			StringBuilder builder = new StringBuilder();
			while (isLetter(peek()) || Character.isDigit(peek())){
				builder.appendCodePoint(advance());
			}
			return new Token(Token.Type.IDENT, builder.toString(), start);
		}
		switch (c){
			case '"':
				return new Token(Token.Type.STRING, scanInterpretedString(start), start);
			case '`':
				return new Token(Token.Type.STRING, scanRawString(start), start);
			case '…':
				advance();
				return new Token(Token.Type.ELLIPSIS, "…", start);
		}
		advance();
		switch (c){
			case '=': return new Token(Token.Type.ASSIGN, "=", start);
			case '.': return new Token(Token.Type.PERIOD, ".", start);
			case '|': return new Token(Token.Type.OR, "|", start);
			case '(': return new Token(Token.Type.LPAREN, "(", start);
			case ')': return new Token(Token.Type.RPAREN, ")", start);
			case '[': return new Token(Token.Type.LBRACK, "[", start);
			case ']': return new Token(Token.Type.RBRACK, "]", start);
			case '{': return new Token(Token.Type.LBRACE, "{", start);
			case '}': return new Token(Token.Type.RBRACE, "}", start);
		}
		throw new SyntaxError(start, String.format("illegal character %s",
				ebnf2y.util.Utils.toPrintableRepresentation(new String(Character.toChars(c)))));
	}

	private static boolean isLetter(int c){
		return c == '_' || Character.isLetter(c);
	}

	private String scanRawString(Location start){
		advance();
		StringBuilder builder = new StringBuilder();
		while (peek() != '`'){
			if (atEnd()){
				throw new SyntaxError(start, "string literal not terminated");
			}
			int c = advance();
			if (c != '\r'){
				builder.appendCodePoint(c);
			}
		}
		advance();
		return builder.toString();
	}

	private String scanInterpretedString(Location start){
		advance();
		StringBuilder builder = new StringBuilder();
		while (peek() != '"'){
			if (atEnd() || peek() == '\n'){
				throw new SyntaxError(start, "string literal not terminated");
			}
			int c = advance();
			if (c == '\\'){
				scanEscape(builder);
			} else {
				builder.appendCodePoint(c);
			}
		}
		advance();
		return builder.toString();
	}

	private void scanEscape(StringBuilder builder){
		Location location = location();
		if (atEnd()){
			throw new SyntaxError(location, "escape sequence not terminated");
		}
		int c = advance();
		switch (c){
			case 'a': builder.append('\u0007'); return;
			case 'b': builder.append('\b'); return;
			case 'f': builder.append('\f'); return;
			case 'n': builder.append('\n'); return;
			case 'r': builder.append('\r'); return;
			case 't': builder.append('\t'); return;
			case 'v': builder.append('\u000b'); return;
			case '\\': builder.append('\\'); return;
			case '"': builder.append('"'); return;
			case '\'': builder.append('\''); return;
			case 'x':
				builder.appendCodePoint(scanDigits(location, 16, 2, 2));
				return;
			case 'u':
				builder.appendCodePoint(scanDigits(location, 16, 4, 4));
				return;
			case 'U':
				int codePoint = scanDigits(location, 16, 8, 8);
				if (!Character.isValidCodePoint(codePoint)){
					throw new SyntaxError(location, "escape sequence is invalid Unicode code point");
				}
				builder.appendCodePoint(codePoint);
				return;
		}
		if (c >= '0' && c <= '7'){
			int value = c - '0';
			for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++){
				value = value * 8 + (advance() - '0');
			}
			if (value > 255){
				throw new SyntaxError(location, "octal escape value > 255");
			}
			builder.appendCodePoint(value);
			return;
		}
		throw new SyntaxError(location, "unknown escape sequence");
	}

	private int scanDigits(Location location, int base, int min, int max){
		int value = 0;
		int count = 0;
		while (count < max && Character.digit(peek(), base) >= 0){
			value = value * base + Character.digit(advance(), base);
			count++;
		}
		if (count < min){
			throw new SyntaxError(location, "illegal character in escape sequence");
		}
		return value;
	}
}

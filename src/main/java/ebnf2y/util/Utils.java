package ebnf2y.util;

/**
 * Class with utility methods...
 */
public class Utils {

	private static final char CONTROL_LIMIT = ' ';
	private static final char PRINTABLE_LIMIT = '~';
	private static final char[] HEX_DIGITS = new char[] { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b',
			'c', 'd', 'e', 'f' };

	private Utils(){
	}

	/**
	 * Return an escaped, double quoted version of the passed string that is a valid
	 * Go and Java string literal.
	 *
	 * Shamelessly copied from http://stackoverflow.com/a/1351973
	 *
	 * @param source passed string
	 * @return escaped version
	 */
	public static String toPrintableRepresentation(String source) {
		if (source == null) {
			return null;
		}
		final StringBuilder sb = new StringBuilder();
		final int limit = source.length();
		char[] hexbuf = null;

		int pointer = 0;

		sb.append('"');

		while (pointer < limit) {

			int ch = source.charAt(pointer++);

			switch (ch) {

				case '\t': sb.append("\\t"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;

				default:
					if (CONTROL_LIMIT <= ch && ch <= PRINTABLE_LIMIT) {
						sb.append((char)ch);
					} else {

						sb.append("\\u");

						if (hexbuf == null) {
							hexbuf = new char[4];
						}

						for (int offs = 4; offs > 0; ) {

							hexbuf[--offs] = HEX_DIGITS[ch & 0xf];
							ch >>>= 4;
						}

						sb.append(hexbuf, 0, 4);
					}
			}
		}

		return sb.append('"').toString();
	}

	/**
	 * Number of unicode code points in the passed string
	 */
	public static int codePointLength(String str){
		return str.codePointCount(0, str.length());
	}
}

package ebnf2y.reader;

/**
 * Position in an EBNF source, lines and columns start at 1.
 */
public class Location {

	public static final Location UNKNOWN = new Location("", 0, 0);

	public final String source;
	public final int line;
	public final int column;

	public Location(String source, int line, int column){
		this.source = source == null ? "" : source;
		this.line = line;
		this.column = column;
	}

	@Override
	public String toString() {
		if (source.isEmpty()){
			return line + ":" + column;
		}
		return source + ":" + line + ":" + column;
	}
}

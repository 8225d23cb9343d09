package ebnf2y.grammar;

import java.util.Objects;

/**
 * Origin of a synthetic production: the production whose lowering created it,
 * the ordinal among the productions created for this origin and the index of the
 * lowered term in its alternative.
 */
public final class Provenance {

	public final String originProduction;
	public final int ordinal;
	public final int termIndex;

	public Provenance(String originProduction, int ordinal, int termIndex) {
		this.originProduction = Objects.requireNonNull(originProduction);
		this.ordinal = ordinal;
		this.termIndex = termIndex;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Provenance)){
			return false;
		}
		Provenance other = (Provenance)obj;
		return originProduction.equals(other.originProduction) && ordinal == other.ordinal
				&& termIndex == other.termIndex;
	}

	@Override
	public int hashCode() {
		return Objects.hash(originProduction, ordinal, termIndex);
	}

	@Override
	public String toString() {
		return originProduction + "#" + ordinal + "@" + termIndex;
	}
}

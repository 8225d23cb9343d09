package ebnf2y.grammar;

import ebnf2y.Ebnf2yException;

public class StartProductionNotFoundError extends Ebnf2yException {

	public final String name;

	public StartProductionNotFoundError(String name) {
		super(String.format("start production %s not found", name));
		this.name = name;
	}
}

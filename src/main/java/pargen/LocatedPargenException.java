package pargen;

import pargen.grammar.reader.Location;

public class LocatedPargenException extends PargenException {

	public final Location errorLocation;

	public LocatedPargenException(Location errorLocation, String message) {
		super(String.format("Error at %s: %s", errorLocation != null ? errorLocation : new Location(0, 0), message));
		if (errorLocation != null) {
			this.errorLocation = errorLocation;
		} else {
			this.errorLocation = new Location(0, 0);
		}
	}
}

package pargen.diagnostic;

import java.util.logging.Level;

/**
 * Severity of a diagnostic and the log level it is reported with
 */
public enum Severity {
	ERROR(Level.SEVERE),
	WARNING(Level.WARNING),
	NOTE(Level.FINE);

	public final Level level;

	Severity(Level level) {
		this.level = level;
	}

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}

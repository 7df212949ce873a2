package pargen.diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import pargen.grammar.reader.Location;

/**
 * A structured diagnostic: severity, message, optional source span and a list of notes.
 *
 * Diagnostics are plain values, {@link #format()} renders them as text and {@link #log(Logger)} reports them.
 */
public final class Diagnostic {

	public final Severity severity;

	public final String message;

	private final Location span;

	public final ImmutableList<String> notes;

	private Diagnostic(Severity severity, String message, Location span, List<String> notes) {
		this.severity = severity;
		this.message = message;
		this.span = span;
		this.notes = ImmutableList.copyOf(notes);
	}

	public static Builder error(String message){
		return new Builder(Severity.ERROR, message);
	}

	public static Builder warning(String message){
		return new Builder(Severity.WARNING, message);
	}

	public static Builder note(String message){
		return new Builder(Severity.NOTE, message);
	}

	public Optional<Location> getSpan(){
		return Optional.ofNullable(span);
	}

	public String format(){
		StringBuilder builder = new StringBuilder();
		builder.append(severity).append(": ").append(message);
		if (span != null){
			builder.append(" at ").append(span);
		}
		for (String note : notes){
			builder.append("\n  note: ").append(note);
		}
		return builder.toString();
	}

	public void log(Logger logger){
		if (logger.isLoggable(severity.level)){
			logger.log(severity.level, format());
		}
	}

	@Override
	public String toString() {
		return format();
	}

	public static class Builder {

		private final Severity severity;
		private final String message;
		private Location span;
		private final List<String> notes = new ArrayList<>();

		private Builder(Severity severity, String message) {
			this.severity = severity;
			this.message = message;
		}

		public Builder span(Location span){
			this.span = span;
			return this;
		}

		public Builder note(String note){
			notes.add(note);
			return this;
		}

		public Diagnostic build(){
			return new Diagnostic(severity, message, span, notes);
		}
	}
}

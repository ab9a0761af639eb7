package ptc;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

/**
 * A message produced by one of the compiler passes. Diagnostics are values: two diagnostics with
 * the same kind, severity, position and message are the same diagnostic.
 */
@AutoValue
public abstract class Diagnostic implements Comparable<Diagnostic> {
  public enum Kind {
    /** A break or continue without a visible target loop, or a shadowed loop label. */
    STRUCTURAL,
    /** Code that no execution can reach. */
    UNREACHABLE,
    /** A loop that control can never leave. */
    UNPRODUCTIVE_LOOP,
    /** A construct that could not be turned into a sound node. */
    MALFORMED;
  }

  public enum Severity {
    ERROR,
    WARNING;
  }

  private static final Comparator<Diagnostic> ORDER =
      Comparator.comparing(Diagnostic::pos)
          .thenComparing(Diagnostic::kind)
          .thenComparing(Diagnostic::severity)
          .thenComparing(Diagnostic::message);

  public static Diagnostic error(Kind kind, Pos pos, String message) {
    return new AutoValue_Diagnostic(kind, Severity.ERROR, pos, message);
  }

  public static Diagnostic warning(Kind kind, Pos pos, String message) {
    return new AutoValue_Diagnostic(kind, Severity.WARNING, pos, message);
  }

  public static Diagnostic of(Kind kind, boolean fatal, Pos pos, String message) {
    return fatal ? error(kind, pos, message) : warning(kind, pos, message);
  }

  public abstract Kind kind();

  public abstract Severity severity();

  public abstract Pos pos();

  public abstract String message();

  public boolean isFatal() {
    return severity() == Severity.ERROR;
  }

  public CompilerException toException() {
    return new CompilerException(this);
  }

  public String format() {
    return String.format("%s: %s %s", severity(), pos(), message());
  }

  @Override
  public int compareTo(Diagnostic other) {
    return ORDER.compare(this, other);
  }
}

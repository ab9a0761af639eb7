package ptc;

/** A fatal {@link Diagnostic} raised to callers that prefer exceptions to result objects. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  public CompilerException(Diagnostic diagnostic) {
    super(diagnostic.message());
    this.diagnostic = diagnostic;
  }

  public Diagnostic diagnostic() {
    return diagnostic;
  }

  public Pos pos() {
    return diagnostic.pos();
  }
}

package ptc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The outcome of compiling one protocol. */
@AutoValue
public abstract class CompileResult {
  static CompileResult create(Optional<Target> target, ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_CompileResult(target, diagnostics);
  }

  /** The lowered protocol; present only if no diagnostic is fatal. */
  public abstract Optional<Target> target();

  /** Every diagnostic found, without repeats, sorted by position. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  public boolean succeeded() {
    return target().isPresent();
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics()
        .stream()
        .filter(Diagnostic::isFatal)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics()
        .stream()
        .filter(d -> !d.isFatal())
        .collect(ImmutableList.toImmutableList());
  }
}

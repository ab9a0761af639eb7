package ptc;

import com.google.auto.value.AutoValue;

/** Controls which diagnostics stop a compilation. */
@AutoValue
public abstract class CompilerOptions {
  private static final CompilerOptions DEFAULTS = builder().build();

  public static CompilerOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setUnreachableCodeFatal(false)
        .setUnproductiveLoopsFatal(true);
  }

  /** Whether unreachable code is an error rather than a warning. */
  public abstract boolean unreachableCodeFatal();

  /**
   * Whether a loop that can never be exited is an error. If not, it is reported as a warning and
   * lowered like any other loop.
   */
  public abstract boolean unproductiveLoopsFatal();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setUnreachableCodeFatal(boolean unreachableCodeFatal);

    public abstract Builder setUnproductiveLoopsFatal(boolean unproductiveLoopsFatal);

    public abstract CompilerOptions build();
  }
}

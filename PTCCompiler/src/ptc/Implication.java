package ptc;

import com.google.auto.value.AutoValue;

/** A unit of solver work: {@link #consequent()} holds once {@link #preconditions()} hold. */
@AutoValue
public abstract class Implication {
  public static Implication create(Dnf preconditions, Constraint consequent) {
    return new AutoValue_Implication(preconditions, consequent);
  }

  public abstract Dnf preconditions();

  public abstract Constraint consequent();
}

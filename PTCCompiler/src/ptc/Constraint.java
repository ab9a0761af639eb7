package ptc;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A property of a CFG node that flow analysis tries to prove. */
@AutoValue
public abstract class Constraint {
  public enum Type {
    /** Control can get from the node to its {@code next}. */
    PASSABLE,
    /** Execution starting at the node can reach the end of its scope. */
    HALTABLE,
    /** Execution starting at the node can break out of {@link #loop()}. */
    BREAKABLE_TO,
    /** Execution starting at the node can continue {@link #loop()}. */
    CONTINUABLE_TO;
  }

  private static final int NO_LOOP = -1;

  public static Constraint passable(int node) {
    return new AutoValue_Constraint(Type.PASSABLE, node, NO_LOOP);
  }

  public static Constraint haltable(int node) {
    return new AutoValue_Constraint(Type.HALTABLE, node, NO_LOOP);
  }

  public static Constraint breakableTo(int from, int loop) {
    Preconditions.checkArgument(loop >= 0);
    return new AutoValue_Constraint(Type.BREAKABLE_TO, from, loop);
  }

  public static Constraint continuableTo(int from, int loop) {
    Preconditions.checkArgument(loop >= 0);
    return new AutoValue_Constraint(Type.CONTINUABLE_TO, from, loop);
  }

  public abstract Type type();

  public abstract int node();

  // Only set for BREAKABLE_TO and CONTINUABLE_TO.
  public abstract int loop();

  @Override
  public final String toString() {
    switch (type()) {
      case PASSABLE:
        return String.format("Passable(#%d)", node());
      case HALTABLE:
        return String.format("Haltable(#%d)", node());
      case BREAKABLE_TO:
        return String.format("BreakableTo(#%d, #%d)", node(), loop());
      default:
        return String.format("ContinuableTo(#%d, #%d)", node(), loop());
    }
  }
}

package ptc;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/** The constraints proven by a {@link FlowSolver} run. Anything else is false. */
public final class FlowFacts {
  private final ImmutableSet<Constraint> facts;
  private final boolean stuck;

  FlowFacts(Set<Constraint> facts, boolean stuck) {
    this.facts = ImmutableSet.copyOf(facts);
    this.stuck = stuck;
  }

  public boolean holds(Constraint constraint) {
    return facts.contains(constraint);
  }

  public boolean isPassable(int node) {
    return holds(Constraint.passable(node));
  }

  public boolean isHaltable(int node) {
    return holds(Constraint.haltable(node));
  }

  public boolean isBreakableTo(int from, int loop) {
    return holds(Constraint.breakableTo(from, loop));
  }

  public boolean isContinuableTo(int from, int loop) {
    return holds(Constraint.continuableTo(from, loop));
  }

  public ImmutableSet<Constraint> facts() {
    return facts;
  }

  /** True if solving ended with implications that could neither be proven nor dropped. */
  public boolean stuck() {
    return stuck;
  }
}

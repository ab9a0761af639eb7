package ptc;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;

import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A worklist solver over {@link Implication}s. Facts are only ever added, so the least set of
 * constraints consistent with the rules is found. Constraints the solver could not prove are
 * false.
 *
 * <p>Each popped implication is either proven (its consequent becomes a fact), dropped (its
 * consequent is already a fact or its preconditions can never hold) or queued again after
 * requiring every constraint its preconditions mention. Solving stops when the queue is empty, or
 * when a whole pass over the queue made no progress.
 */
public final class FlowSolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Supplies the preconditions under which a constraint holds. */
  public interface Rules {
    Dnf preconditions(Constraint constraint);
  }

  private final Rules rules;
  private final Queue<Implication> queue = new ArrayDeque<>();
  private final Set<Constraint> seen = new HashSet<>();
  private final Set<Constraint> facts = new LinkedHashSet<>();

  public FlowSolver(Rules rules) {
    this.rules = rules;
  }

  /** Queues {@code constraint} for solving. Returns false if it was already queued or solved. */
  @CanIgnoreReturnValue
  public boolean require(Constraint constraint) {
    if (!seen.add(constraint)) return false;
    queue.add(Implication.create(rules.preconditions(constraint), constraint));
    return true;
  }

  public FlowFacts solve() {
    int steps = 0;
    int sinceProgress = 0;
    boolean stuck = false;

    while (!queue.isEmpty()) {
      if (sinceProgress >= queue.size()) {
        stuck = true;
        break;
      }

      Implication implication = queue.remove();
      steps++;

      if (facts.contains(implication.consequent()) || implication.preconditions().isImpossible()) {
        continue;
      }
      if (implication.preconditions().isEntailedBy(facts)) {
        facts.add(implication.consequent());
        sinceProgress = 0;
        continue;
      }

      boolean discovered = false;
      for (Constraint constraint : implication.preconditions().constraints()) {
        discovered |= require(constraint);
      }
      queue.add(implication);
      sinceProgress = discovered ? 0 : sinceProgress + 1;
    }

    logger.atFine().log(
        "solved %d constraints in %d steps: %d facts, %d unresolved%s",
        seen.size(), steps, facts.size(), queue.size(), stuck ? " (stuck)" : "");
    return new FlowFacts(facts, stuck);
  }
}

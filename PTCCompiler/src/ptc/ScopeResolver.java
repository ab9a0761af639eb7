package ptc;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.flogger.FluentLogger;

/**
 * Makes every continuation in a {@link Cfg} explicit, in place.
 *
 * <ul>
 *   <li>A choose or offer hands its {@code next} to each arm: the arm's last node is linked to it
 *       (or the arm becomes it, if empty) and the choice itself keeps no {@code next}.
 *   <li>A loop body that can fall off its end gets a trailing synthetic {@code continue} back to
 *       the loop. Synthetic nodes may turn out to be dead and are marked as such.
 *   <li>The last node of any other scope is linked to the scope's implicit continuation.
 * </ul>
 *
 * <p>Running the pass again on its own output changes nothing.
 */
public final class ScopeResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Cfg cfg;
  private final Set<Integer> visited = new HashSet<>();
  private int changes = 0;

  private ScopeResolver(Cfg cfg) {
    this.cfg = cfg;
  }

  /** Returns the number of edits made; zero if {@code cfg} was already resolved. */
  public static int resolve(Cfg cfg) {
    ScopeResolver resolver = new ScopeResolver(cfg);
    cfg.root().ifPresent(root -> resolver.resolveChain(root, Optional.empty()));
    logger.atFine().log("scope resolution made %d edits", resolver.changes);
    return resolver.changes;
  }

  private static boolean isJump(Ir.Type type) {
    return type == Ir.Type.BREAK || type == Ir.Type.CONTINUE;
  }

  // Walks the chain starting at 'start' whose scope continues with 'implicit' when it ends.
  private void resolveChain(int start, Optional<Integer> implicit) {
    Optional<Integer> current = Optional.of(start);
    while (current.isPresent()) {
      int index = current.get();
      if (!visited.add(index)) return;

      CfgNode node = cfg.get(index);
      switch (node.type()) {
        case CHOOSE:
        case OFFER:
          resolveBranches(node, implicit);
          return;
        case CALL:
          node.ir().<Ir.Call>cast().callee().ifPresent(c -> resolveChain(c, Optional.empty()));
          break;
        case SPLIT:
          {
            Ir.Split split = node.ir().cast();
            split.transmit().ifPresent(tx -> resolveChain(tx, Optional.empty()));
            split.receive().ifPresent(rx -> resolveChain(rx, Optional.empty()));
            break;
          }
        case LOOP:
          resolveLoop(index);
          break;
        default:
          break;
      }

      if (!node.next().isPresent()) {
        if (implicit.isPresent() && !isJump(node.type())) {
          node.setNext(implicit);
          changes++;
        }
        return;
      }
      current = node.next();
    }
  }

  private void resolveBranches(CfgNode node, Optional<Integer> implicit) {
    Optional<Integer> own = node.next();
    Optional<Integer> continuation = own.isPresent() ? own : implicit;
    if (own.isPresent()) {
      node.setNext(Optional.empty());
      changes++;
    }

    Ir.Branches branches = node.ir().cast();
    for (int i = 0; i < branches.numArms(); i++) {
      Optional<Integer> arm = branches.arm(i);
      if (arm.isPresent()) {
        resolveChain(arm.get(), continuation);
      } else if (continuation.isPresent()) {
        branches.setArm(i, continuation);
        changes++;
      }
    }

    // An implicit continuation belongs to an enclosing scope, which resolves it itself.
    own.ifPresent(next -> resolveChain(next, implicit));
  }

  private void resolveLoop(int index) {
    CfgNode node = cfg.get(index);
    Ir.Loop loop = node.ir().cast();

    if (!loop.body().isPresent()) {
      int repeat = cfg.addSynthetic(Ir.continueTo(index), Optional.empty(), node.pos());
      visited.add(repeat);
      loop.setBody(Optional.of(repeat));
      changes++;
      return;
    }

    int body = loop.body().get();
    Optional<Integer> implicit = Optional.empty();
    if (!endsInJump(body, new HashMap<>())) {
      implicit = Optional.of(cfg.addSynthetic(Ir.continueTo(index), Optional.empty(), node.pos()));
      changes++;
    }
    resolveChain(body, implicit);
  }

  // True if no path through the chain starting at 'start' can fall off its end.
  private boolean endsInJump(int start, Map<Integer, Boolean> memo) {
    Boolean known = memo.get(start);
    if (known != null) return known;

    int tail = start;
    while (cfg.get(tail).next().isPresent()) {
      tail = cfg.get(tail).next().get();
    }

    CfgNode node = cfg.get(tail);
    boolean result;
    if (isJump(node.type())) {
      result = true;
    } else if (node.type() == Ir.Type.CHOOSE || node.type() == Ir.Type.OFFER) {
      result =
          node.ir()
              .<Ir.Branches>cast()
              .arms()
              .stream()
              .allMatch(arm -> arm.isPresent() && endsInJump(arm.get(), memo));
    } else {
      result = false;
    }

    memo.put(start, result);
    return result;
  }
}

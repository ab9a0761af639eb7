package ptc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

/**
 * Turns a scope-resolved, analyzed {@link Cfg} into a {@link Target} tree.
 *
 * <p>Jumps are addressed by the position of their loop on the stack of enclosing loops, innermost
 * first: {@code Break<0>} leaves the innermost loop and {@code Continue<1>} repeats the one around
 * it. Calls and splits start with an empty stack. Code behind a node that never passes is not
 * lowered, and a subtree whose node carries a fatal diagnostic lowers to {@link Target#error()}.
 */
public final class Lowering {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Cfg cfg;
  private final FlowFacts facts;
  private final boolean unproductiveLoopsFatal;

  private Deque<Integer> loops = new ArrayDeque<>();
  // Keyed by the node followed by the enclosing loops; continuations shared between arms are
  // lowered once per loop context.
  private final Map<ImmutableList<Integer>, Target> lowered = new HashMap<>();
  private final ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();

  public Lowering(Cfg cfg, FlowFacts facts, boolean unproductiveLoopsFatal) {
    this.cfg = cfg;
    this.facts = facts;
    this.unproductiveLoopsFatal = unproductiveLoopsFatal;
  }

  public Target lower() {
    Target target = lower(cfg.root());
    logger.atFine().log("lowered %d node contexts", lowered.size());
    return target;
  }

  /** Diagnostics raised while lowering, in the order they were found. */
  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics.build();
  }

  private Target lower(Optional<Integer> index) {
    return index.map(this::lower).orElse(Target.done());
  }

  private Target lower(int index) {
    ImmutableList<Integer> key =
        ImmutableList.<Integer>builder().add(index).addAll(loops).build();
    Target target = lowered.get(key);
    if (target == null) {
      target = lowerNode(index);
      lowered.put(key, target);
    }
    return target;
  }

  private Target lowerNode(int index) {
    CfgNode node = cfg.get(index);
    if (node.hasFatalDiagnostic()) return Target.error();

    Ir ir = node.ir();
    switch (ir.type()) {
      case SEND:
        return Target.send(ir.<Ir.Message>cast().payload(), lower(node.next()));
      case RECV:
        return Target.recv(ir.<Ir.Message>cast().payload(), lower(node.next()));
      case TYPE:
        {
          Target type = Target.type(ir.<Ir.TypeLiteral>cast().typeName());
          return node.next().isPresent() ? Target.then(type, lower(node.next())) : type;
        }
      case CALL:
        {
          Target callee = inNewScope(() -> lower(ir.<Ir.Call>cast().callee()));
          return Target.call(callee, continuation(index));
        }
      case SPLIT:
        {
          Ir.Split split = ir.cast();
          Target transmit = inNewScope(() -> lower(split.transmit()));
          Target receive = inNewScope(() -> lower(split.receive()));
          return Target.split(transmit, receive, continuation(index));
        }
      case CHOOSE:
        return Target.choose(lowerArms(ir.cast()));
      case OFFER:
        return Target.offer(lowerArms(ir.cast()));
      case LOOP:
        return lowerLoop(index);
      case BREAK:
        return Target.breakLoop(depth(ir.<Ir.Jump>cast().loop()));
      case CONTINUE:
        return Target.continueLoop(depth(ir.<Ir.Jump>cast().loop()));
      case ERROR:
        return Target.error();
    }
    throw new AssertionError(ir);
  }

  private ImmutableList<Target> lowerArms(Ir.Branches branches) {
    ImmutableList.Builder<Target> arms = ImmutableList.builder();
    for (Optional<Integer> arm : branches.arms()) {
      arms.add(lower(arm));
    }
    return arms.build();
  }

  // What follows a call or split; nothing if it can never get there.
  private Target continuation(int index) {
    return facts.isPassable(index) ? lower(cfg.get(index).next()) : Target.done();
  }

  private Target lowerLoop(int index) {
    CfgNode node = cfg.get(index);
    Optional<Integer> body = node.ir().<Ir.Loop>cast().body();

    if (!isProductive(index, body)) {
      Diagnostic diagnostic =
          Diagnostic.of(
              Diagnostic.Kind.UNPRODUCTIVE_LOOP,
              unproductiveLoopsFatal,
              node.pos(),
              node.ir()
                  .<Ir.Loop>cast()
                  .label()
                  .map(label -> String.format("loop '%s' can never be exited", label))
                  .orElse("loop can never be exited"));
      if (node.addDiagnostic(diagnostic)) {
        diagnostics.add(diagnostic);
      }
      if (unproductiveLoopsFatal) return Target.error();
    }

    loops.push(index);
    Target loop;
    try {
      loop = Target.loop(lower(body));
    } finally {
      loops.pop();
    }

    if (facts.isPassable(index) && node.next().isPresent()) {
      return Target.then(loop, lower(node.next()));
    }
    return loop;
  }

  // A loop is productive if control can leave it: a break to itself, or a break or continue to
  // a loop around it.
  private boolean isProductive(int index, Optional<Integer> body) {
    if (!body.isPresent()) return false;
    if (facts.isBreakableTo(body.get(), index)) return true;
    return loops.stream()
        .anyMatch(
            outer ->
                facts.isBreakableTo(body.get(), outer)
                    || facts.isContinuableTo(body.get(), outer));
  }

  private int depth(int loop) {
    int depth = 0;
    for (int enclosing : loops) {
      if (enclosing == loop) return depth;
      depth++;
    }
    throw new VerifyException(
        String.format("#%d is not an enclosing loop of the current scope:\n%s", loop, cfg));
  }

  private Target inNewScope(Supplier<Target> body) {
    Deque<Integer> saved = loops;
    loops = new ArrayDeque<>();
    try {
      return body.get();
    } finally {
      loops = saved;
    }
  }
}

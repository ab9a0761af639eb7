package ptc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Verify;

/**
 * The flow rules of a scope-resolved {@link Cfg}.
 *
 * <ul>
 *   <li>{@code Passable(n)}: messages, type literals and error nodes always pass. A call passes if
 *       its callee halts, a split if both halves halt, a choice if one of its arms halts and a loop
 *       if its body can break out of it. Jumps never pass.
 *   <li>{@code Haltable(n)}: {@code n} passes and, if it has one, its {@code next} halts.
 *   <li>{@code BreakableTo(n, loop)}: {@code n} breaks to {@code loop} directly, through one of its
 *       arms, or through the body of a nested loop; or {@code n} passes and its {@code next} can
 *       break to {@code loop}. Breaks never leave a call or split.
 *   <li>{@code ContinuableTo(n, loop)}: the same, for continues.
 * </ul>
 *
 * An absent scope is the empty protocol, which halts immediately.
 */
public final class FlowAnalysis implements FlowSolver.Rules {
  private final Cfg cfg;

  private FlowAnalysis(Cfg cfg) {
    this.cfg = cfg;
  }

  public static FlowFacts analyze(Cfg cfg) {
    FlowSolver solver = new FlowSolver(new FlowAnalysis(cfg));
    cfg.indices()
        .forEach(
            index -> {
              solver.require(Constraint.passable(index));
              solver.require(Constraint.haltable(index));
              if (cfg.type(index) == Ir.Type.LOOP) {
                cfg.get(index)
                    .ir()
                    .<Ir.Loop>cast()
                    .body()
                    .ifPresent(body -> solver.require(Constraint.breakableTo(body, index)));
              }
            });

    // Lowering also needs to know whether a nested loop can jump out to an enclosing one.
    cfg.indices()
        .filter(index -> cfg.type(index) == Ir.Type.LOOP)
        .forEach(
            outer -> {
              for (int inner : nestedLoops(cfg, outer)) {
                Optional<Integer> body = cfg.get(inner).ir().<Ir.Loop>cast().body();
                if (body.isPresent()) {
                  solver.require(Constraint.breakableTo(body.get(), outer));
                  solver.require(Constraint.continuableTo(body.get(), outer));
                }
              }
            });
    return solver.solve();
  }

  // Loops inside the body of 'loop' that a break could leave 'loop' from.
  private static Set<Integer> nestedLoops(Cfg cfg, int loop) {
    Set<Integer> loops = new LinkedHashSet<>();
    Set<Integer> visited = new HashSet<>();
    Deque<Integer> pending = new ArrayDeque<>();
    cfg.get(loop).ir().<Ir.Loop>cast().body().ifPresent(pending::add);
    while (!pending.isEmpty()) {
      int index = pending.pop();
      if (index == loop || !visited.add(index)) continue;

      CfgNode node = cfg.get(index);
      node.next().ifPresent(pending::add);
      if (node.type() == Ir.Type.LOOP) loops.add(index);
      if (node.type() != Ir.Type.CALL && node.type() != Ir.Type.SPLIT) {
        pending.addAll(cfg.children(index));
      }
    }
    return loops;
  }

  @Override
  public Dnf preconditions(Constraint constraint) {
    switch (constraint.type()) {
      case PASSABLE:
        return passable(constraint.node());
      case HALTABLE:
        return haltable(constraint.node());
      case BREAKABLE_TO:
      case CONTINUABLE_TO:
        return jumpableTo(constraint);
    }
    throw new AssertionError(constraint);
  }

  private static List<Constraint> haltableIfPresent(Optional<Integer> scope) {
    List<Constraint> constraints = new ArrayList<>();
    scope.ifPresent(index -> constraints.add(Constraint.haltable(index)));
    return constraints;
  }

  private Dnf passable(int index) {
    Ir ir = cfg.get(index).ir();
    switch (ir.type()) {
      case RECV:
      case SEND:
      case TYPE:
      case ERROR:
        return Dnf.trivial();
      case CALL:
        return Dnf.builder().or(haltableIfPresent(ir.<Ir.Call>cast().callee())).build();
      case SPLIT:
        {
          Ir.Split split = ir.cast();
          List<Constraint> halves = haltableIfPresent(split.transmit());
          halves.addAll(haltableIfPresent(split.receive()));
          return Dnf.builder().or(halves).build();
        }
      case CHOOSE:
      case OFFER:
        {
          Dnf.Builder arms = Dnf.builder();
          for (Optional<Integer> arm : ir.<Ir.Branches>cast().arms()) {
            arms.or(haltableIfPresent(arm));
          }
          return arms.build();
        }
      case LOOP:
        return ir.<Ir.Loop>cast()
            .body()
            .map(body -> Dnf.allOf(Constraint.breakableTo(body, index)))
            .orElse(Dnf.impossible());
      case BREAK:
      case CONTINUE:
        return Dnf.impossible();
    }
    throw new AssertionError(ir);
  }

  private Dnf haltable(int index) {
    Optional<Integer> next = cfg.get(index).next();
    return next.isPresent()
        ? Dnf.allOf(Constraint.passable(index), Constraint.haltable(next.get()))
        : Dnf.allOf(Constraint.passable(index));
  }

  private Dnf jumpableTo(Constraint constraint) {
    int index = constraint.node();
    int loop = constraint.loop();
    Verify.verify(cfg.type(loop) == Ir.Type.LOOP, "#%s is not a loop", loop);

    Ir.Type jump =
        constraint.type() == Constraint.Type.BREAKABLE_TO ? Ir.Type.BREAK : Ir.Type.CONTINUE;
    CfgNode node = cfg.get(index);
    Ir ir = node.ir();
    Dnf.Builder builder = Dnf.builder();
    switch (ir.type()) {
      case BREAK:
      case CONTINUE:
        if (ir.type() == jump && ir.<Ir.Jump>cast().loop() == loop) {
          return Dnf.trivial();
        }
        break;
      case CHOOSE:
      case OFFER:
        for (Optional<Integer> arm : ir.<Ir.Branches>cast().arms()) {
          arm.ifPresent(a -> builder.or(sameJump(constraint, a)));
        }
        break;
      case LOOP:
        ir.<Ir.Loop>cast().body().ifPresent(body -> builder.or(sameJump(constraint, body)));
        break;
      default:
        break;
    }

    node.next()
        .ifPresent(
            next -> builder.or(Constraint.passable(index), sameJump(constraint, next)));
    return builder.build();
  }

  private static Constraint sameJump(Constraint constraint, int from) {
    return constraint.type() == Constraint.Type.BREAKABLE_TO
        ? Constraint.breakableTo(from, constraint.loop())
        : Constraint.continuableTo(from, constraint.loop());
  }
}

package ptc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

/**
 * Translates the surface syntax into a {@link Cfg}. Each visit receives the continuation of the
 * statement (the node to run afterward) and returns the index of the first node it built.
 *
 * <p>No flow checking happens here. Break and continue targets are resolved against the visible
 * loops; a target that cannot be resolved produces an {@link Ir.Type#ERROR} node carrying a
 * structural diagnostic, and building carries on.
 */
public final class CfgBuilder extends DefaultASTVisitor<Optional<Integer>> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final class LoopScope {
    private final Optional<String> label;
    private final int loop;

    private LoopScope(Optional<String> label, int loop) {
      this.label = label;
      this.loop = loop;
    }
  }

  private final Cfg cfg;
  // The innermost scope is the one loops are pushed on; outer scopes are hidden by a call or
  // split boundary and only kept to explain errors.
  private final Deque<Deque<LoopScope>> scopes = new ArrayDeque<>();

  public CfgBuilder(Cfg cfg) {
    this.cfg = cfg;
    scopes.push(new ArrayDeque<>());
  }

  public static Cfg build(AST ast) {
    Cfg cfg = new Cfg();
    CfgBuilder builder = new CfgBuilder(cfg);
    cfg.setRoot(ast.accept(builder, Optional.empty()));
    logger.atFine().log("built %d nodes for protocol '%s'", cfg.size(), ast.name());
    return cfg;
  }

  /** Builds {@code block} so that it runs {@code continuation} when it completes. */
  public Optional<Integer> build(AST.Block block, Optional<Integer> continuation) {
    return block.accept(this, continuation);
  }

  @Override
  public Optional<Integer> visit(AST ast, Optional<Integer> continuation) {
    return build(ast.body(), continuation);
  }

  @Override
  public Optional<Integer> visit(AST.Block block, Optional<Integer> continuation) {
    ImmutableList<AST.Statement> statements = block.statements();
    for (int i = statements.size() - 1; i >= 0; i--) {
      continuation = statements.get(i).accept(this, continuation);
    }
    return continuation;
  }

  @Override
  public Optional<Integer> visit(AST.Send send, Optional<Integer> continuation) {
    return Optional.of(cfg.add(Ir.send(send.payload()), continuation, send.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.Recv recv, Optional<Integer> continuation) {
    return Optional.of(cfg.add(Ir.recv(recv.payload()), continuation, recv.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.TypeLiteral type, Optional<Integer> continuation) {
    return Optional.of(cfg.add(Ir.type(type.type()), continuation, type.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.Call call, Optional<Integer> continuation) {
    Optional<Integer> callee = inNewScope(() -> build(call.callee(), Optional.empty()));
    return Optional.of(cfg.add(Ir.call(callee), continuation, call.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.Split split, Optional<Integer> continuation) {
    Optional<Integer> transmit = inNewScope(() -> build(split.transmit(), Optional.empty()));
    Optional<Integer> receive = inNewScope(() -> build(split.receive(), Optional.empty()));
    return Optional.of(cfg.add(Ir.split(transmit, receive), continuation, split.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.Choose choose, Optional<Integer> continuation) {
    Ir ir = Ir.choose(buildArms(choose.branches()));
    return Optional.of(cfg.add(ir, continuation, choose.pos()));
  }

  @Override
  public Optional<Integer> visit(AST.Offer offer, Optional<Integer> continuation) {
    Ir ir = Ir.offer(buildArms(offer.branches()));
    return Optional.of(cfg.add(ir, continuation, offer.pos()));
  }

  // Arms are built without a continuation; scope resolution splices it in.
  private ImmutableList<Optional<Integer>> buildArms(ImmutableList<AST.Block> branches) {
    ImmutableList.Builder<Optional<Integer>> arms = ImmutableList.builder();
    for (AST.Block branch : branches) {
      arms.add(build(branch, Optional.empty()));
    }
    return arms.build();
  }

  @Override
  public Optional<Integer> visit(AST.Loop loop, Optional<Integer> continuation) {
    // Allocated first so jumps inside the body can refer to it.
    Ir.Loop ir = Ir.loop(loop.label());
    int index = cfg.add(ir, continuation, loop.pos());

    scopes.peek().push(new LoopScope(loop.label(), index));
    try {
      ir.setBody(build(loop.body(), Optional.empty()));
    } finally {
      scopes.peek().pop();
    }
    return Optional.of(index);
  }

  @Override
  public Optional<Integer> visit(AST.Break breakAst, Optional<Integer> continuation) {
    return jump(Ir.Type.BREAK, breakAst.label(), breakAst.pos(), continuation);
  }

  @Override
  public Optional<Integer> visit(AST.Continue continueAst, Optional<Integer> continuation) {
    return jump(Ir.Type.CONTINUE, continueAst.label(), continueAst.pos(), continuation);
  }

  @Override
  public Optional<Integer> visit(AST.Done done, Optional<Integer> continuation) {
    return continuation;
  }

  // Anything following a jump stays linked so the reachability report can point at it.
  private Optional<Integer> jump(
      Ir.Type type, Optional<String> label, Pos pos, Optional<Integer> continuation) {
    String keyword = type == Ir.Type.BREAK ? "break" : "continue";
    Optional<Integer> target = resolve(label);
    if (!target.isPresent()) {
      int error = cfg.add(Ir.error(), continuation, pos);
      cfg.get(error)
          .addDiagnostic(
              Diagnostic.error(Diagnostic.Kind.STRUCTURAL, pos, unresolvedMessage(keyword, label)));
      return Optional.of(error);
    }

    Ir ir = type == Ir.Type.BREAK ? Ir.breakTo(target.get()) : Ir.continueTo(target.get());
    return Optional.of(cfg.add(ir, continuation, pos));
  }

  private Optional<Integer> resolve(Optional<String> label) {
    for (LoopScope scope : scopes.peek()) {
      if (!label.isPresent() || label.equals(scope.label)) {
        return Optional.of(scope.loop);
      }
    }
    return Optional.empty();
  }

  private String unresolvedMessage(String keyword, Optional<String> label) {
    boolean hidden =
        scopes
            .stream()
            .skip(1)
            .flatMap(Deque::stream)
            .anyMatch(scope -> !label.isPresent() || label.equals(scope.label));
    if (hidden) {
      return label.isPresent()
          ? String.format(
              "%s '%s' refers to a loop outside of the enclosing call or split",
              keyword, label.get())
          : String.format(
              "%s cannot leave the enclosing call or split; it has no loop of its own", keyword);
    }
    return label.isPresent()
        ? String.format("%s refers to undeclared loop label '%s'", keyword, label.get())
        : String.format("%s outside of a loop", keyword);
  }

  private <T> T inNewScope(Supplier<T> body) {
    scopes.push(new ArrayDeque<>());
    try {
      return body.get();
    } finally {
      scopes.pop();
    }
  }
}

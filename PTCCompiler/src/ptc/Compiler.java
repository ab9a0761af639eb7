package ptc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

/**
 * Compiles a protocol {@link AST} into a {@link Target}.
 *
 * <p>Every pass runs even after an error so a single compilation reports as much as it can.
 * Lowering is skipped if the program is structurally broken, and its result is only returned if
 * nothing fatal was found.
 */
public final class Compiler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CompilerOptions options;

  public Compiler() {
    this(CompilerOptions.defaults());
  }

  public Compiler(CompilerOptions options) {
    this.options = options;
  }

  public CompileResult compile(AST ast) {
    List<Diagnostic> diagnostics = new ArrayList<>(new ASTValidator(ast).computeErrors());

    Cfg cfg = CfgBuilder.build(ast);
    ScopeResolver.resolve(cfg);
    FlowFacts facts = FlowAnalysis.analyze(cfg);
    if (facts.stuck()) {
      logger.atFine().log("flow analysis left unproven constraints for '%s'", ast.name());
    }
    new DeadCodeReporter(cfg, facts, options.unreachableCodeFatal()).report();
    // Equal diagnostics on different nodes are separate findings.
    cfg.indices().forEach(index -> diagnostics.addAll(cfg.get(index).diagnostics()));

    Optional<Target> target = Optional.empty();
    if (diagnostics.stream().noneMatch(Compiler::blocksLowering)) {
      Lowering lowering = new Lowering(cfg, facts, options.unproductiveLoopsFatal());
      Target lowered = lowering.lower();
      diagnostics.addAll(lowering.diagnostics());
      if (diagnostics.stream().noneMatch(Diagnostic::isFatal)) {
        target = Optional.of(lowered);
      }
    }

    logger.atFine().log(
        "compiled '%s': %d diagnostics, %s",
        ast.name(), diagnostics.size(), target.isPresent() ? "succeeded" : "failed");
    return CompileResult.create(target, ImmutableList.sortedCopyOf(diagnostics));
  }

  /** Returns the lowered protocol, or throws the first fatal diagnostic. */
  public Target compileOrThrow(AST ast) throws CompilerException {
    CompileResult result = compile(ast);
    if (!result.succeeded()) {
      throw result.errors().get(0).toException();
    }
    return result.target().get();
  }

  private static boolean blocksLowering(Diagnostic diagnostic) {
    return diagnostic.isFatal()
        && (diagnostic.kind() == Diagnostic.Kind.STRUCTURAL
            || diagnostic.kind() == Diagnostic.Kind.MALFORMED);
  }
}

package ptc;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/** One control-flow construct. Owned by a {@link Cfg}; other nodes refer to it by index. */
public final class CfgNode {
  private final Ir ir;
  private final Pos pos;
  private final boolean allowUnreachable;
  private Optional<Integer> next;
  // Insertion ordered so reports stay deterministic.
  private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

  CfgNode(Ir ir, Optional<Integer> next, Pos pos, boolean allowUnreachable) {
    this.ir = ir;
    this.next = next;
    this.pos = pos;
    this.allowUnreachable = allowUnreachable;
  }

  public Ir ir() {
    return ir;
  }

  public Ir.Type type() {
    return ir.type();
  }

  public Optional<Integer> next() {
    return next;
  }

  void setNext(Optional<Integer> next) {
    this.next = next;
  }

  public Pos pos() {
    return pos;
  }

  /** True for nodes inserted by a pass rather than written by the user. */
  public boolean allowUnreachable() {
    return allowUnreachable;
  }

  /** Returns false if an equal diagnostic was already attached. */
  public boolean addDiagnostic(Diagnostic diagnostic) {
    return diagnostics.add(diagnostic);
  }

  public ImmutableSet<Diagnostic> diagnostics() {
    return ImmutableSet.copyOf(diagnostics);
  }

  public boolean hasFatalDiagnostic() {
    return diagnostics.stream().anyMatch(Diagnostic::isFatal);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(ir.toString());
    next.ifPresent(n -> sb.append(" -> #").append(n));
    if (allowUnreachable) sb.append(" [synthetic]");
    return sb.toString();
  }
}

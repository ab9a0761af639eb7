package ptc;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<Diagnostic> errors = new ArrayList<>();

  protected ImmutableList<Diagnostic> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Diagnostic.Kind kind, Pos pos, String msg) {
    logError(Diagnostic.error(kind, pos, msg));
  }

  protected void logError(Diagnostic diagnostic) {
    errors.add(diagnostic);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }
}

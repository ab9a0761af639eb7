package ptc;

import java.util.ArrayDeque;
import java.util.Deque;

// Rejects loop labels that hide a visible enclosing label. Call bodies and split halves start
// with no visible labels.
class LabelValidator extends ErrorCollectingValidator {

  private final Deque<Deque<String>> scopes = new ArrayDeque<>();

  public LabelValidator() {
    scopes.push(new ArrayDeque<>());
  }

  @Override
  public void visitImpl(AST.Call call) {
    scopes.push(new ArrayDeque<>());
    super.visitImpl(call);
    scopes.pop();
  }

  @Override
  public void visitImpl(AST.Split split) {
    scopes.push(new ArrayDeque<>());
    super.visitImpl(split);
    scopes.pop();
  }

  @Override
  public void visitImpl(AST.Loop loop) {
    if (!loop.label().isPresent()) {
      super.visitImpl(loop);
      return;
    }

    String label = loop.label().get();
    if (scopes.peek().contains(label)) {
      logError(
          Diagnostic.Kind.STRUCTURAL,
          loop.pos(),
          String.format("loop label '%s' shadows an enclosing loop with the same label", label));
    }
    scopes.peek().push(label);
    super.visitImpl(loop);
    scopes.peek().pop();
  }
}

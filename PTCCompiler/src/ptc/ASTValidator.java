package ptc;

import com.google.common.collect.ImmutableList;

/** Runs the checks that only need the surface syntax, before any graph is built. */
public class ASTValidator extends ErrorCollectingValidator {

  private final AST ast;

  public ASTValidator(AST ast) {
    this.ast = ast;
  }

  public ImmutableList<Diagnostic> computeErrors() {
    accept(new LabelValidator());
    accept(new PayloadValidator());
    return errors();
  }

  private void accept(ErrorCollectingValidator visitor) {
    ast.accept(visitor, null);
    takeErrors(visitor);
  }
}

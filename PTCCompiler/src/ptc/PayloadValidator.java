package ptc;

class PayloadValidator extends ErrorCollectingValidator {

  private void checkDescriptor(Pos pos, String descriptor, String what) {
    if (descriptor.trim().isEmpty()) {
      logError(Diagnostic.Kind.MALFORMED, pos, String.format("%s requires a type", what));
    }
  }

  @Override
  public void visitImpl(AST.Send send) {
    checkDescriptor(send.pos(), send.payload(), "send");
  }

  @Override
  public void visitImpl(AST.Recv recv) {
    checkDescriptor(recv.pos(), recv.payload(), "recv");
  }

  @Override
  public void visitImpl(AST.TypeLiteral type) {
    checkDescriptor(type.pos(), type.type(), "type passthrough");
  }
}

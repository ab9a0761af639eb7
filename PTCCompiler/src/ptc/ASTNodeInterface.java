package ptc;

/** Implemented by every surface syntax node through its generated {@code *_ASTNode} interface. */
public interface ASTNodeInterface {
  <V> V accept(ASTVisitor<V> visitor, V value);

  <V> V visitChildren(ASTVisitor<V> visitor, V value);
}

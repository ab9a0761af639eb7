package ptc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The control-flow graph of one compilation unit: an arena of {@link CfgNode}s addressed by stable
 * integer indices. Nodes never own each other; a node is live if it is reachable from {@link
 * #root()}.
 */
public final class Cfg {
  private final List<CfgNode> nodes = new ArrayList<>();
  private Optional<Integer> root = Optional.empty();

  public int add(Ir ir, Optional<Integer> next, Pos pos) {
    return add(new CfgNode(ir, next, pos, false));
  }

  public int addSynthetic(Ir ir, Optional<Integer> next, Pos pos) {
    return add(new CfgNode(ir, next, pos, true));
  }

  private int add(CfgNode node) {
    node.next().ifPresent(this::checkIndex);
    nodes.add(node);
    return nodes.size() - 1;
  }

  public CfgNode get(int index) {
    checkIndex(index);
    return nodes.get(index);
  }

  public Ir.Type type(int index) {
    return get(index).type();
  }

  public int size() {
    return nodes.size();
  }

  public IntStream indices() {
    return IntStream.range(0, nodes.size());
  }

  /** The first node executed, or empty for the protocol that does nothing. */
  public Optional<Integer> root() {
    return root;
  }

  void setRoot(Optional<Integer> root) {
    root.ifPresent(this::checkIndex);
    this.root = root;
  }

  /**
   * Every node directly referenced by {@code index}: its continuation followed by its nested
   * scopes, in a fixed order.
   */
  public ImmutableList<Integer> successors(int index) {
    CfgNode node = get(index);
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    node.next().ifPresent(builder::add);
    children(index).forEach(builder::add);
    return builder.build();
  }

  /** The nested scopes of {@code index}: callee, split halves, arms or loop body. */
  public ImmutableList<Integer> children(int index) {
    Ir ir = get(index).ir();
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    switch (ir.type()) {
      case CALL:
        ir.<Ir.Call>cast().callee().ifPresent(builder::add);
        break;
      case SPLIT:
        {
          Ir.Split split = ir.cast();
          split.transmit().ifPresent(builder::add);
          split.receive().ifPresent(builder::add);
          break;
        }
      case CHOOSE:
      case OFFER:
        ir.<Ir.Branches>cast().arms().forEach(arm -> arm.ifPresent(builder::add));
        break;
      case LOOP:
        ir.<Ir.Loop>cast().body().ifPresent(builder::add);
        break;
      default:
        break;
    }
    return builder.build();
  }

  /** A line per node, used in test failure messages and to detect mutation. */
  public String dump() {
    StringBuilder sb = new StringBuilder();
    sb.append("root: ").append(root.map(r -> "#" + r).orElse("_")).append('\n');
    for (int i = 0; i < nodes.size(); i++) {
      sb.append('#').append(i).append(": ").append(nodes.get(i)).append('\n');
    }
    return sb.toString();
  }

  private void checkIndex(int index) {
    Preconditions.checkElementIndex(index, nodes.size(), "node index");
  }

  @Override
  public String toString() {
    return dump();
  }
}

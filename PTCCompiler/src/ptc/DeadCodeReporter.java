package ptc;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Finds the nodes no execution can reach and reports each maximal dead region once, on the first
 * node control would have entered it through.
 *
 * <p>Regions are connected through structural edges in either direction, so dead arms that share
 * a dead continuation form one region and get a single diagnostic between them.
 */
public final class DeadCodeReporter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Cfg cfg;
  private final FlowFacts facts;
  private final boolean fatal;

  // Every reference between nodes.
  private final MutableGraph<Integer> structure =
      GraphBuilder.directed().allowsSelfLoops(true).build();
  // The references control can actually follow.
  private final MutableGraph<Integer> live =
      GraphBuilder.directed().allowsSelfLoops(true).build();

  public DeadCodeReporter(Cfg cfg, FlowFacts facts, boolean fatal) {
    this.cfg = cfg;
    this.facts = facts;
    this.fatal = fatal;
  }

  /** Nodes reachable from the root. */
  public ImmutableSet<Integer> reachable() {
    buildGraphs();
    if (!cfg.root().isPresent()) return ImmutableSet.of();
    return ImmutableSet.copyOf(Graphs.reachableNodes(live, cfg.root().get()));
  }

  /** Attaches one diagnostic per dead region and returns the ones not attached before. */
  @CanIgnoreReturnValue
  public ImmutableList<Diagnostic> report() {
    ImmutableSet<Integer> reachable = reachable();

    // Synthetic nodes are never reported and do not join regions of user code.
    MutableGraph<Integer> dead = GraphBuilder.undirected().build();
    cfg.indices()
        .filter(i -> !reachable.contains(i) && !cfg.get(i).allowUnreachable())
        .forEach(dead::addNode);
    for (Integer node : ImmutableList.copyOf(dead.nodes())) {
      for (Integer successor : structure.successors(node)) {
        if (dead.nodes().contains(successor)) {
          dead.putEdge(node, successor);
        }
      }
    }

    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    Set<Integer> covered = new HashSet<>();
    for (int node : ImmutableList.sortedCopyOf(dead.nodes())) {
      if (covered.contains(node)) continue;

      Set<Integer> region = Graphs.reachableNodes(dead, node);
      covered.addAll(region);
      CfgNode entry = cfg.get(boundary(region, reachable));
      Diagnostic diagnostic =
          Diagnostic.of(Diagnostic.Kind.UNREACHABLE, fatal, entry.pos(), "unreachable code");
      if (entry.addDiagnostic(diagnostic)) {
        diagnostics.add(diagnostic);
      }
    }

    ImmutableList<Diagnostic> result = diagnostics.build();
    logger.atFine().log(
        "%d of %d nodes unreachable, %d reported", dead.nodes().size(), cfg.size(), result.size());
    return result;
  }

  // The node of the region to report, preferring those entered from live code.
  private int boundary(Set<Integer> region, Set<Integer> reachable) {
    Comparator<Integer> order =
        Comparator.<Integer, Boolean>comparing(
                node -> structure.predecessors(node).stream().noneMatch(reachable::contains))
            .thenComparing(node -> cfg.get(node).pos())
            .thenComparing(Comparator.naturalOrder());
    return region.stream().min(order).get();
  }

  private void buildGraphs() {
    if (!structure.nodes().isEmpty() || cfg.size() == 0) return;

    cfg.indices().forEach(structure::addNode);
    cfg.indices().forEach(live::addNode);
    cfg.indices()
        .forEach(
            index -> {
              cfg.successors(index).forEach(successor -> structure.putEdge(index, successor));
              liveSuccessors(index).forEach(successor -> live.putEdge(index, successor));
            });
  }

  private ImmutableList<Integer> liveSuccessors(int index) {
    CfgNode node = cfg.get(index);
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    builder.addAll(cfg.children(index));
    switch (node.type()) {
      case BREAK:
      case CONTINUE:
      case CHOOSE:
      case OFFER:
        break;
      case CALL:
      case SPLIT:
      case LOOP:
        if (facts.isPassable(index)) {
          node.next().ifPresent(builder::add);
        }
        break;
      default:
        node.next().ifPresent(builder::add);
        break;
    }
    return builder.build();
  }
}

package ptc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Generates small well-formed programs: every jump names a loop that encloses it within the same
 * call or split, and loop labels never shadow each other.
 */
final class RandomPrograms {
  private static final int MAX_DEPTH = 4;
  private static final int MAX_STATEMENTS = 3;

  private final Random random;
  private final List<String> loops = new ArrayList<>();

  RandomPrograms(long seed) {
    this.random = new Random(seed);
  }

  AST next() {
    loops.clear();
    return AST.of("random", block(0));
  }

  private AST.Block block(int depth) {
    int size = random.nextInt(MAX_STATEMENTS + 1);
    List<AST.Statement> statements = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      statements.add(statement(depth));
    }
    return AST.block(Pos.internal(), statements);
  }

  private AST.Statement statement(int depth) {
    int choice = random.nextInt(depth >= MAX_DEPTH ? 4 : 11);
    switch (choice) {
      case 0:
        return AST.send("S" + random.nextInt(3));
      case 1:
        return AST.recv("R" + random.nextInt(3));
      case 2:
        return jump(true);
      case 3:
        return jump(false);
      case 4:
        return AST.type("T" + random.nextInt(3));
      case 5:
        return AST.call(Pos.internal(), inNewScope(depth + 1));
      case 6:
        return AST.split(Pos.internal(), inNewScope(depth + 1), inNewScope(depth + 1));
      case 7:
        return AST.choose(Pos.internal(), arms(depth + 1));
      case 8:
        return AST.offer(Pos.internal(), arms(depth + 1));
      default:
        {
          String label = "l" + loops.size();
          loops.add(label);
          try {
            return AST.loop(Pos.internal(), Optional.of(label), block(depth + 1));
          } finally {
            loops.remove(loops.size() - 1);
          }
        }
    }
  }

  private AST.Statement jump(boolean isBreak) {
    if (loops.isEmpty()) return AST.done();

    Optional<String> label =
        random.nextBoolean()
            ? Optional.empty()
            : Optional.of(loops.get(random.nextInt(loops.size())));
    return isBreak
        ? AST.breakLoop(Pos.internal(), label)
        : AST.continueLoop(Pos.internal(), label);
  }

  private List<AST.Block> arms(int depth) {
    int size = random.nextInt(3);
    List<AST.Block> arms = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      arms.add(block(depth));
    }
    return arms;
  }

  private AST.Block inNewScope(int depth) {
    List<String> saved = new ArrayList<>(loops);
    loops.clear();
    try {
      return block(depth);
    } finally {
      loops.addAll(saved);
    }
  }
}

package ptc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Writes a lowered {@link Target} back out as surface syntax. Loops are labeled by their nesting
 * depth within the current call or split ({@code l0} outermost), so every jump can name its loop.
 * Compiling the result yields the same target.
 */
public final class SurfaceEmbedding {
  private static final String LABEL_PREFIX = "l";

  private int depth = 0;

  private SurfaceEmbedding() {}

  public static AST embed(String name, Target target) {
    return AST.of(name, new SurfaceEmbedding().block(target));
  }

  private AST.Block block(Target target) {
    List<AST.Statement> statements = new ArrayList<>();
    append(target, statements);
    return AST.block(Pos.internal(), statements);
  }

  private void append(Target target, List<AST.Statement> out) {
    switch (target.kind()) {
      case DONE:
        return;
      case SEND:
        {
          Target.Message send = target.cast();
          out.add(AST.send(send.payload()));
          append(send.next(), out);
          return;
        }
      case RECV:
        {
          Target.Message recv = target.cast();
          out.add(AST.recv(recv.payload()));
          append(recv.next(), out);
          return;
        }
      case CHOOSE:
        out.add(AST.choose(Pos.internal(), arms(target.cast())));
        return;
      case OFFER:
        out.add(AST.offer(Pos.internal(), arms(target.cast())));
        return;
      case CALL:
        {
          Target.Call call = target.cast();
          out.add(AST.call(Pos.internal(), inNewScope(call.callee())));
          append(call.next(), out);
          return;
        }
      case SPLIT:
        {
          Target.Split split = target.cast();
          out.add(
              AST.split(
                  Pos.internal(), inNewScope(split.transmit()), inNewScope(split.receive())));
          append(split.next(), out);
          return;
        }
      case LOOP:
        {
          String label = LABEL_PREFIX + depth;
          depth++;
          try {
            AST.Block body = block(target.<Target.Loop>cast().body());
            out.add(AST.loop(Pos.internal(), Optional.of(label), body));
          } finally {
            depth--;
          }
          return;
        }
      case BREAK:
        out.add(AST.breakLoop(label(target.cast())));
        return;
      case CONTINUE:
        out.add(AST.continueLoop(label(target.cast())));
        return;
      case THEN:
        {
          Target.Then then = target.cast();
          append(then.first(), out);
          append(then.second(), out);
          return;
        }
      case TYPE:
        out.add(AST.type(target.<Target.TypeLiteral>cast().typeName()));
        return;
      case ERROR:
        throw new IllegalArgumentException("cannot embed a target that failed to lower");
    }
    throw new AssertionError(target.kind());
  }

  private List<AST.Block> arms(Target.Branches branches) {
    List<AST.Block> arms = new ArrayList<>();
    for (Target arm : branches.arms()) {
      arms.add(block(arm));
    }
    return arms;
  }

  private String label(Target.Jump jump) {
    int target = depth - 1 - jump.depth();
    Preconditions.checkArgument(target >= 0, "%s escapes its enclosing loops", jump);
    return LABEL_PREFIX + target;
  }

  private AST.Block inNewScope(Target target) {
    int saved = depth;
    depth = 0;
    try {
      return block(target);
    } finally {
      depth = saved;
    }
  }
}

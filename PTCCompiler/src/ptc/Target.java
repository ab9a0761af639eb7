package ptc;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The lowered protocol: a self-contained tree in which loops are addressed by how many loop scopes
 * enclose a jump rather than by label. Two targets are equal if they have the same structure.
 *
 * <p>{@link #toString()} renders the tree as a host type expression, e.g. {@code Recv<X, Send<Y,
 * Done>>}.
 */
public abstract class Target {
  public enum Kind {
    DONE,
    SEND,
    RECV,
    CHOOSE,
    OFFER,
    CALL,
    SPLIT,
    LOOP,
    BREAK,
    CONTINUE,
    THEN,
    TYPE,
    ERROR;
  }

  Target() {}

  public abstract Kind kind();

  @SuppressWarnings("unchecked")
  public <T extends Target> T cast() {
    return (T) this;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    render(sb);
    return sb.toString();
  }

  abstract void render(StringBuilder sb);

  private static void renderGeneric(StringBuilder sb, String name, Object... parameters) {
    sb.append(name).append('<');
    for (int i = 0; i < parameters.length; i++) {
      if (i > 0) sb.append(", ");
      Object parameter = parameters[i];
      if (parameter instanceof Target) {
        ((Target) parameter).render(sb);
      } else {
        sb.append(parameter);
      }
    }
    sb.append('>');
  }

  @AutoValue
  public abstract static class Done extends Target {
    private static final Done INSTANCE = new AutoValue_Target_Done();

    @Override
    public final Kind kind() {
      return Kind.DONE;
    }

    @Override
    final void render(StringBuilder sb) {
      sb.append("Done");
    }
  }

  // Send and Recv.
  @AutoValue
  public abstract static class Message extends Target {
    abstract Kind messageKind();

    public abstract String payload();

    public abstract Target next();

    @Override
    public final Kind kind() {
      return messageKind();
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, kind() == Kind.SEND ? "Send" : "Recv", payload(), next());
    }
  }

  // Choose and Offer.
  @AutoValue
  public abstract static class Branches extends Target {
    abstract Kind branchesKind();

    public abstract ImmutableList<Target> arms();

    @Override
    public final Kind kind() {
      return branchesKind();
    }

    @Override
    final void render(StringBuilder sb) {
      sb.append(kind() == Kind.CHOOSE ? "Choose" : "Offer").append("<(");
      for (int i = 0; i < arms().size(); i++) {
        if (i > 0) sb.append(", ");
        arms().get(i).render(sb);
      }
      sb.append(")>");
    }
  }

  @AutoValue
  public abstract static class Call extends Target {
    public abstract Target callee();

    public abstract Target next();

    @Override
    public final Kind kind() {
      return Kind.CALL;
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, "Call", callee(), next());
    }
  }

  @AutoValue
  public abstract static class Split extends Target {
    public abstract Target transmit();

    public abstract Target receive();

    public abstract Target next();

    @Override
    public final Kind kind() {
      return Kind.SPLIT;
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, "Split", transmit(), receive(), next());
    }
  }

  @AutoValue
  public abstract static class Loop extends Target {
    public abstract Target body();

    @Override
    public final Kind kind() {
      return Kind.LOOP;
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, "Loop", body());
    }
  }

  /** Break and Continue. {@link #depth()} counts the loops between the jump and its target. */
  @AutoValue
  public abstract static class Jump extends Target {
    abstract Kind jumpKind();

    public abstract int depth();

    @Override
    public final Kind kind() {
      return jumpKind();
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, kind() == Kind.BREAK ? "Break" : "Continue", depth());
    }
  }

  /** Sequencing for protocols that have no continuation of their own. */
  @AutoValue
  public abstract static class Then extends Target {
    public abstract Target first();

    public abstract Target second();

    @Override
    public final Kind kind() {
      return Kind.THEN;
    }

    @Override
    final void render(StringBuilder sb) {
      renderGeneric(sb, "Then", first(), second());
    }
  }

  /** A protocol type spliced in verbatim. */
  @AutoValue
  public abstract static class TypeLiteral extends Target {
    public abstract String typeName();

    @Override
    public final Kind kind() {
      return Kind.TYPE;
    }

    @Override
    final void render(StringBuilder sb) {
      sb.append(typeName());
    }
  }

  /** Stands in for a subtree that could not be lowered. */
  @AutoValue
  public abstract static class Error extends Target {
    private static final Error INSTANCE = new AutoValue_Target_Error();

    @Override
    public final Kind kind() {
      return Kind.ERROR;
    }

    @Override
    final void render(StringBuilder sb) {
      sb.append("Error");
    }
  }

  public static Target done() {
    return Done.INSTANCE;
  }

  public static Target send(String payload, Target next) {
    return new AutoValue_Target_Message(Kind.SEND, payload, next);
  }

  public static Target recv(String payload, Target next) {
    return new AutoValue_Target_Message(Kind.RECV, payload, next);
  }

  public static Target choose(Iterable<Target> arms) {
    return new AutoValue_Target_Branches(Kind.CHOOSE, ImmutableList.copyOf(arms));
  }

  public static Target choose(Target... arms) {
    return choose(ImmutableList.copyOf(arms));
  }

  public static Target offer(Iterable<Target> arms) {
    return new AutoValue_Target_Branches(Kind.OFFER, ImmutableList.copyOf(arms));
  }

  public static Target offer(Target... arms) {
    return offer(ImmutableList.copyOf(arms));
  }

  public static Target call(Target callee, Target next) {
    return new AutoValue_Target_Call(callee, next);
  }

  public static Target split(Target transmit, Target receive, Target next) {
    return new AutoValue_Target_Split(transmit, receive, next);
  }

  public static Target loop(Target body) {
    return new AutoValue_Target_Loop(body);
  }

  public static Target breakLoop(int depth) {
    Preconditions.checkArgument(depth >= 0, "negative loop depth %s", depth);
    return new AutoValue_Target_Jump(Kind.BREAK, depth);
  }

  public static Target continueLoop(int depth) {
    Preconditions.checkArgument(depth >= 0, "negative loop depth %s", depth);
    return new AutoValue_Target_Jump(Kind.CONTINUE, depth);
  }

  public static Target then(Target first, Target second) {
    return new AutoValue_Target_Then(first, second);
  }

  public static Target type(String typeName) {
    return new AutoValue_Target_TypeLiteral(typeName);
  }

  public static Target error() {
    return Error.INSTANCE;
  }

  /** True if an {@link Error} placeholder appears anywhere in this tree. */
  public final boolean containsError() {
    switch (kind()) {
      case ERROR:
        return true;
      case SEND:
      case RECV:
        return this.<Message>cast().next().containsError();
      case CHOOSE:
      case OFFER:
        return this.<Branches>cast().arms().stream().anyMatch(Target::containsError);
      case CALL:
        {
          Call call = cast();
          return call.callee().containsError() || call.next().containsError();
        }
      case SPLIT:
        {
          Split split = cast();
          return split.transmit().containsError()
              || split.receive().containsError()
              || split.next().containsError();
        }
      case LOOP:
        return this.<Loop>cast().body().containsError();
      case THEN:
        {
          Then then = cast();
          return then.first().containsError() || then.second().containsError();
        }
      default:
        return false;
    }
  }
}

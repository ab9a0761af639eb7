package ptc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The payload of a {@link CfgNode}. References to other nodes are indices into the owning {@link
 * Cfg}. Payloads with node references are mutable so scope resolution can rewire them in place.
 */
public abstract class Ir {
  public enum Type {
    RECV,
    SEND,
    CALL,
    CHOOSE,
    OFFER,
    SPLIT,
    LOOP,
    BREAK,
    CONTINUE,
    TYPE,
    ERROR;
  }

  private final Type type;

  private Ir(Type type) {
    this.type = type;
  }

  public Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends Ir> T cast() {
    return (T) this;
  }

  private static String ref(Optional<Integer> index) {
    return index.map(i -> "#" + i).orElse("_");
  }

  // Recv and Send.
  public static final class Message extends Ir {
    private final String payload;

    private Message(Type type, String payload) {
      super(type);
      this.payload = payload;
    }

    public String payload() {
      return payload;
    }

    @Override
    public String toString() {
      return String.format("%s(%s)", type(), payload);
    }
  }

  public static final class Call extends Ir {
    private final Optional<Integer> callee;

    private Call(Optional<Integer> callee) {
      super(Type.CALL);
      this.callee = callee;
    }

    public Optional<Integer> callee() {
      return callee;
    }

    @Override
    public String toString() {
      return String.format("CALL(%s)", ref(callee));
    }
  }

  // Choose and Offer.
  public static final class Branches extends Ir {
    private final List<Optional<Integer>> arms;

    private Branches(Type type, List<Optional<Integer>> arms) {
      super(type);
      this.arms = new ArrayList<>(arms);
    }

    public ImmutableList<Optional<Integer>> arms() {
      return ImmutableList.copyOf(arms);
    }

    public int numArms() {
      return arms.size();
    }

    public Optional<Integer> arm(int index) {
      return arms.get(index);
    }

    void setArm(int index, Optional<Integer> arm) {
      arms.set(index, arm);
    }

    @Override
    public String toString() {
      return arms.stream().map(Ir::ref).collect(Collectors.joining(", ", type() + "(", ")"));
    }
  }

  public static final class Split extends Ir {
    private final Optional<Integer> transmit;
    private final Optional<Integer> receive;

    private Split(Optional<Integer> transmit, Optional<Integer> receive) {
      super(Type.SPLIT);
      this.transmit = transmit;
      this.receive = receive;
    }

    public Optional<Integer> transmit() {
      return transmit;
    }

    public Optional<Integer> receive() {
      return receive;
    }

    @Override
    public String toString() {
      return String.format("SPLIT(%s, %s)", ref(transmit), ref(receive));
    }
  }

  public static final class Loop extends Ir {
    private final Optional<String> label;
    private Optional<Integer> body = Optional.empty();

    private Loop(Optional<String> label) {
      super(Type.LOOP);
      this.label = label;
    }

    public Optional<String> label() {
      return label;
    }

    public Optional<Integer> body() {
      return body;
    }

    void setBody(Optional<Integer> body) {
      this.body = body;
    }

    @Override
    public String toString() {
      return String.format("LOOP(%s)", ref(body));
    }
  }

  // Break and Continue.
  public static final class Jump extends Ir {
    private final int loop;

    private Jump(Type type, int loop) {
      super(type);
      this.loop = loop;
    }

    public int loop() {
      return loop;
    }

    @Override
    public String toString() {
      return String.format("%s(#%d)", type(), loop);
    }
  }

  public static final class TypeLiteral extends Ir {
    private final String typeName;

    private TypeLiteral(String typeName) {
      super(Type.TYPE);
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }

    @Override
    public String toString() {
      return String.format("TYPE(%s)", typeName);
    }
  }

  public static final class Error extends Ir {
    private Error() {
      super(Type.ERROR);
    }

    @Override
    public String toString() {
      return "ERROR";
    }
  }

  public static Message recv(String payload) {
    return new Message(Type.RECV, payload);
  }

  public static Message send(String payload) {
    return new Message(Type.SEND, payload);
  }

  public static Call call(Optional<Integer> callee) {
    return new Call(callee);
  }

  public static Branches choose(List<Optional<Integer>> arms) {
    return new Branches(Type.CHOOSE, arms);
  }

  public static Branches offer(List<Optional<Integer>> arms) {
    return new Branches(Type.OFFER, arms);
  }

  public static Split split(Optional<Integer> transmit, Optional<Integer> receive) {
    return new Split(transmit, receive);
  }

  public static Loop loop(Optional<String> label) {
    return new Loop(label);
  }

  public static Jump breakTo(int loop) {
    Preconditions.checkArgument(loop >= 0);
    return new Jump(Type.BREAK, loop);
  }

  public static Jump continueTo(int loop) {
    Preconditions.checkArgument(loop >= 0);
    return new Jump(Type.CONTINUE, loop);
  }

  public static TypeLiteral type(String typeName) {
    return new TypeLiteral(typeName);
  }

  public static Error error() {
    return new Error();
  }
}

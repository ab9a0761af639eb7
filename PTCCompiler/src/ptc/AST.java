package ptc;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import ptc.processor.ASTChild;
import ptc.processor.ASTNode;

/**
 * A parsed protocol: a name and the block describing its session. Instances come from an external
 * parser, or are assembled directly with the static factories below.
 */
@ASTNode
public final class AST implements AST_ASTNode {
  private final String name;
  private final Pos pos;
  private final Block body;

  private AST(String name, Pos pos, Block body) {
    this.name = name;
    this.pos = pos;
    this.body = body;
  }

  public static AST of(String name, Pos pos, Block body) {
    return new AST(name, pos, body);
  }

  public static AST of(String name, Block body) {
    return of(name, Pos.internal(), body);
  }

  public static AST program(Statement... statements) {
    return of("main", block(statements));
  }

  public String name() {
    return name;
  }

  public Pos pos() {
    return pos;
  }

  @ASTChild
  @Override
  public Block body() {
    return body;
  }

  // A sequence of statements, executed in order.
  @ASTNode
  public static final class Block implements AST_Block_ASTNode {
    private final Pos pos;
    private final ImmutableList<Statement> statements;

    private Block(Pos pos, List<Statement> statements) {
      this.pos = pos;
      this.statements = ImmutableList.copyOf(statements);
    }

    public Pos pos() {
      return pos;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> statements() {
      return statements;
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }
  }

  public abstract static class Statement implements ASTNodeInterface {
    public enum Kind {
      SEND,
      RECV,
      TYPE,
      CALL,
      CHOOSE,
      OFFER,
      SPLIT,
      LOOP,
      BREAK,
      CONTINUE,
      DONE;
    }

    private final Kind kind;
    private final Pos pos;

    protected Statement(Kind kind, Pos pos) {
      this.kind = kind;
      this.pos = pos;
    }

    public Kind kind() {
      return kind;
    }

    public Pos pos() {
      return pos;
    }

    @SuppressWarnings("unchecked")
    public <T extends Statement> T cast() {
      return (T) this;
    }
  }

  // send T
  @ASTNode
  public static final class Send extends Statement implements AST_Send_ASTNode {
    private final String payload;

    private Send(Pos pos, String payload) {
      super(Kind.SEND, pos);
      this.payload = payload;
    }

    public String payload() {
      return payload;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Send_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Send_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // recv T
  @ASTNode
  public static final class Recv extends Statement implements AST_Recv_ASTNode {
    private final String payload;

    private Recv(Pos pos, String payload) {
      super(Kind.RECV, pos);
      this.payload = payload;
    }

    public String payload() {
      return payload;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Recv_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Recv_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // A host type spliced into the protocol as-is.
  @ASTNode
  public static final class TypeLiteral extends Statement implements AST_TypeLiteral_ASTNode {
    private final String type;

    private TypeLiteral(Pos pos, String type) {
      super(Kind.TYPE, pos);
      this.type = type;
    }

    public String type() {
      return type;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_TypeLiteral_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_TypeLiteral_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // call { ... }
  @ASTNode
  public static final class Call extends Statement implements AST_Call_ASTNode {
    private final Block callee;

    private Call(Pos pos, Block callee) {
      super(Kind.CALL, pos);
      this.callee = callee;
    }

    @ASTChild
    @Override
    public Block callee() {
      return callee;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Call_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Call_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // choose { 0 => ..., 1 => ... }
  @ASTNode
  public static final class Choose extends Statement implements AST_Choose_ASTNode {
    private final ImmutableList<Block> branches;

    private Choose(Pos pos, List<Block> branches) {
      super(Kind.CHOOSE, pos);
      this.branches = ImmutableList.copyOf(branches);
    }

    @ASTChild
    @Override
    public ImmutableList<Block> branches() {
      return branches;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Choose_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Choose_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // offer { 0 => ..., 1 => ... }
  @ASTNode
  public static final class Offer extends Statement implements AST_Offer_ASTNode {
    private final ImmutableList<Block> branches;

    private Offer(Pos pos, List<Block> branches) {
      super(Kind.OFFER, pos);
      this.branches = ImmutableList.copyOf(branches);
    }

    @ASTChild
    @Override
    public ImmutableList<Block> branches() {
      return branches;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Offer_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Offer_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // split { -> ..., <- ... }
  @ASTNode
  public static final class Split extends Statement implements AST_Split_ASTNode {
    private final Block transmit;
    private final Block receive;

    private Split(Pos pos, Block transmit, Block receive) {
      super(Kind.SPLIT, pos);
      this.transmit = transmit;
      this.receive = receive;
    }

    @ASTChild
    @Override
    public Block transmit() {
      return transmit;
    }

    @ASTChild
    @Override
    public Block receive() {
      return receive;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Split_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Split_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // 'label: loop { ... }
  @ASTNode
  public static final class Loop extends Statement implements AST_Loop_ASTNode {
    private final Optional<String> label;
    private final Block body;

    private Loop(Pos pos, Optional<String> label, Block body) {
      super(Kind.LOOP, pos);
      this.label = label;
      this.body = body;
    }

    public Optional<String> label() {
      return label;
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Loop_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Loop_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // break 'label
  @ASTNode
  public static final class Break extends Statement implements AST_Break_ASTNode {
    private final Optional<String> label;

    private Break(Pos pos, Optional<String> label) {
      super(Kind.BREAK, pos);
      this.label = label;
    }

    public Optional<String> label() {
      return label;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Break_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Break_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // continue 'label
  @ASTNode
  public static final class Continue extends Statement implements AST_Continue_ASTNode {
    private final Optional<String> label;

    private Continue(Pos pos, Optional<String> label) {
      super(Kind.CONTINUE, pos);
      this.label = label;
    }

    public Optional<String> label() {
      return label;
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Continue_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Continue_ASTNode.super.visitChildren(visitor, value);
    }
  }

  // The empty protocol. As a statement it does nothing.
  @ASTNode
  public static final class Done extends Statement implements AST_Done_ASTNode {
    private Done(Pos pos) {
      super(Kind.DONE, pos);
    }

    @Override
    public <V> V accept(ASTVisitor<V> visitor, V value) {
      return AST_Done_ASTNode.super.accept(visitor, value);
    }

    @Override
    public <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      return AST_Done_ASTNode.super.visitChildren(visitor, value);
    }
  }

  public static Block block(Pos pos, List<? extends Statement> statements) {
    return new Block(pos, ImmutableList.copyOf(statements));
  }

  public static Block block(Statement... statements) {
    return block(Pos.internal(), Arrays.asList(statements));
  }

  public static Send send(Pos pos, String payload) {
    return new Send(pos, Preconditions.checkNotNull(payload));
  }

  public static Send send(String payload) {
    return send(Pos.internal(), payload);
  }

  public static Recv recv(Pos pos, String payload) {
    return new Recv(pos, Preconditions.checkNotNull(payload));
  }

  public static Recv recv(String payload) {
    return recv(Pos.internal(), payload);
  }

  public static TypeLiteral type(Pos pos, String type) {
    return new TypeLiteral(pos, Preconditions.checkNotNull(type));
  }

  public static TypeLiteral type(String type) {
    return type(Pos.internal(), type);
  }

  public static Call call(Pos pos, Block callee) {
    return new Call(pos, callee);
  }

  public static Call call(Statement... callee) {
    return call(Pos.internal(), block(callee));
  }

  public static Choose choose(Pos pos, List<Block> branches) {
    return new Choose(pos, branches);
  }

  public static Choose choose(Block... branches) {
    return choose(Pos.internal(), Arrays.asList(branches));
  }

  public static Offer offer(Pos pos, List<Block> branches) {
    return new Offer(pos, branches);
  }

  public static Offer offer(Block... branches) {
    return offer(Pos.internal(), Arrays.asList(branches));
  }

  public static Split split(Pos pos, Block transmit, Block receive) {
    return new Split(pos, transmit, receive);
  }

  public static Split split(Block transmit, Block receive) {
    return split(Pos.internal(), transmit, receive);
  }

  public static Loop loop(Pos pos, Optional<String> label, Block body) {
    return new Loop(pos, label, body);
  }

  public static Loop loop(Statement... body) {
    return loop(Pos.internal(), Optional.empty(), block(body));
  }

  public static Loop labeledLoop(String label, Statement... body) {
    return loop(Pos.internal(), Optional.of(label), block(body));
  }

  public static Break breakLoop(Pos pos, Optional<String> label) {
    return new Break(pos, label);
  }

  public static Break breakLoop() {
    return breakLoop(Pos.internal(), Optional.empty());
  }

  public static Break breakLoop(String label) {
    return breakLoop(Pos.internal(), Optional.of(label));
  }

  public static Continue continueLoop(Pos pos, Optional<String> label) {
    return new Continue(pos, label);
  }

  public static Continue continueLoop() {
    return continueLoop(Pos.internal(), Optional.empty());
  }

  public static Continue continueLoop(String label) {
    return continueLoop(Pos.internal(), Optional.of(label));
  }

  public static Done done(Pos pos) {
    return new Done(pos);
  }

  public static Done done() {
    return done(Pos.internal());
  }
}

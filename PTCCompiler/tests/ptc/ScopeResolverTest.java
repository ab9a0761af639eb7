package ptc;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class ScopeResolverTest {

  private static Cfg resolved(AST.Statement... statements) {
    Cfg cfg = CfgBuilder.build(AST.program(statements));
    ScopeResolver.resolve(cfg);
    return cfg;
  }

  private static void assertIdempotent(Cfg cfg) {
    String before = cfg.dump();
    assertWithMessage(before).that(ScopeResolver.resolve(cfg)).isEqualTo(0);
    assertThat(cfg.dump()).isEqualTo(before);
  }

  @Test
  public void choiceHandsContinuationToArms() {
    Cfg cfg = resolved(AST.choose(AST.block(AST.send("A")), AST.block()), AST.send("C"));

    CfgNode choose = cfg.get(cfg.root().get());
    assertThat(choose.next()).isEqualTo(Optional.empty());

    Ir.Branches branches = choose.ir().cast();
    int continuation = branches.arm(1).get();
    assertThat(cfg.get(continuation).ir().<Ir.Message>cast().payload()).isEqualTo("C");
    assertThat(cfg.get(branches.arm(0).get()).next()).isEqualTo(Optional.of(continuation));
    assertIdempotent(cfg);
  }

  @Test
  public void nestedChoicesShareContinuation() {
    Cfg cfg =
        resolved(
            AST.offer(
                AST.block(AST.choose(AST.block(AST.send("A")), AST.block(AST.send("B")))),
                AST.block(AST.recv("C"))),
            AST.send("D"));

    int d =
        cfg.indices()
            .filter(i -> cfg.type(i) == Ir.Type.SEND)
            .filter(i -> cfg.get(i).ir().<Ir.Message>cast().payload().equals("D"))
            .findFirst()
            .getAsInt();
    cfg.indices()
        .filter(i -> cfg.type(i) == Ir.Type.SEND || cfg.type(i) == Ir.Type.RECV)
        .filter(i -> i != d)
        .forEach(i -> assertThat(cfg.get(i).next()).isEqualTo(Optional.of(d)));
    cfg.indices()
        .filter(i -> cfg.type(i) == Ir.Type.CHOOSE || cfg.type(i) == Ir.Type.OFFER)
        .forEach(i -> assertThat(cfg.get(i).next()).isEqualTo(Optional.empty()));
    assertIdempotent(cfg);
  }

  @Test
  public void loopBodyGetsSyntheticContinue() {
    Cfg cfg = resolved(AST.loop(AST.send("X")));

    int loop = cfg.root().get();
    CfgNode send = cfg.get(cfg.get(loop).ir().<Ir.Loop>cast().body().get());
    CfgNode repeat = cfg.get(send.next().get());
    assertThat(repeat.type()).isEqualTo(Ir.Type.CONTINUE);
    assertThat(repeat.ir().<Ir.Jump>cast().loop()).isEqualTo(loop);
    assertThat(repeat.allowUnreachable()).isTrue();
    assertIdempotent(cfg);
  }

  @Test
  public void emptyLoopBodyBecomesContinue() {
    Cfg cfg = resolved(AST.loop());

    int loop = cfg.root().get();
    CfgNode body = cfg.get(cfg.get(loop).ir().<Ir.Loop>cast().body().get());
    assertThat(body.type()).isEqualTo(Ir.Type.CONTINUE);
    assertThat(body.allowUnreachable()).isTrue();
    assertIdempotent(cfg);
  }

  @Test
  public void bodyEndingInJumpsIsLeftAlone() {
    Cfg cfg = CfgBuilder.build(AST.program(AST.loop(AST.send("X"), AST.breakLoop())));
    int size = cfg.size();
    ScopeResolver.resolve(cfg);
    assertThat(cfg.size()).isEqualTo(size);

    Cfg branching =
        resolved(
            AST.loop(
                AST.choose(
                    AST.block(AST.breakLoop()), AST.block(AST.send("Y"), AST.continueLoop()))));
    assertThat(branching.indices().filter(i -> branching.get(i).allowUnreachable()).count())
        .isEqualTo(0);
  }

  @Test
  public void choiceInLoopFallsBackToLoop() {
    Cfg cfg = resolved(AST.loop(AST.choose(AST.block(AST.breakLoop()), AST.block())));

    int loop = cfg.root().get();
    CfgNode choose = cfg.get(cfg.get(loop).ir().<Ir.Loop>cast().body().get());
    CfgNode empty = cfg.get(choose.ir().<Ir.Branches>cast().arm(1).get());
    assertThat(empty.type()).isEqualTo(Ir.Type.CONTINUE);
    assertThat(empty.allowUnreachable()).isTrue();
    assertIdempotent(cfg);
  }

  @Test
  public void idempotentOnRandomPrograms() {
    RandomPrograms programs = new RandomPrograms(42);
    for (int i = 0; i < 500; i++) {
      Cfg cfg = CfgBuilder.build(programs.next());
      ScopeResolver.resolve(cfg);
      assertIdempotent(cfg);
    }
  }
}

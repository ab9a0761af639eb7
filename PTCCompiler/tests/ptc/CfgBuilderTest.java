package ptc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

public class CfgBuilderTest {

  private static Diagnostic onlyDiagnostic(Cfg cfg) {
    return Iterables.getOnlyElement(
        cfg.indices()
            .boxed()
            .flatMap(i -> cfg.get(i).diagnostics().stream())
            .collect(ImmutableList.toImmutableList()));
  }

  @Test
  public void sequenceBecomesChain() {
    Cfg cfg = CfgBuilder.build(AST.program(AST.recv("X"), AST.send("Y")));

    assertThat(cfg.size()).isEqualTo(2);
    CfgNode first = cfg.get(cfg.root().get());
    assertThat(first.type()).isEqualTo(Ir.Type.RECV);
    assertThat(first.ir().<Ir.Message>cast().payload()).isEqualTo("X");

    CfgNode second = cfg.get(first.next().get());
    assertThat(second.type()).isEqualTo(Ir.Type.SEND);
    assertThat(second.next()).isEqualTo(Optional.empty());
  }

  @Test
  public void emptyProgramHasNoRoot() {
    Cfg cfg = CfgBuilder.build(AST.program());

    assertThat(cfg.root()).isEqualTo(Optional.empty());
    assertThat(cfg.size()).isEqualTo(0);
  }

  @Test
  public void doneAddsNothing() {
    Cfg cfg = CfgBuilder.build(AST.program(AST.send("A"), AST.done(), AST.send("B")));

    assertThat(cfg.size()).isEqualTo(2);
  }

  @Test
  public void jumpsReferToTheirLoop() {
    Cfg cfg =
        CfgBuilder.build(
            AST.program(
                AST.labeledLoop("outer", AST.loop(AST.breakLoop("outer"), AST.continueLoop()))));

    int outer = cfg.root().get();
    int inner = cfg.get(outer).ir().<Ir.Loop>cast().body().get();
    assertThat(cfg.type(inner)).isEqualTo(Ir.Type.LOOP);

    CfgNode breakNode = cfg.get(cfg.get(inner).ir().<Ir.Loop>cast().body().get());
    assertThat(breakNode.type()).isEqualTo(Ir.Type.BREAK);
    assertThat(breakNode.ir().<Ir.Jump>cast().loop()).isEqualTo(outer);

    CfgNode continueNode = cfg.get(breakNode.next().get());
    assertThat(continueNode.type()).isEqualTo(Ir.Type.CONTINUE);
    assertThat(continueNode.ir().<Ir.Jump>cast().loop()).isEqualTo(inner);
  }

  @Test
  public void armsAreBuiltWithoutContinuation() {
    Cfg cfg =
        CfgBuilder.build(
            AST.program(AST.choose(AST.block(AST.send("A")), AST.block()), AST.send("C")));

    CfgNode choose = cfg.get(cfg.root().get());
    Ir.Branches branches = choose.ir().cast();
    assertThat(branches.numArms()).isEqualTo(2);
    assertThat(cfg.get(branches.arm(0).get()).next()).isEqualTo(Optional.empty());
    assertThat(branches.arm(1)).isEqualTo(Optional.empty());
    assertThat(choose.next().isPresent()).isTrue();
  }

  @Test
  public void breakOutsideLoop() {
    Pos pos = Pos.create("test.ptc", 2, 4);
    Cfg cfg = CfgBuilder.build(AST.program(AST.breakLoop(pos, Optional.empty())));

    assertThat(cfg.type(cfg.root().get())).isEqualTo(Ir.Type.ERROR);
    Diagnostic diagnostic = onlyDiagnostic(cfg);
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.STRUCTURAL);
    assertThat(diagnostic.isFatal()).isTrue();
    assertThat(diagnostic.pos()).isEqualTo(pos);
    assertThat(diagnostic.message()).isEqualTo("break outside of a loop");
  }

  @Test
  public void undeclaredLabel() {
    Cfg cfg = CfgBuilder.build(AST.program(AST.loop(AST.continueLoop("missing"))));

    assertThat(onlyDiagnostic(cfg).message())
        .isEqualTo("continue refers to undeclared loop label 'missing'");
  }

  @Test
  public void callHidesEnclosingLoops() {
    Cfg cfg =
        CfgBuilder.build(
            AST.program(
                AST.labeledLoop("outer", AST.call(AST.breakLoop("outer")), AST.breakLoop())));
    assertThat(onlyDiagnostic(cfg).message())
        .isEqualTo("break 'outer' refers to a loop outside of the enclosing call or split");

    cfg =
        CfgBuilder.build(
            AST.program(
                AST.loop(
                    AST.split(AST.block(AST.continueLoop()), AST.block()), AST.breakLoop())));
    assertThat(onlyDiagnostic(cfg).message())
        .isEqualTo("continue cannot leave the enclosing call or split; it has no loop of its own");
  }

  @Test
  public void buildingContinuesAfterErrors() {
    Cfg cfg =
        CfgBuilder.build(AST.program(AST.breakLoop(), AST.send("A"), AST.continueLoop("x")));

    assertThat(cfg.size()).isEqualTo(3);
    long errors = cfg.indices().filter(i -> cfg.type(i) == Ir.Type.ERROR).count();
    assertThat(errors).isEqualTo(2);
  }
}

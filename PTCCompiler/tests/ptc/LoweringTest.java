package ptc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

public class LoweringTest {

  private ImmutableList<Diagnostic> diagnostics;

  private Target lower(boolean unproductiveLoopsFatal, AST.Statement... statements) {
    Cfg cfg = CfgBuilder.build(AST.program(statements));
    ScopeResolver.resolve(cfg);
    Lowering lowering = new Lowering(cfg, FlowAnalysis.analyze(cfg), unproductiveLoopsFatal);
    Target target = lowering.lower();
    diagnostics = lowering.diagnostics();
    return target;
  }

  private Target lower(AST.Statement... statements) {
    return lower(true, statements);
  }

  private void assertLowers(String expected, AST.Statement... statements) {
    assertThat(lower(statements).toString()).isEqualTo(expected);
    assertThat(diagnostics).isEmpty();
  }

  @Test
  public void twoStepChain() {
    assertLowers("Recv<X, Send<Y, Done>>", AST.recv("X"), AST.send("Y"));
  }

  @Test
  public void emptyProgram() {
    assertLowers("Done");
    assertLowers("Done", AST.done());
  }

  @Test
  public void loopWithBreakAndContinue() {
    assertLowers(
        "Loop<Offer<(Send<X, Break<0>>, Recv<Y, Continue<0>>)>>",
        AST.loop(
            AST.offer(
                AST.block(AST.send("X"), AST.breakLoop()),
                AST.block(AST.recv("Y"), AST.continueLoop()))));
  }

  @Test
  public void implicitContinueBecomesExplicit() {
    assertLowers(
        "Loop<Choose<(Break<0>, Send<X, Continue<0>>)>>",
        AST.loop(AST.choose(AST.block(AST.breakLoop()), AST.block(AST.send("X")))));
  }

  @Test
  public void loopWithoutBreakIsUnproductive() {
    Pos pos = Pos.create("test.ptc", 3, 2);
    Target target = lower(AST.loop(pos, Optional.of("forever"), AST.block(AST.send("X"))));

    assertThat(target).isEqualTo(Target.error());
    Diagnostic diagnostic = Iterables.getOnlyElement(diagnostics);
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.UNPRODUCTIVE_LOOP);
    assertThat(diagnostic.isFatal()).isTrue();
    assertThat(diagnostic.pos()).isEqualTo(pos);
    assertThat(diagnostic.message()).contains("'forever'");
  }

  @Test
  public void unproductiveLoopAsWarning() {
    Target target = lower(false, AST.loop(AST.send("X")));

    assertThat(target.toString()).isEqualTo("Loop<Send<X, Continue<0>>>");
    assertThat(Iterables.getOnlyElement(diagnostics).isFatal()).isFalse();
  }

  @Test
  public void unproductiveLoopDoesNotHideSiblings() {
    Target target =
        lower(AST.choose(AST.block(AST.loop(AST.send("X"))), AST.block(AST.send("Y"))));

    assertThat(target.toString()).isEqualTo("Choose<(Error, Send<Y, Done>)>");
    assertThat(target.containsError()).isTrue();
    assertThat(diagnostics).hasSize(1);
  }

  @Test
  public void labeledBreakCountsEnclosingLoops() {
    assertLowers(
        "Loop<Loop<Break<1>>>", AST.labeledLoop("outer", AST.loop(AST.breakLoop("outer"))));
  }

  @Test
  public void labeledContinueCountsEnclosingLoops() {
    assertLowers(
        "Loop<Then<Loop<Choose<(Continue<1>, Break<0>)>>, Break<0>>>",
        AST.labeledLoop(
            "outer",
            AST.loop(
                AST.choose(AST.block(AST.continueLoop("outer")), AST.block(AST.breakLoop()))),
            AST.breakLoop()));
  }

  @Test
  public void continueToEnclosingLoopLeavesTheInnerLoop() {
    assertLowers(
        "Loop<Choose<(Loop<Recv<X, Continue<1>>>, Break<0>)>>",
        AST.labeledLoop(
            "outer",
            AST.choose(
                AST.block(AST.loop(AST.recv("X"), AST.continueLoop("outer"))),
                AST.block(AST.breakLoop()))));
  }

  @Test
  public void loopFollowedByMore() {
    assertLowers(
        "Then<Loop<Break<0>>, Send<X, Done>>", AST.loop(AST.breakLoop()), AST.send("X"));
  }

  @Test
  public void typeLiteral() {
    assertLowers("Foo", AST.type("Foo"));
    assertLowers("Then<Foo, Recv<Bar, Done>>", AST.type("Foo"), AST.recv("Bar"));
  }

  @Test
  public void callAndSplit() {
    assertLowers("Call<Send<A, Done>, Recv<B, Done>>", AST.call(AST.send("A")), AST.recv("B"));
    assertLowers(
        "Split<Send<A, Done>, Recv<B, Done>, Send<C, Done>>",
        AST.split(AST.block(AST.send("A")), AST.block(AST.recv("B"))),
        AST.send("C"));
  }

  @Test
  public void callStartsFreshLoopStack() {
    assertLowers(
        "Loop<Call<Loop<Break<0>>, Break<0>>>",
        AST.labeledLoop(
            "a", AST.call(AST.labeledLoop("a", AST.breakLoop("a"))), AST.breakLoop("a")));
  }

  @Test
  public void nothingAfterCallThatNeverReturns() {
    Target target = lower(false, AST.call(AST.loop(AST.send("X"))), AST.send("Y"));

    assertThat(target.toString()).isEqualTo("Call<Loop<Send<X, Continue<0>>>, Done>");
  }

  @Test
  public void choiceContinuationIsCopiedIntoArms() {
    Target target = lower(AST.choose(AST.block(AST.send("A")), AST.block()), AST.send("C"));

    assertThat(target.toString()).isEqualTo("Choose<(Send<A, Send<C, Done>>, Send<C, Done>)>");
    Target.Branches choose = target.cast();
    Target.Message first = choose.arms().get(0).cast();
    assertThat(first.next()).isSameInstanceAs(choose.arms().get(1));
  }

  @Test
  public void choiceWithoutArms() {
    assertLowers("Offer<()>", AST.offer());
  }
}

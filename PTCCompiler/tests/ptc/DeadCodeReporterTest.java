package ptc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

public class DeadCodeReporterTest {

  private static Pos line(int line) {
    return Pos.create("test.ptc", line, 0);
  }

  private Cfg cfg;
  private DeadCodeReporter reporter;

  private ImmutableList<Diagnostic> report(boolean fatal, AST.Statement... statements) {
    cfg = CfgBuilder.build(AST.program(statements));
    ScopeResolver.resolve(cfg);
    reporter = new DeadCodeReporter(cfg, FlowAnalysis.analyze(cfg), fatal);
    return reporter.report();
  }

  private ImmutableList<Diagnostic> report(AST.Statement... statements) {
    return report(false, statements);
  }

  @Test
  public void liveProgram() {
    assertThat(
            report(
                AST.recv("X"),
                AST.loop(
                    AST.offer(
                        AST.block(AST.send("Y"), AST.breakLoop()),
                        AST.block(AST.recv("Z"), AST.continueLoop())))))
        .isEmpty();
    assertThat(reporter.reachable()).hasSize(cfg.size());
  }

  @Test
  public void codeAfterBreakIsOneRegion() {
    ImmutableList<Diagnostic> diagnostics =
        report(
            AST.loop(
                AST.breakLoop(),
                AST.send(line(2), "A"),
                AST.send(line(3), "B"),
                AST.send(line(4), "C")));

    Diagnostic diagnostic = Iterables.getOnlyElement(diagnostics);
    assertThat(diagnostic.kind()).isEqualTo(Diagnostic.Kind.UNREACHABLE);
    assertThat(diagnostic.severity()).isEqualTo(Diagnostic.Severity.WARNING);
    assertThat(diagnostic.pos()).isEqualTo(line(2));
  }

  @Test
  public void separateRegionsAreReportedSeparately() {
    ImmutableList<Diagnostic> diagnostics =
        report(
            AST.loop(
                AST.choose(
                    AST.block(AST.breakLoop(), AST.send(line(2), "X")),
                    AST.block(AST.breakLoop(), AST.recv(line(3), "Y")))));

    assertThat(diagnostics.stream().map(Diagnostic::pos).collect(ImmutableSet.toImmutableSet()))
        .containsExactly(line(2), line(3));
  }

  @Test
  public void deadArmsSharingAContinuationAreOneRegion() {
    ImmutableList<Diagnostic> diagnostics =
        report(
            AST.choose(
                AST.block(AST.call(AST.loop(AST.send("X"))), AST.send(line(2), "A")),
                AST.block(AST.call(AST.loop(AST.recv("Y"))), AST.send(line(3), "B"))),
            AST.recv(line(4), "C"));

    assertThat(Iterables.getOnlyElement(diagnostics).pos()).isEqualTo(line(2));
  }

  @Test
  public void codeAfterCallThatNeverReturns() {
    ImmutableList<Diagnostic> diagnostics =
        report(
            AST.call(AST.loop(AST.send("X"))),
            AST.send(line(5), "Y"),
            AST.recv(line(6), "Z"));

    assertThat(Iterables.getOnlyElement(diagnostics).pos()).isEqualTo(line(5));
  }

  @Test
  public void codeAfterLoopWithoutBreak() {
    ImmutableList<Diagnostic> diagnostics =
        report(AST.loop(AST.send("X")), AST.send(line(7), "Y"));

    assertThat(Iterables.getOnlyElement(diagnostics).pos()).isEqualTo(line(7));
  }

  @Test
  public void syntheticNodesAreNeverReported() {
    assertThat(report(AST.labeledLoop("outer", AST.loop(AST.breakLoop("outer"))))).isEmpty();

    int synthetic =
        cfg.indices().filter(i -> cfg.get(i).allowUnreachable()).findFirst().getAsInt();
    assertThat(reporter.reachable()).doesNotContain(synthetic);
  }

  @Test
  public void fatalWhenConfigured() {
    Diagnostic diagnostic =
        Iterables.getOnlyElement(
            report(true, AST.loop(AST.breakLoop(), AST.send(line(1), "A"))));

    assertThat(diagnostic.isFatal()).isTrue();
  }

  @Test
  public void diagnosticsAreAttachedOnce() {
    Diagnostic diagnostic =
        Iterables.getOnlyElement(report(AST.loop(AST.breakLoop(), AST.send(line(1), "A"))));

    int entry =
        cfg.indices().filter(i -> !cfg.get(i).diagnostics().isEmpty()).findFirst().getAsInt();
    assertThat(cfg.get(entry).diagnostics()).containsExactly(diagnostic);
    assertThat(reporter.report()).isEmpty();
    assertThat(cfg.get(entry).diagnostics()).containsExactly(diagnostic);
  }

  @Test
  public void reportsOnlyUnreachableUserCode() {
    RandomPrograms programs = new RandomPrograms(7);
    for (int i = 0; i < 300; i++) {
      cfg = CfgBuilder.build(programs.next());
      ScopeResolver.resolve(cfg);
      reporter = new DeadCodeReporter(cfg, FlowAnalysis.analyze(cfg), false);
      reporter.report();

      ImmutableSet<Integer> reachable = reporter.reachable();
      cfg.indices()
          .filter(
              index ->
                  cfg.get(index)
                      .diagnostics()
                      .stream()
                      .anyMatch(d -> d.kind() == Diagnostic.Kind.UNREACHABLE))
          .forEach(
              index -> {
                assertThat(cfg.get(index).allowUnreachable()).isFalse();
                assertThat(reachable).doesNotContain(index);
              });
    }
  }
}

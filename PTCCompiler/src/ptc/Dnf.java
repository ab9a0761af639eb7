package ptc;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A precondition in disjunctive normal form: it holds if every constraint of at least one
 * conjunction holds. An empty conjunction always holds; a formula without conjunctions never does.
 */
@AutoValue
public abstract class Dnf {
  private static final Dnf TRIVIAL = create(ImmutableList.of(ImmutableList.of()));
  private static final Dnf IMPOSSIBLE = create(ImmutableList.of());

  private static Dnf create(ImmutableList<ImmutableList<Constraint>> conjunctions) {
    return new AutoValue_Dnf(conjunctions);
  }

  public static Dnf trivial() {
    return TRIVIAL;
  }

  public static Dnf impossible() {
    return IMPOSSIBLE;
  }

  /** A single conjunction. */
  public static Dnf allOf(Constraint... constraints) {
    return create(ImmutableList.of(ImmutableList.copyOf(constraints)));
  }

  public static Builder builder() {
    return new Builder();
  }

  public abstract ImmutableList<ImmutableList<Constraint>> conjunctions();

  public boolean isImpossible() {
    return conjunctions().isEmpty();
  }

  public boolean isEntailedBy(Set<Constraint> facts) {
    return conjunctions().stream().anyMatch(facts::containsAll);
  }

  /** Every constraint mentioned, in order of appearance, without repeats. */
  public ImmutableList<Constraint> constraints() {
    return conjunctions()
        .stream()
        .flatMap(ImmutableList::stream)
        .distinct()
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public final String toString() {
    if (isImpossible()) return "false";
    return conjunctions().stream().map(Dnf::render).collect(Collectors.joining(" | "));
  }

  private static String render(ImmutableList<Constraint> conjunction) {
    if (conjunction.isEmpty()) return "true";
    return conjunction.stream().map(Constraint::toString).collect(Collectors.joining(" & "));
  }

  public static final class Builder {
    private final ImmutableList.Builder<ImmutableList<Constraint>> conjunctions =
        ImmutableList.builder();

    private Builder() {}

    public Builder or(Constraint... conjunction) {
      conjunctions.add(ImmutableList.copyOf(Arrays.asList(conjunction)));
      return this;
    }

    public Builder or(Iterable<Constraint> conjunction) {
      conjunctions.add(ImmutableList.copyOf(conjunction));
      return this;
    }

    public Dnf build() {
      return create(conjunctions.build());
    }
  }
}

package ptc;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

/**
 * A source location handed over by the parser. The compiler never interprets it beyond ordering
 * and rendering diagnostics.
 */
@AutoValue
public abstract class Pos implements Comparable<Pos> {
  private static final Pos INTERNAL = create("<internal>", -1, -1);

  private static final Comparator<Pos> ORDER =
      Comparator.comparing(Pos::file).thenComparing(Pos::lineNumber).thenComparing(Pos::column);

  public static Pos internal() {
    return INTERNAL;
  }

  public static Pos create(String file, int lineNumber, int column) {
    return new AutoValue_Pos(file, lineNumber, column);
  }

  public abstract String file();

  // Zero-based.
  public abstract int lineNumber();

  // Zero-based.
  public abstract int column();

  public boolean isInternal() {
    return lineNumber() < 0;
  }

  @Override
  public int compareTo(Pos pos) {
    return ORDER.compare(this, pos);
  }

  @Override
  public final String toString() {
    return isInternal()
        ? file()
        : String.format("%s@%d:%d", file(), lineNumber() + 1, column() + 1);
  }
}

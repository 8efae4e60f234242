package tecomp.expr.arith;

import tecomp.expr.Expr;
import tecomp.expr.Range;

import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkSub;

/** A closed integer interval with symbolic ends. A null end is unbounded. */
public record IntSet(Expr min, Expr max) {
  private static final IntSet EVERYTHING = new IntSet(null, null);

  public static IntSet everything() {
    return EVERYTHING;
  }

  public static IntSet single(Expr e) {
    return new IntSet(e, e);
  }

  public static IntSet interval(Expr min, Expr max) {
    return new IntSet(min, max);
  }

  /** The interval {@code [min, min + extent - 1]}. */
  public static IntSet fromRange(Range range) {
    if (range.extent().isConst(1)) return single(range.min());
    return new IntSet(range.min(), mkSub(mkAdd(range.min(), range.extent()), mkInt(1)));
  }

  public boolean hasMin() {
    return min != null;
  }

  public boolean hasMax() {
    return max != null;
  }

  public boolean isSingle() {
    return min != null && min.equals(max);
  }

  /** The covering range, or null if either end is unbounded. */
  public Range coverRange(Analyzer analyzer) {
    if (min == null || max == null) return null;
    return new Range(min, analyzer.simplify(mkAdd(mkSub(max, min), mkInt(1))));
  }

  @Override
  public String toString() {
    return "[" + (min == null ? "-inf" : min) + ", " + (max == null ? "+inf" : max) + "]";
  }
}

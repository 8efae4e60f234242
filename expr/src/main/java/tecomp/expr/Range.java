package tecomp.expr;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.expr.Expr.mkInt;

/** The half-open integer interval {@code [min, min + extent)}. */
public record Range(Expr min, Expr extent) {
  public Range {
    checkArgument(min.type().isInt() && extent.type().isInt(), "range bounds must be int");
  }

  public static Range mk(long min, long extent) {
    return new Range(mkInt(min), mkInt(extent));
  }

  /** The range {@code [begin, end)}. */
  public static Range fromTo(long begin, long end) {
    return mk(begin, end - begin);
  }

  @Override
  public String toString() {
    return "[" + min + ", " + min + " + " + extent + ")";
  }
}

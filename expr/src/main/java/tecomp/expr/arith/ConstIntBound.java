package tecomp.expr.arith;

import tecomp.expr.BinaryOp;
import tecomp.expr.Cast;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.Range;
import tecomp.expr.Select;
import tecomp.expr.Var;

import java.util.Map;

/**
 * Constant interval bounds of integer expressions under variable ranges. Infinite ends are
 * represented by {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE}; arithmetic saturates.
 */
public final class ConstIntBound {
  public static final long NEG_INF = Long.MIN_VALUE;
  public static final long POS_INF = Long.MAX_VALUE;
  private static final int MAX_VAR_DEPTH = 16;

  public record Bound(long min, long max) {
    private static final Bound EVERYTHING = new Bound(NEG_INF, POS_INF);

    public static Bound everything() {
      return EVERYTHING;
    }

    public static Bound single(long v) {
      return new Bound(v, v);
    }

    public boolean isSingle() {
      return min == max && min != NEG_INF && min != POS_INF;
    }

    public boolean hasMin() {
      return min != NEG_INF;
    }

    public boolean hasMax() {
      return max != POS_INF;
    }

    public Bound union(Bound other) {
      return new Bound(Math.min(min, other.min), Math.max(max, other.max));
    }

    public Bound scale(long k) {
      if (k >= 0) return new Bound(mul(min, k), mul(max, k));
      return new Bound(mul(max, k), mul(min, k));
    }

    public Bound plus(Bound other) {
      return new Bound(add(min, other.min), add(max, other.max));
    }
  }

  private final Map<Var, Range> ranges;
  private int depth;

  public ConstIntBound(Map<Var, Range> ranges) {
    this.ranges = ranges;
  }

  static boolean isInf(long x) {
    return x == NEG_INF || x == POS_INF;
  }

  static long add(long x, long y) {
    if (isInf(x)) return x;
    if (isInf(y)) return y;
    final long r = x + y;
    if (((x ^ r) & (y ^ r)) < 0) return x > 0 ? POS_INF : NEG_INF;
    return r;
  }

  static long neg(long x) {
    if (x == NEG_INF) return POS_INF;
    if (x == POS_INF) return NEG_INF;
    return -x;
  }

  static long mul(long x, long y) {
    if (x == 0 || y == 0) return 0;
    if (isInf(x) || isInf(y)) return (x > 0) == (y > 0) ? POS_INF : NEG_INF;
    final long hi = Math.multiplyHigh(x, y), lo = x * y;
    if ((hi == 0 && lo >= 0) || (hi == -1 && lo < 0)) return lo;
    return (x > 0) == (y > 0) ? POS_INF : NEG_INF;
  }

  public Bound eval(Expr e) {
    if (e.type().isBool()) return boolBound(e);
    if (!e.type().isInt()) return Bound.everything();

    return switch (e.kind()) {
      case INT_IMM -> Bound.single(e.constValue());
      case VAR -> evalVar((Var) e);
      case ADD -> eval(((BinaryOp) e).a()).plus(eval(((BinaryOp) e).b()));
      case SUB -> eval(((BinaryOp) e).a()).plus(eval(((BinaryOp) e).b()).scale(-1));
      case MUL -> evalMul(eval(((BinaryOp) e).a()), eval(((BinaryOp) e).b()));
      case DIV, FLOOR_DIV, MOD, FLOOR_MOD -> evalDivMod((BinaryOp) e);
      case MIN -> {
        final Bound a = eval(((BinaryOp) e).a()), b = eval(((BinaryOp) e).b());
        yield new Bound(Math.min(a.min, b.min), Math.min(a.max, b.max));
      }
      case MAX -> {
        final Bound a = eval(((BinaryOp) e).a()), b = eval(((BinaryOp) e).b());
        yield new Bound(Math.max(a.min, b.min), Math.max(a.max, b.max));
      }
      case SELECT -> eval(((Select) e).trueValue()).union(eval(((Select) e).falseValue()));
      case CAST -> {
        final Expr v = ((Cast) e).value();
        yield v.type().isFloat() ? Bound.everything() : eval(v);
      }
      default -> Bound.everything();
    };
  }

  private Bound boolBound(Expr e) {
    final Long c = e.constValue();
    return c != null ? Bound.single(c) : new Bound(0, 1);
  }

  private Bound evalVar(Var v) {
    final Range range = ranges.get(v);
    if (range == null || depth >= MAX_VAR_DEPTH) return Bound.everything();
    ++depth;
    try {
      final Bound min = eval(range.min()), extent = eval(range.extent());
      return new Bound(min.min, add(min.max, add(extent.max, -1)));
    } finally {
      --depth;
    }
  }

  private static Bound evalMul(Bound a, Bound b) {
    final long p0 = mul(a.min, b.min), p1 = mul(a.min, b.max);
    final long p2 = mul(a.max, b.min), p3 = mul(a.max, b.max);
    return new Bound(
        Math.min(Math.min(p0, p1), Math.min(p2, p3)), Math.max(Math.max(p0, p1), Math.max(p2, p3)));
  }

  private Bound evalDivMod(BinaryOp e) {
    final Long divisor = e.b().constValue();
    if (divisor == null || divisor == 0) return Bound.everything();
    final long c = divisor;
    final Bound a = eval(e.a());
    final long m = Math.abs(c) - 1;

    return switch (e.kind()) {
      case FLOOR_DIV, DIV -> {
        final boolean floor = e.kind() == ExprKind.FLOOR_DIV;
        final long lo = divEnd(a.min, c, floor), hi = divEnd(a.max, c, floor);
        yield c > 0 ? new Bound(lo, hi) : new Bound(hi, lo);
      }
      case FLOOR_MOD -> {
        if (c > 0) yield a.min >= 0 && a.max <= m ? a : new Bound(0, m);
        yield a.max <= 0 && a.min >= -m ? a : new Bound(-m, 0);
      }
      default -> {
        if (a.min >= 0) yield new Bound(0, Math.min(a.max, m));
        if (a.max <= 0) yield new Bound(Math.max(a.min, -m), 0);
        yield new Bound(Math.max(a.min, -m), Math.min(a.max, m));
      }
    };
  }

  private static long divEnd(long x, long c, boolean floor) {
    if (isInf(x)) return c > 0 ? x : neg(x);
    return floor ? Math.floorDiv(x, c) : x / c;
  }
}

package tecomp.expr.arith;

import tecomp.expr.BinaryOp;
import tecomp.expr.Cast;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.Select;
import tecomp.expr.Var;

import java.util.Map;

import static tecomp.expr.Expr.mkBinary;
import static tecomp.expr.Expr.mkGe;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkMax;
import static tecomp.expr.Expr.mkMin;
import static tecomp.expr.Expr.mkMul;

/**
 * Interval arithmetic with symbolic ends. Variables absent from the domain map stand for
 * themselves. Ends are simplified with the owning analyzer.
 */
final class IntSetEvaluator {
  private final Analyzer analyzer;
  private final Map<Var, IntSet> dom;

  IntSetEvaluator(Analyzer analyzer, Map<Var, IntSet> dom) {
    this.analyzer = analyzer;
    this.dom = dom;
  }

  IntSet eval(Expr e) {
    final IntSet result = eval0(e);
    final Expr min = result.min() == null ? null : analyzer.simplify(result.min());
    final Expr max = result.max() == null ? null : analyzer.simplify(result.max());
    return IntSet.interval(min, max);
  }

  private IntSet eval0(Expr e) {
    if (e.type().isBool()) {
      return e.kind() == ExprKind.INT_IMM
          ? IntSet.single(mkInt(e.constValue()))
          : IntSet.interval(mkInt(0), mkInt(1));
    }
    if (!e.type().isInt()) return IntSet.everything();

    return switch (e.kind()) {
      case INT_IMM -> IntSet.single(e);
      case VAR -> dom.getOrDefault((Var) e, IntSet.single(e));
      case ADD -> {
        final IntSet a = eval0(((BinaryOp) e).a()), b = eval0(((BinaryOp) e).b());
        yield IntSet.interval(combine(ExprKind.ADD, a.min(), b.min()), combine(ExprKind.ADD, a.max(), b.max()));
      }
      case SUB -> {
        final IntSet a = eval0(((BinaryOp) e).a()), b = eval0(((BinaryOp) e).b());
        yield IntSet.interval(combine(ExprKind.SUB, a.min(), b.max()), combine(ExprKind.SUB, a.max(), b.min()));
      }
      case MUL -> evalMul(eval0(((BinaryOp) e).a()), eval0(((BinaryOp) e).b()));
      case DIV, FLOOR_DIV, MOD, FLOOR_MOD -> evalDivMod((BinaryOp) e);
      case MIN -> {
        final IntSet a = eval0(((BinaryOp) e).a()), b = eval0(((BinaryOp) e).b());
        yield IntSet.interval(
            a.hasMin() && b.hasMin() ? mkMin(a.min(), b.min()) : null,
            !a.hasMax() ? b.max() : !b.hasMax() ? a.max() : mkMin(a.max(), b.max()));
      }
      case MAX -> {
        final IntSet a = eval0(((BinaryOp) e).a()), b = eval0(((BinaryOp) e).b());
        yield IntSet.interval(
            !a.hasMin() ? b.min() : !b.hasMin() ? a.min() : mkMax(a.min(), b.min()),
            a.hasMax() && b.hasMax() ? mkMax(a.max(), b.max()) : null);
      }
      case SELECT -> {
        final IntSet a = eval0(((Select) e).trueValue()), b = eval0(((Select) e).falseValue());
        yield IntSet.interval(
            a.hasMin() && b.hasMin() ? mkMin(a.min(), b.min()) : null,
            a.hasMax() && b.hasMax() ? mkMax(a.max(), b.max()) : null);
      }
      case CAST -> {
        final Expr v = ((Cast) e).value();
        yield v.type().isFloat() ? IntSet.everything() : eval0(v);
      }
      default -> IntSet.everything();
    };
  }

  private static Expr combine(ExprKind kind, Expr a, Expr b) {
    return a == null || b == null ? null : mkBinary(kind, a, b);
  }

  private Long constOf(IntSet s) {
    if (!s.isSingle()) return null;
    return analyzer.simplify(s.min()).constValue();
  }

  private IntSet evalMul(IntSet a, IntSet b) {
    final Long ka = constOf(a), kb = constOf(b);
    if (kb != null) return scale(a, kb);
    if (ka != null) return scale(b, ka);
    if (a.isSingle() && b.isSingle()) return IntSet.single(mkMul(a.min(), b.min()));

    final Long a0 = endConst(a.min()), a1 = endConst(a.max()), b0 = endConst(b.min()), b1 = endConst(b.max());
    if (a0 == null || a1 == null || b0 == null || b1 == null) return IntSet.everything();
    final long p0 = a0 * b0, p1 = a0 * b1, p2 = a1 * b0, p3 = a1 * b1;
    return IntSet.interval(
        mkInt(Math.min(Math.min(p0, p1), Math.min(p2, p3))),
        mkInt(Math.max(Math.max(p0, p1), Math.max(p2, p3))));
  }

  private Long endConst(Expr end) {
    return end == null ? null : analyzer.simplify(end).constValue();
  }

  private static IntSet scale(IntSet s, long k) {
    final Expr lo = s.min() == null ? null : mkMul(s.min(), mkInt(k));
    final Expr hi = s.max() == null ? null : mkMul(s.max(), mkInt(k));
    return k >= 0 ? IntSet.interval(lo, hi) : IntSet.interval(hi, lo);
  }

  private IntSet evalDivMod(BinaryOp e) {
    final Long divisor = analyzer.simplify(e.b()).constValue();
    if (divisor == null || divisor == 0) return IntSet.everything();
    final long c = divisor;
    final IntSet a = eval0(e.a());
    final Expr m = mkInt(Math.abs(c) - 1);

    switch (e.kind()) {
      case DIV, FLOOR_DIV -> {
        // both divisions are monotone in the dividend
        final Expr lo = a.min() == null ? null : mkBinary(e.kind(), a.min(), mkInt(c));
        final Expr hi = a.max() == null ? null : mkBinary(e.kind(), a.max(), mkInt(c));
        return c > 0 ? IntSet.interval(lo, hi) : IntSet.interval(hi, lo);
      }
      case FLOOR_MOD -> {
        if (c > 0) {
          if (withinBounds(a, mkInt(0), m)) return a;
          return IntSet.interval(mkInt(0), m);
        }
        if (withinBounds(a, mkInt(c + 1), mkInt(0))) return a;
        return IntSet.interval(mkInt(c + 1), mkInt(0));
      }
      default -> {
        final Expr negM = mkInt(1 - Math.abs(c));
        if (a.hasMin() && analyzer.canProve(mkGe(a.min(), mkInt(0)))) {
          if (withinBounds(a, mkInt(0), m)) return a;
          return IntSet.interval(mkInt(0), m);
        }
        if (a.hasMax() && analyzer.canProve(mkLe(a.max(), mkInt(0))))
          return IntSet.interval(negM, mkInt(0));
        return IntSet.interval(negM, m);
      }
    }
  }

  private boolean withinBounds(IntSet s, Expr lo, Expr hi) {
    return s.hasMin()
        && s.hasMax()
        && analyzer.canProve(mkGe(s.min(), lo))
        && analyzer.canProve(mkLe(s.max(), hi));
  }
}

package tecomp.zeroelim.logic;

import org.apache.commons.lang3.tuple.Pair;
import tecomp.expr.BinaryOp;
import tecomp.expr.Expr;
import tecomp.expr.ExprComparator;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprMutator;
import tecomp.expr.ExprSupport;
import tecomp.expr.NotOp;
import tecomp.expr.Select;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.expr.Expr.mkBool;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkZero;

public abstract class FormulaSupport {
  private FormulaSupport() {}

  // connectives folding constant operands

  public static Expr and(Expr a, Expr b) {
    if (a.isFalse() || b.isFalse()) return mkBool(false);
    if (a.isTrue()) return b;
    if (b.isTrue()) return a;
    return Expr.mkAnd(a, b);
  }

  public static Expr and(Collection<? extends Expr> operands) {
    Expr result = mkBool(true);
    for (Expr x : operands) result = and(result, x);
    return result;
  }

  public static Expr or(Expr a, Expr b) {
    if (a.isTrue() || b.isTrue()) return mkBool(true);
    if (a.isFalse()) return b;
    if (b.isFalse()) return a;
    return Expr.mkOr(a, b);
  }

  public static Expr not(Expr a) {
    if (a.isTrue()) return mkBool(false);
    if (a.isFalse()) return mkBool(true);
    return Expr.mkNot(a);
  }

  /** {@code select(cond, value, 0)}, folded when the condition is constant. */
  public static Expr selectElseZero(Expr cond, Expr value) {
    if (cond.isTrue()) return value;
    if (cond.isFalse()) return mkZero(value.type());
    return Expr.mkSelect(cond, value, mkZero(value.type()));
  }

  /**
   * Splits a boolean formula into a conjunction of atomic formulas (variables, constants, calls,
   * comparisons and anything else that is not a logical connective) and a residual.
   */
  public static FactoredFormula factorOutAtomicFormulas(Expr e) {
    checkArgument(e.type().isBool(), "cannot factor a formula of type %s: %s", e.type(), e);
    final Factored f = factor(e);
    return new FactoredFormula(new ArrayList<>(f.atomics), f.rest);
  }

  private record Factored(TreeSet<Expr> atomics, Expr rest) {
    static Factored atomic(Expr e) {
      final TreeSet<Expr> atomics = new TreeSet<>(ExprComparator.INSTANCE);
      atomics.add(e);
      return new Factored(atomics, mkBool(true));
    }

    Expr toExpr() {
      Expr result = rest;
      for (Expr atomic : atomics) result = and(atomic, result);
      return result;
    }
  }

  private static Factored factor(Expr e) {
    switch (e.kind()) {
      case AND: {
        final Factored a = factor(((BinaryOp) e).a()), b = factor(((BinaryOp) e).b());
        final TreeSet<Expr> union = new TreeSet<>(ExprComparator.INSTANCE);
        union.addAll(a.atomics);
        union.addAll(b.atomics);
        return new Factored(union, and(a.rest, b.rest));
      }
      case MUL:
        if (!e.type().isBool()) return Factored.atomic(e);
        // booleans multiply like a conjunction
        return factor(Expr.mkAnd(((BinaryOp) e).a(), ((BinaryOp) e).b()));

      case OR: {
        final Factored a = factor(((BinaryOp) e).a()), b = factor(((BinaryOp) e).b());
        final TreeSet<Expr> common = new TreeSet<>(ExprComparator.INSTANCE);
        common.addAll(a.atomics);
        common.retainAll(b.atomics);
        a.atomics.removeAll(common);
        b.atomics.removeAll(common);
        return new Factored(common, or(a.toExpr(), b.toExpr()));
      }
      case SELECT: {
        final Select s = (Select) e;
        return factor(
            Expr.mkOr(
                Expr.mkAnd(s.cond(), s.trueValue()),
                Expr.mkAnd(Expr.mkNot(s.cond()), s.falseValue())));
      }
      case NOT: {
        final Expr a = ((NotOp) e).a();
        if (a.kind() == ExprKind.OR) {
          final BinaryOp or = (BinaryOp) a;
          return factor(Expr.mkAnd(Expr.mkNot(or.a()), Expr.mkNot(or.b())));
        }
        if (a.kind() == ExprKind.AND) {
          final BinaryOp and = (BinaryOp) a;
          return factor(Expr.mkOr(Expr.mkNot(and.a()), Expr.mkNot(and.b())));
        }
        if (a instanceof Select s) {
          return factor(
              Expr.mkAnd(
                  Expr.mkOr(Expr.mkNot(s.cond()), Expr.mkNot(s.trueValue())),
                  Expr.mkOr(s.cond(), Expr.mkNot(s.falseValue()))));
        }
        return Factored.atomic(e);
      }
      default:
        return Factored.atomic(e);
    }
  }

  /**
   * Rewrites every integer or floating comparison into {@code d == 0}, {@code d != 0},
   * {@code d <= 0} or {@code d < 0}, with {@code d} simplified. Integer {@code a < b} becomes
   * {@code a - b + 1 <= 0}.
   */
  public static Expr normalizeComparisons(Expr e) {
    return new ComparisonNormalizer().mutate(e);
  }

  private static final class ComparisonNormalizer extends ExprMutator {
    private final Analyzer analyzer = Analyzer.empty();

    @Override
    protected Expr mutateBinary(BinaryOp e) {
      if (!e.kind().isComparison() || e.a().type().isBool()) return super.mutateBinary(e);
      return switch (e.kind()) {
        case GT -> make(ExprKind.LT, e.b(), e.a());
        case GE -> make(ExprKind.LE, e.b(), e.a());
        default -> make(e.kind(), e.a(), e.b());
      };
    }

    private Expr make(ExprKind kind, Expr a, Expr b) {
      if (kind == ExprKind.LT && a.type().isInt())
        return Expr.mkLe(analyzer.simplify(Expr.mkAdd(Expr.mkSub(a, b), mkInt(1))), mkInt(0));
      return Expr.mkBinary(kind, analyzer.simplify(Expr.mkSub(a, b)), mkZero(a.type()));
    }
  }

  /**
   * Splits {@code cond} into {@code (outer, inner)} such that {@code outer} does not use any of
   * {@code vars}, {@code cond} implies {@code outer}, and {@code outer && inner} is equivalent to
   * {@code cond}.
   */
  public static Pair<Expr, Expr> implicationNotContainingVars(Expr cond, Collection<Var> vars) {
    checkArgument(cond.type().isBool(), "the condition must be boolean: %s", cond);
    if (cond.kind() == ExprKind.AND) {
      final Pair<Expr, Expr> a = implicationNotContainingVars(((BinaryOp) cond).a(), vars);
      final Pair<Expr, Expr> b = implicationNotContainingVars(((BinaryOp) cond).b(), vars);
      return Pair.of(and(a.getLeft(), b.getLeft()), and(a.getRight(), b.getRight()));
    }
    if (cond.kind() == ExprKind.OR) {
      final Pair<Expr, Expr> a = implicationNotContainingVars(((BinaryOp) cond).a(), vars);
      final Pair<Expr, Expr> b = implicationNotContainingVars(((BinaryOp) cond).b(), vars);
      final Expr inner =
          and(
              and(or(a.getLeft(), b.getRight()), or(b.getLeft(), a.getRight())),
              or(a.getRight(), b.getRight()));
      return Pair.of(or(a.getLeft(), b.getLeft()), inner);
    }
    if (!ExprSupport.usesAnyVar(cond, vars)) return Pair.of(cond, mkBool(true));
    return Pair.of(mkBool(true), cond);
  }

  /** The atomic formulas of {@code cond}, without its residual. */
  public static List<Expr> atomicFormulasOf(Expr cond) {
    return factorOutAtomicFormulas(cond).atomicFormulas();
  }
}

package tecomp.zeroelim.solver;

import tecomp.expr.BinaryOp;
import tecomp.expr.Expr;
import tecomp.expr.ExprComparator;
import tecomp.expr.ExprKind;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;
import tecomp.expr.arith.LinearSupport;
import tecomp.expr.arith.LinearSupport.LinearEquation;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.logic.FormulaSupport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.common.utils.Commons.gcd;
import static tecomp.common.utils.Commons.lcm;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkConst;
import static tecomp.expr.Expr.mkGe;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkMul;
import static tecomp.expr.Expr.mkSub;
import static tecomp.expr.Expr.mkZero;

/**
 * Fourier-Motzkin elimination. The variables are eliminated one by one in the given order; for
 * each one the inequalities mentioning it linearly are turned into its bounds, and every lower
 * bound is combined with every upper bound into an inequality free of it. The remaining system
 * moves on to the next variable.
 *
 * <p>The pending inequalities are kept sorted, and a new one is only compared against its two
 * neighbours in that order when checking for redundancy.
 */
public class InequalitySolver {
  /** {@code coef * v + rest <= 0}. */
  private record Term(long coef, Expr rest) {}

  private final Analyzer analyzer;
  private TreeSet<Expr> current = new TreeSet<>(ExprComparator.INSTANCE);
  private TreeSet<Expr> newCurrent = new TreeSet<>(ExprComparator.INSTANCE);

  private InequalitySolver(Map<Var, Range> vranges, ZeContext ctx) {
    this.analyzer = ctx.analyzer(vranges);
  }

  public static InequalitySystem solve(
      Collection<Expr> inequalities, List<Var> variables, Map<Var, Range> vranges, ZeContext ctx) {
    return new InequalitySolver(vranges, ctx).run(inequalities, variables);
  }

  private Expr simplify(Expr e) {
    return analyzer.simplify(e);
  }

  private boolean canProve(Expr cond) {
    return analyzer.canProve(cond);
  }

  private void addToNewCurrent(Expr ineq) {
    // follows from the ranges
    if (canProve(ineq)) return;

    if (ineq.kind() == ExprKind.LE) {
      final Expr a = ((BinaryOp) ineq).a();
      final Expr before = newCurrent.lower(ineq);
      if (before != null && before.kind() == ExprKind.LE) {
        final Expr b = ((BinaryOp) before).a();
        if (canProve(mkLe(mkSub(a, b), mkZero(a.type())))) return;
        if (canProve(mkLe(mkSub(b, a), mkZero(a.type())))) newCurrent.remove(before);
      }
      final Expr after = newCurrent.ceiling(ineq);
      if (after != null && after.kind() == ExprKind.LE) {
        final Expr b = ((BinaryOp) after).a();
        if (canProve(mkLe(mkSub(a, b), mkZero(a.type())))) return;
        if (canProve(mkLe(mkSub(b, a), mkZero(a.type())))) newCurrent.remove(after);
      }
    }
    newCurrent.add(ineq);
  }

  private Expr normalized(Expr e) {
    return FormulaSupport.normalizeComparisons(simplify(e));
  }

  private InequalitySystem run(Collection<Expr> inequalities, List<Var> variables) {
    final Map<Var, VarBounds> bounds = new LinkedHashMap<>();
    final List<Expr> rest = new ArrayList<>();

    for (Expr ineq : inequalities) addToNewCurrent(normalized(ineq));
    swap();

    for (Var v : variables) {
      checkArgument(!bounds.containsKey(v), "variable %s appears several times in %s", v, variables);
      newCurrent.clear();
      final List<Term> pos = new ArrayList<>(), neg = new ArrayList<>();

      final Range range = analyzer.ranges().get(v);
      if (range != null) {
        final Expr lo = simplify(range.min());
        final Expr hi = simplify(mkSub(mkAdd(range.min(), range.extent()), mkInt(1)));
        neg.add(new Term(-1, lo));
        pos.add(new Term(1, mkSub(mkZero(hi.type()), hi)));
      }

      for (Expr ineq : current) {
        if (ineq.kind() == ExprKind.LE || ineq.kind() == ExprKind.EQ) {
          final LinearEquation lin =
              LinearSupport.detectLinearEquation(((BinaryOp) ineq).a(), List.of(v));
          if (lin != null) {
            final long c = lin.coefs().get(0);
            final Expr base = lin.base();
            final Expr negBase = mkSub(mkZero(base.type()), base);
            if (c == 0) addToNewCurrent(ineq);
            else if (ineq.kind() == ExprKind.LE) (c > 0 ? pos : neg).add(new Term(c, base));
            else if (c > 0) {
              // an equality is a pair of opposite inequalities
              pos.add(new Term(c, base));
              neg.add(new Term(-c, negBase));
            } else {
              pos.add(new Term(-c, negBase));
              neg.add(new Term(c, base));
            }
            continue;
          }
        }
        rest.add(ineq);
      }

      for (Term p : pos) {
        for (Term n : neg) {
          final long g = gcd(p.coef, -n.coef);
          final Expr lhs =
              mkSub(
                  mkMul(mkConst(v.type(), p.coef / g), n.rest),
                  mkMul(mkConst(v.type(), n.coef / g), p.rest));
          addToNewCurrent(normalized(mkLe(lhs, mkZero(lhs.type()))));
        }
      }

      bounds.put(v, boundsOf(v, pos, neg));
      swap();
    }

    final List<Expr> others = new ArrayList<>();
    for (Expr e : current) {
      final Expr simplified = simplify(e);
      if (simplified.isFalse()) {
        // contradiction
        return new InequalitySystem(variables, bounds, List.of(simplified));
      }
      if (!simplified.isTrue()) others.add(simplified);
    }
    others.addAll(rest);
    return new InequalitySystem(variables, bounds, others);
  }

  private void swap() {
    final TreeSet<Expr> tmp = current;
    current = newCurrent;
    newCurrent = tmp;
  }

  /** Bounds on {@code lcm * v} where lcm is the common multiple of all coefficients. */
  private VarBounds boundsOf(Var v, List<Term> pos, List<Term> neg) {
    long coefLcm = 1;
    for (Term p : pos) coefLcm = lcm(coefLcm, p.coef);
    for (Term n : neg) coefLcm = lcm(coefLcm, -n.coef);

    final List<Expr> upper = new ArrayList<>(pos.size());
    for (Term p : pos) {
      final Expr bound = simplify(mkMul(mkConst(v.type(), -coefLcm / p.coef), p.rest));
      // an existing bound is at least as tight
      if (upper.stream().anyMatch(o -> canProve(mkLe(mkSub(o, bound), mkZero(o.type())))))
        continue;
      upper.removeIf(o -> canProve(mkGe(mkSub(o, bound), mkZero(o.type()))));
      upper.add(bound);
    }
    final List<Expr> lower = new ArrayList<>(neg.size());
    for (Term n : neg) {
      final Expr bound = simplify(mkMul(mkConst(v.type(), -coefLcm / n.coef), n.rest));
      if (lower.stream().anyMatch(o -> canProve(mkGe(mkSub(o, bound), mkZero(o.type())))))
        continue;
      lower.removeIf(o -> canProve(mkLe(mkSub(o, bound), mkZero(o.type()))));
      lower.add(bound);
    }

    final TreeSet<Expr> uppers = new TreeSet<>(ExprComparator.INSTANCE);
    uppers.addAll(upper);
    final TreeSet<Expr> lowers = new TreeSet<>(ExprComparator.INSTANCE);
    lowers.addAll(lower);
    final TreeSet<Expr> equal = new TreeSet<>(ExprComparator.INSTANCE);
    equal.addAll(uppers);
    equal.retainAll(lowers);
    uppers.removeAll(equal);
    lowers.removeAll(equal);

    return new VarBounds(
        coefLcm, new ArrayList<>(equal), new ArrayList<>(lowers), new ArrayList<>(uppers));
  }
}

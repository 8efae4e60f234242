package tecomp.zeroelim.domain;

import tecomp.expr.Expr;
import tecomp.expr.ExprComparator;
import tecomp.expr.ExprSupport;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;
import tecomp.expr.arith.IntSet;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.solver.InequalitySolver;
import tecomp.zeroelim.solver.InequalitySystem;
import tecomp.zeroelim.solver.VarBounds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkConst;
import static tecomp.expr.Expr.mkFloorDiv;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkLt;
import static tecomp.expr.Expr.mkSub;
import static tecomp.expr.Expr.mkZero;

/**
 * Shifts and shrinks the variables of a domain so that each ranges over {@code [0, extent)} with
 * the tightest extent found among its bounds from Fourier-Motzkin elimination. Variables pinned
 * to a single value disappear.
 */
public class DomainDeskewer {
  private final Domain domain;
  private final ZeContext ctx;

  // ranges of the old, outer and new variables together
  private final Map<Var, Range> vranges;
  private final Map<Var, IntSet> intSets = new HashMap<>();
  private final Map<Var, Range> resRanges = new TreeMap<>();
  private final Map<Var, Expr> oldToNew = new HashMap<>();
  private final Map<Var, Expr> newToOld = new HashMap<>();
  private final List<Var> resVariables = new ArrayList<>();

  private DomainDeskewer(Domain domain, ZeContext ctx) {
    this.domain = domain;
    this.ctx = ctx;
    this.vranges = new TreeMap<>(domain.ranges());
    for (Map.Entry<Var, Range> entry : domain.ranges().entrySet())
      intSets.put(entry.getKey(), IntSet.fromRange(entry.getValue()));
  }

  public static DomainTransformation deskew(Domain domain, ZeContext ctx) {
    for (Var v : domain.variables())
      checkArgument(domain.ranges().containsKey(v), "no range for %s in %s", v, domain);
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("deskewDomain", domain);
    return tracer.exit(new DomainDeskewer(domain, ctx).deskew());
  }

  private Expr simplify(Expr e) {
    return ctx.simplify(e, vranges);
  }

  private DomainTransformation deskew() {
    final ZeTracer tracer = ctx.tracer();

    // domain variables first, then the outer ones with a range
    final List<Var> vars = new ArrayList<>(domain.variables());
    final Set<Var> known = new HashSet<>(vars);
    for (Map.Entry<Var, Range> entry : domain.ranges().entrySet()) {
      if (known.add(entry.getKey())) {
        vars.add(entry.getKey());
        resRanges.put(entry.getKey(), entry.getValue());
      }
    }

    final InequalitySystem solved =
        InequalitySolver.solve(domain.conditions(), vars, domain.ranges(), ctx);
    tracer.value("conditions after elimination", solved.asConditions());

    // the last variable is the least dependent one
    final List<Var> reversed = new ArrayList<>(domain.variables());
    Collections.reverse(reversed);
    for (Var var : reversed) processVariable(var, solved.bounds().get(var).substitute(oldToNew));

    final List<Expr> conditions = new ArrayList<>();
    for (Expr cond : solved.asConditions()) {
      final Expr newCond = simplify(ExprSupport.substitute(cond, oldToNew));
      if (!newCond.isTrue()) conditions.add(newCond);
    }

    Collections.reverse(resVariables);
    final Domain newDomain = new Domain(resVariables, conditions, resRanges);
    return new DomainTransformation(newDomain, domain, newToOld, oldToNew);
  }

  private void processVariable(Var var, VarBounds bnd) {
    final ZeTracer tracer = ctx.tracer();
    tracer.value("variable", var);

    if (bnd.coef() == 1 && !bnd.equal().isEmpty()) {
      // the first one is the simplest
      oldToNew.put(var, bnd.equal().get(0));
      tracer.value("replaced with", bnd.equal().get(0));
      return;
    }

    final List<Expr> lowers = new ArrayList<>(bnd.equal());
    lowers.addAll(bnd.lower());
    lowers.sort(ExprComparator.INSTANCE);
    final List<Expr> uppers = new ArrayList<>(bnd.equal());
    uppers.addAll(bnd.upper());
    uppers.sort(ExprComparator.INSTANCE);

    final Range range = vranges.get(var);
    final Expr coef = mkConst(var.type(), bnd.coef());
    final Expr one = mkConst(var.type(), 1);
    Expr bestLower = range.min();
    Expr bestDiffOver = mkSub(range.extent(), one);

    for (Expr low : lowers) {
      for (Expr upp : uppers) {
        // the bounds are on coef * var, the difference is wanted for var itself
        final Expr diff1 = simplify(mkFloorDiv(mkSub(upp, low), coef));
        Expr diffOver = overapproximate(diff1);
        final Expr lowDivided = simplify(mkFloorDiv(mkSub(mkAdd(low, coef), one), coef));
        final Expr diff2 = simplify(mkSub(mkFloorDiv(upp, coef), lowDivided));
        final Expr diffOver2 = overapproximate(diff2);

        if (diffOver2 != null
            && (diffOver == null || ctx.canProve(mkLt(mkSub(diffOver2, diffOver), mkInt(0)))))
          diffOver = diffOver2;

        // strictly better only, so earlier and simpler pairs win ties
        if (diffOver != null
            && ctx.canProve(mkLt(mkSub(diffOver, bestDiffOver), mkInt(0)), vranges)) {
          bestLower = lowDivided;
          bestDiffOver = diffOver;
        }
      }
    }

    final String suffix = bestLower.equals(range.min()) ? "" : ".shifted";
    final Var newVar = var.copyWithSuffix(suffix);
    final Expr diff = simplify(bestDiffOver);

    if (diff.isConst(0)) {
      oldToNew.put(var, bestLower);
      tracer.value("replaced with", bestLower);
      return;
    }

    oldToNew.put(var, mkAdd(newVar, bestLower));
    // bestLower is over the new variables
    newToOld.put(newVar, simplify(mkSub(var, ExprSupport.substitute(bestLower, newToOld))));
    intSets.put(newVar, IntSet.interval(mkZero(newVar.type()), diff));

    final Range newRange = new Range(mkZero(newVar.type()), simplify(mkAdd(diff, one)));
    resVariables.add(newVar);
    resRanges.put(newVar, newRange);
    vranges.put(newVar, newRange);
    tracer.value("replaced with", mkAdd(newVar, bestLower));
    tracer.value("new range", newRange);
  }

  /** The maximum of {@code e} over the known intervals, or null if unbounded. */
  private Expr overapproximate(Expr e) {
    final Analyzer analyzer = ctx.analyzer(vranges);
    final IntSet set = analyzer.evalSet(e, intSets);
    return set.hasMax() ? analyzer.simplify(set.max()) : null;
  }
}

package tecomp.zeroelim.domain;

import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.tensor.TensorSupport;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.solver.DivModEliminator;
import tecomp.zeroelim.solver.LinearEquationSolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static tecomp.common.utils.Commons.merge;
import static tecomp.expr.Expr.mkEq;
import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkLt;
import static tecomp.expr.Expr.mkMul;

public abstract class DomainSimplifier {
  private DomainSimplifier() {}

  /**
   * Rewrites a domain into an equivalent one with fewer or tighter variables: div and mod are
   * eliminated first if configured, then equation solving and deskewing alternate for the
   * configured number of rounds. A result with more variables or more conditions than the input
   * is only kept if its bounding box is provably smaller; otherwise the rounds are retried without
   * div/mod elimination, and the domain is returned as is if that does not help either.
   */
  public static DomainTransformation simplifyDomain(Domain domain, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("simplifyDomain", domain);

    final DomainTransformation id = DomainSupport.id(domain);
    if (ctx.config().eliminateDivMod()) {
      final DomainTransformation transf =
          rounds(
              DomainSupport.compose(
                  id, DivModEliminator.eliminateDivModFromDomainConditions(domain, ctx), ctx),
              ctx);
      if (isImprovement(transf.newDomain(), domain, ctx)) return tracer.exit(transf);
      tracer.value("rejected", transf.newDomain());
    }

    final DomainTransformation transf = rounds(id, ctx);
    if (isImprovement(transf.newDomain(), domain, ctx)) return tracer.exit(transf);
    tracer.value("rejected", transf.newDomain());
    return tracer.exit(id);
  }

  private static DomainTransformation rounds(DomainTransformation transf, ZeContext ctx) {
    for (int i = 0; i < ctx.config().simplifyIterations(); ++i) {
      transf =
          DomainSupport.compose(
              transf, LinearEquationSolver.solve(transf.newDomain(), ctx), ctx);
      transf =
          DomainSupport.compose(transf, DomainDeskewer.deskew(transf.newDomain(), ctx), ctx);
    }
    return transf;
  }

  /** Whether {@code after} has no more variables and conditions, or a provably smaller box. */
  private static boolean isImprovement(Domain after, Domain before, ZeContext ctx) {
    if (DomainSupport.isEmpty(after)) return true;
    if (after.variables().size() <= before.variables().size()
        && after.conditions().size() <= before.conditions().size()) return true;

    final Expr oldVolume = boxVolumeOf(before), newVolume = boxVolumeOf(after);
    if (oldVolume == null || newVolume == null) return false;
    return ctx.canProve(mkLt(newVolume, oldVolume), merge(before.ranges(), after.ranges()));
  }

  private static Expr boxVolumeOf(Domain domain) {
    Expr volume = mkInt(1);
    for (Var v : domain.variables()) {
      final Range range = domain.ranges().get(v);
      if (range == null) return null;
      volume = mkMul(volume, range.extent());
    }
    return volume;
  }

  /**
   * Simplifies the iteration domain of a reduction under its condition. The axis is replaced by
   * the variables of the simplified domain and the condition by its conditions. Anything but a
   * reduction is returned as is.
   */
  public static Expr simplifyReductionDomain(
      Expr expr, Map<Var, Range> outerRanges, ZeContext ctx) {
    if (!(expr instanceof Reduce red)) return expr;
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("simplifyReductionDomain", expr);

    final Map<Var, Range> ranges = merge(outerRanges, TensorSupport.axisRanges(red.axis()));
    final Domain domain = Domain.of(red.axisVars(), red.condition(), ranges);
    final DomainTransformation res = simplifyDomain(domain, ctx);

    final List<Expr> source = ExprSupport.substitute(red.source(), res.oldToNew());
    final List<IterVar> axis =
        DomainSupport.iterVarsFromMap(res.newDomain().variables(), res.newDomain().ranges());
    final Reduce newRed =
        Reduce.mk(red.combiner(), source, axis, res.newDomain().condition(), red.valueIndex());
    // removes the reduction altogether if the domain turned out empty
    return tracer.exit(ctx.simplify(newRed));
  }

  /**
   * Turns every outer variable used by the conditions into a domain variable {@code vZ} tied to
   * it by {@code vZ == v}, so that equalities between outer variables take part in solving.
   */
  public static DomainTransformation addOuterVariablesIntoDomain(Domain domain, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("addOuterVariablesIntoDomain", domain);

    final Set<Var> known = new HashSet<>(domain.variables());
    final List<Var> newVariables = new ArrayList<>(domain.variables());
    final Map<Var, Expr> outerToNew = new HashMap<>();
    final Map<Var, Expr> newToOld = new HashMap<>();
    final List<Expr> newConditions = new ArrayList<>();
    final Map<Var, Range> newRanges = new HashMap<>(domain.ranges());

    for (Expr cond : domain.conditions()) {
      for (Var v : ExprSupport.freeVars(cond)) {
        if (known.contains(v)) continue;
        final Var newVar = v.copyWithSuffix("Z");
        newVariables.add(newVar);
        outerToNew.put(v, newVar);
        newToOld.put(newVar, v);
        final Range range = domain.ranges().get(v);
        if (range != null) newRanges.put(newVar, range);
        known.add(newVar);
        known.add(v);
        newConditions.add(mkEq(newVar, v));
      }
      newConditions.add(ExprSupport.substitute(cond, outerToNew));
    }

    final Map<Var, Expr> oldToNew = new HashMap<>();
    for (Var v : domain.variables()) {
      oldToNew.put(v, v);
      newToOld.put(v, v);
    }
    final Domain newDomain = new Domain(newVariables, newConditions, newRanges);
    return tracer.exit(new DomainTransformation(newDomain, domain, newToOld, oldToNew));
  }
}

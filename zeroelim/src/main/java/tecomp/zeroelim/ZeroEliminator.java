package tecomp.zeroelim;

import org.apache.commons.lang3.tuple.Pair;
import tecomp.expr.CommReducer;
import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;
import tecomp.zeroelim.domain.DomainSimplifier;
import tecomp.zeroelim.domain.DomainSupport;
import tecomp.zeroelim.extract.ReductionExtractor;
import tecomp.zeroelim.extract.TensorExtractor;
import tecomp.zeroelim.logic.FactoredFormula;
import tecomp.zeroelim.logic.FormulaSupport;
import tecomp.zeroelim.logic.NonzeronessCondition;
import tecomp.zeroelim.logic.NonzeronessResult;
import tecomp.zeroelim.logic.RedundantInequalityRemover;
import tecomp.zeroelim.solver.InequalitySolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static tecomp.common.utils.Commons.merge;
import static tecomp.common.utils.ListSupport.concat;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkZero;
import static tecomp.zeroelim.logic.FormulaSupport.and;
import static tecomp.zeroelim.logic.FormulaSupport.selectElseZero;

/**
 * The zero-elimination pass. Lifts the conditions under which a tensor body is nonzero out of it,
 * shrinks the iteration domains of its reductions, and moves sub-expressions living on a smaller
 * domain into tensors of their own.
 */
public abstract class ZeroEliminator {
  private ZeroEliminator() {}

  /** Whether the combiner is a plain sum: one value, identity 0, result {@code x + y}. */
  public static boolean isSumCombiner(
      CommReducer combiner, Map<Var, Range> ranges, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("isSumCombiner", combiner);
    if (combiner.arity() != 1) return tracer.exit(false);
    if (!ctx.simplify(combiner.identity().get(0), ranges).isZero()) return tracer.exit(false);

    final Expr result = ctx.simplify(combiner.result().get(0), ranges);
    final Var x = combiner.lhs().get(0), y = combiner.rhs().get(0);
    return tracer.exit(result.equals(mkAdd(x, y)) || result.equals(mkAdd(y, x)));
  }

  /**
   * Whether a reduction with this combiner yields zero at {@code valueIndex} as soon as every
   * source there is zero: the identity is zero and combining zeros gives zero.
   */
  public static boolean canFactorZeroFromCombiner(
      CommReducer combiner, int valueIndex, Map<Var, Range> ranges, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("canFactorZeroFromCombiner", combiner, valueIndex);
    if (!ctx.simplify(combiner.identity().get(valueIndex), ranges).isZero())
      return tracer.exit(false);

    final Expr result = combiner.result().get(valueIndex);
    final Expr zero = mkZero(result.type());
    final Map<Var, Expr> vmap = new HashMap<>();
    vmap.put(combiner.lhs().get(valueIndex), zero);
    vmap.put(combiner.rhs().get(valueIndex), zero);
    return tracer.exit(ctx.simplify(ExprSupport.substitute(result, vmap), ranges).isZero());
  }

  /** {@code expr} rewritten as {@code select(cond, value, 0)} with the nonzeroness condition. */
  public static Expr liftNonzeronessCondition(Expr expr, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("liftNonzeronessCondition", expr);
    return tracer.exit(new NonzeronessCondition(ctx).apply(expr).toExpr());
  }

  /**
   * Splits the condition of a reduction into {@code (outer, inner)}: {@code outer} does not use
   * the reduction variables, and {@code outer && inner} is equivalent to {@code cond}. The
   * reduction variables are eliminated first, so bounds of the outer variables implied by the
   * condition end up in {@code outer}.
   */
  public static Pair<Expr, Expr> liftConditionsThroughReduction(
      Expr cond, List<IterVar> reduceAxis, List<IterVar> outerAxis, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("liftConditionsThroughReduction", cond, reduceAxis, outerAxis);

    final FactoredFormula factored = FormulaSupport.factorOutAtomicFormulas(cond);
    final List<Var> reduceVars = DomainSupport.iterVarsToVars(reduceAxis);
    final List<Var> allVars = concat(reduceVars, DomainSupport.iterVarsToVars(outerAxis));
    final Map<Var, Range> vranges =
        merge(TensorSupport.axisRanges(reduceAxis), TensorSupport.axisRanges(outerAxis));

    final List<Expr> atomics =
        InequalitySolver.solve(factored.atomicFormulas(), allVars, vranges, ctx).asConditions();
    final Expr rewritten = and(Expr.mkAnd(atomics), factored.rest());
    return tracer.exit(FormulaSupport.implicationNotContainingVars(rewritten, reduceVars));
  }

  /**
   * Applies the pass to the body of a compute tensor, given the ranges of variables outside of it.
   * Placeholders and bodies that do not change are returned as is.
   */
  public static Tensor optimizeAndLiftNonzeronessConditions(
      Tensor tensor, Map<Var, Range> ranges, ZeContext ctx) {
    return TensorSupport.transformBody(
        tensor, (body, axis) -> optimizeAndLiftNonzeronessConditions(body, axis, ranges, ctx));
  }

  public static Expr optimizeAndLiftNonzeronessConditions(
      Expr original, List<IterVar> axis, Map<Var, Range> ranges, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("optimizeAndLiftNonzeronessConditions", original, axis);

    final Map<Var, Range> combined = merge(ranges, TensorSupport.axisRanges(axis));
    final List<Var> axisVars = DomainSupport.iterVarsToVars(axis);

    // mostly to simplify combiners
    final Expr expr = ctx.simplify(original, combined);
    tracer.value("simplified", expr);

    Expr result;
    if (expr instanceof Reduce red) {
      final boolean isSum = isSumCombiner(red.combiner(), ranges, ctx);
      if (!isSum && !canFactorZeroFromCombiner(red.combiner(), red.valueIndex(), ranges, ctx))
        return tracer.exit(DomainSimplifier.simplifyReductionDomain(expr, combined, ctx));

      Expr cond = red.condition();
      List<Expr> source = red.source();
      if (isSum) {
        // a summand that is zero may as well be skipped
        final NonzeronessResult nz = new NonzeronessCondition(ctx).apply(source.get(0));
        cond = and(nz.cond(), cond);
        source = List.of(nz.value());
      }

      final Expr simplified =
          DomainSimplifier.simplifyReductionDomain(
              Reduce.mk(red.combiner(), source, red.axis(), cond, red.valueIndex()),
              combined,
              ctx);
      if (!(simplified instanceof Reduce newRed))
        return tracer.exit(optimizeAndLiftNonzeronessConditions(simplified, axis, ranges, ctx));

      final Pair<Expr, Expr> lifted =
          liftConditionsThroughReduction(newRed.condition(), newRed.axis(), axis, ctx);
      Expr outerCond = lifted.getLeft();
      final Expr reduceCond = lifted.getRight();
      final List<Expr> newSource = new ArrayList<>(newRed.source());

      if (!isSum) {
        final NonzeronessResult nz =
            new NonzeronessCondition(ctx).apply(newRed.source().get(newRed.valueIndex()));
        final Pair<Expr, Expr> nzLifted =
            liftConditionsThroughReduction(and(reduceCond, nz.cond()), newRed.axis(), axis, ctx);
        outerCond = and(outerCond, nzLifted.getLeft());
        newSource.set(newRed.valueIndex(), selectElseZero(nzLifted.getRight(), nz.value()));
      }

      Expr newReduce =
          Reduce.mk(newRed.combiner(), newSource, newRed.axis(), reduceCond, newRed.valueIndex());
      newReduce =
          TensorExtractor.extractAsTensorMaybe(newReduce, outerCond, axisVars, combined, ctx);
      result = selectElseZero(outerCond, newReduce);
    } else {
      final NonzeronessResult nz = new NonzeronessCondition(ctx).apply(expr);
      final Expr extracted =
          TensorExtractor.extractAsTensorMaybe(nz.value(), nz.cond(), axisVars, combined, ctx);
      result = selectElseZero(nz.cond(), extracted);
    }

    // propagates equalities such as (i % 3) == 0 which the simplifier does not
    result =
        RedundantInequalityRemover.removeRedundantInequalities(
            result, DomainSupport.iterVarsToInequalities(axis), ctx);

    // extraction may have been skipped, leaving nested reductions behind
    result =
        ctx.simplify(
            ReductionExtractor.extractNonTopReductions(result, axisVars, combined, ctx), combined);
    return tracer.exit(result);
  }
}
